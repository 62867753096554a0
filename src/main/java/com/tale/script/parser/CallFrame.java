package com.tale.script.parser;

public class CallFrame {
    final String functionName;
    final int callLine;

    CallFrame(String functionName, int callLine) {
        this.functionName = functionName;
        this.callLine = callLine;
    }

    @Override
    public String toString() {
        return functionName + " (called at line " + callLine + ")";
    }
}
