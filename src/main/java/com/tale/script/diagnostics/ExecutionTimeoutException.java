package com.tale.script.diagnostics;

/** Wall-clock deadline, step budget or host interruption ended the run. */
public class ExecutionTimeoutException extends TaleException {
    private static final long serialVersionUID = 1L;

    public ExecutionTimeoutException(String detail) {
        super(ErrorKind.TIMEOUT, 0, detail);
    }
}
