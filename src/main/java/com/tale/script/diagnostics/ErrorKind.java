package com.tale.script.diagnostics;

/**
 * Failure taxonomy. The first four kinds are found without running user code and
 * surface as diagnostics; the rest only happen inside the sandbox.
 */
public enum ErrorKind {
    STRUCTURAL(true, false,
            "Every if, repeat, while, for each, function, class and try block needs its own 'end' line."),
    TRANSFORM(true, false,
            "I could not understand the TALE syntax; check if/else/end, assignments, and helpers."),
    VALIDATION(true, false,
            "Ensure TALE lines follow the documented patterns."),
    SECURITY(true, false,
            "Only math, random, datetime, json and csv are available, and names starting with '_' are off limits."),
    RUNTIME(false, true,
            "Check the translated program to see what went wrong."),
    INPUT_EXHAUSTED(false, false,
            "Provide an input value for each `ask` line in the Inputs box before running."),
    TIMEOUT(false, false,
            "Check your loops: the program ran longer than it is allowed to."),
    RESOURCE_LIMIT(false, false,
            "The program produced or stored too much data; try smaller numbers.");

    private final boolean detectableWithoutRunning;
    private final boolean catchableByProgram;
    private final String suggestedFix;

    ErrorKind(boolean detectableWithoutRunning, boolean catchableByProgram, String suggestedFix) {
        this.detectableWithoutRunning = detectableWithoutRunning;
        this.catchableByProgram = catchableByProgram;
        this.suggestedFix = suggestedFix;
    }

    public boolean detectableWithoutRunning() { return detectableWithoutRunning; }

    /** Only plain runtime faults may be handled by a program's own try/catch. */
    public boolean catchableByProgram() { return catchableByProgram; }

    public String suggestedFix() { return suggestedFix; }
}
