package com.tale.script.diagnostics;

/** The program asked for more input values than were supplied. */
public class InputExhaustedException extends TaleException {
    private static final long serialVersionUID = 1L;

    private final int askNumber;
    private final String prompt;

    public InputExhaustedException(int askNumber, String prompt, int supplied) {
        super(ErrorKind.INPUT_EXHAUSTED, 0, describe(askNumber, prompt, supplied));
        this.askNumber = askNumber;
        this.prompt = prompt;
    }

    private static String describe(int askNumber, String prompt, int supplied) {
        String which = (prompt == null || prompt.trim().isEmpty())
                ? "ask #" + askNumber
                : "ask #" + askNumber + " (\"" + prompt.trim() + "\")";
        return "No more inputs were supplied for " + which + "; only " + supplied
                + (supplied == 1 ? " value was" : " values were") + " given. Add values in the Inputs box (one per line).";
    }

    /** 1-based ordinal of the ask that ran dry. */
    public int askNumber() { return askNumber; }

    public String prompt() { return prompt; }
}
