package com.tale.script.sandbox;

import com.tale.script.diagnostics.TaleException;

/** Everything a program prints, capped; the real process streams are never touched. */
public final class OutputBuffer {

    private final StringBuilder sb = new StringBuilder();
    private final int limit;

    public OutputBuffer(int limit) {
        this.limit = limit;
    }

    public void append(String text) {
        int room = limit - sb.length();
        if (text.length() > room) {
            sb.append(text, 0, Math.max(0, room));
            throw TaleException.resourceLimit("Output limit of " + limit + " characters exceeded");
        }
        sb.append(text);
    }

    public int length() { return sb.length(); }

    public String text() { return sb.toString(); }
}
