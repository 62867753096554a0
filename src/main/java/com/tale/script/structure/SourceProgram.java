package com.tale.script.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Raw program text split into 1-indexed lines. Immutable. */
public final class SourceProgram {

    private final List<String> lines;

    private SourceProgram(List<String> lines) {
        this.lines = Collections.unmodifiableList(lines);
    }

    public static SourceProgram of(String code) {
        List<String> out = new ArrayList<>();
        if (code == null || code.isEmpty()) return new SourceProgram(out);
        String[] parts = code.split("\\r\\n|\\r|\\n", -1);
        int count = parts.length;
        // A trailing newline does not open an extra line.
        if (count > 0 && parts[count - 1].isEmpty()) count--;
        for (int i = 0; i < count; i++) out.add(parts[i]);
        return new SourceProgram(out);
    }

    public int lineCount() { return lines.size(); }

    /** @param number 1-based line number */
    public String line(int number) {
        if (number < 1 || number > lines.size()) {
            throw new IndexOutOfBoundsException("No line " + number + " (program has " + lines.size() + ")");
        }
        return lines.get(number - 1);
    }

    public List<String> lines() { return lines; }
}
