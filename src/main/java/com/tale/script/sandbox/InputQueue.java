package com.tale.script.sandbox;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import com.tale.script.diagnostics.InputExhaustedException;
import com.tale.script.parser.Value;

/**
 * Pre-supplied answers for {@code ask}, consumed first in, first out. The
 * cursor only moves forward.
 */
public final class InputQueue {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\d*\\.\\d+)");

    private final List<String> values;
    private int cursor;

    public InputQueue(List<String> values) {
        this.values = values == null ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * @param prompt shown in the exhaustion message; may be null
     * @throws InputExhaustedException when every value has been used
     */
    public Value next(String prompt) {
        if (cursor >= values.size()) {
            throw new InputExhaustedException(cursor + 1, prompt, values.size());
        }
        return coerce(values.get(cursor++));
    }

    /** "42" becomes 42, "3.14" becomes 3.14, anything else stays text. */
    public static Value coerce(String raw) {
        String s = raw.trim();
        if (INTEGER.matcher(s).matches()) {
            try {
                return Value.integer(Long.parseLong(s));
            } catch (NumberFormatException e) {
                // too many digits for a whole number; read it as a decimal
                return Value.decimal(Double.parseDouble(s));
            }
        }
        if (DECIMAL.matcher(s).matches()) return Value.decimal(Double.parseDouble(s));
        return Value.text(raw);
    }

    public int consumed() { return cursor; }

    public int remaining() { return values.size() - cursor; }
}
