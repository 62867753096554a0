package com.tale.script.sandbox;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Interpreter;
import com.tale.script.parser.Value;

/**
 * Per-run state shared between the interpreter and the capabilities: output,
 * input, files, randomness, the clock and the budget. Never reused across runs.
 */
public final class SandboxContext {

    private final TaleSettings settings;
    private final OutputBuffer output;
    private final InputQueue input;
    private final SandboxFiles files;
    private final Random random;
    private final Clock clock;
    private final ExecutionBudget budget;
    private final Map<String, Value> capabilities;
    private Interpreter interpreter;

    public SandboxContext(TaleSettings settings, CapabilityTable table, List<String> inputs,
                          Map<String, String> initialFiles, Clock clock) {
        this.settings = settings;
        this.output = new OutputBuffer(settings.maxOutputChars());
        this.input = new InputQueue(inputs);
        this.files = new SandboxFiles(settings.maxFileBytes(), settings.maxFiles(), initialFiles);
        this.random = new Random(settings.randomSeed());
        this.clock = clock;
        this.budget = new ExecutionBudget(settings.maxSteps(), settings.timeoutMillis());
        this.capabilities = table.bind(this);
    }

    public TaleSettings settings() { return settings; }
    public OutputBuffer output() { return output; }
    public InputQueue input() { return input; }
    public SandboxFiles files() { return files; }
    public Random random() { return random; }
    public Clock clock() { return clock; }
    public ExecutionBudget budget() { return budget; }

    /** Bound capability values, by name. */
    public Map<String, Value> capabilities() { return capabilities; }

    public void attach(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    /** Calls a program value (function, lambda, class) from inside a capability. */
    public Value call(Value fn, List<Value> args) {
        if (interpreter == null) throw new IllegalStateException("no interpreter attached");
        return interpreter.callValue(fn, args);
    }

    public void print(String text) {
        output.append(text);
    }

    /** Raises RESOURCE_LIMIT when a collection would grow past the configured size. */
    public void checkSize(long size) {
        if (size > settings.maxCollectionSize()) {
            throw TaleException.resourceLimit("Collections may hold at most " + settings.maxCollectionSize() + " items");
        }
    }

    public void checkText(long length) {
        if (length > settings.maxTextLength()) {
            throw TaleException.resourceLimit("Text may be at most " + settings.maxTextLength() + " characters long");
        }
    }
}
