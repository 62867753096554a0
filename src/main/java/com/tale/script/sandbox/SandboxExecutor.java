package com.tale.script.sandbox;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import com.tale.debug.Debug;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Interpreter;
import com.tale.script.validate.ValidatedProgram;

/**
 * Runs a validated program in a fresh {@link SandboxContext}. Every fault is
 * converted into an {@link ExecutionResult} here; nothing thrown by user code
 * reaches the caller.
 */
public final class SandboxExecutor {

    private static final String TAG = "tale.sandbox";

    private final TaleSettings settings;
    private final CapabilityTable capabilities;
    private final Clock clock;

    public SandboxExecutor(TaleSettings settings, CapabilityTable capabilities) {
        this(settings, capabilities, Clock.systemDefaultZone());
    }

    public SandboxExecutor(TaleSettings settings, CapabilityTable capabilities, Clock clock) {
        this.settings = settings;
        this.capabilities = capabilities;
        this.clock = clock;
    }

    public TaleSettings settings() { return settings; }

    public ExecutionResult execute(ValidatedProgram program, List<String> inputs, Map<String, String> files) {
        if (!program.ok()) {
            return ExecutionResult.rejected(program.diagnostics().get(0), program.translated());
        }
        String translated = program.translated();

        SandboxContext ctx;
        try {
            ctx = new SandboxContext(settings, capabilities, inputs, files, clock);
        } catch (TaleException e) {
            // the preloaded files broke a sandbox rule
            return ExecutionResult.failure("", e, translated, null);
        }

        Interpreter interpreter = new Interpreter(ctx);
        try {
            interpreter.execute(program.statements());
        } catch (TaleException e) {
            Debug.get().d(TAG, "run ended with " + e.kind() + ": " + e.getMessage());
            return ExecutionResult.failure(ctx.output().text(), e, translated, ctx.files().snapshot());
        } catch (StackOverflowError e) {
            Debug.get().w(TAG, "java stack exhausted at depth " + interpreter.stackTrace().size());
            TaleException limit = TaleException.resourceLimit("Too many nested calls. Does a function keep calling itself?")
                    .atLine(interpreter.currentLine());
            return ExecutionResult.failure(ctx.output().text(), limit, translated, ctx.files().snapshot());
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "unexpected failure inside the sandbox", e);
            TaleException wrapped = TaleException.runtime("Internal error: " + e);
            return ExecutionResult.failure(ctx.output().text(), wrapped, translated, ctx.files().snapshot());
        }

        Debug.get().t(TAG, "run finished in " + ctx.budget().steps() + " steps");
        return ExecutionResult.success(ctx.output().text(), translated, ctx.files().snapshot());
    }
}
