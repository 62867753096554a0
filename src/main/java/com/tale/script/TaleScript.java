package com.tale.script;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.tale.debug.Debug;
import com.tale.script.diagnostics.Diagnostic;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.plugins.TaleCollectionsPlugin;
import com.tale.script.plugins.TaleCorePlugin;
import com.tale.script.plugins.TaleCsvPlugin;
import com.tale.script.plugins.TaleDatetimePlugin;
import com.tale.script.plugins.TaleFilesPlugin;
import com.tale.script.plugins.TaleJsonPlugin;
import com.tale.script.plugins.TaleMathPlugin;
import com.tale.script.plugins.TaleRandomPlugin;
import com.tale.script.plugins.TaleTextPlugin;
import com.tale.script.sandbox.CapabilityTable;
import com.tale.script.sandbox.ExecutionResult;
import com.tale.script.sandbox.SandboxExecutor;
import com.tale.script.sandbox.TaleSettings;
import com.tale.script.structure.BlockStructureBuilder;
import com.tale.script.structure.BlockTree;
import com.tale.script.structure.SourceProgram;
import com.tale.script.transform.StatementTranslator;
import com.tale.script.transform.TransformedProgram;
import com.tale.script.validate.ValidatedProgram;
import com.tale.script.validate.Validator;

/**
 * TALE engine.
 *
 * - Natural-language-like block syntax ({@code if x > 0} ... {@code end})
 * - Two entry points:
 *     - analyze: structure, translation and validation only; nothing runs
 *     - run: the same pipeline, then the sandboxed interpreter
 * - Sandboxed: programs see only the capability table, an in-memory file
 *   workspace and the pre-supplied inputs
 *
 * An engine is immutable apart from its request counter and may be shared
 * between threads; every call builds its own program and sandbox.
 */
public class TaleScript {

    private static final String TAG = "tale.engine";

    private final TaleSettings settings;
    private final CapabilityTable capabilities;
    private final BlockStructureBuilder structure = new BlockStructureBuilder();
    private final StatementTranslator translator = new StatementTranslator();
    private final Validator validator;
    private final SandboxExecutor executor;
    private final AtomicLong version = new AtomicLong();

    public TaleScript() {
        this(TaleSettings.load());
    }

    public TaleScript(TaleSettings settings) {
        this(settings, standardCapabilities(), Clock.systemDefaultZone());
    }

    public TaleScript(TaleSettings settings, CapabilityTable capabilities, Clock clock) {
        this.settings = settings;
        this.capabilities = capabilities;
        this.validator = new Validator(settings);
        this.executor = new SandboxExecutor(settings, capabilities, clock);
    }

    /** Core builtins, text and collection helpers, the file shim and every module. */
    public static CapabilityTable standardCapabilities() {
        CapabilityTable.Builder b = CapabilityTable.builder();
        TaleCorePlugin.register(b);
        TaleTextPlugin.register(b);
        TaleCollectionsPlugin.register(b);
        TaleFilesPlugin.register(b);
        TaleJsonPlugin.register(b);
        TaleCsvPlugin.register(b);
        TaleMathPlugin.register(b);
        TaleRandomPlugin.register(b);
        TaleDatetimePlugin.register(b);
        return b.build();
    }

    public TaleSettings settings() { return settings; }

    public CapabilityTable capabilities() { return capabilities; }

    // ===================== ANALYZE =====================

    /** Static checks only. Has no side effects beyond bumping the request version. */
    public AnalysisReport analyze(String code) {
        long v = version.incrementAndGet();
        BlockTree tree;
        try {
            tree = structure.build(SourceProgram.of(code));
        } catch (TaleException e) {
            return new AnalysisReport(Collections.singletonList(Diagnostic.of(e)), v, null);
        }
        try {
            ValidatedProgram program = validator.validate(translator.translate(tree));
            Debug.get().d(TAG, "analyze v" + v + ": " + program.diagnostics().size() + " problem(s)");
            return new AnalysisReport(program.diagnostics(), v, program.translated());
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "analyze v" + v + " failed unexpectedly", e);
            List<Diagnostic> internal = new ArrayList<>();
            internal.add(Diagnostic.of(TaleException.validation(0, "Unknown error: " + e)));
            return new AnalysisReport(internal, v, null);
        }
    }

    /** True when no analyze call was issued after the one that produced {@code v}. */
    public boolean isLatest(long v) {
        return version.get() == v;
    }

    public long currentVersion() {
        return version.get();
    }

    // ===================== RUN =====================

    public ExecutionResult run(String code, List<String> inputs) {
        return run(code, inputs, null);
    }

    /**
     * @param files text files present in the workspace before the program starts; may be null
     */
    public ExecutionResult run(String code, List<String> inputs, Map<String, String> files) {
        ValidatedProgram program;
        try {
            BlockTree tree = structure.build(SourceProgram.of(code));
            TransformedProgram transformed = translator.translate(tree);
            program = validator.validate(transformed);
        } catch (TaleException e) {
            return ExecutionResult.failure("", e, null, null);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "translation failed unexpectedly", e);
            return ExecutionResult.failure("", TaleException.validation(0, "I could not understand: " + e), null, null);
        }
        ExecutionResult result = executor.execute(program, inputs == null ? Collections.<String>emptyList() : inputs, files);
        Debug.get().d(TAG, "run: " + result);
        return result;
    }

    /** Inputs box text: one value per line. A trailing newline adds no value. */
    public static List<String> splitInputs(String box) {
        List<String> out = new ArrayList<>();
        if (box == null || box.isEmpty()) return out;
        Collections.addAll(out, box.split("\\r\\n|\\r|\\n", -1));
        if (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) out.remove(out.size() - 1);
        return out;
    }
}
