package com.tale.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.tale.debug.Debug;
import com.tale.script.diagnostics.Diagnostic;
import com.tale.script.sandbox.ExecutionResult;

public final class TaleCli {

    private static final String USAGE = "Usage: TaleCli <script-file> [--input value]... [--analyze] [--verbose]";

    public static void main(String[] args) {
        String file = null;
        List<String> inputs = new ArrayList<>();
        boolean analyzeOnly = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if ("--input".equals(a)) {
                if (i + 1 >= args.length) usage();
                inputs.add(args[++i]);
            } else if ("--analyze".equals(a)) {
                analyzeOnly = true;
            } else if ("--verbose".equals(a)) {
                Debug.useSysOut();
            } else if (a.startsWith("--") || file != null) {
                usage();
            } else {
                file = a;
            }
        }
        if (file == null) usage();

        final Path scriptPath = Path.of(file);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + scriptPath);
            e.printStackTrace(System.err);
            System.exit(3);
            return;
        }

        final TaleScript engine = new TaleScript();

        if (analyzeOnly) {
            AnalysisReport report = engine.analyze(script);
            if (report.ok()) {
                System.out.println("No problems found.");
                return;
            }
            for (Diagnostic d : report.diagnostics()) System.out.println(d.render());
            System.exit(1);
            return;
        }

        ExecutionResult result = engine.run(script, inputs);
        System.out.print(result.output());
        if (!result.success()) {
            System.err.println(result.error());
            if (result.suggestedFix() != null) System.err.println("Hint: " + result.suggestedFix());
            System.exit(1);
        }
    }

    private static void usage() {
        System.err.println(USAGE);
        System.exit(2);
    }

    private TaleCli() {}
}
