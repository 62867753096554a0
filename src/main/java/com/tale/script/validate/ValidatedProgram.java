package com.tale.script.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tale.script.diagnostics.Diagnostic;
import com.tale.script.parser.Statement.Stmt;
import com.tale.script.transform.TransformedProgram;

/**
 * Outcome of static validation: the executable statement tree when every line
 * passed, and all diagnostics in line order otherwise.
 */
public final class ValidatedProgram {

    private final TransformedProgram transformed;
    private final List<Stmt> statements;
    private final List<Diagnostic> diagnostics;

    ValidatedProgram(TransformedProgram transformed, List<Stmt> statements, List<Diagnostic> diagnostics) {
        this.transformed = transformed;
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public boolean ok() { return diagnostics.isEmpty(); }

    /** Empty unless {@link #ok()}. */
    public List<Stmt> statements() { return statements; }

    public List<Diagnostic> diagnostics() { return diagnostics; }

    public TransformedProgram transformed() { return transformed; }

    /** The canonical program shown to learners next to their TALE. */
    public String translated() { return transformed.render(); }
}
