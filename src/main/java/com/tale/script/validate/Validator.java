package com.tale.script.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.tale.debug.Debug;
import com.tale.script.diagnostics.Diagnostic;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Header;
import com.tale.script.parser.Parser;
import com.tale.script.parser.Statement;
import com.tale.script.parser.Statement.Stmt;
import com.tale.script.sandbox.TaleSettings;
import com.tale.script.structure.BlockNode;
import com.tale.script.transform.TransformedProgram;
import com.tale.script.transform.TransformedStatement;

/**
 * Parses every canonical line and assembles the statement tree without running
 * anything. A failing line becomes a diagnostic and validation carries on with
 * the next line, so one report lists every problem.
 */
public final class Validator {

    private static final String TAG = "tale.validate";

    private final TaleSettings settings;

    public Validator(TaleSettings settings) {
        this.settings = settings;
    }

    public ValidatedProgram validate(TransformedProgram program) {
        Run run = new Run(program);
        List<Stmt> statements = run.nodes(program.tree().roots(), Scope.TOP);

        List<Diagnostic> diagnostics = new ArrayList<>(program.diagnostics());
        diagnostics.addAll(run.diagnostics);
        diagnostics.sort(Comparator.comparingInt(Diagnostic::line));

        Debug.get().t(TAG, "validated " + program.statements().size() + " lines, "
                + diagnostics.size() + " problem(s)");
        if (!diagnostics.isEmpty()) {
            return new ValidatedProgram(program, Collections.<Stmt>emptyList(), diagnostics);
        }
        return new ValidatedProgram(program, statements, diagnostics);
    }

    /** Where a statement sits; decides whether return/break/continue are legal. */
    private static final class Scope {
        static final Scope TOP = new Scope(false, false);

        final boolean inFunction;
        final boolean inLoop;

        Scope(boolean inFunction, boolean inLoop) {
            this.inFunction = inFunction;
            this.inLoop = inLoop;
        }

        Scope loop() { return new Scope(inFunction, true); }
        Scope function() { return new Scope(true, false); }
        Scope classBody() { return new Scope(false, false); }
    }

    /** State for validating one program. */
    private final class Run {
        private final TransformedProgram program;
        private final SecurityCheck security = new SecurityCheck(settings);
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        Run(TransformedProgram program) {
            this.program = program;
        }

        List<Stmt> nodes(List<BlockNode> nodes, Scope scope) {
            List<Stmt> out = new ArrayList<>();
            for (BlockNode node : nodes) {
                if (node instanceof BlockNode.Block) {
                    Stmt s = block((BlockNode.Block) node, scope);
                    if (s != null) out.add(s);
                } else {
                    out.addAll(statement(node.line(), scope));
                }
            }
            return out;
        }

        private List<Stmt> statement(int line, Scope scope) {
            TransformedStatement ts = program.at(line);
            if (ts == null) return Collections.emptyList();
            try {
                List<Stmt> parsed = Parser.of(ts.canonical(), line).parseLine();
                for (Stmt s : parsed) {
                    security.check(s);
                    placement(s, scope);
                }
                return parsed;
            } catch (TaleException e) {
                diagnostics.add(Diagnostic.of(e.atLine(line)));
                return Collections.emptyList();
            }
        }

        private void placement(Stmt s, Scope scope) {
            if (s instanceof Statement.ReturnStmt && !scope.inFunction) {
                throw TaleException.validation(s.line(), "'return' can only be used inside a function");
            }
            if (s instanceof Statement.BreakStmt && !scope.inLoop) {
                throw TaleException.validation(s.line(), "'break' can only be used inside a loop");
            }
            if (s instanceof Statement.ContinueStmt && !scope.inLoop) {
                throw TaleException.validation(s.line(), "'continue' can only be used inside a loop");
            }
        }

        /** Null when the header line itself is broken; the body is still checked. */
        private Header header(int line) {
            TransformedStatement ts = program.at(line);
            if (ts == null) return null;
            try {
                Header h = Parser.of(ts.canonical(), line).parseHeader();
                if (h.condition != null) security.checkExpr(h.condition, line);
                if (h.iterable != null) security.checkExpr(h.iterable, line);
                for (String n : h.names) security.checkName(n, line);
                if (h.name != null) security.checkName(h.name, line);
                if (h.base != null) security.checkName(h.base, line);
                return h;
            } catch (TaleException e) {
                diagnostics.add(Diagnostic.of(e.atLine(line)));
                return null;
            }
        }

        private Stmt block(BlockNode.Block b, Scope scope) {
            Header h = header(b.line());
            int line = b.line();
            switch (b.kind()) {
                case IF:
                    return ifChain(b, h, scope);
                case WHILE: {
                    List<Stmt> body = nodes(b.children(), scope.loop());
                    if (h == null) return null;
                    return new Statement.While(line, h.condition, new Statement.Block(line, body));
                }
                case REPEAT:
                case FOR_EACH: {
                    List<Stmt> body = nodes(b.children(), scope.loop());
                    if (h == null) return null;
                    return new Statement.ForEach(line, h.params(), h.iterable, new Statement.Block(line, body));
                }
                case FUNCTION: {
                    List<Stmt> body = nodes(b.children(), scope.function());
                    if (h == null) return null;
                    return new Statement.FunctionStmt(line, h.name, h.params(), body);
                }
                case CLASS: {
                    List<Stmt> body = nodes(b.children(), scope.classBody());
                    if (h == null) return null;
                    return new Statement.ClassStmt(line, h.name, h.base, body);
                }
                case TRY:
                    return tryBlock(b, h, scope);
                default:
                    throw new IllegalStateException("Unhandled block kind: " + b.kind());
            }
        }

        private Stmt ifChain(BlockNode.Block b, Header h, Scope scope) {
            List<Stmt> thenBody = nodes(b.children(), scope);
            List<Header> conditions = new ArrayList<>();
            List<List<Stmt>> bodies = new ArrayList<>();
            List<Integer> lines = new ArrayList<>();
            List<Stmt> elseBody = null;
            boolean broken = h == null;

            for (BlockNode.Branch br : b.branches()) {
                Header bh = header(br.line());
                List<Stmt> body = nodes(br.children(), scope);
                if (bh == null) {
                    broken = true;
                    continue;
                }
                if (bh.kind == Header.Kind.ELSE) {
                    elseBody = body;
                } else {
                    conditions.add(bh);
                    bodies.add(body);
                    lines.add(br.line());
                }
            }
            if (broken) return null;

            // build the elif chain from the innermost branch outwards
            Stmt tail = elseBody == null ? null : new Statement.Block(b.line(), elseBody);
            for (int i = conditions.size() - 1; i >= 0; i--) {
                int line = lines.get(i);
                tail = new Statement.If(line, conditions.get(i).condition, new Statement.Block(line, bodies.get(i)), tail);
            }
            return new Statement.If(b.line(), h.condition, new Statement.Block(b.line(), thenBody), tail);
        }

        private Stmt tryBlock(BlockNode.Block b, Header h, Scope scope) {
            List<Stmt> body = nodes(b.children(), scope);
            String catchName = null;
            List<Stmt> catchBody = null;
            List<Stmt> finallyBody = null;
            boolean broken = h == null;

            for (BlockNode.Branch br : b.branches()) {
                Header bh = header(br.line());
                List<Stmt> branchBody = nodes(br.children(), scope);
                if (bh == null) {
                    broken = true;
                    continue;
                }
                if (bh.kind == Header.Kind.CATCH) {
                    catchName = bh.name;
                    catchBody = branchBody;
                } else {
                    finallyBody = branchBody;
                }
            }
            if (broken) return null;
            return new Statement.TryStmt(b.line(), body, catchName, catchBody, finallyBody);
        }
    }
}
