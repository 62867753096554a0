package com.tale.script.validate;

import java.util.List;

import com.tale.script.parser.Expr;
import com.tale.script.parser.Expr.ExprInterface;
import com.tale.script.parser.Statement;
import com.tale.script.parser.Statement.Stmt;
import com.tale.script.parser.Token;
import com.tale.script.sandbox.SandboxPolicy;
import com.tale.script.sandbox.TaleSettings;

/**
 * Walks parsed statements without evaluating them and throws a
 * {@link com.tale.script.diagnostics.SandboxViolationException} at the first
 * denied name, introspective attribute or disallowed import.
 */
final class SecurityCheck implements Expr.ExprVisitor<Void>, Statement.StmtVisitor {

    private final TaleSettings settings;
    private int line;

    SecurityCheck(TaleSettings settings) {
        this.settings = settings;
    }

    void check(Stmt stmt) {
        int saved = line;
        line = stmt.line();
        try {
            stmt.accept(this);
        } finally {
            line = saved;
        }
    }

    void check(List<Stmt> stmts) {
        for (Stmt s : stmts) check(s);
    }

    void checkExpr(ExprInterface expr, int atLine) {
        int saved = line;
        line = atLine;
        try {
            expr(expr);
        } finally {
            line = saved;
        }
    }

    void checkName(String name, int atLine) {
        SandboxPolicy.checkName(name, atLine);
    }

    private void expr(ExprInterface e) {
        if (e != null) e.accept(this);
    }

    private void exprs(List<ExprInterface> es) {
        for (ExprInterface e : es) expr(e);
    }

    private void name(Token t) {
        SandboxPolicy.checkName(t.lexeme, line);
    }

    // ------------------------------------------------------------ statements

    @Override public void visitExprStmt(Statement.ExprStmt stmt) { expr(stmt.expression); }

    @Override
    public void visitUnpackStmt(Statement.UnpackStmt stmt) {
        for (Token t : stmt.names) name(t);
        expr(stmt.value);
    }

    @Override public void visitBlockStmt(Statement.Block stmt) { check(stmt.statements); }

    @Override
    public void visitIfStmt(Statement.If stmt) {
        expr(stmt.condition);
        check(stmt.thenBranch);
        if (stmt.elseBranch != null) check(stmt.elseBranch);
    }

    @Override
    public void visitWhileStmt(Statement.While stmt) {
        expr(stmt.condition);
        check(stmt.body);
    }

    @Override
    public void visitForEachStmt(Statement.ForEach stmt) {
        for (String v : stmt.vars) SandboxPolicy.checkName(v, line);
        expr(stmt.iterable);
        check(stmt.body);
    }

    @Override
    public void visitFunctionStmt(Statement.FunctionStmt stmt) {
        SandboxPolicy.checkName(stmt.name, line);
        for (String p : stmt.params) SandboxPolicy.checkName(p, line);
        check(stmt.body);
    }

    @Override
    public void visitClassStmt(Statement.ClassStmt stmt) {
        SandboxPolicy.checkName(stmt.name, line);
        if (stmt.base != null) SandboxPolicy.checkName(stmt.base, line);
        check(stmt.body);
    }

    @Override
    public void visitTryStmt(Statement.TryStmt stmt) {
        check(stmt.body);
        if (stmt.catchBody != null) {
            SandboxPolicy.checkName(stmt.catchName, line);
            check(stmt.catchBody);
        }
        if (stmt.finallyBody != null) check(stmt.finallyBody);
    }

    @Override public void visitReturnStmt(Statement.ReturnStmt stmt) { expr(stmt.value); }
    @Override public void visitBreakStmt(Statement.BreakStmt stmt) { }
    @Override public void visitContinueStmt(Statement.ContinueStmt stmt) { }
    @Override public void visitPassStmt(Statement.PassStmt stmt) { }
    @Override public void visitRaiseStmt(Statement.RaiseStmt stmt) { expr(stmt.value); }

    @Override
    public void visitImportStmt(Statement.ImportStmt stmt) {
        SandboxPolicy.checkImport(settings, stmt.module.lexeme, line);
        if (stmt.alias != null) name(stmt.alias);
    }

    @Override
    public void visitFromImportStmt(Statement.FromImportStmt stmt) {
        SandboxPolicy.checkImport(settings, stmt.module.lexeme, line);
        for (Token t : stmt.names) name(t);
    }

    @Override
    public void visitGlobalStmt(Statement.GlobalStmt stmt) {
        for (Token t : stmt.names) name(t);
    }

    // ----------------------------------------------------------- expressions

    @Override
    public Void visitBinaryExpr(Expr.Binary expr) {
        expr(expr.left);
        expr(expr.right);
        return null;
    }

    @Override
    public Void visitUnaryExpr(Expr.Unary expr) {
        expr(expr.right);
        return null;
    }

    @Override public Void visitLiteralExpr(Expr.Literal expr) { return null; }

    @Override
    public Void visitListLiteralExpr(Expr.ListLiteral expr) {
        exprs(expr.items);
        return null;
    }

    @Override
    public Void visitTupleLiteralExpr(Expr.TupleLiteral expr) {
        exprs(expr.items);
        return null;
    }

    @Override
    public Void visitMapLiteralExpr(Expr.MapLiteral expr) {
        exprs(expr.keys);
        exprs(expr.values);
        return null;
    }

    @Override
    public Void visitVariableExpr(Expr.Variable expr) {
        name(expr.name);
        return null;
    }

    @Override
    public Void visitAssignExpr(Expr.Assign expr) {
        name(expr.name);
        expr(expr.value);
        return null;
    }

    @Override
    public Void visitLogicalExpr(Expr.Logical expr) {
        expr(expr.left);
        expr(expr.right);
        return null;
    }

    @Override
    public Void visitComparisonExpr(Expr.Comparison expr) {
        exprs(expr.operands);
        return null;
    }

    @Override
    public Void visitTernaryExpr(Expr.Ternary expr) {
        expr(expr.condition);
        expr(expr.thenValue);
        expr(expr.elseValue);
        return null;
    }

    @Override
    public Void visitLambdaExpr(Expr.Lambda expr) {
        for (Token p : expr.params) name(p);
        expr(expr.body);
        return null;
    }

    @Override
    public Void visitComprehensionExpr(Expr.Comprehension expr) {
        for (Token v : expr.vars) name(v);
        expr(expr.iterable);
        expr(expr.condition);
        expr(expr.element);
        return null;
    }

    @Override
    public Void visitCallExpr(Expr.Call expr) {
        expr(expr.callee);
        exprs(expr.arguments);
        return null;
    }

    @Override
    public Void visitMethodCallExpr(Expr.MethodCallExpr expr) {
        expr(expr.receiver);
        SandboxPolicy.checkAttribute(expr.method.lexeme, line);
        exprs(expr.arguments);
        return null;
    }

    @Override
    public Void visitIndexExpr(Expr.IndexExpr expr) {
        expr(expr.target);
        expr(expr.index);
        return null;
    }

    @Override
    public Void visitSliceExpr(Expr.SliceExpr expr) {
        expr(expr.target);
        expr(expr.lower);
        expr(expr.upper);
        expr(expr.step);
        return null;
    }

    @Override
    public Void visitSetIndexExpr(Expr.SetIndexExpr expr) {
        expr(expr.target);
        expr(expr.index);
        expr(expr.value);
        return null;
    }

    @Override
    public Void visitGetExpr(Expr.GetExpr expr) {
        expr(expr.receiver);
        SandboxPolicy.checkAttribute(expr.name.lexeme, line);
        return null;
    }

    @Override
    public Void visitSetExpr(Expr.SetExpr expr) {
        expr(expr.receiver);
        SandboxPolicy.checkAttribute(expr.name.lexeme, line);
        expr(expr.value);
        return null;
    }
}
