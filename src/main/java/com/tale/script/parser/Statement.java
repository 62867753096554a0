package com.tale.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);

        /** TALE source line the statement came from. */
        int line();
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitUnpackStmt(UnpackStmt stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitForEachStmt(ForEach stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitClassStmt(ClassStmt stmt);
        void visitTryStmt(TryStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
        void visitBreakStmt(BreakStmt stmt);
        void visitContinueStmt(ContinueStmt stmt);
        void visitPassStmt(PassStmt stmt);
        void visitRaiseStmt(RaiseStmt stmt);
        void visitImportStmt(ImportStmt stmt);
        void visitFromImportStmt(FromImportStmt stmt);
        void visitGlobalStmt(GlobalStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        final int line;
        public final Expr.ExprInterface expression;
        public ExprStmt(int line, Expr.ExprInterface expression) { this.line = line; this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
        public int line() { return line; }
    }

    /** {@code a, b = value}. */
    public static final class UnpackStmt implements Stmt {
        final int line;
        public final List<Token> names;
        public final Expr.ExprInterface value;
        public UnpackStmt(int line, List<Token> names, Expr.ExprInterface value) {
            this.line = line;
            this.names = names;
            this.value = value;
        }
        public void accept(StmtVisitor visitor) { visitor.visitUnpackStmt(this); }
        public int line() { return line; }
    }

    /** A statement sequence. Blocks do not open a scope. */
    public static final class Block implements Stmt {
        final int line;
        public final List<Stmt> statements;
        public Block(int line, List<Stmt> statements) { this.line = line; this.statements = statements; }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
        public int line() { return line; }
    }

    /** An elif chain is an If nested in the else branch. */
    public static final class If implements Stmt {
        final int line;
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch;
        public If(int line, Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.line = line;
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
        public int line() { return line; }
    }

    public static final class While implements Stmt {
        final int line;
        public final Expr.ExprInterface condition;
        public final Stmt body;
        public While(int line, Expr.ExprInterface condition, Stmt body) {
            this.line = line;
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
        public int line() { return line; }
    }

    /** Iterates {@code iterable}; with no vars the items are simply counted off. */
    public static final class ForEach implements Stmt {
        final int line;
        public final List<String> vars;
        public final Expr.ExprInterface iterable;
        public final Stmt body;
        public ForEach(int line, List<String> vars, Expr.ExprInterface iterable, Stmt body) {
            this.line = line;
            this.vars = vars;
            this.iterable = iterable;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitForEachStmt(this); }
        public int line() { return line; }
    }

    public static final class FunctionStmt implements Stmt {
        final int line;
        public final String name;
        public final List<String> params;
        public final List<Stmt> body;

        public FunctionStmt(int line, String name, List<String> params, List<Stmt> body) {
            this.line = line;
            this.name = name;
            this.params = params;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
        public int line() { return line; }
    }

    /** The body runs once in the class namespace; what it binds becomes class attributes. */
    public static final class ClassStmt implements Stmt {
        final int line;
        public final String name;
        public final String base; // may be null
        public final List<Stmt> body;

        public ClassStmt(int line, String name, String base, List<Stmt> body) {
            this.line = line;
            this.name = name;
            this.base = base;
            this.body = body;
        }

        public void accept(StmtVisitor visitor) { visitor.visitClassStmt(this); }
        public int line() { return line; }
    }

    public static final class TryStmt implements Stmt {
        final int line;
        public final List<Stmt> body;
        public final String catchName;       // null without a catch
        public final List<Stmt> catchBody;   // null without a catch
        public final List<Stmt> finallyBody; // null without a finally

        public TryStmt(int line, List<Stmt> body, String catchName, List<Stmt> catchBody, List<Stmt> finallyBody) {
            this.line = line;
            this.body = body;
            this.catchName = catchName;
            this.catchBody = catchBody;
            this.finallyBody = finallyBody;
        }

        public void accept(StmtVisitor visitor) { visitor.visitTryStmt(this); }
        public int line() { return line; }
    }

    public static final class ReturnStmt implements Stmt {
        final Token keyword;
        public final Expr.ExprInterface value; // may be null

        public ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class BreakStmt implements Stmt {
        final Token keyword;
        public BreakStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitBreakStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class ContinueStmt implements Stmt {
        final Token keyword;
        public ContinueStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitContinueStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class PassStmt implements Stmt {
        final Token keyword;
        public PassStmt(Token keyword) { this.keyword = keyword; }
        public void accept(StmtVisitor visitor) { visitor.visitPassStmt(this); }
        public int line() { return keyword.line; }
    }

    /** A bare {@code raise} re-raises the error being handled. */
    public static final class RaiseStmt implements Stmt {
        final Token keyword;
        public final Expr.ExprInterface value; // may be null
        public RaiseStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }
        public void accept(StmtVisitor visitor) { visitor.visitRaiseStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class ImportStmt implements Stmt {
        final Token keyword;
        public final Token module;
        public final Token alias; // may be null
        public ImportStmt(Token keyword, Token module, Token alias) {
            this.keyword = keyword;
            this.module = module;
            this.alias = alias;
        }
        public void accept(StmtVisitor visitor) { visitor.visitImportStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class FromImportStmt implements Stmt {
        final Token keyword;
        public final Token module;
        public final List<Token> names;
        public FromImportStmt(Token keyword, Token module, List<Token> names) {
            this.keyword = keyword;
            this.module = module;
            this.names = names;
        }
        public void accept(StmtVisitor visitor) { visitor.visitFromImportStmt(this); }
        public int line() { return keyword.line; }
    }

    public static final class GlobalStmt implements Stmt {
        final Token keyword;
        public final List<Token> names;
        public GlobalStmt(Token keyword, List<Token> names) {
            this.keyword = keyword;
            this.names = names;
        }
        public void accept(StmtVisitor visitor) { visitor.visitGlobalStmt(this); }
        public int line() { return keyword.line; }
    }
}
