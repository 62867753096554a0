package com.tale.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLiteralExpr(Literal expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitTupleLiteralExpr(TupleLiteral expr);
        R visitMapLiteralExpr(MapLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitAssignExpr(Assign expr);
        R visitLogicalExpr(Logical expr);
        R visitComparisonExpr(Comparison expr);
        R visitTernaryExpr(Ternary expr);
        R visitLambdaExpr(Lambda expr);
        R visitComprehensionExpr(Comprehension expr);
        R visitCallExpr(Call expr);
        R visitMethodCallExpr(MethodCallExpr expr);
        R visitIndexExpr(IndexExpr expr);
        R visitSliceExpr(SliceExpr expr);
        R visitSetIndexExpr(SetIndexExpr expr);
        R visitGetExpr(GetExpr expr);
        R visitSetExpr(SetExpr expr);
    }

    // -------------------------
    // Core expression nodes
    // -------------------------

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /** Long, Double, String, Boolean or null. */
    public static final class Literal implements ExprInterface {
        public final Object value;

        public Literal(Object value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class ListLiteral implements ExprInterface {
        public final List<ExprInterface> items;

        public ListLiteral(List<ExprInterface> items) {
            this.items = items;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }
    }

    public static final class TupleLiteral implements ExprInterface {
        public final List<ExprInterface> items;

        public TupleLiteral(List<ExprInterface> items) {
            this.items = items;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTupleLiteralExpr(this);
        }
    }

    /** Keys are arbitrary expressions; entries keep source order. */
    public static final class MapLiteral implements ExprInterface {
        public final List<ExprInterface> keys;
        public final List<ExprInterface> values;

        public MapLiteral(List<ExprInterface> keys, List<ExprInterface> values) {
            this.keys = keys;
            this.values = values;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMapLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Assign implements ExprInterface {
        public final Token name;
        public final ExprInterface value;

        public Assign(Token name, ExprInterface value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    /** {@code a < b <= c}: each operand is evaluated once, evaluation stops at the first false link. */
    public static final class Comparison implements ExprInterface {
        public final List<ExprInterface> operands;
        public final List<Token> operators;

        public Comparison(List<ExprInterface> operands, List<Token> operators) {
            this.operands = operands;
            this.operators = operators;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitComparisonExpr(this);
        }
    }

    /** {@code then if condition else otherwise}. */
    public static final class Ternary implements ExprInterface {
        public final ExprInterface condition;
        public final ExprInterface thenValue;
        public final ExprInterface elseValue;

        public Ternary(ExprInterface condition, ExprInterface thenValue, ExprInterface elseValue) {
            this.condition = condition;
            this.thenValue = thenValue;
            this.elseValue = elseValue;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTernaryExpr(this);
        }
    }

    public static final class Lambda implements ExprInterface {
        public final Token keyword;
        public final List<Token> params;
        public final ExprInterface body;

        public Lambda(Token keyword, List<Token> params, ExprInterface body) {
            this.keyword = keyword;
            this.params = params;
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLambdaExpr(this);
        }
    }

    /** {@code [element for vars in iterable if condition]}; condition may be null. */
    public static final class Comprehension implements ExprInterface {
        public final ExprInterface element;
        public final List<Token> vars;
        public final ExprInterface iterable;
        public final ExprInterface condition;

        public Comprehension(ExprInterface element, List<Token> vars, ExprInterface iterable, ExprInterface condition) {
            this.element = element;
            this.vars = vars;
            this.iterable = iterable;
            this.condition = condition;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitComprehensionExpr(this);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    public static final class MethodCallExpr implements ExprInterface {
        public final ExprInterface receiver;
        public final Token method;
        public final List<ExprInterface> arguments;

        public MethodCallExpr(ExprInterface receiver, Token method, List<ExprInterface> arguments) {
            this.receiver = receiver;
            this.method = method;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMethodCallExpr(this);
        }
    }

    // -------------------------
    // Indexing and attributes
    // -------------------------

    public static final class IndexExpr implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public IndexExpr(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    /** {@code target[lower:upper:step]}; any bound may be null. */
    public static final class SliceExpr implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface lower;
        public final ExprInterface upper;
        public final ExprInterface step;
        public final Token bracket;

        public SliceExpr(ExprInterface target, ExprInterface lower, ExprInterface upper, ExprInterface step, Token bracket) {
            this.target = target;
            this.lower = lower;
            this.upper = upper;
            this.step = step;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSliceExpr(this);
        }
    }

    public static final class SetIndexExpr implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final ExprInterface value;
        public final Token bracket;

        public SetIndexExpr(ExprInterface target, ExprInterface index, ExprInterface value, Token bracket) {
            this.target = target;
            this.index = index;
            this.value = value;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetIndexExpr(this);
        }
    }

    public static final class GetExpr implements ExprInterface {
        public final ExprInterface receiver;
        public final Token name;

        public GetExpr(ExprInterface receiver, Token name) {
            this.receiver = receiver;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGetExpr(this);
        }
    }

    public static final class SetExpr implements ExprInterface {
        public final ExprInterface receiver;
        public final Token name;
        public final ExprInterface value;

        public SetExpr(ExprInterface receiver, Token name, ExprInterface value) {
            this.receiver = receiver;
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetExpr(this);
        }
    }
}
