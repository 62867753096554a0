package com.tale.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.tale.script.diagnostics.ErrorKind;
import com.tale.script.diagnostics.SandboxViolationException;
import com.tale.script.diagnostics.TaleException;
import com.tale.script.parser.Expr.Assign;
import com.tale.script.parser.Expr.Binary;
import com.tale.script.parser.Expr.Call;
import com.tale.script.parser.Expr.Comparison;
import com.tale.script.parser.Expr.Comprehension;
import com.tale.script.parser.Expr.ExprVisitor;
import com.tale.script.parser.Expr.GetExpr;
import com.tale.script.parser.Expr.IndexExpr;
import com.tale.script.parser.Expr.Lambda;
import com.tale.script.parser.Expr.ListLiteral;
import com.tale.script.parser.Expr.Literal;
import com.tale.script.parser.Expr.Logical;
import com.tale.script.parser.Expr.MapLiteral;
import com.tale.script.parser.Expr.MethodCallExpr;
import com.tale.script.parser.Expr.SetExpr;
import com.tale.script.parser.Expr.SetIndexExpr;
import com.tale.script.parser.Expr.SliceExpr;
import com.tale.script.parser.Expr.Ternary;
import com.tale.script.parser.Expr.TupleLiteral;
import com.tale.script.parser.Expr.Unary;
import com.tale.script.parser.Expr.Variable;
import com.tale.script.parser.Statement.Block;
import com.tale.script.parser.Statement.BreakStmt;
import com.tale.script.parser.Statement.ClassStmt;
import com.tale.script.parser.Statement.ContinueStmt;
import com.tale.script.parser.Statement.ExprStmt;
import com.tale.script.parser.Statement.ForEach;
import com.tale.script.parser.Statement.FromImportStmt;
import com.tale.script.parser.Statement.FunctionStmt;
import com.tale.script.parser.Statement.GlobalStmt;
import com.tale.script.parser.Statement.If;
import com.tale.script.parser.Statement.ImportStmt;
import com.tale.script.parser.Statement.PassStmt;
import com.tale.script.parser.Statement.RaiseStmt;
import com.tale.script.parser.Statement.ReturnStmt;
import com.tale.script.parser.Statement.Stmt;
import com.tale.script.parser.Statement.StmtVisitor;
import com.tale.script.parser.Statement.TryStmt;
import com.tale.script.parser.Statement.UnpackStmt;
import com.tale.script.parser.Statement.While;
import com.tale.script.parser.Value.TaleClass;
import com.tale.script.parser.Value.TaleInstance;
import com.tale.script.sandbox.SandboxContext;
import com.tale.script.sandbox.SandboxPolicy;

/**
 * Tree-walking evaluator for a validated program. Everything the program can
 * reach comes from its own namespace or the bound capability table of the
 * {@link SandboxContext}; every statement, loop iteration and call is charged
 * to the run's budget.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {

    /** Methods on built-in values, mapped to the capability that implements them. */
    private static final Map<String, String> METHOD_ALIASES;
    static {
        Map<String, String> m = new HashMap<>();
        for (String name : Arrays.asList("upper", "lower", "title", "strip", "isalpha", "isdigit", "isalnum",
                "replace", "split", "join", "find", "count", "startswith", "endswith",
                "extend", "insert", "remove", "pop", "clear", "sort", "reverse", "copy", "index",
                "keys", "values", "items", "get", "update",
                "union", "intersection", "difference", "issubset",
                "read", "write", "close")) {
            m.put(name, name);
        }
        m.put("append", "add_to");
        m.put("add", "add_to");
        METHOD_ALIASES = m;
    }

    Environment env;
    private final Environment globals;
    private final SandboxContext context;
    private final Map<String, Value> capabilities;
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final int maxDepth;
    private TaleException handling;
    private int currentLine;

    public Interpreter(SandboxContext context) {
        this.globals = new Environment();
        this.env = globals;
        this.context = context;
        this.capabilities = context.capabilities();
        this.maxDepth = context.settings().maxCallDepth();
        context.attach(this);
    }

    public Environment globals() {
        return globals;
    }

    public void execute(List<Stmt> program) {
        for (Stmt stmt : program) executeStmt(stmt);
    }

    void executeStmt(Stmt stmt) {
        context.budget().checkpoint();
        currentLine = stmt.line();
        try {
            stmt.accept(this);
        } catch (TaleException e) {
            throw e.atLine(stmt.line());
        }
    }

    /** Runs {@code body} with {@code frame} as the current namespace. */
    void executeBody(List<Stmt> body, Environment frame) {
        Environment previous = this.env;
        this.env = frame;
        try {
            for (Stmt s : body) executeStmt(s);
        } finally {
            this.env = previous;
        }
    }

    Value evaluateIn(Expr.ExprInterface expr, Environment frame) {
        Environment previous = this.env;
        this.env = frame;
        try {
            return eval(expr);
        } finally {
            this.env = previous;
        }
    }

    private Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    // ------------------------------------------------------------ statements

    public void visitExprStmt(ExprStmt stmt) { eval(stmt.expression); }

    public void visitUnpackStmt(UnpackStmt stmt) {
        Value value = eval(stmt.value);
        List<Value> items = unpack(value, stmt.names.size());
        for (int i = 0; i < items.size(); i++) {
            String name = stmt.names.get(i).lexeme;
            SandboxPolicy.checkName(name, stmt.line());
            env.assign(name, items.get(i));
        }
    }

    public void visitBlockStmt(Block stmt) {
        for (Stmt s : stmt.statements) executeStmt(s);
    }

    public void visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) executeStmt(stmt.thenBranch);
        else if (stmt.elseBranch != null) executeStmt(stmt.elseBranch);
    }

    public void visitWhileStmt(While stmt) {
        while (eval(stmt.condition).isTruthy()) {
            try {
                executeStmt(stmt.body);
            } catch (BreakSignal bs) {
                break;
            } catch (ContinueSignal cs) {
                continue;
            }
        }
    }

    public void visitForEachStmt(ForEach stmt) {
        Value iterable = eval(stmt.iterable);
        Iterator<Value> it = iterable.iterator();
        while (it.hasNext()) {
            Value item = it.next();
            bindLoopVars(stmt.vars, item, stmt.line());
            try {
                executeStmt(stmt.body);
            } catch (BreakSignal bs) {
                break;
            } catch (ContinueSignal cs) {
                continue;
            }
        }
    }

    private void bindLoopVars(List<String> vars, Value item, int line) {
        if (vars.isEmpty()) return;
        if (vars.size() == 1) {
            env.assign(vars.get(0), item);
            return;
        }
        List<Value> parts = unpack(item, vars.size());
        for (int i = 0; i < vars.size(); i++) env.assign(vars.get(i), parts.get(i));
    }

    private static List<Value> unpack(Value value, int count) {
        if (!value.isIterable()) {
            throw TaleException.runtime("Cannot unpack " + value.typeName() + " into " + count + " names");
        }
        List<Value> items = value.toList();
        if (items.size() != count) {
            throw TaleException.runtime("Wrong number of values: expected " + count + ", got " + items.size());
        }
        return items;
    }

    public void visitFunctionStmt(FunctionStmt stmt) {
        SandboxPolicy.checkName(stmt.name, stmt.line());
        env.assign(stmt.name, Value.func(new UserFunction(stmt.name, stmt.params, stmt.body, env)));
    }

    @Override
    public void visitClassStmt(ClassStmt stmt) {
        SandboxPolicy.checkName(stmt.name, stmt.line());
        TaleClass base = null;
        if (stmt.base != null) {
            Value b = lookupVariable(stmt.base, stmt.line());
            if (b.type != Value.Type.CLASS) {
                throw TaleException.runtime("'" + stmt.base + "' is not a class");
            }
            base = b.asClass();
        }

        Environment classEnv = env.child();
        executeBody(stmt.body, classEnv);

        Map<String, Value> attributes = new LinkedHashMap<>(classEnv.values());
        env.assign(stmt.name, Value.clazz(new TaleClass(stmt.name, base, attributes)));
    }

    @Override
    public void visitTryStmt(TryStmt stmt) {
        try {
            executeBody(stmt.body, env);
        } catch (TaleException e) {
            if (stmt.catchBody == null || !e.kind().catchableByProgram()) throw e;
            TaleException outer = handling;
            handling = e;
            try {
                env.assign(stmt.catchName, Value.error(e.detail()));
                executeBody(stmt.catchBody, env);
            } finally {
                handling = outer;
            }
        } finally {
            if (stmt.finallyBody != null) executeBody(stmt.finallyBody, env);
        }
    }

    public void visitReturnStmt(ReturnStmt stmt) {
        throw new ReturnSignal(stmt.value == null ? Value.nil() : eval(stmt.value));
    }

    public void visitBreakStmt(BreakStmt stmt) {
        throw new BreakSignal();
    }

    public void visitContinueStmt(ContinueStmt stmt) {
        throw new ContinueSignal();
    }

    public void visitPassStmt(PassStmt stmt) {
        // nothing to do
    }

    public void visitRaiseStmt(RaiseStmt stmt) {
        if (stmt.value == null) {
            if (handling == null) throw TaleException.runtime("There is no error to raise again here");
            throw handling;
        }
        Value v = eval(stmt.value);
        String message = v.type == Value.Type.FUNC ? v.asFunc().name() : v.toString();
        throw TaleException.runtime(message);
    }

    public void visitImportStmt(ImportStmt stmt) {
        Value module = module(stmt.module);
        String bound = stmt.alias == null ? stmt.module.lexeme : stmt.alias.lexeme;
        SandboxPolicy.checkName(bound, stmt.line());
        env.assign(bound, module);
    }

    public void visitFromImportStmt(FromImportStmt stmt) {
        Value.ModuleValue module = module(stmt.module).asModule();
        for (Token name : stmt.names) {
            SandboxPolicy.checkName(name.lexeme, stmt.line());
            Value member = module.members.get(name.lexeme);
            if (member == null) {
                throw TaleException.runtime("Module '" + module.name + "' has no member '" + name.lexeme + "'");
            }
            env.assign(name.lexeme, member);
        }
    }

    private Value module(Token name) {
        SandboxPolicy.checkImport(context.settings(), name.lexeme, name.line);
        Value module = capabilities.get(name.lexeme);
        if (module == null || module.type != Value.Type.MODULE) {
            throw new SandboxViolationException(name.line, "Import not allowed: " + name.lexeme);
        }
        return module;
    }

    public void visitGlobalStmt(GlobalStmt stmt) {
        for (Token name : stmt.names) env.declareGlobal(name.lexeme);
    }

    // ----------------------------------------------------------- expressions

    public Value visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v == null) return Value.nil();
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        if (v instanceof Long) return Value.integer((Long) v);
        if (v instanceof Double) return Value.decimal((Double) v);
        if (v instanceof String) return Value.text((String) v);
        throw new IllegalStateException("Unsupported literal value: " + v);
    }

    public Value visitListLiteralExpr(ListLiteral expr) {
        List<Value> values = new ArrayList<>(expr.items.size());
        for (Expr.ExprInterface e : expr.items) values.add(eval(e));
        context.checkSize(values.size());
        return Value.list(values);
    }

    public Value visitTupleLiteralExpr(TupleLiteral expr) {
        List<Value> values = new ArrayList<>(expr.items.size());
        for (Expr.ExprInterface e : expr.items) values.add(eval(e));
        return Value.tuple(values);
    }

    public Value visitMapLiteralExpr(MapLiteral expr) {
        Map<Value, Value> out = new LinkedHashMap<>();
        for (int i = 0; i < expr.keys.size(); i++) {
            Value k = eval(expr.keys.get(i)).requireHashable();
            out.put(k, eval(expr.values.get(i)));
        }
        context.checkSize(out.size());
        return Value.map(out);
    }

    public Value visitVariableExpr(Variable expr) {
        return lookupVariable(expr.name.lexeme, expr.name.line);
    }

    private Value lookupVariable(String name, int line) {
        SandboxPolicy.checkName(name, line);
        Value v = env.lookup(name);
        if (v != null) return v;
        v = capabilities.get(name);
        if (v != null) return v;
        throw new TaleException(ErrorKind.RUNTIME, line, "Unknown variable: name '" + name + "' is not defined")
                .withSuggestedFix("Did you define the variable before using it?");
    }

    public Value visitAssignExpr(Assign expr) {
        SandboxPolicy.checkName(expr.name.lexeme, expr.name.line);
        Value value = eval(expr.value);
        env.assign(expr.name.lexeme, value);
        return value;
    }

    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        if (expr.operator.type == TokenType.OR_OR) {
            if (left.isTruthy()) return left;
        } else {
            if (!left.isTruthy()) return left;
        }
        return eval(expr.right);
    }

    public Value visitComparisonExpr(Comparison expr) {
        Value left = eval(expr.operands.get(0));
        for (int i = 0; i < expr.operators.size(); i++) {
            Value right = eval(expr.operands.get(i + 1));
            if (!compare(expr.operators.get(i).type, left, right)) return Value.FALSE;
            left = right;
        }
        return Value.TRUE;
    }

    public Value visitTernaryExpr(Ternary expr) {
        return eval(expr.condition).isTruthy() ? eval(expr.thenValue) : eval(expr.elseValue);
    }

    public Value visitLambdaExpr(Lambda expr) {
        List<String> params = new ArrayList<>(expr.params.size());
        for (Token p : expr.params) {
            SandboxPolicy.checkName(p.lexeme, p.line);
            params.add(p.lexeme);
        }
        return Value.func(new LambdaFunction(params, expr.body, env));
    }

    public Value visitComprehensionExpr(Comprehension expr) {
        Value iterable = eval(expr.iterable);
        List<String> vars = new ArrayList<>(expr.vars.size());
        for (Token t : expr.vars) vars.add(t.lexeme);

        Environment previous = env;
        env = env.child();
        try {
            List<Value> out = new ArrayList<>();
            Iterator<Value> it = iterable.iterator();
            while (it.hasNext()) {
                context.budget().checkpoint();
                bindLoopVars(vars, it.next(), currentLine);
                if (expr.condition != null && !eval(expr.condition).isTruthy()) continue;
                out.add(eval(expr.element));
                context.checkSize(out.size());
            }
            return Value.list(out);
        } finally {
            env = previous;
        }
    }

    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG:
                return Value.bool(!right.isTruthy());
            case MINUS:
                if (right.type == Value.Type.INT) return exact(() -> Value.integer(Math.negateExact(right.asInt())));
                if (right.type == Value.Type.DECIMAL) return Value.decimal(-right.asDouble());
                throw TaleException.runtime("Cannot make " + right.typeName() + " negative");
            case PLUS:
                if (right.isNumber()) return right;
                throw TaleException.runtime("Expected a number after '+' but got " + right.typeName());
            default:
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        TokenType op = expr.operator.type;

        switch (op) {
            case PLUS: return add(left, right);
            case MINUS: return subtract(left, right);
            case STAR: return multiply(left, right);
            case SLASH: {
                requireNumbers(left, right, "/");
                if (right.asDouble() == 0) throw divideByZero();
                return Value.decimal(left.asDouble() / right.asDouble());
            }
            case DOUBLE_SLASH: {
                requireNumbers(left, right, "//");
                if (right.asDouble() == 0) throw divideByZero();
                if (left.type == Value.Type.INT && right.type == Value.Type.INT) {
                    // floorDiv does not report MIN_VALUE // -1
                    if (left.asInt() == Long.MIN_VALUE && right.asInt() == -1) throw tooLarge();
                    return Value.integer(Math.floorDiv(left.asInt(), right.asInt()));
                }
                return Value.decimal(Math.floor(left.asDouble() / right.asDouble()));
            }
            case PERCENT: {
                requireNumbers(left, right, "%");
                if (right.asDouble() == 0) throw divideByZero();
                if (left.type == Value.Type.INT && right.type == Value.Type.INT) {
                    return Value.integer(Math.floorMod(left.asInt(), right.asInt()));
                }
                double a = left.asDouble();
                double b = right.asDouble();
                return Value.decimal(a - b * Math.floor(a / b));
            }
            case DOUBLE_STAR: return power(left, right);
            default:
                return Value.bool(compare(op, left, right));
        }
    }

    private Value add(Value left, Value right) {
        if (left.isNumber() && right.isNumber()) {
            if (left.type == Value.Type.INT && right.type == Value.Type.INT) {
                return exact(() -> Value.integer(Math.addExact(left.asInt(), right.asInt())));
            }
            return Value.decimal(left.asDouble() + right.asDouble());
        }
        if (left.type == Value.Type.TEXT || right.type == Value.Type.TEXT) {
            if (left.type == Value.Type.TEXT || isScalar(left)) {
                if (right.type == Value.Type.TEXT || isScalar(right)) {
                    String joined = left.toString() + right.toString();
                    context.checkText(joined.length());
                    return Value.text(joined);
                }
            }
        }
        if (left.type == right.type && (left.type == Value.Type.LIST || left.type == Value.Type.TUPLE)) {
            List<Value> out = new ArrayList<>(left.asList());
            out.addAll(right.asList());
            context.checkSize(out.size());
            return left.type == Value.Type.LIST ? Value.list(out) : Value.tuple(out);
        }
        throw TaleException.runtime("Cannot add " + left.typeName() + " and " + right.typeName());
    }

    private static boolean isScalar(Value v) {
        return v.isNumber() || v.type == Value.Type.BOOL || v.type == Value.Type.NULL;
    }

    private Value subtract(Value left, Value right) {
        if (left.type == Value.Type.SET && right.type == Value.Type.SET) {
            Set<Value> out = new LinkedHashSet<>(left.asSet());
            out.removeAll(right.asSet());
            return Value.set(out);
        }
        requireNumbers(left, right, "-");
        if (left.type == Value.Type.INT && right.type == Value.Type.INT) {
            return exact(() -> Value.integer(Math.subtractExact(left.asInt(), right.asInt())));
        }
        return Value.decimal(left.asDouble() - right.asDouble());
    }

    private Value multiply(Value left, Value right) {
        if (left.isNumber() && right.isNumber()) {
            if (left.type == Value.Type.INT && right.type == Value.Type.INT) {
                return exact(() -> Value.integer(Math.multiplyExact(left.asInt(), right.asInt())));
            }
            return Value.decimal(left.asDouble() * right.asDouble());
        }
        Value seq = left.type == Value.Type.INT ? right : left;
        Value times = left.type == Value.Type.INT ? left : right;
        if (times.type == Value.Type.INT) {
            long n = Math.max(0, times.asInt());
            if (seq.type == Value.Type.TEXT) {
                String s = seq.asText();
                context.checkText((long) s.length() * n);
                StringBuilder sb = new StringBuilder();
                for (long i = 0; i < n; i++) sb.append(s);
                return Value.text(sb.toString());
            }
            if (seq.type == Value.Type.LIST || seq.type == Value.Type.TUPLE) {
                List<Value> items = seq.asList();
                context.checkSize((long) items.size() * n);
                List<Value> out = new ArrayList<>();
                for (long i = 0; i < n; i++) out.addAll(items);
                return seq.type == Value.Type.LIST ? Value.list(out) : Value.tuple(out);
            }
        }
        throw TaleException.runtime("Cannot multiply " + left.typeName() + " and " + right.typeName());
    }

    private Value power(Value left, Value right) {
        requireNumbers(left, right, "**");
        if (left.type == Value.Type.INT && right.type == Value.Type.INT && right.asInt() >= 0) {
            final long base = left.asInt();
            final long exponent = right.asInt();
            return exact(() -> {
                long result = 1;
                long b = base;
                long e = exponent;
                while (e > 0) {
                    if ((e & 1) == 1) result = Math.multiplyExact(result, b);
                    e >>= 1;
                    if (e > 0) b = Math.multiplyExact(b, b);
                }
                return Value.integer(result);
            });
        }
        double a = left.asDouble();
        double b = right.asDouble();
        if (a == 0 && b < 0) throw divideByZero();
        double r = Math.pow(a, b);
        if (Double.isNaN(r)) throw TaleException.runtime("The result of " + left + " ** " + right + " is not a real number");
        if (Double.isInfinite(r)) throw tooLarge();
        return Value.decimal(r);
    }

    private boolean compare(TokenType op, Value left, Value right) {
        switch (op) {
            case EQUAL_EQUAL: return left.equals(right);
            case BANG_EQUAL: return !left.equals(right);
            case LESS: return Value.compare(left, right) < 0;
            case LESS_EQUAL: return Value.compare(left, right) <= 0;
            case GREATER: return Value.compare(left, right) > 0;
            case GREATER_EQUAL: return Value.compare(left, right) >= 0;
            case IN: return contains(right, left);
            case NOT_IN: return !contains(right, left);
            default:
                throw new IllegalStateException("Unsupported operator: " + op);
        }
    }

    /** Membership test behind {@code in}. */
    public static boolean contains(Value container, Value item) {
        switch (container.type) {
            case TEXT:
                if (item.type != Value.Type.TEXT) {
                    throw TaleException.runtime("Only text can be looked for in text, not " + item.typeName());
                }
                return container.asText().contains(item.asText());
            case LIST:
            case TUPLE:
                return container.asList().contains(item);
            case SET:
                return container.asSet().contains(item);
            case MAP:
                return container.asMap().containsKey(item);
            case RANGE:
                if (item.type == Value.Type.INT) return container.asRange().contains(item.asInt());
                if (item.type == Value.Type.DECIMAL && item.asDouble() == Math.rint(item.asDouble())) {
                    return container.asRange().contains((long) item.asDouble());
                }
                return false;
            default:
                throw TaleException.runtime("Cannot look inside " + container.typeName());
        }
    }

    // ----------------------------------------------------------------- calls

    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (Expr.ExprInterface a : expr.arguments) args.add(eval(a));
        return invoke(callee, args, expr.paren.line);
    }

    /** Calls a program value from Java, e.g. a lambda passed to {@code map}. */
    public Value callValue(Value callee, List<Value> args) {
        return invoke(callee, args, currentLine);
    }

    private Value invoke(Value callee, List<Value> args, int line) {
        context.budget().checkpoint();
        if (callStack.size() >= maxDepth) {
            throw TaleException.resourceLimit("Too many nested calls (limit " + maxDepth
                    + "). Does a function keep calling itself?");
        }
        switch (callee.type) {
            case FUNC: {
                Callable fn = callee.asFunc();
                callStack.push(new CallFrame(fn.name(), line));
                try {
                    return fn.call(this, args);
                } finally {
                    callStack.pop();
                }
            }
            case CLASS: {
                TaleClass cls = callee.asClass();
                callStack.push(new CallFrame(cls.name, line));
                try {
                    return instantiate(cls, args);
                } finally {
                    callStack.pop();
                }
            }
            default:
                throw TaleException.runtime("A " + callee.typeName() + " cannot be called like a function");
        }
    }

    private Value instantiate(TaleClass cls, List<Value> args) {
        Value self = Value.instance(new TaleInstance(cls));
        Value init = cls.find("init");
        if (init != null && init.type == Value.Type.FUNC) {
            List<Value> full = new ArrayList<>(args.size() + 1);
            full.add(self);
            full.addAll(args);
            init.asFunc().call(this, full);
        } else if (!args.isEmpty()) {
            throw TaleException.runtime(cls.name + "() takes no values; give the class an init function to accept them");
        }
        return self;
    }

    public Value visitMethodCallExpr(MethodCallExpr expr) {
        Value receiver = eval(expr.receiver);
        String name = expr.method.lexeme;
        SandboxPolicy.checkAttribute(name, expr.method.line);

        List<Value> args = new ArrayList<>(expr.arguments.size() + 1);
        for (Expr.ExprInterface a : expr.arguments) args.add(eval(a));

        switch (receiver.type) {
            case INSTANCE:
            case CLASS:
            case MODULE:
                return invoke(getAttribute(receiver, expr.method), args, expr.method.line);
            default:
                break;
        }

        String capability = METHOD_ALIASES.get(name);
        Value fn = capability == null ? null : capabilities.get(capability);
        if (fn == null) {
            throw TaleException.runtime("A " + receiver.typeName() + " has no method '" + name + "'");
        }
        args.add(0, receiver);
        return invoke(fn, args, expr.method.line);
    }

    // ------------------------------------------------------------ attributes

    public Value visitGetExpr(GetExpr expr) {
        return getAttribute(eval(expr.receiver), expr.name);
    }

    private Value getAttribute(Value receiver, Token name) {
        String attr = name.lexeme;
        SandboxPolicy.checkAttribute(attr, name.line);
        switch (receiver.type) {
            case INSTANCE: {
                TaleInstance inst = receiver.asInstance();
                Value field = inst.fields.get(attr);
                if (field != null) return field;
                Value member = inst.clazz.find(attr);
                if (member == null) {
                    throw TaleException.runtime("A " + inst.clazz.name + " object has no attribute '" + attr + "'");
                }
                if (member.type == Value.Type.FUNC && member.asFunc() instanceof UserFunction) {
                    return Value.func(new BoundMethod(receiver, member.asFunc()));
                }
                return member;
            }
            case CLASS: {
                Value member = receiver.asClass().find(attr);
                if (member == null) {
                    throw TaleException.runtime("Class " + receiver.asClass().name + " has no attribute '" + attr + "'");
                }
                return member;
            }
            case MODULE: {
                Value member = receiver.asModule().members.get(attr);
                if (member == null) {
                    throw TaleException.runtime("Module '" + receiver.asModule().name + "' has no member '" + attr + "'");
                }
                return member;
            }
            case ERROR:
                if (attr.equals("message")) return Value.text((String) receiver.value);
                break;
            default:
                break;
        }
        throw TaleException.runtime("A " + receiver.typeName() + " has no attribute '" + attr + "'");
    }

    public Value visitSetExpr(SetExpr expr) {
        Value receiver = eval(expr.receiver);
        SandboxPolicy.checkAttribute(expr.name.lexeme, expr.name.line);
        Value value = eval(expr.value);
        switch (receiver.type) {
            case INSTANCE:
                receiver.asInstance().fields.put(expr.name.lexeme, value);
                return value;
            case CLASS:
                receiver.asClass().attributes.put(expr.name.lexeme, value);
                return value;
            default:
                throw TaleException.runtime("Cannot set '" + expr.name.lexeme + "' on a " + receiver.typeName());
        }
    }

    // -------------------------------------------------------------- indexing

    public Value visitIndexExpr(IndexExpr expr) {
        Value target = eval(expr.target);
        Value index = eval(expr.index);
        switch (target.type) {
            case LIST:
            case TUPLE: {
                List<Value> list = target.asList();
                return list.get(position(index, list.size(), target));
            }
            case TEXT: {
                String s = target.asText();
                int i = position(index, s.length(), target);
                return Value.text(String.valueOf(s.charAt(i)));
            }
            case RANGE: {
                Value.RangeValue r = target.asRange();
                long size = r.size();
                long i = index.asInt();
                if (i < 0) i += size;
                if (i < 0 || i >= size) throw outOfRange(index, size, target);
                return Value.integer(r.get(i));
            }
            case MAP: {
                Value v = target.asMap().get(index.requireHashable());
                if (v == null) throw TaleException.runtime("Key " + index.repr() + " is not in the dict");
                return v;
            }
            default:
                throw TaleException.runtime("A " + target.typeName() + " cannot be indexed with [...]");
        }
    }

    private static int position(Value index, int size, Value target) {
        if (index.type != Value.Type.INT) {
            throw TaleException.runtime("Positions must be whole numbers, not " + index.typeName());
        }
        long i = index.asInt();
        if (i < 0) i += size;
        if (i < 0 || i >= size) throw outOfRange(index, size, target);
        return (int) i;
    }

    private static TaleException outOfRange(Value index, long size, Value target) {
        return TaleException.runtime("Position " + index + " is out of range for a " + target.typeName()
                + " of " + size + (size == 1 ? " item" : " items"));
    }

    public Value visitSliceExpr(SliceExpr expr) {
        Value target = eval(expr.target);
        Long lower = bound(expr.lower);
        Long upper = bound(expr.upper);
        Long step = bound(expr.step);
        long s = step == null ? 1 : step;
        if (s == 0) throw TaleException.runtime("Slice step cannot be zero");

        switch (target.type) {
            case TEXT: {
                String text = target.asText();
                StringBuilder sb = new StringBuilder();
                for (int i : sliceIndices(text.length(), lower, upper, s)) sb.append(text.charAt(i));
                return Value.text(sb.toString());
            }
            case LIST:
            case TUPLE: {
                List<Value> list = target.asList();
                List<Value> out = new ArrayList<>();
                for (int i : sliceIndices(list.size(), lower, upper, s)) out.add(list.get(i));
                return target.type == Value.Type.LIST ? Value.list(out) : Value.tuple(out);
            }
            default:
                throw TaleException.runtime("A " + target.typeName() + " cannot be sliced");
        }
    }

    private Long bound(Expr.ExprInterface e) {
        if (e == null) return null;
        Value v = eval(e);
        if (v.isNull()) return null;
        if (v.type != Value.Type.INT) throw TaleException.runtime("Slice positions must be whole numbers");
        return v.asInt();
    }

    static List<Integer> sliceIndices(int size, Long lower, Long upper, long step) {
        long start;
        long stop;
        if (step > 0) {
            start = lower == null ? 0 : clamp(lower < 0 ? lower + size : lower, 0, size);
            stop = upper == null ? size : clamp(upper < 0 ? upper + size : upper, 0, size);
        } else {
            start = lower == null ? size - 1 : clamp(lower < 0 ? lower + size : lower, -1, size - 1);
            stop = upper == null ? -1 : clamp(upper < 0 ? upper + size : upper, -1, size - 1);
        }
        List<Integer> out = new ArrayList<>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) out.add((int) i);
        return out;
    }

    private static long clamp(long v, long lo, long hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    public Value visitSetIndexExpr(SetIndexExpr expr) {
        Value target = eval(expr.target);
        Value index = eval(expr.index);
        Value value = eval(expr.value);

        if (target.type == Value.Type.MAP) {
            Map<Value, Value> m = target.asMap();
            m.put(index.requireHashable(), value);
            context.checkSize(m.size());
            return value;
        }

        if (target.type == Value.Type.LIST) {
            List<Value> list = target.asList();
            // allow append at end: a[len(a)] = v
            if (index.type == Value.Type.INT && index.asInt() == list.size()) {
                list.add(value);
                context.checkSize(list.size());
                return value;
            }
            list.set(position(index, list.size(), target), value);
            return value;
        }

        throw TaleException.runtime("A " + target.typeName() + " cannot be changed with [...] = ...");
    }

    // --------------------------------------------------------------- helpers

    private static void requireNumbers(Value left, Value right, String op) {
        if (!left.isNumber() || !right.isNumber()) {
            throw TaleException.runtime("'" + op + "' needs two numbers but got " + left.typeName()
                    + " and " + right.typeName());
        }
    }

    private interface ExactOp {
        Value apply();
    }

    private static Value exact(ExactOp op) {
        try {
            return op.apply();
        } catch (ArithmeticException e) {
            throw tooLarge();
        }
    }

    private static TaleException tooLarge() {
        return TaleException.runtime("Number is too large");
    }

    private static TaleException divideByZero() {
        return TaleException.runtime("Cannot divide by zero");
    }

    /** Names of the functions currently running, innermost first. */
    /** Line of the statement being executed; 0 before the first one. */
    public int currentLine() {
        return currentLine;
    }

    public List<String> stackTrace() {
        List<String> out = new ArrayList<>();
        for (CallFrame f : callStack) out.add(f.toString());
        return out;
    }

    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final Value value;
        ReturnSignal(Value value) { super(null, null, false, false); this.value = value; }
    }

    public static final class BreakSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        BreakSignal() { super(null, null, false, false); }
    }

    public static final class ContinueSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        ContinueSignal() { super(null, null, false, false); }
    }
}
