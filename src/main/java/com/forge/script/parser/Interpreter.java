package com.forge.script.parser;

import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.forge.debug.Debug;
import com.forge.script.error.ArityError;
import com.forge.script.error.ForgeException;
import com.forge.script.error.HostError;
import com.forge.script.error.IndexError;
import com.forge.script.error.RuntimeError;
import com.forge.script.error.TypeError;
import com.forge.script.error.UndefinedVariableError;
import com.forge.script.host.HostIO;
import com.forge.script.parser.Expr.Assign;
import com.forge.script.parser.Expr.Binary;
import com.forge.script.parser.Expr.Call;
import com.forge.script.parser.Expr.Cast;
import com.forge.script.parser.Expr.CloneOf;
import com.forge.script.parser.Expr.ExprInterface;
import com.forge.script.parser.Expr.ExprVisitor;
import com.forge.script.parser.Expr.FunctionLiteral;
import com.forge.script.parser.Expr.Index;
import com.forge.script.parser.Expr.InputOf;
import com.forge.script.parser.Expr.ListLiteral;
import com.forge.script.parser.Expr.ListRepeat;
import com.forge.script.parser.Expr.Literal;
import com.forge.script.parser.Expr.Logical;
import com.forge.script.parser.Expr.MapLiteral;
import com.forge.script.parser.Expr.MirrorOf;
import com.forge.script.parser.Expr.Range;
import com.forge.script.parser.Expr.Unary;
import com.forge.script.parser.Expr.Variable;
import com.forge.script.parser.Statement.Block;
import com.forge.script.parser.Statement.BreakStmt;
import com.forge.script.parser.Statement.ContinueStmt;
import com.forge.script.parser.Statement.ExprStmt;
import com.forge.script.parser.Statement.For;
import com.forge.script.parser.Statement.If;
import com.forge.script.parser.Statement.InputStmt;
import com.forge.script.parser.Statement.PrintStmt;
import com.forge.script.parser.Statement.ReturnStmt;
import com.forge.script.parser.Statement.Stmt;
import com.forge.script.parser.Statement.StmtVisitor;
import com.forge.script.parser.Statement.VarStmt;
import com.forge.script.parser.Statement.While;

/**
 * Tree-walking evaluator.
 *
 * Statements return a {@link Signal}; runtime errors are exceptions that abort the current
 * top-level unit. Assignment and input resolve their target to a {@link Place} first, so
 * writes into string characters and slices land back in the slot that holds the string.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "Interpreter";
    private static final String ANONYMOUS = "<anonymous>";

    Environment env;
    private final HostIO io;
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final int maxDepth;

    public Interpreter(Environment env, HostIO io, int maxDepth) {
        this.env = env;
        this.io = io;
        this.maxDepth = maxDepth;
    }

    public HostIO io() {
        return io;
    }

    public int callDepth() {
        return callStack.size();
    }

    // -------------------------
    // Entry points
    // -------------------------

    /**
     * Runs top-level statements in the current scope. Stops early on a RETURN signal,
     * which ends the unit.
     */
    public Signal execute(List<Stmt> statements) {
        try {
            for (Stmt s : statements) {
                Signal signal = s.accept(this);
                if (!signal.isNormal()) return signal;
            }
            return Signal.NORMAL;
        } catch (RuntimeError e) {
            Debug.get().d(TAG, "runtime error at " + e.span().position() + ": " + e.getMessage());
            throw e;
        }
    }

    public Value evaluate(ExprInterface expr) {
        return expr.accept(this);
    }

    /** Runs statements in the given scope and restores the previous scope on every exit. */
    Signal executeBlock(List<Stmt> statements, Environment scope) {
        Environment previous = env;
        env = scope;
        try {
            for (Stmt s : statements) {
                Signal signal = s.accept(this);
                if (!signal.isNormal()) return signal;
            }
            return Signal.NORMAL;
        } finally {
            env = previous;
        }
    }

    /**
     * Calls a function value from host code, for example a native that takes a callback.
     * Errors are attributed to the call currently in progress.
     */
    public Value call(Value callee, List<Value> args) {
        CallFrame top = callStack.peek();
        Span site = (top == null) ? Span.point(1, 1, 0) : top.callSite;
        return callValue(callee, args, site, null);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Signal visitVarStmt(VarStmt stmt) {
        Value value;
        if (stmt.initializer instanceof FunctionLiteral) {
            value = makeFunction((FunctionLiteral) stmt.initializer, stmt.name.lexeme);
        } else {
            value = evaluate(stmt.initializer);
        }
        env.define(stmt.name.lexeme, value);
        return Signal.NORMAL;
    }

    @Override
    public Signal visitExprStmt(ExprStmt stmt) {
        evaluate(stmt.expression);
        return Signal.NORMAL;
    }

    @Override
    public Signal visitPrintStmt(PrintStmt stmt) {
        Value value = evaluate(stmt.expression);
        write(value.display() + "\n", stmt.span());
        return Signal.NORMAL;
    }

    @Override
    public Signal visitIfStmt(If stmt) {
        if (truthy(evaluate(stmt.condition), stmt.condition.span())) {
            return executeBlock(stmt.thenBranch.statements, env.child());
        }
        if (stmt.elseBranch != null) {
            return stmt.elseBranch.accept(this);
        }
        return Signal.NORMAL;
    }

    @Override
    public Signal visitWhileStmt(While stmt) {
        while (truthy(evaluate(stmt.condition), stmt.condition.span())) {
            Signal signal = executeBlock(stmt.body.statements, env.child());
            if (signal.kind == Signal.Kind.BREAK) break;
            if (signal.kind == Signal.Kind.RETURN) return signal;
        }
        return Signal.NORMAL;
    }

    @Override
    public Signal visitForStmt(For stmt) {
        Value iterable = evaluate(stmt.iterable);
        String name = stmt.variable.lexeme;

        switch (iterable.type) {
            case RANGE: {
                Value.RangeBounds r = iterable.asRange();
                for (long i = r.lo; i < r.hi; i++) {
                    Signal signal = iteration(stmt, name, Value.number(i));
                    if (signal.kind == Signal.Kind.BREAK) break;
                    if (signal.kind == Signal.Kind.RETURN) return signal;
                }
                return Signal.NORMAL;
            }
            case LIST: {
                List<Value> items = iterable.asList();
                // live length: the body may grow or shrink the list
                for (int i = 0; i < items.size(); i++) {
                    Signal signal = iteration(stmt, name, items.get(i));
                    if (signal.kind == Signal.Kind.BREAK) break;
                    if (signal.kind == Signal.Kind.RETURN) return signal;
                }
                return Signal.NORMAL;
            }
            case CUSTOM: {
                Value.Custom c = iterable.asCustom();
                Iterator<Value> it = c.type.iterator(c.payload);
                if (it == null) break;
                while (it.hasNext()) {
                    Signal signal = iteration(stmt, name, it.next());
                    if (signal.kind == Signal.Kind.BREAK) break;
                    if (signal.kind == Signal.Kind.RETURN) return signal;
                }
                return Signal.NORMAL;
            }
            default:
                break;
        }
        throw new TypeError("cannot iterate over value of type '" + iterable.typeName() + "'", stmt.iterable.span());
    }

    private Signal iteration(For stmt, String name, Value element) {
        Environment scope = env.child();
        scope.define(name, element);
        return executeBlock(stmt.body.statements, scope);
    }

    @Override
    public Signal visitInputStmt(InputStmt stmt) {
        Place place = resolve(stmt.target);
        Value prompt = (stmt.prompt == null) ? Value.nil() : evaluate(stmt.prompt);
        place.set(readInput(prompt, stmt.span()));
        return Signal.NORMAL;
    }

    @Override
    public Signal visitReturnStmt(ReturnStmt stmt) {
        Value value = (stmt.value == null) ? Value.nil() : evaluate(stmt.value);
        return Signal.ret(value);
    }

    @Override
    public Signal visitBreakStmt(BreakStmt stmt) {
        return Signal.BREAK;
    }

    @Override
    public Signal visitContinueStmt(ContinueStmt stmt) {
        return Signal.CONTINUE;
    }

    @Override
    public Signal visitBlockStmt(Block stmt) {
        return executeBlock(stmt.statements, env.child());
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        Value v = env.get(expr.name.lexeme);
        if (v == null) throw new UndefinedVariableError(expr.name.lexeme, expr.span());
        return v;
    }

    @Override
    public Value visitRangeExpr(Range expr) {
        Value lo = evaluate(expr.lo);
        Value hi = evaluate(expr.hi);
        return binary(TokenType.DOT_DOT, "..", lo, hi, expr.span());
    }

    @Override
    public Value visitListLiteralExpr(ListLiteral expr) {
        List<Value> items = new ArrayList<>(expr.items.size());
        for (ExprInterface item : expr.items) items.add(evaluate(item));
        return Value.list(items);
    }

    @Override
    public Value visitListRepeatExpr(ListRepeat expr) {
        Value item = evaluate(expr.item);
        Value count = evaluate(expr.count);
        if (!count.isIntegral() || count.asNumber() < 0) {
            throw new TypeError("list repeat count must be a non-negative integral number, found "
                    + count.display(), expr.count.span());
        }
        long n = (long) count.asNumber();
        List<Value> items = new ArrayList<>();
        for (long i = 0; i < n; i++) items.add(item.deepClone());
        return Value.list(items);
    }

    @Override
    public Value visitMapLiteralExpr(MapLiteral expr) {
        Map<Value, Value> entries = new LinkedHashMap<>();
        for (int i = 0; i < expr.keys.size(); i++) {
            Value key = evaluate(expr.keys.get(i));
            Value value = evaluate(expr.values.get(i));
            entries.put(key.deepClone(), value);
        }
        return Value.map(entries);
    }

    @Override
    public Value visitFunctionLiteralExpr(FunctionLiteral expr) {
        return makeFunction(expr, ANONYMOUS);
    }

    private Value makeFunction(FunctionLiteral expr, String name) {
        return Value.function(new UserFunction(name, expr.params, expr.body, env, expr.declaration));
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = evaluate(expr.right);
        return unary(expr.operator, right, expr.span(), true);
    }

    private Value unary(Token op, Value right, Span span, boolean coerce) {
        switch (op.type) {
            case BANG:
                if (right.type == Value.Type.BOOL) return Value.bool(!right.asBool());
                if (coerce && right.type == Value.Type.CUSTOM) {
                    Value c = coerce(right, Value.Type.BOOL);
                    if (c != null) return unary(op, c, span, false);
                }
                break;
            case MINUS:
                if (right.type == Value.Type.NUMBER) return Value.number(-right.asNumber());
                if (coerce && right.type == Value.Type.CUSTOM) {
                    Value c = coerce(right, Value.Type.NUMBER);
                    if (c != null) return unary(op, c, span, false);
                }
                break;
            default:
                break;
        }
        throw new TypeError("unsupported operand type for '" + op.lexeme + "': '" + right.typeName() + "'", span);
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = evaluate(expr.left);
        Value right = evaluate(expr.right);
        return binary(expr.operator.type, expr.operator.lexeme, left, right, expr.span());
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        String op = expr.operator.lexeme;
        Value left = evaluate(expr.left);
        if (left.type != Value.Type.BOOL) {
            Value right = evaluate(expr.right);
            throw unsupported(op, left, right, expr.span());
        }
        boolean l = left.asBool();
        if (expr.operator.type == TokenType.AND && !l) return Value.bool(false);
        if (expr.operator.type == TokenType.OR && l) return Value.bool(true);

        Value right = evaluate(expr.right);
        if (right.type != Value.Type.BOOL) throw unsupported(op, left, right, expr.span());
        boolean r = right.asBool();
        switch (expr.operator.type) {
            case XOR: return Value.bool(l ^ r);
            default: return Value.bool(r);
        }
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = evaluate(expr.callee);
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface arg : expr.arguments) args.add(evaluate(arg));
        String name = (expr.callee instanceof Variable) ? ((Variable) expr.callee).name.lexeme : null;
        return callValue(callee, args, expr.span(), name);
    }

    @Override
    public Value visitIndexExpr(Index expr) {
        Value target = evaluate(expr.target);
        Value index = evaluate(expr.index);
        return readIndex(target, index, expr);
    }

    @Override
    public Value visitAssignExpr(Assign expr) {
        Place place = resolve(expr.target);
        Value value = evaluate(expr.value);
        if (expr.operator.type != TokenType.EQUAL) {
            TokenType op = compoundOperator(expr.operator.type);
            String symbol = expr.operator.lexeme.substring(0, expr.operator.lexeme.length() - 1);
            value = binary(op, symbol, place.get(), value, expr.span());
        }
        place.set(value);
        return value;
    }

    private static TokenType compoundOperator(TokenType t) {
        switch (t) {
            case PLUS_EQUAL: return TokenType.PLUS;
            case MINUS_EQUAL: return TokenType.MINUS;
            case STAR_EQUAL: return TokenType.STAR;
            case SLASH_EQUAL: return TokenType.SLASH;
            case PERCENT_EQUAL: return TokenType.PERCENT;
            default: throw new IllegalArgumentException("not a compound assignment: " + t);
        }
    }

    @Override
    public Value visitCloneExpr(CloneOf expr) {
        return evaluate(expr.expression).deepClone();
    }

    @Override
    public Value visitMirrorExpr(MirrorOf expr) {
        return evaluate(expr.expression);
    }

    @Override
    public Value visitInputExpr(InputOf expr) {
        Value prompt = evaluate(expr.prompt);
        return readInput(prompt, expr.span());
    }

    @Override
    public Value visitCastExpr(Cast expr) {
        Value v = evaluate(expr.expression);
        return Casts.cast(v, expr.type.lexeme, expr.span());
    }

    // -------------------------
    // Calls
    // -------------------------

    private Value callValue(Value callee, List<Value> args, Span span, String name) {
        Callable fn = null;
        if (callee.type == Value.Type.FUNCTION) {
            fn = callee.asFunction();
        } else if (callee.type == Value.Type.CUSTOM) {
            Value.Custom c = callee.asCustom();
            fn = c.type.asCallable(c.payload);
        }
        if (fn == null) {
            throw new TypeError("cannot call value of type '" + callee.typeName() + "'", span);
        }
        return invoke(fn, args, span, name == null ? fn.name() : name);
    }

    private Value invoke(Callable fn, List<Value> args, Span span, String name) {
        if (fn.arity() != Callable.VARIADIC && fn.arity() != args.size()) {
            throw new ArityError(fn.arity(), args.size(), span, fn.declaration());
        }
        if (callStack.size() >= maxDepth) {
            throw new RuntimeError("maximum call depth of " + maxDepth + " exceeded", span);
        }

        CallFrame frame = new CallFrame(name, span);
        callStack.push(frame);
        Debug.get().t(TAG, "call " + name + " at " + span.position() + " depth=" + callStack.size());
        try {
            return fn.call(this, args);
        } catch (ForgeException e) {
            if (fn instanceof UserFunction) e.addTrail(frame.describe());
            throw e;
        } catch (RuntimeException e) {
            throw new HostError("host function '" + name + "' failed: " + e.getMessage(), span, e);
        } finally {
            callStack.pop();
        }
    }

    // -------------------------
    // Host IO
    // -------------------------

    private void write(String text, Span span) {
        try {
            io.print(text);
        } catch (UncheckedIOException e) {
            throw new HostError(e.getMessage(), span, e);
        }
    }

    private Value readInput(Value prompt, Span span) {
        if (!prompt.isNull()) write(prompt.display(), span);
        String line;
        try {
            line = io.readLine();
        } catch (UncheckedIOException e) {
            throw new HostError(e.getMessage(), span, e);
        }
        return line == null ? Value.nil() : Value.string(line);
    }

    // -------------------------
    // Operators
    // -------------------------

    private boolean truthy(Value v, Span span) {
        if (v.type == Value.Type.BOOL) return v.asBool();
        if (v.type == Value.Type.CUSTOM) {
            Value c = coerce(v, Value.Type.BOOL);
            if (c != null && c.type == Value.Type.BOOL) return c.asBool();
        }
        throw new TypeError("cannot determine truthiness of value of type '" + v.typeName() + "'", span);
    }

    /** Shared by binary expressions, ranges and compound assignment. */
    Value binary(TokenType op, String symbol, Value left, Value right, Span span) {
        Value result = Operators.apply(op, left, right);
        if (result != null) return result;

        // a custom operand gets one chance to become the other operand's type
        if (left.type == Value.Type.CUSTOM && right.type != Value.Type.CUSTOM) {
            Value c = coerce(left, right.type);
            if (c != null) result = Operators.apply(op, c, right);
        } else if (right.type == Value.Type.CUSTOM && left.type != Value.Type.CUSTOM) {
            Value c = coerce(right, left.type);
            if (c != null) result = Operators.apply(op, left, c);
        }
        if (result != null) return result;

        if (op == TokenType.EQUAL_EQUAL) return Value.bool(false);
        if (op == TokenType.BANG_EQUAL) return Value.bool(true);
        throw unsupported(symbol, left, right, span);
    }

    private static Value coerce(Value custom, Value.Type target) {
        Value.Custom c = custom.asCustom();
        Value out = c.type.coerce(c.payload, target);
        if (out == null || out.type != target) return null;
        return out;
    }

    private static TypeError unsupported(String op, Value left, Value right, Span span) {
        return new TypeError("unsupported operand types for '" + op + "': '"
                + left.typeName() + "' and '" + right.typeName() + "'", span);
    }

    // -------------------------
    // Indexing and places
    // -------------------------

    private Value readIndex(Value target, Value index, Index expr) {
        Span span = expr.span();
        switch (target.type) {
            case LIST: {
                List<Value> items = target.asList();
                if (index.type == Value.Type.RANGE) {
                    int[] b = sliceBounds(index, items.size(), target, expr.index.span());
                    return Value.list(new ArrayList<>(items.subList(b[0], b[1])));
                }
                return items.get(elementIndex(index, items.size(), target, expr.index.span()));
            }
            case STRING: {
                int[] cps = target.asString().codePoints().toArray();
                if (index.type == Value.Type.RANGE) {
                    int[] b = sliceBounds(index, cps.length, target, expr.index.span());
                    return Value.string(new String(cps, b[0], b[1] - b[0]));
                }
                return Value.character(cps[elementIndex(index, cps.length, target, expr.index.span())]);
            }
            case MAP: {
                Value v = target.asMap().get(index);
                return v == null ? Value.nil() : v;
            }
            default:
                throw new TypeError("cannot index value of type '" + target.typeName() + "'", span);
        }
    }

    private static int elementIndex(Value index, int length, Value target, Span span) {
        if (index.type != Value.Type.NUMBER) {
            throw new TypeError("cannot index " + target.typeName() + " with value of type '"
                    + index.typeName() + "'", span);
        }
        if (!index.isIntegral()) {
            throw new TypeError("index must be an integral number, found " + index.display(), span);
        }
        double i = index.asNumber();
        if (i < 0 || i >= length) {
            throw new IndexError("index " + Value.formatNumber(i) + " out of bounds for "
                    + target.typeName() + " of length " + length, span);
        }
        return (int) i;
    }

    /** [lo, hi) for a slice: lo must lie in 0..length, hi is clamped to length and never below lo. */
    private static int[] sliceBounds(Value range, int length, Value target, Span span) {
        Value.RangeBounds r = range.asRange();
        if (r.lo < 0 || r.lo > length) {
            throw new IndexError("index " + r.lo + " out of bounds for "
                    + target.typeName() + " of length " + length, span);
        }
        int lo = (int) r.lo;
        int hi = (int) Math.min(r.hi, length);
        if (hi < lo) hi = lo;
        return new int[] { lo, hi };
    }

    /** A settable location produced by resolving an lvalue. */
    private abstract static class Place {
        abstract Value get();
        abstract void set(Value value);
    }

    private Place resolve(ExprInterface target) {
        if (target instanceof Variable) {
            final Variable v = (Variable) target;
            final Environment scope = env;
            if (scope.get(v.name.lexeme) == null) {
                throw new UndefinedVariableError(v.name.lexeme, v.span());
            }
            return new Place() {
                Value get() { return scope.get(v.name.lexeme); }
                void set(Value value) { scope.assign(v.name.lexeme, value); }
            };
        }
        if (target instanceof Index) {
            return resolveIndex((Index) target);
        }
        final Value temp = evaluate(target);
        return new Place() {
            Value get() { return temp; }
            void set(Value value) {
                // f()[0] = x: element writes into a list still land; the temporary itself is dropped
            }
        };
    }

    private Place resolveIndex(final Index expr) {
        final Place parent = resolve(expr.target);
        final Value container = parent.get();
        final Value index = evaluate(expr.index);
        final Span span = expr.index.span();

        switch (container.type) {
            case LIST: {
                final List<Value> items = container.asList();
                // bounds are checked now and again on access: the right-hand side may resize the list
                if (index.type == Value.Type.RANGE) {
                    sliceBounds(index, items.size(), container, span);
                    return new Place() {
                        Value get() {
                            int[] now = sliceBounds(index, items.size(), container, span);
                            return Value.list(new ArrayList<>(items.subList(now[0], now[1])));
                        }
                        void set(Value value) {
                            if (value.type != Value.Type.LIST) {
                                throw new TypeError("cannot assign value of type '" + value.typeName()
                                        + "' to a list slice", expr.span());
                            }
                            int[] now = sliceBounds(index, items.size(), container, span);
                            List<Value> replacement = new ArrayList<>(value.asList());
                            List<Value> run = items.subList(now[0], now[1]);
                            run.clear();
                            run.addAll(replacement);
                        }
                    };
                }
                elementIndex(index, items.size(), container, span);
                return new Place() {
                    Value get() { return items.get(elementIndex(index, items.size(), container, span)); }
                    void set(Value value) { items.set(elementIndex(index, items.size(), container, span), value); }
                };
            }
            case STRING: {
                final int[] cps = container.asString().codePoints().toArray();
                if (index.type == Value.Type.RANGE) {
                    final int[] b = sliceBounds(index, cps.length, container, span);
                    return new Place() {
                        Value get() { return Value.string(new String(cps, b[0], b[1] - b[0])); }
                        void set(Value value) {
                            if (value.type != Value.Type.STRING) {
                                throw new TypeError("cannot assign value of type '" + value.typeName()
                                        + "' to a string slice", expr.span());
                            }
                            StringBuilder sb = new StringBuilder();
                            sb.append(new String(cps, 0, b[0]));
                            sb.append(value.asString());
                            sb.append(new String(cps, b[1], cps.length - b[1]));
                            parent.set(Value.string(sb.toString()));
                        }
                    };
                }
                final int i = elementIndex(index, cps.length, container, span);
                return new Place() {
                    Value get() { return Value.character(cps[i]); }
                    void set(Value value) {
                        if (value.type != Value.Type.CHAR) {
                            throw new TypeError("cannot assign value of type '" + value.typeName()
                                    + "' to a string element", expr.span());
                        }
                        int[] copy = cps.clone();
                        copy[i] = value.asChar();
                        parent.set(Value.string(new String(copy, 0, copy.length)));
                    }
                };
            }
            case MAP: {
                final Map<Value, Value> entries = container.asMap();
                return new Place() {
                    Value get() {
                        Value v = entries.get(index);
                        return v == null ? Value.nil() : v;
                    }
                    void set(Value value) { entries.put(index.deepClone(), value); }
                };
            }
            default:
                throw new TypeError("cannot index value of type '" + container.typeName() + "'", expr.span());
        }
    }
}
