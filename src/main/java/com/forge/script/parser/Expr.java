package com.forge.script.parser;

import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);

        /** Source region covered by this expression, used for every diagnostic it raises. */
        Span span();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitRangeExpr(Range expr);
        R visitListLiteralExpr(ListLiteral expr);
        R visitListRepeatExpr(ListRepeat expr);
        R visitMapLiteralExpr(MapLiteral expr);
        R visitFunctionLiteralExpr(FunctionLiteral expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitCallExpr(Call expr);
        R visitIndexExpr(Index expr);
        R visitAssignExpr(Assign expr);
        R visitCloneExpr(CloneOf expr);
        R visitMirrorExpr(MirrorOf expr);
        R visitInputExpr(InputOf expr);
        R visitCastExpr(Cast expr);
    }

    // -------------------------
    // Literals and names
    // -------------------------

    /** Scalar literal; the value is immutable so it is shared by every evaluation. */
    public static final class Literal implements ExprInterface {
        public final Value value;
        private final Span span;

        public Literal(Value value, Span span) {
            this.value = value;
            this.span = span;
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public Span span() { return name.span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Range implements ExprInterface {
        public final ExprInterface lo;
        public final ExprInterface hi;

        public Range(ExprInterface lo, ExprInterface hi) {
            this.lo = lo;
            this.hi = hi;
        }

        @Override
        public Span span() { return lo.span().union(hi.span()); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRangeExpr(this);
        }
    }

    // -------------------------
    // Collections and functions
    // -------------------------

    public static final class ListLiteral implements ExprInterface {
        public final List<ExprInterface> items;
        private final Span span;

        public ListLiteral(List<ExprInterface> items, Span span) {
            this.items = items;
            this.span = span;
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListLiteralExpr(this);
        }
    }

    /** {@code [item; count]}: a list holding count independent copies of item. */
    public static final class ListRepeat implements ExprInterface {
        public final ExprInterface item;
        public final ExprInterface count;
        private final Span span;

        public ListRepeat(ExprInterface item, ExprInterface count, Span span) {
            this.item = item;
            this.count = count;
            this.span = span;
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListRepeatExpr(this);
        }
    }

    public static final class MapLiteral implements ExprInterface {
        // parallel lists, source order
        public final List<ExprInterface> keys;
        public final List<ExprInterface> values;
        private final Span span;

        public MapLiteral(List<ExprInterface> keys, List<ExprInterface> values, Span span) {
            this.keys = keys;
            this.values = values;
            this.span = span;
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMapLiteralExpr(this);
        }
    }

    /**
     * {@code |a, b| { ... }}. The declaration span covers the whole literal and is what
     * arity diagnostics point back to.
     */
    public static final class FunctionLiteral implements ExprInterface {
        public final List<Token> params;
        public final Statement.Block body;
        public final Span declaration;

        public FunctionLiteral(List<Token> params, Statement.Block body, Span declaration) {
            this.params = params;
            this.body = body;
            this.declaration = declaration;
        }

        @Override
        public Span span() { return declaration; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionLiteralExpr(this);
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public Span span() { return operator.span.union(right.span()); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

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
        public Span span() { return left.span().union(right.span()); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    /** and / or / xor. */
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
        public Span span() { return left.span().union(right.span()); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final List<ExprInterface> arguments;
        private final Span span;

        public Call(ExprInterface callee, List<ExprInterface> arguments, Span span) {
            this.callee = callee;
            this.arguments = arguments;
            this.span = span;
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        private final Span span;

        public Index(ExprInterface target, ExprInterface index, Span span) {
            this.target = target;
            this.index = index;
            this.span = span;
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    /** Target is always a Variable or an Index; the parser rejects anything else. */
    public static final class Assign implements ExprInterface {
        public final ExprInterface target;
        public final Token operator;
        public final ExprInterface value;

        public Assign(ExprInterface target, Token operator, ExprInterface value) {
            this.target = target;
            this.operator = operator;
            this.value = value;
        }

        @Override
        public Span span() { return target.span().union(value.span()); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    // -------------------------
    // Prefix forms
    // -------------------------

    public static final class CloneOf implements ExprInterface {
        public final Token keyword;
        public final ExprInterface expression;

        public CloneOf(Token keyword, ExprInterface expression) {
            this.keyword = keyword;
            this.expression = expression;
        }

        @Override
        public Span span() { return keyword.span.union(expression.span()); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCloneExpr(this);
        }
    }

    public static final class MirrorOf implements ExprInterface {
        public final Token keyword;
        public final ExprInterface expression;

        public MirrorOf(Token keyword, ExprInterface expression) {
            this.keyword = keyword;
            this.expression = expression;
        }

        @Override
        public Span span() { return keyword.span.union(expression.span()); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMirrorExpr(this);
        }
    }

    public static final class InputOf implements ExprInterface {
        public final Token keyword;
        public final ExprInterface prompt;

        public InputOf(Token keyword, ExprInterface prompt) {
            this.keyword = keyword;
            this.prompt = prompt;
        }

        @Override
        public Span span() { return keyword.span.union(prompt.span()); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInputExpr(this);
        }
    }

    /** {@code expr as num|str|char|bool|list}. */
    public static final class Cast implements ExprInterface {
        public final ExprInterface expression;
        public final Token type;

        public Cast(ExprInterface expression, Token type) {
            this.expression = expression;
            this.type = type;
        }

        @Override
        public Span span() { return expression.span().union(type.span); }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCastExpr(this);
        }
    }
}
