package com.forge.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        Signal accept(StmtVisitor visitor);

        Span span();
    }

    /** Every statement yields a completion signal; NORMAL unless control flow is unwinding. */
    public interface StmtVisitor {
        Signal visitVarStmt(VarStmt stmt);
        Signal visitExprStmt(ExprStmt stmt);
        Signal visitPrintStmt(PrintStmt stmt);
        Signal visitIfStmt(If stmt);
        Signal visitWhileStmt(While stmt);
        Signal visitForStmt(For stmt);
        Signal visitInputStmt(InputStmt stmt);
        Signal visitReturnStmt(ReturnStmt stmt);
        Signal visitBreakStmt(BreakStmt stmt);
        Signal visitContinueStmt(ContinueStmt stmt);
        Signal visitBlockStmt(Block stmt);
    }

    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer;
        private final Span span;

        VarStmt(Token name, Expr.ExprInterface initializer, Span span) {
            this.name = name;
            this.initializer = initializer;
            this.span = span;
        }

        public Span span() { return span; }
        public Signal accept(StmtVisitor visitor) { return visitor.visitVarStmt(this); }
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;

        ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }

        public Span span() { return expression.span(); }
        public Signal accept(StmtVisitor visitor) { return visitor.visitExprStmt(this); }
    }

    public static final class PrintStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface expression;

        PrintStmt(Token keyword, Expr.ExprInterface expression) {
            this.keyword = keyword;
            this.expression = expression;
        }

        public Span span() { return keyword.span.union(expression.span()); }
        public Signal accept(StmtVisitor visitor) { return visitor.visitPrintStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block thenBranch;
        public final Stmt elseBranch; // Block, nested If, or null
        private final Span span;

        If(Expr.ExprInterface condition, Block thenBranch, Stmt elseBranch, Span span) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
            this.span = span;
        }

        public Span span() { return span; }
        public Signal accept(StmtVisitor visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block body;
        private final Span span;

        While(Expr.ExprInterface condition, Block body, Span span) {
            this.condition = condition;
            this.body = body;
            this.span = span;
        }

        public Span span() { return span; }
        public Signal accept(StmtVisitor visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class For implements Stmt {
        public final Token variable;
        public final Expr.ExprInterface iterable;
        public final Block body;
        private final Span span;

        For(Token variable, Expr.ExprInterface iterable, Block body, Span span) {
            this.variable = variable;
            this.iterable = iterable;
            this.body = body;
            this.span = span;
        }

        public Span span() { return span; }
        public Signal accept(StmtVisitor visitor) { return visitor.visitForStmt(this); }
    }

    /** {@code input target, prompt;} stores the line read into an lvalue. */
    public static final class InputStmt implements Stmt {
        public final Expr.ExprInterface target;
        public final Expr.ExprInterface prompt; // may be null
        private final Span span;

        InputStmt(Expr.ExprInterface target, Expr.ExprInterface prompt, Span span) {
            this.target = target;
            this.prompt = prompt;
            this.span = span;
        }

        public Span span() { return span; }
        public Signal accept(StmtVisitor visitor) { return visitor.visitInputStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public Span span() { return value == null ? keyword.span : keyword.span.union(value.span()); }
        public Signal accept(StmtVisitor visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;

        BreakStmt(Token keyword) { this.keyword = keyword; }

        public Span span() { return keyword.span; }
        public Signal accept(StmtVisitor visitor) { return visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        public final Token keyword;

        ContinueStmt(Token keyword) { this.keyword = keyword; }

        public Span span() { return keyword.span; }
        public Signal accept(StmtVisitor visitor) { return visitor.visitContinueStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        private final Span span;

        Block(List<Stmt> statements, Span span) {
            this.statements = statements;
            this.span = span;
        }

        public Span span() { return span; }
        public Signal accept(StmtVisitor visitor) { return visitor.visitBlockStmt(this); }
    }
}
