package com.expecta.analyzer.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Request expressions. The node set is closed: tests and assignment
 * right-hand sides are built only from these, and evaluated by
 * {@link Evaluator} against an {@link Environment}.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitSlotReadExpr(SlotRead expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitNotExpr(Not expr);
        R visitCallExpr(Call expr);
    }

    public enum Op {
        EQUAL("equal"),
        NOT_EQUAL("not-equal"),
        LESS("<"),
        LESS_EQUAL("<="),
        GREATER(">"),
        GREATER_EQUAL(">="),
        PLUS("+"),
        MINUS("-");

        public final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }
    }

    public enum LogicalOp { AND, OR }

    /** A constant, possibly a template that still holds variable references. */
    public static final class Literal implements ExprInterface {
        public final CdForm value;

        public Literal(CdForm value) {
            this.value = (value == null) ? CdForm.NIL : value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }

        @Override
        public String toString() {
            switch (value.getType()) {
                case SYMBOL:
                    if (value == CdForm.T) return "t";
                    // fall through
                case FRAME:
                case LIST:
                    return "'" + value;
                default:
                    return value.toString();
            }
        }
    }

    public static final class SlotRead implements ExprInterface {
        public final String slot;

        public SlotRead(String slot) {
            this.slot = slot;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSlotReadExpr(this);
        }

        @Override
        public String toString() {
            return slot;
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Op operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Op operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }

        @Override
        public String toString() {
            return "(" + operator.symbol + " " + left + " " + right + ")";
        }
    }

    public static final class Logical implements ExprInterface {
        public final LogicalOp operator;
        public final List<ExprInterface> operands;

        public Logical(LogicalOp operator, List<ExprInterface> operands) {
            this.operator = operator;
            this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }

        @Override
        public String toString() {
            return "(" + operator.name().toLowerCase() + join(operands) + ")";
        }
    }

    public static final class Not implements ExprInterface {
        public final ExprInterface operand;

        public Not(ExprInterface operand) {
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNotExpr(this);
        }

        @Override
        public String toString() {
            return "(not " + operand + ")";
        }
    }

    /** Call of a host-registered builtin, e.g. (append cdForm predicates). */
    public static final class Call implements ExprInterface {
        public final String function;
        public final List<ExprInterface> arguments;

        public Call(String function, List<ExprInterface> arguments) {
            this.function = function;
            this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }

        @Override
        public String toString() {
            return "(" + function + join(arguments) + ")";
        }
    }

    private static String join(List<ExprInterface> exprs) {
        StringBuilder sb = new StringBuilder();
        for (ExprInterface e : exprs) sb.append(' ').append(e);
        return sb.toString();
    }
}
