package com.expecta.analyzer.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.expecta.analyzer.engine.Expr.Binary;
import com.expecta.analyzer.engine.Expr.Call;
import com.expecta.analyzer.engine.Expr.ExprInterface;
import com.expecta.analyzer.engine.Expr.ExprVisitor;
import com.expecta.analyzer.engine.Expr.Literal;
import com.expecta.analyzer.engine.Expr.Logical;
import com.expecta.analyzer.engine.Expr.Not;
import com.expecta.analyzer.engine.Expr.SlotRead;

/**
 * Evaluates request expressions. Evaluation is pure: the only way a request
 * changes the environment is through its assignments, applied by the engine.
 */
public class Evaluator implements ExprVisitor<CdForm> {
    private final Environment env;
    private final Map<String, BuiltinFunction> functions;

    public Evaluator(Environment env, Map<String, BuiltinFunction> functions) {
        this.env = env;
        this.functions = functions;
    }

    public CdForm eval(ExprInterface expr) {
        if (expr == null) return CdForm.NIL;
        return expr.accept(this);
    }

    @Override
    public CdForm visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public CdForm visitSlotReadExpr(SlotRead expr) {
        return env.get(expr.slot);
    }

    @Override
    public CdForm visitBinaryExpr(Binary expr) {
        CdForm left = eval(expr.left);
        CdForm right = eval(expr.right);

        switch (expr.operator) {
            case EQUAL:
                return CdForm.bool(left.equals(right));
            case NOT_EQUAL:
                return CdForm.bool(!left.equals(right));
            case LESS:
                requireNumbers(left, right, expr);
                return CdForm.bool(left.asNumber() < right.asNumber());
            case LESS_EQUAL:
                requireNumbers(left, right, expr);
                return CdForm.bool(left.asNumber() <= right.asNumber());
            case GREATER:
                requireNumbers(left, right, expr);
                return CdForm.bool(left.asNumber() > right.asNumber());
            case GREATER_EQUAL:
                requireNumbers(left, right, expr);
                return CdForm.bool(left.asNumber() >= right.asNumber());
            case PLUS:
                requireNumbers(left, right, expr);
                return CdForm.number(left.asNumber() + right.asNumber());
            case MINUS:
                requireNumbers(left, right, expr);
                return CdForm.number(left.asNumber() - right.asNumber());
            default:
                throw AnalysisException.malformed(expr.operator.symbol, "Unsupported operator: " + expr.operator);
        }
    }

    @Override
    public CdForm visitLogicalExpr(Logical expr) {
        CdForm last = (expr.operator == Expr.LogicalOp.AND) ? CdForm.T : CdForm.NIL;
        for (ExprInterface operand : expr.operands) {
            last = eval(operand);
            if (expr.operator == Expr.LogicalOp.AND && !last.isTruthy()) return CdForm.NIL;
            if (expr.operator == Expr.LogicalOp.OR && last.isTruthy()) return last;
        }
        return last;
    }

    @Override
    public CdForm visitNotExpr(Not expr) {
        return CdForm.bool(!eval(expr.operand).isTruthy());
    }

    @Override
    public CdForm visitCallExpr(Call expr) {
        BuiltinFunction fn = functions.get(expr.function);
        if (fn == null) {
            throw AnalysisException.malformed(expr.function, "Unknown function: " + expr.function);
        }
        List<CdForm> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) args.add(eval(a));
        CdForm out = fn.call(args);
        return (out == null) ? CdForm.NIL : out;
    }

    private static void requireNumbers(CdForm left, CdForm right, Binary expr) {
        if (left.getType() != CdForm.Type.NUMBER || right.getType() != CdForm.Type.NUMBER) {
            throw AnalysisException.malformed(expr.operator.symbol,
                    "Operands must be numbers for '" + expr.operator.symbol + "': " + left + ", " + right);
        }
    }
}
