package com.expecta.analyzer.lexicon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.expecta.analyzer.engine.AnalysisException;
import com.expecta.analyzer.engine.CdForm;
import com.expecta.analyzer.engine.Expr;
import com.expecta.analyzer.engine.Packet;
import com.expecta.analyzer.engine.Request;

/**
 * Compiles lexicon data into packets.
 *
 * <pre>
 * packet  := (request ...)
 * request := (clause ...)
 * clause  := (test expr) | (assign slot expr ...) | (next-packet request ...)
 * </pre>
 *
 * Each next-packet clause becomes one packet. Quoted data is a template
 * literal: {@code (header (role filler) ...)} is a frame, a list whose first
 * element is itself a list is a compound list, {@code ?x} is a variable
 * reference and {@code nil} / {@code ()} are nil.
 */
public final class RequestCompiler {
    public static final String TEST = "test";
    public static final String ASSIGN = "assign";
    public static final String NEXT_PACKET = "next-packet";

    private static final Map<String, Expr.Op> OPERATORS;
    static {
        Map<String, Expr.Op> map = new HashMap<>();
        map.put("equal", Expr.Op.EQUAL);
        map.put("=", Expr.Op.EQUAL);
        map.put("not-equal", Expr.Op.NOT_EQUAL);
        map.put("!=", Expr.Op.NOT_EQUAL);
        map.put("<", Expr.Op.LESS);
        map.put("<=", Expr.Op.LESS_EQUAL);
        map.put(">", Expr.Op.GREATER);
        map.put(">=", Expr.Op.GREATER_EQUAL);
        map.put("+", Expr.Op.PLUS);
        map.put("-", Expr.Op.MINUS);
        OPERATORS = Collections.unmodifiableMap(map);
    }

    private RequestCompiler() {}

    /** Compile the request list of a word definition into its initial packet. */
    public static Packet compilePacket(List<Datum> requests, String word) {
        List<Request> out = new ArrayList<>(requests.size());
        for (Datum d : requests) out.add(compileRequest(d, word));
        return new Packet(out);
    }

    /** Compile a packet written as one list of requests, e.g. {@code ((test x) (assign y 1))}. */
    public static Packet compilePacket(Datum packet, String word) {
        if (!packet.isList()) throw malformed(word, packet, "packet must be a list of requests");
        return compilePacket(packet.items(), word);
    }

    public static Request compileRequest(Datum request, String word) {
        if (!request.isList() || request.items().isEmpty()) {
            throw malformed(word, request, "request must be a non-empty list of clauses");
        }

        Expr.ExprInterface test = null;
        boolean hasTest = false;
        List<Request.Assignment> assignments = new ArrayList<>();
        List<Packet> nextPackets = new ArrayList<>();

        for (Datum clause : request.items()) {
            if (!clause.isList() || clause.items().isEmpty() || !clause.items().get(0).isSymbol()) {
                throw malformed(word, clause, "clause must be (test ...), (assign ...) or (next-packet ...)");
            }
            List<Datum> body = clause.items().subList(1, clause.items().size());
            String key = clause.items().get(0).name();

            switch (key) {
                case TEST:
                    if (hasTest) throw malformed(word, clause, "request has more than one test");
                    if (body.size() != 1) throw malformed(word, clause, "test takes exactly one expression");
                    test = compileExpr(body.get(0), word);
                    hasTest = true;
                    break;
                case ASSIGN:
                    if (body.size() % 2 != 0) throw malformed(word, clause, "assign needs slot/expression pairs");
                    for (int i = 0; i < body.size(); i += 2) {
                        Datum slot = body.get(i);
                        if (!slot.isSymbol() || "nil".equals(slot.name()) || "t".equals(slot.name())) {
                            throw malformed(word, slot, "assign target must be a slot name");
                        }
                        assignments.add(new Request.Assignment(slot.name(), compileExpr(body.get(i + 1), word)));
                    }
                    break;
                case NEXT_PACKET:
                    nextPackets.add(compilePacket(body, word));
                    break;
                default:
                    throw malformed(word, clause, "unknown clause '" + key + "'");
            }
        }

        return new Request(test, assignments, nextPackets, request.toString());
    }

    public static Expr.ExprInterface compileExpr(Datum d, String word) {
        switch (d.kind) {
            case NUMBER:
                return new Expr.Literal(CdForm.number(d.number()));
            case VARIABLE:
                return new Expr.Literal(CdForm.variable(d.name()));
            case QUOTE:
                return new Expr.Literal(toForm(d.quoted(), word));
            case SYMBOL:
                if ("nil".equals(d.name())) return new Expr.Literal(CdForm.NIL);
                if ("t".equals(d.name())) return new Expr.Literal(CdForm.T);
                return new Expr.SlotRead(d.name());
            case LIST:
                return compileCall(d, word);
            default:
                throw malformed(word, d, "unsupported expression");
        }
    }

    private static Expr.ExprInterface compileCall(Datum d, String word) {
        List<Datum> items = d.items();
        if (items.isEmpty()) return new Expr.Literal(CdForm.NIL);
        if (!items.get(0).isSymbol()) throw malformed(word, d, "expression must start with an operator name");

        String op = items.get(0).name();
        List<Datum> args = items.subList(1, items.size());

        if ("quote".equals(op)) {
            if (args.size() != 1) throw malformed(word, d, "quote takes exactly one datum");
            return new Expr.Literal(toForm(args.get(0), word));
        }
        if ("not".equals(op)) {
            if (args.size() != 1) throw malformed(word, d, "not takes exactly one expression");
            return new Expr.Not(compileExpr(args.get(0), word));
        }
        if ("and".equals(op) || "or".equals(op)) {
            List<Expr.ExprInterface> operands = new ArrayList<>(args.size());
            for (Datum a : args) operands.add(compileExpr(a, word));
            return new Expr.Logical("and".equals(op) ? Expr.LogicalOp.AND : Expr.LogicalOp.OR, operands);
        }

        Expr.Op binary = OPERATORS.get(op);
        if (binary != null) {
            if (args.size() != 2) throw malformed(word, d, "'" + op + "' takes exactly two operands");
            return new Expr.Binary(compileExpr(args.get(0), word), binary, compileExpr(args.get(1), word));
        }

        List<Expr.ExprInterface> callArgs = new ArrayList<>(args.size());
        for (Datum a : args) callArgs.add(compileExpr(a, word));
        return new Expr.Call(op, callArgs);
    }

    /** Convert quoted data into a template. */
    public static CdForm toForm(Datum d, String word) {
        switch (d.kind) {
            case SYMBOL:
                return CdForm.symbol(d.name());
            case NUMBER:
                return CdForm.number(d.number());
            case VARIABLE:
                return CdForm.variable(d.name());
            case QUOTE:
                throw malformed(word, d, "nested quote inside quoted data");
            case LIST: {
                List<Datum> items = d.items();
                if (items.isEmpty()) return CdForm.NIL;

                Datum head = items.get(0);
                if (head.isList()) {
                    List<CdForm> forms = new ArrayList<>(items.size());
                    for (Datum item : items) forms.add(toForm(item, word));
                    return CdForm.list(forms);
                }
                if (!head.isSymbol() || "nil".equals(head.name())) {
                    throw malformed(word, d, "frame header must be a symbol");
                }

                List<CdForm.Role> roles = new ArrayList<>(items.size() - 1);
                for (Datum pair : items.subList(1, items.size())) {
                    if (!pair.isList() || pair.items().size() != 2 || !pair.items().get(0).isSymbol()) {
                        throw malformed(word, pair, "expected (role filler) in frame " + head.name());
                    }
                    roles.add(CdForm.role(pair.items().get(0).name(), toForm(pair.items().get(1), word)));
                }
                return CdForm.frame(head.name(), roles);
            }
            default:
                throw malformed(word, d, "unsupported datum");
        }
    }

    private static AnalysisException malformed(String word, Datum where, String message) {
        return AnalysisException.malformed(word,
                "Malformed definition of '" + word + "' [line " + where.line + "]: " + message + ": " + where);
    }
}
