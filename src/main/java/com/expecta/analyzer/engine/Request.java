package com.expecta.analyzer.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A guarded action: an optional test, assignments applied in order when the
 * request fires, and the packets to push once the current cascade halts.
 */
public final class Request {

    public static final class Assignment {
        public final String slot;
        public final Expr.ExprInterface value;

        public Assignment(String slot, Expr.ExprInterface value) {
            if (slot == null || slot.isEmpty()) throw new IllegalArgumentException("slot must not be empty");
            if (value == null) throw new IllegalArgumentException("assignment to " + slot + " has no expression");
            this.slot = slot;
            this.value = value;
        }

        @Override
        public String toString() {
            return slot + " " + value;
        }
    }

    private final Expr.ExprInterface test;
    private final List<Assignment> assignments;
    private final List<Packet> nextPackets;
    private final String source;

    public Request(Expr.ExprInterface test, List<Assignment> assignments, List<Packet> nextPackets) {
        this(test, assignments, nextPackets, null);
    }

    public Request(Expr.ExprInterface test, List<Assignment> assignments, List<Packet> nextPackets, String source) {
        this.test = test;
        this.assignments = (assignments == null) ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(assignments));
        this.nextPackets = (nextPackets == null) ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(nextPackets));
        this.source = source;
    }

    /** Null when the request always triggers. */
    public Expr.ExprInterface test() { return test; }

    public List<Assignment> assignments() { return assignments; }

    public List<Packet> nextPackets() { return nextPackets; }

    /** A request without a test is always triggered. */
    public boolean isTriggered(Environment env) {
        return test == null || env.evaluate(test).isTruthy();
    }

    /** Apply the assignments strictly in order; each sees the writes before it. */
    public void apply(Environment env) {
        for (Assignment a : assignments) {
            env.set(a.slot, env.evaluate(a.value));
        }
    }

    @Override
    public String toString() {
        if (source != null) return source;
        StringBuilder sb = new StringBuilder("(");
        if (test != null) sb.append("(test ").append(test).append(")");
        if (!assignments.isEmpty()) {
            if (sb.length() > 1) sb.append(' ');
            sb.append("(assign");
            for (Assignment a : assignments) sb.append(' ').append(a);
            sb.append(")");
        }
        for (Packet p : nextPackets) {
            if (sb.length() > 1) sb.append(' ');
            sb.append("(next-packet ").append(p.size()).append(" requests)");
        }
        return sb.append(")").toString();
    }
}
