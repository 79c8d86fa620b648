package com.expecta.analyzer.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Requests competing for the top of the stack; list order is priority order. */
public final class Packet {
    public static final Packet EMPTY = new Packet(Collections.emptyList());

    private final List<Request> requests;

    public Packet(List<Request> requests) {
        this.requests = (requests == null) ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(requests));
    }

    public static Packet of(Request... requests) {
        List<Request> list = new ArrayList<>(requests.length);
        Collections.addAll(list, requests);
        return new Packet(list);
    }

    public List<Request> requests() { return requests; }

    public int size() { return requests.size(); }

    public boolean isEmpty() { return requests.isEmpty(); }

    /** First request whose test passes, or null when none does. */
    public Request firstTriggered(Environment env) {
        for (Request r : requests) {
            if (r.isTriggered(env)) return r;
        }
        return null;
    }

    @Override
    public String toString() {
        return requests.toString();
    }
}
