package com.expecta.analyzer.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** LIFO of packets. Only the top is ever inspected. */
public class PacketStack {
    private final Deque<Packet> packets = new ArrayDeque<>();

    /** Null or empty packets are ignored. */
    public void push(Packet packet) {
        if (packet == null || packet.isEmpty()) return;
        packets.push(packet);
    }

    public Packet pop() {
        if (packets.isEmpty()) {
            throw new IllegalStateException("Cannot pop an empty packet stack");
        }
        return packets.pop();
    }

    /** Top packet, or null when the stack is empty. */
    public Packet peek() {
        return packets.peek();
    }

    public boolean isEmpty() {
        return packets.isEmpty();
    }

    public int size() {
        return packets.size();
    }

    public void clear() {
        packets.clear();
    }

    /** DEBUG: packets from top to bottom. */
    public List<Packet> snapshotTopToBottom() {
        return new ArrayList<>(packets);
    }
}
