package com.expecta.analyzer.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns a template into a concrete form by replacing every variable reference
 * with the (recursively instantiated) value of its slot.
 *
 * Frame roles whose filler instantiates to nil are dropped; the remaining roles
 * keep their order. A frame that loses all roles still yields {@code (header)}.
 * Lists are instantiated element by element, which is how compound concepts
 * pass through.
 */
public class Instantiator {
    public static final int DEFAULT_MAX_DEPTH = 64;

    private final int maxDepth;

    public Instantiator() {
        this(DEFAULT_MAX_DEPTH);
    }

    public Instantiator(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = maxDepth;
    }

    public CdForm instantiate(CdForm template, Environment env) {
        return instantiate(template, env, new ArrayDeque<>(), new HashMap<>());
    }

    // resolving: slots currently being resolved, innermost first
    // resolved: slots already instantiated during this call; the environment does not change meanwhile
    private CdForm instantiate(CdForm template, Environment env, Deque<String> resolving,
                               Map<String, CdForm> resolved) {
        if (template == null) return CdForm.NIL;

        switch (template.getType()) {
            case NIL:
            case SYMBOL:
            case NUMBER:
                return template;

            case VARIABLE: {
                String slot = template.variableName();
                CdForm done = resolved.get(slot);
                if (done != null) return done;

                if (resolving.contains(slot)) {
                    throw new AnalysisException(ErrorKind.CYCLIC_BINDING, slot,
                            "Cyclic binding: " + chain(resolving, slot));
                }
                if (resolving.size() >= maxDepth) {
                    throw new AnalysisException(ErrorKind.CYCLIC_BINDING, slot,
                            "Resolution deeper than " + maxDepth + " slots: " + chain(resolving, slot));
                }
                resolving.push(slot);
                try {
                    CdForm value = instantiate(env.get(slot), env, resolving, resolved);
                    resolved.put(slot, value);
                    return value;
                } finally {
                    resolving.pop();
                }
            }

            case FRAME: {
                List<CdForm.Role> kept = new ArrayList<>(template.roles().size());
                for (CdForm.Role role : template.roles()) {
                    CdForm filler = instantiate(role.filler, env, resolving, resolved);
                    if (!filler.isNil()) kept.add(new CdForm.Role(role.name, filler));
                }
                return CdForm.frame(template.header(), kept);
            }

            case LIST: {
                List<CdForm> out = new ArrayList<>(template.items().size());
                for (CdForm item : template.items()) out.add(instantiate(item, env, resolving, resolved));
                return CdForm.list(out);
            }

            default:
                throw new IllegalStateException("Unsupported form type: " + template.getType());
        }
    }

    private static String chain(Deque<String> resolving, String slot) {
        StringBuilder sb = new StringBuilder();
        for (Iterator<String> it = resolving.descendingIterator(); it.hasNext();) {
            sb.append(it.next()).append(" -> ");
        }
        return sb.append(slot).toString();
    }
}
