package com.expecta.analyzer.engine;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slot store shared by every request fired during a parse.
 *
 * Control slots always exist. Any other name is declared by its first
 * assignment and stays visible to all later requests of the parse. Reading a
 * slot that was never declared is an {@link ErrorKind#UNBOUND_SLOT} failure,
 * never an implicit nil.
 */
public class Environment {
    public static final String CURRENT_WORD = "currentWord";
    public static final String PART_OF_SPEECH = "partOfSpeech";
    public static final String CD_FORM = "cdForm";
    public static final String SUBJECT = "subject";
    public static final String PREDICATES = "predicates";
    public static final String CONCEPT = "concept";
    public static final String REMAINING_WORDS = "remainingWords";

    public static final List<String> CONTROL_SLOTS = Collections.unmodifiableList(Arrays.asList(
            CURRENT_WORD, PART_OF_SPEECH, CD_FORM, SUBJECT, PREDICATES, CONCEPT, REMAINING_WORDS));

    private final Map<String, CdForm> slots = new LinkedHashMap<>();
    private final Map<String, BuiltinFunction> functions;

    public Environment() {
        this(CoreFunctions.create());
    }

    public Environment(Map<String, BuiltinFunction> functions) {
        this.functions = (functions == null) ? CoreFunctions.create() : functions;
        declareControlSlots();
    }

    private void declareControlSlots() {
        for (String name : CONTROL_SLOTS) slots.put(name, CdForm.NIL);
    }

    // -------------------------
    // Slots API
    // -------------------------
    public CdForm get(String name) {
        CdForm v = slots.get(name);
        if (v == null) throw AnalysisException.unboundSlot(name);
        return v;
    }

    public boolean exists(String name) {
        return slots.containsKey(name);
    }

    /** Assign, declaring the slot if this is the first write to it. */
    public void set(String name, CdForm value) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("slot name must not be empty");
        slots.put(name, value == null ? CdForm.NIL : value);
    }

    public boolean isControlSlot(String name) {
        return CONTROL_SLOTS.contains(name);
    }

    /** Evaluate a request expression against the current slot values. */
    public CdForm evaluate(Expr.ExprInterface expr) {
        return new Evaluator(this, functions).eval(expr);
    }

    public void reset(ResetPolicy policy) {
        if (policy == ResetPolicy.CARRY_OVER) {
            slots.put(CONCEPT, CdForm.NIL);
            return;
        }
        slots.clear();
        declareControlSlots();
    }

    /** Ordered copy of every declared slot. Forms are immutable, so no deep copy is needed. */
    public Map<String, CdForm> snapshot() {
        return new LinkedHashMap<>(slots);
    }

    @Override
    public String toString() {
        return slots.toString();
    }
}
