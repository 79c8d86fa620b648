package com.expecta.analyzer.lexicon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.expecta.analyzer.engine.CdForm;

/** Raw S-expression as read from lexicon source, before it is compiled into requests. */
public final class Datum {
    public enum Kind { SYMBOL, NUMBER, VARIABLE, QUOTE, LIST }

    public final Kind kind;
    public final int line;
    private final Object value;

    private Datum(Kind kind, Object value, int line) {
        this.kind = kind;
        this.value = value;
        this.line = line;
    }

    public static Datum symbol(String name, int line) { return new Datum(Kind.SYMBOL, name, line); }
    public static Datum number(double d, int line) { return new Datum(Kind.NUMBER, d, line); }
    public static Datum variable(String name, int line) { return new Datum(Kind.VARIABLE, name, line); }
    public static Datum quote(Datum quoted, int line) { return new Datum(Kind.QUOTE, quoted, line); }

    public static Datum list(List<Datum> items, int line) {
        return new Datum(Kind.LIST, Collections.unmodifiableList(new ArrayList<>(items)), line);
    }

    public boolean isSymbol() { return kind == Kind.SYMBOL; }
    public boolean isList() { return kind == Kind.LIST; }

    public boolean isSymbol(String name) {
        return kind == Kind.SYMBOL && name.equals(value);
    }

    public String name() {
        if (kind != Kind.SYMBOL && kind != Kind.VARIABLE) throw new IllegalStateException("Expected symbol, got " + kind);
        return (String) value;
    }

    public double number() {
        if (kind != Kind.NUMBER) throw new IllegalStateException("Expected number, got " + kind);
        return (double) value;
    }

    public Datum quoted() {
        if (kind != Kind.QUOTE) throw new IllegalStateException("Expected quote, got " + kind);
        return (Datum) value;
    }

    @SuppressWarnings("unchecked")
    public List<Datum> items() {
        if (kind != Kind.LIST) throw new IllegalStateException("Expected list, got " + kind);
        return (List<Datum>) value;
    }

    @Override
    public String toString() {
        switch (kind) {
            case SYMBOL:
                return name();
            case NUMBER:
                return CdForm.formatNumber(number());
            case VARIABLE:
                return "?" + name();
            case QUOTE:
                return "'" + quoted();
            case LIST: {
                StringBuilder sb = new StringBuilder("(");
                List<Datum> items = items();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(' ');
                    sb.append(items.get(i));
                }
                return sb.append(')').toString();
            }
            default:
                return "?";
        }
    }
}
