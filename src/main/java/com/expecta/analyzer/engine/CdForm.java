package com.expecta.analyzer.engine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Conceptual-dependency form: the single value type of the analyzer. Used for
 * environment slot values, template literals and parse results.
 *
 * Forms are immutable. FRAME and LIST contents are unmodifiable, so a form can
 * be shared freely between the environment and returned results.
 */
public final class CdForm {
    public enum Type { NIL, SYMBOL, NUMBER, VARIABLE, FRAME, LIST }

    public static final CdForm NIL = new CdForm(Type.NIL, null);
    public static final CdForm T = new CdForm(Type.SYMBOL, "t");

    /** One (role filler) pair of a frame. */
    public static final class Role {
        public final String name;
        public final CdForm filler;

        public Role(String name, CdForm filler) {
            if (name == null || name.isEmpty()) throw new IllegalArgumentException("role name must not be empty");
            this.name = name;
            this.filler = (filler == null) ? NIL : filler;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Role)) return false;
            Role r = (Role) o;
            return name.equals(r.name) && filler.equals(r.filler);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + filler.hashCode();
        }

        @Override
        public String toString() {
            return "(" + name + " " + filler + ")";
        }
    }

    private static final class Frame {
        final String header;
        final List<Role> roles;

        Frame(String header, List<Role> roles) {
            this.header = header;
            this.roles = roles;
        }
    }

    public final Type type;
    private final Object value;

    private CdForm(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static CdForm symbol(String name) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("symbol name must not be empty");
        if ("nil".equals(name)) return NIL;
        if ("t".equals(name)) return T;
        return new CdForm(Type.SYMBOL, name);
    }

    public static CdForm number(double d) { return new CdForm(Type.NUMBER, d); }

    public static CdForm bool(boolean b) { return b ? T : NIL; }

    public static CdForm variable(String name) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("variable name must not be empty");
        return new CdForm(Type.VARIABLE, name);
    }

    public static CdForm frame(String header, List<Role> roles) {
        if (header == null || header.isEmpty()) throw new IllegalArgumentException("frame header must not be empty");
        List<Role> copy = (roles == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(roles));
        return new CdForm(Type.FRAME, new Frame(header, copy));
    }

    public static CdForm frame(String header, Role... roles) {
        List<Role> list = new ArrayList<>(roles.length);
        Collections.addAll(list, roles);
        return frame(header, list);
    }

    /** An empty list is nil. */
    public static CdForm list(List<CdForm> items) {
        if (items == null || items.isEmpty()) return NIL;
        List<CdForm> copy = new ArrayList<>(items.size());
        for (CdForm f : items) copy.add(f == null ? NIL : f);
        return new CdForm(Type.LIST, Collections.unmodifiableList(copy));
    }

    public static CdForm list(CdForm... items) {
        List<CdForm> list = new ArrayList<>(items.length);
        Collections.addAll(list, items);
        return list(list);
    }

    public static Role role(String name, CdForm filler) {
        return new Role(name, filler);
    }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }

    /** Anything but nil counts as true. */
    public boolean isTruthy() { return type != Type.NIL; }

    public String asSymbol() {
        if (type != Type.SYMBOL) throw new IllegalStateException("Expected symbol, got " + type);
        return (String) value;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public String variableName() {
        if (type != Type.VARIABLE) throw new IllegalStateException("Expected variable, got " + type);
        return (String) value;
    }

    public String header() {
        if (type != Type.FRAME) throw new IllegalStateException("Expected frame, got " + type);
        return ((Frame) value).header;
    }

    public List<Role> roles() {
        if (type != Type.FRAME) throw new IllegalStateException("Expected frame, got " + type);
        return ((Frame) value).roles;
    }

    /** Filler of the first role called {@code name}, or nil. */
    public CdForm filler(String name) {
        for (Role r : roles()) {
            if (r.name.equals(name)) return r.filler;
        }
        return NIL;
    }

    @SuppressWarnings("unchecked")
    public List<CdForm> items() {
        if (type != Type.LIST) throw new IllegalStateException("Expected list, got " + type);
        return (List<CdForm>) value;
    }

    /** True when this form, or anything nested in it, is a variable reference. */
    public boolean containsVariables() {
        switch (type) {
            case VARIABLE:
                return true;
            case FRAME:
                for (Role r : roles()) {
                    if (r.filler.containsVariables()) return true;
                }
                return false;
            case LIST:
                for (CdForm f : items()) {
                    if (f.containsVariables()) return true;
                }
                return false;
            default:
                return false;
        }
    }

    /**
     * Integral values print without a fraction; values beyond the long range
     * print in plain decimal rather than being clamped.
     */
    public static String formatNumber(double d) {
        if (d == Math.rint(d) && Math.abs(d) < 0x1p63) return Long.toString((long) d);
        if (d == Math.rint(d) && !Double.isInfinite(d)) return BigDecimal.valueOf(d).toPlainString();
        return Double.toString(d);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CdForm)) return false;
        CdForm other = (CdForm) o;
        if (type != other.type) return false;
        switch (type) {
            case NIL:
                return true;
            case FRAME:
                return header().equals(other.header()) && roles().equals(other.roles());
            default:
                return Objects.equals(value, other.value);
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NIL:
                return 0;
            case FRAME:
                return 31 * header().hashCode() + roles().hashCode();
            default:
                return 31 * type.hashCode() + value.hashCode();
        }
    }

    @Override
    public String toString() {
        switch (type) {
            case NIL:
                return "nil";
            case SYMBOL:
                return asSymbol();
            case NUMBER:
                return formatNumber(asNumber());
            case VARIABLE:
                return "?" + variableName();
            case FRAME: {
                StringBuilder sb = new StringBuilder("(").append(header());
                for (Role r : roles()) sb.append(' ').append(r);
                return sb.append(')').toString();
            }
            case LIST: {
                StringBuilder sb = new StringBuilder("(");
                List<CdForm> items = items();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(' ');
                    sb.append(items.get(i));
                }
                return sb.append(')').toString();
            }
            default:
                return "nil";
        }
    }
}
