package com.ram.script.parser;

import java.util.Objects;

/**
 * Tagged runtime value: number, text, boolean, callable function record, or absent.
 *
 * Numbers are floating point. Loop counters are stored as whole numbers so
 * they display without a fraction; they compare and compute as doubles.
 */
public final class Value {
    public enum Type { NUMBER, BOOL, STRING, FUNC, NULL }

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    private static final Value NIL = new Value(Type.NULL, null);

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value integer(long n) { return new Value(Type.NUMBER, n); }
    public static Value bool(boolean b) { return new Value(Type.BOOL, b); }
    public static Value string(String s) { return new Value(Type.STRING, Objects.requireNonNull(s)); }
    public static Value func(RamCallable f) { return new Value(Type.FUNC, Objects.requireNonNull(f)); }
    public static Value nil() { return NIL; }

    public boolean isNumber() { return type == Type.NUMBER; }

    public boolean isCallable() { return type == Type.FUNC; }

    /** True for whole-number bindings such as loop counters. */
    public boolean isIntegral() { return value instanceof Long; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return ((Number) value).doubleValue();
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    public RamCallable asFunc() {
        if (type != Type.FUNC) throw new IllegalStateException("Expected function, got " + type);
        return (RamCallable) value;
    }

    /** Type name used in error messages. */
    public String typeName() {
        switch (type) {
            case NUMBER: return "number";
            case BOOL:   return "boolean";
            case STRING: return "text";
            case FUNC:   return "function";
            default:     return "nothing";
        }
    }

    /** Value equality; numbers compare as doubles. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.NUMBER) return asNumber() == other.asNumber();
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.NUMBER) return Double.hashCode(asNumber());
        return Objects.hash(type, value);
    }

    /** Display form: {@code 15.0}, {@code 3} (counters), {@code True}, raw text, {@code None}. */
    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return isIntegral() ? Long.toString((Long) value) : formatNumber(asNumber());
            case BOOL:
                return asBool() ? "True" : "False";
            case STRING:
                return asString();
            case FUNC:
                return "<function " + asFunc().name() + ">";
            default:
                return "None";
        }
    }

    static String formatNumber(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e16) {
            return (long) d + ".0";
        }
        return Double.toString(d);
    }
}
