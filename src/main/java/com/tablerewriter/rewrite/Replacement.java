package com.tablerewriter.rewrite;

import java.util.Objects;

/**
 * Decision for one component of a table identifier.
 *
 * <p>{@link #keep()} leaves the component exactly as parsed, including its absence.
 * {@link #clear()} removes that qualification level. {@link #set(String)} replaces it.
 */
public final class Replacement {

    private enum Kind {
        KEEP,
        CLEAR,
        SET
    }

    private static final Replacement KEEP = new Replacement(Kind.KEEP, null);
    private static final Replacement CLEAR = new Replacement(Kind.CLEAR, null);

    private final Kind kind;
    private final String value;

    private Replacement(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    public static Replacement keep() {
        return KEEP;
    }

    public static Replacement clear() {
        return CLEAR;
    }

    public static Replacement set(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Replacement value cannot be null, use Replacement.clear() to drop a component");
        }
        return new Replacement(Kind.SET, value);
    }

    /**
     * Lenient factory for callers holding a plain nullable value: {@code null} means keep.
     */
    public static Replacement setOrKeep(String value) {
        return value == null ? KEEP : set(value);
    }

    public boolean isKeep() {
        return kind == Kind.KEEP;
    }

    public boolean isClear() {
        return kind == Kind.CLEAR;
    }

    public boolean isSet() {
        return kind == Kind.SET;
    }

    /**
     * Value of a {@link #set(String)} replacement, {@code null} otherwise.
     */
    public String getValue() {
        return value;
    }

    /**
     * Applies this decision to the original component value.
     */
    public String applyTo(String original) {
        switch (kind) {
            case KEEP:
                return original;
            case CLEAR:
                return null;
            default:
                return value;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Replacement)) {
            return false;
        }
        Replacement that = (Replacement) o;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.SET ? "SET(" + value + ")" : kind.name();
    }
}
