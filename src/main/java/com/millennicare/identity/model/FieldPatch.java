package com.millennicare.identity.model;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A single field of a partial update. Distinguishes "leave unchanged" ({@link #unset()})
 * from "set to this value", where the value may be {@code null} to clear the field.
 */
public final class FieldPatch<T> {

    private static final FieldPatch<?> UNSET = new FieldPatch<>(false, null);

    private final boolean set;
    private final T value;

    private FieldPatch(boolean set, T value) {
        this.set = set;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldPatch<T> unset() {
        return (FieldPatch<T>) UNSET;
    }

    public static <T> FieldPatch<T> of(T value) {
        return new FieldPatch<>(true, value);
    }

    /** Set when {@code value} is non-null, otherwise unset. */
    public static <T> FieldPatch<T> ofNonNull(T value) {
        return value == null ? unset() : of(value);
    }

    static <T> FieldPatch<T> orUnset(FieldPatch<T> patch) {
        return patch == null ? unset() : patch;
    }

    public boolean isSet() {
        return set;
    }

    public T value() {
        if (!set) throw new IllegalStateException("FieldPatch is unset");
        return value;
    }

    public void ifSet(Consumer<? super T> action) {
        if (set) action.accept(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPatch<?> other)) return false;
        return set == other.set && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(set, value);
    }

    @Override
    public String toString() {
        return set ? "FieldPatch[" + value + "]" : "FieldPatch[unset]";
    }
}
