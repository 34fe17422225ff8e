package com.example.finrecon.service.merge;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * 병합 대상 필드 하나(getter/setter 쌍).
 *
 * <p>Absence policy: a value is absent only when it is {@code null} or a blank string.
 * Numeric zero and {@code false} are real observations and are never overwritten.</p>
 */
public final class MergeField<R, V> {

    private final String name;
    private final Function<R, V> getter;
    private final BiConsumer<R, V> setter;

    private MergeField(String name, Function<R, V> getter, BiConsumer<R, V> setter) {
        this.name = name;
        this.getter = getter;
        this.setter = setter;
    }

    public static <R, V> MergeField<R, V> of(String name, Function<R, V> getter, BiConsumer<R, V> setter) {
        return new MergeField<>(name, getter, setter);
    }

    public String name() { return name; }

    public V get(R record) { return getter.apply(record); }

    public boolean isAbsent(R record) {
        return absent(getter.apply(record));
    }

    /** Copies the source value into target only when target lacks it and source has it. */
    public boolean fill(R target, R source) {
        if (!isAbsent(target)) return false;
        V v = getter.apply(source);
        if (absent(v)) return false;
        setter.accept(target, v);
        return true;
    }

    /** Sets {@code value} only when the field is currently absent. */
    public void fillWith(R target, V value) {
        if (isAbsent(target) && !absent(value)) setter.accept(target, value);
    }

    public static boolean absent(Object v) {
        if (v == null) return true;
        if (v instanceof String s) return s.isBlank();
        return false;
    }
}
