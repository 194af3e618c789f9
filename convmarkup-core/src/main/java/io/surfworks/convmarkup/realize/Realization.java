package io.surfworks.convmarkup.realize;

import java.util.Optional;

/**
 * Successful outcome of realizing a block.
 *
 * A realization may carry no value, which means the block was handled but
 * has no runtime counterpart (Input, Assert). This is different from a
 * realizer declining the block.
 *
 * @param <T> type of the external representation
 */
public final class Realization<T> {

    private static final Realization<?> NONE = new Realization<>(null);

    private final T value;

    private Realization(T value) {
        this.value = value;
    }

    public static <T> Realization<T> of(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Use Realization.none() for blocks without a value");
        }
        return new Realization<>(value);
    }

    @SuppressWarnings("unchecked")
    public static <T> Realization<T> none() {
        return (Realization<T>) NONE;
    }

    public boolean isEmpty() {
        return value == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return isEmpty() ? "Realization.none" : "Realization[" + value + "]";
    }
}
