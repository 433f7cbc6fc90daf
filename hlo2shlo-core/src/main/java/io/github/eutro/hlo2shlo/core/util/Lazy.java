package io.github.eutro.hlo2shlo.core.util;

import java.util.function.Supplier;

/**
 * A lazily-initialized value, computed at most once.
 *
 * @param <T> The type of the value.
 */
public final class Lazy<T> implements Supplier<T> {
    private Supplier<T> thunk;
    private T value;

    private Lazy(Supplier<T> thunk) {
        this.thunk = thunk;
    }

    /**
     * Create a lazily-initialized value.
     *
     * @param thunk The function that produces the value.
     * @param <T>   The type of the value.
     * @return The lazily-initialized value.
     */
    public static <T> Lazy<T> lazy(Supplier<T> thunk) {
        return new Lazy<>(thunk);
    }

    /**
     * Get the value, initializing it on the first call.
     * <p>
     * If the thunk throws, it will be run again on the next call.
     *
     * @return The value.
     */
    @Override
    public synchronized T get() {
        if (thunk != null) {
            value = thunk.get();
            thunk = null;
        }
        return value;
    }
}
