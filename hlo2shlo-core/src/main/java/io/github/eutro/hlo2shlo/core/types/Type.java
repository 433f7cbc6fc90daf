package io.github.eutro.hlo2shlo.core.types;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

/**
 * The type of a {@link io.github.eutro.hlo2shlo.core.ir.Value}.
 * <p>
 * Types are immutable values, and compare structurally.
 */
public abstract class Type {
    /**
     * Get the dialect this type is defined in.
     *
     * @return The dialect.
     */
    public abstract Dialect getDialect();

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
