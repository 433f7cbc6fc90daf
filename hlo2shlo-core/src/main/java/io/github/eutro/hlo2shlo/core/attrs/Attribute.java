package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

/**
 * A piece of named, typed metadata attached to an
 * {@link io.github.eutro.hlo2shlo.core.ir.Operation operation}.
 * <p>
 * Attributes form a closed set of immutable value classes, all of which compare structurally.
 * Builtin attributes (strings, integers, arrays, ...) are shared by all dialects,
 * the rest belong to exactly one of {@link Dialect#MHLO} or {@link Dialect#STABLEHLO}.
 */
public abstract class Attribute {
    /**
     * Get the dialect this attribute is defined in.
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
