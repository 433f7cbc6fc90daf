package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;
import org.jetbrains.annotations.Nullable;

/**
 * An attribute holding one symbol of an {@link EnumKind}.
 *
 * @param <E> The Java enum of the symbol.
 */
public final class EnumAttr<E extends Enum<E>> extends Attribute {
    public final EnumKind<E> kind;
    public final E value;

    EnumAttr(EnumKind<E> kind, E value) {
        this.kind = kind;
        this.value = value;
    }

    /**
     * Get the value of this attribute, if it is of the given kind.
     *
     * @param attr The attribute, possibly null.
     * @param kind The kind.
     * @param <E>  The Java enum of the kind.
     * @return The value, or null if the attribute is null or of a different kind.
     */
    @SuppressWarnings("unchecked")
    public static <E extends Enum<E>> @Nullable E valueOf(@Nullable Attribute attr, EnumKind<E> kind) {
        if (attr instanceof EnumAttr && ((EnumAttr<?>) attr).kind == kind) {
            return ((EnumAttr<E>) attr).value;
        }
        return null;
    }

    @Override
    public Dialect getDialect() {
        return kind.dialect;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof EnumAttr)) return false;
        EnumAttr<?> that = (EnumAttr<?>) o;
        return kind == that.kind && value == that.value;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + value.hashCode();
    }

    @Override
    public String toString() {
        return "#" + kind.dialect + "<" + kind.name + " " + value.name() + ">";
    }
}
