package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;
import org.jetbrains.annotations.Nullable;

/**
 * A kind of enumerated attribute in some dialect, such as {@code #mhlo<precision ...>}.
 * <p>
 * Enum kinds with the same {@link #name} in different dialects are considered to be
 * the same kind, and their symbols correspond by name.
 *
 * @param <E> The Java enum holding the symbols of this kind.
 */
public final class EnumKind<E extends Enum<E>> {
    public final Dialect dialect;
    public final String name;
    public final Class<E> symbols;

    EnumKind(Dialect dialect, String name, Class<E> symbols) {
        this.dialect = dialect;
        this.name = name;
        this.symbols = symbols;
    }

    /**
     * Parse a symbol of this enum kind.
     *
     * @param symbol The symbol name.
     * @return The symbol, or null if this kind has no such symbol.
     */
    public @Nullable E symbolize(String symbol) {
        for (E e : symbols.getEnumConstants()) {
            if (e.name().equals(symbol)) return e;
        }
        return null;
    }

    /**
     * Create an attribute of this kind.
     *
     * @param value The symbol.
     * @return The attribute.
     */
    public EnumAttr<E> attr(E value) {
        return new EnumAttr<>(this, value);
    }

    @Override
    public String toString() {
        return dialect + "<" + name + ">";
    }
}
