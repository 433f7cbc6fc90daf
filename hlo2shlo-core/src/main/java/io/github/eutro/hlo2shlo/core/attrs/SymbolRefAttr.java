package io.github.eutro.hlo2shlo.core.attrs;

/**
 * A flat reference to a symbol in the program's symbol table, e.g. {@code @all_reduce}.
 */
public final class SymbolRefAttr extends BuiltinAttribute {
    public final String symbol;

    public SymbolRefAttr(String symbol) {
        this.symbol = symbol;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SymbolRefAttr && ((SymbolRefAttr) o).symbol.equals(symbol);
    }

    @Override
    public int hashCode() {
        return symbol.hashCode();
    }

    @Override
    public String toString() {
        return "@" + symbol;
    }
}
