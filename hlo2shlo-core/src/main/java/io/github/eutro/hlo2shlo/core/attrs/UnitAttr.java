package io.github.eutro.hlo2shlo.core.attrs;

/**
 * An attribute whose presence is its only meaning.
 */
public final class UnitAttr extends BuiltinAttribute {
    public static final UnitAttr INSTANCE = new UnitAttr();

    private UnitAttr() {
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UnitAttr;
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return "unit";
    }
}
