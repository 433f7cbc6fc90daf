package io.github.eutro.hlo2shlo.core.attrs;

public final class BoolAttr extends BuiltinAttribute {
    public static final BoolAttr TRUE = new BoolAttr(true);
    public static final BoolAttr FALSE = new BoolAttr(false);

    public final boolean value;

    private BoolAttr(boolean value) {
        this.value = value;
    }

    public static BoolAttr of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BoolAttr && ((BoolAttr) o).value == value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
