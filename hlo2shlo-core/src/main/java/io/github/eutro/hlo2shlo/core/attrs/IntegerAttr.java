package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.types.ScalarType;

public final class IntegerAttr extends BuiltinAttribute {
    public final long value;
    public final ScalarType type;

    public IntegerAttr(long value, ScalarType type) {
        this.value = value;
        this.type = type;
    }

    public static IntegerAttr i64(long value) {
        return new IntegerAttr(value, ScalarType.I64);
    }

    public static IntegerAttr i32(int value) {
        return new IntegerAttr(value, ScalarType.I32);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof IntegerAttr)) return false;
        IntegerAttr that = (IntegerAttr) o;
        return value == that.value && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(value) + type.hashCode();
    }

    @Override
    public String toString() {
        return value + " : " + type;
    }
}
