package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.types.ScalarType;

public final class FloatAttr extends BuiltinAttribute {
    public final double value;
    public final ScalarType type;

    public FloatAttr(double value, ScalarType type) {
        this.value = value;
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FloatAttr)) return false;
        FloatAttr that = (FloatAttr) o;
        return Double.compare(value, that.value) == 0 && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(value) + type.hashCode();
    }

    @Override
    public String toString() {
        return value + " : " + type;
    }
}
