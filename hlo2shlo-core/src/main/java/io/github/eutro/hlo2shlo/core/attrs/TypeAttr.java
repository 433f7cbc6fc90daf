package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.types.Type;

public final class TypeAttr extends BuiltinAttribute {
    public final Type type;

    public TypeAttr(Type type) {
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TypeAttr && ((TypeAttr) o).type.equals(type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return type.toString();
    }
}
