package io.github.eutro.hlo2shlo.core.attrs;

public final class StringAttr extends BuiltinAttribute {
    public final String value;

    public StringAttr(String value) {
        this.value = value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringAttr && ((StringAttr) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
