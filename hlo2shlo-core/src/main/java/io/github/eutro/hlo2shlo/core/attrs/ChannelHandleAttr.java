package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

public final class ChannelHandleAttr extends DialectAttribute {
    public final long handle;
    public final long type;

    public ChannelHandleAttr(Dialect dialect, long handle, long type) {
        super(dialect);
        this.handle = handle;
        this.type = type;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ChannelHandleAttr)) return false;
        ChannelHandleAttr that = (ChannelHandleAttr) o;
        return dialect == that.dialect && handle == that.handle && type == that.type;
    }

    @Override
    public int hashCode() {
        return (dialect.hashCode() * 31 + Long.hashCode(handle)) * 31 + Long.hashCode(type);
    }

    @Override
    public String toString() {
        return "#" + dialect + ".channel_handle<handle = " + handle + ", type = " + type + ">";
    }
}
