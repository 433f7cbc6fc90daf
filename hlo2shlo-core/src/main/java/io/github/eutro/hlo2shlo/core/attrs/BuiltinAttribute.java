package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

abstract class BuiltinAttribute extends Attribute {
    @Override
    public final Dialect getDialect() {
        return Dialect.BUILTIN;
    }
}
