package io.github.eutro.hlo2shlo.core.types;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

/**
 * A builtin scalar element type, such as {@code f32} or {@code i1}.
 */
public final class ScalarType extends Type {
    public static final ScalarType I1 = new ScalarType("i1");
    public static final ScalarType I8 = new ScalarType("i8");
    public static final ScalarType I32 = new ScalarType("i32");
    public static final ScalarType I64 = new ScalarType("i64");
    public static final ScalarType UI32 = new ScalarType("ui32");
    public static final ScalarType BF16 = new ScalarType("bf16");
    public static final ScalarType F16 = new ScalarType("f16");
    public static final ScalarType F32 = new ScalarType("f32");
    public static final ScalarType F64 = new ScalarType("f64");
    public static final ScalarType INDEX = new ScalarType("index");

    public final String name;

    public ScalarType(String name) {
        this.name = name;
    }

    @Override
    public Dialect getDialect() {
        return Dialect.BUILTIN;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ScalarType && ((ScalarType) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
