package io.github.eutro.hlo2shlo.core.types;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.Arrays;

/**
 * A ranked tensor type. A dimension of {@link #DYNAMIC} has an unknown size.
 */
public final class TensorType extends Type {
    public static final long DYNAMIC = -1;

    private final long[] shape;
    public final Type elementType;

    public TensorType(Type elementType, long... shape) {
        this.elementType = elementType;
        this.shape = shape.clone();
    }

    public long[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    /**
     * Get a tensor type with the same shape, but a different element type.
     *
     * @param elementType The new element type.
     * @return The new tensor type.
     */
    public TensorType withElementType(Type elementType) {
        return new TensorType(elementType, shape);
    }

    @Override
    public Dialect getDialect() {
        return Dialect.BUILTIN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorType)) return false;
        TensorType that = (TensorType) o;
        return Arrays.equals(shape, that.shape) && elementType.equals(that.elementType);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + elementType.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("tensor<");
        for (long dim : shape) {
            sb.append(dim == DYNAMIC ? "?" : Long.toString(dim)).append('x');
        }
        return sb.append(elementType).append('>').toString();
    }
}
