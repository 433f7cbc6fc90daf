package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.types.TensorType;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A tensor-typed constant of integers, e.g. {@code dense<[1, 0]> : tensor<2xi64>}.
 */
public final class DenseIntElementsAttr extends BuiltinAttribute {
    public final TensorType type;
    private final long[] values;

    public DenseIntElementsAttr(TensorType type, long... values) {
        this.type = type;
        this.values = values.clone();
    }

    public long[] getValues() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DenseIntElementsAttr)) return false;
        DenseIntElementsAttr that = (DenseIntElementsAttr) o;
        return type.equals(that.type) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.stream(values)
                .mapToObj(Long::toString)
                .collect(Collectors.joining(", ", "dense<[", "]> : " + type));
    }
}
