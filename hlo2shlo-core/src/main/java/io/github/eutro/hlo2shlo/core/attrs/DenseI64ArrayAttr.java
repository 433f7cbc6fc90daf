package io.github.eutro.hlo2shlo.core.attrs;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A flat array of 64-bit integers, e.g. {@code array<i64: 1, 0>}.
 */
public final class DenseI64ArrayAttr extends BuiltinAttribute {
    private final long[] values;

    public DenseI64ArrayAttr(long... values) {
        this.values = values.clone();
    }

    public long[] getValues() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DenseI64ArrayAttr && Arrays.equals(((DenseI64ArrayAttr) o).values, values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        if (values.length == 0) return "array<i64>";
        return Arrays.stream(values)
                .mapToObj(Long::toString)
                .collect(Collectors.joining(", ", "array<i64: ", ">"));
    }
}
