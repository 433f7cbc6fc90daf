package io.github.eutro.hlo2shlo.core.types;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The bundle threaded through MHLO's async start/update/done ops.
 * It is internal to XLA, and has no StableHLO equivalent.
 */
public final class AsyncBundleType extends Type {
    public final List<Type> types;

    public AsyncBundleType(Type... types) {
        this.types = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(types)));
    }

    @Override
    public Dialect getDialect() {
        return Dialect.MHLO;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AsyncBundleType && ((AsyncBundleType) o).types.equals(types);
    }

    @Override
    public int hashCode() {
        return types.hashCode();
    }

    @Override
    public String toString() {
        return types.stream()
                .map(Object::toString)
                .collect(Collectors.joining(", ", "!mhlo.async_bundle<", ">"));
    }
}
