package io.github.eutro.hlo2shlo.core.attrs;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Base class for the structured records that exist, with identical fields, in both HLO dialects.
 */
public abstract class DialectAttribute extends Attribute {
    protected final Dialect dialect;

    protected DialectAttribute(Dialect dialect) {
        if (dialect != Dialect.MHLO && dialect != Dialect.STABLEHLO) {
            throw new IllegalArgumentException("not an HLO dialect: " + dialect);
        }
        this.dialect = dialect;
    }

    @Override
    public final Dialect getDialect() {
        return dialect;
    }

    static String dims(long[] dims) {
        return Arrays.stream(dims)
                .mapToObj(Long::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
