package io.github.eutro.hlo2shlo.core.conversion;

import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ops.OpKey;

/**
 * A rule that converts one kind of operation.
 */
public interface ConversionPattern {
    /**
     * Get the kind of operation this pattern converts.
     *
     * @return The op key.
     */
    OpKey getRootKey();

    /**
     * Try to convert an operation.
     * <p>
     * All changes must be made through the rewriter. If this returns false,
     * the driver rolls back whatever the pattern changed.
     *
     * @param op       The operation, whose key is {@link #getRootKey()}.
     * @param rewriter The rewriter.
     * @return Whether the operation was converted.
     */
    boolean matchAndRewrite(Operation op, ConversionRewriter rewriter);
}
