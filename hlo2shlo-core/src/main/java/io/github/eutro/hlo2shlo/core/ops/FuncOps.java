package io.github.eutro.hlo2shlo.core.ops;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import static io.github.eutro.hlo2shlo.core.ext.CommonExts.markTerminator;

/**
 * Operations of the {@code func} dialect, which both HLO dialects are embedded in.
 */
public class FuncOps {
    public static final OpKey RETURN = markTerminator(OpKey.of(Dialect.FUNC, "return"));
}
