package io.github.eutro.hlo2shlo.core.passes;

import io.github.eutro.hlo2shlo.core.ir.Program;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * Legalize a program to StableHLO, throwing if any MHLO operation is left.
     */
    public static final IRPass<Program, Program> LEGALIZE_TO_STABLEHLO =
            HloLegalizeToStablehlo.INSTANCE
                    .then(RequireSuccess.INSTANCE);

    /**
     * Legalize a program to StableHLO, then decode the custom calls that encode MHLO operations again.
     */
    public static final IRPass<Program, Program> ROUND_TRIP =
            LEGALIZE_TO_STABLEHLO
                    .then(DecodeHloFallbacks.INSTANCE)
                    .then(RequireSuccess.INSTANCE);
}
