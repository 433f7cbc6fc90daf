package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.conf.LegalizeOptions;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ops.HloOps;
import io.github.eutro.hlo2shlo.core.ops.OpKey;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Converts an MHLO operation that has no StableHLO counterpart at all. Such operations
 * can only be encoded as custom calls, if they have public or experimental features.
 */
public final class HloToStablehloCustomCallOpConverter extends AbstractHloConverter {
    /**
     * The operations this converter is registered for.
     */
    public static final List<OpKey> ROOT_KEYS = Collections.unmodifiableList(Arrays.asList(
            HloOps.TAN,
            HloOps.TOPK
    ));

    public HloToStablehloCustomCallOpConverter(OpKey rootKey,
                                               FeatureClassifier classifier,
                                               FallbackEncoder encoder,
                                               LegalizeOptions options) {
        super(rootKey, classifier, encoder, options);
    }

    @Override
    protected boolean rewriteSupported(Operation op, FeatureTier tier, ConversionRewriter rewriter) {
        return rewriter.notifyMatchFailure(op, "op has no StableHLO counterpart");
    }
}
