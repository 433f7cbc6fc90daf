package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.conf.LegalizeOptions;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ops.OpKey;

/**
 * Converts an MHLO operation that has a StableHLO counterpart.
 * <p>
 * Most operations which end up here are fully supported, and are {@link DirectTranslator translated directly}.
 * Some have features that StableHLO lacks, and are handled by tier instead.
 */
public final class HloToStablehloOpConverter extends AbstractHloConverter {
    private final OpKey targetKey;
    private final DirectTranslator translator;

    public HloToStablehloOpConverter(OpKey rootKey,
                                     OpKey targetKey,
                                     FeatureClassifier classifier,
                                     FallbackEncoder encoder,
                                     DirectTranslator translator,
                                     LegalizeOptions options) {
        super(rootKey, classifier, encoder, options);
        this.targetKey = targetKey;
        this.translator = translator;
    }

    @Override
    protected boolean rewriteSupported(Operation op, FeatureTier tier, ConversionRewriter rewriter) {
        return translator.translate(op, targetKey, rewriter);
    }
}
