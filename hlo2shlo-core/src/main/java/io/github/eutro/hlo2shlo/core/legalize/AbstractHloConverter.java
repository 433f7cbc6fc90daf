package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.conf.LegalizeOptions;
import io.github.eutro.hlo2shlo.core.conversion.ConversionPattern;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for patterns converting one kind of MHLO operation, which route the
 * operation according to its {@link FeatureTier tier}.
 * <p>
 * Private operations are rejected. Experimental operations are rejected unless
 * {@link LegalizeOptions#allowExperimentalFeatures() allowed}, in which case they, like public
 * operations, are {@link FallbackEncoder encoded as custom calls}. What happens to the rest is up
 * to the subclass.
 */
public abstract class AbstractHloConverter implements ConversionPattern {
    private static final Logger log = LoggerFactory.getLogger(AbstractHloConverter.class);

    protected final OpKey rootKey;
    protected final FeatureClassifier classifier;
    protected final FallbackEncoder encoder;
    protected final LegalizeOptions options;

    protected AbstractHloConverter(OpKey rootKey,
                                   FeatureClassifier classifier,
                                   FallbackEncoder encoder,
                                   LegalizeOptions options) {
        this.rootKey = rootKey;
        this.classifier = classifier;
        this.encoder = encoder;
        this.options = options;
    }

    @Override
    public OpKey getRootKey() {
        return rootKey;
    }

    @Override
    public final boolean matchAndRewrite(Operation op, ConversionRewriter rewriter) {
        FeatureTier tier = classifier.classify(op);
        log.debug("Classified {} as {}", op.getName(), tier);
        switch (tier.getKind()) {
            case PRIVATE:
                return rewriter.notifyMatchFailure(op, "op has private features not in StableHLO");
            case EXPERIMENTAL:
                if (!options.allowExperimentalFeatures()) {
                    return rewriter.notifyMatchFailure(op, "op has experimental features not in StableHLO, "
                            + "and experimental features are not allowed");
                }
                return encoder.encode(op, tier, rewriter);
            case PUBLIC:
                return encoder.encode(op, tier, rewriter);
            default:
                return rewriteSupported(op, tier, rewriter);
        }
    }

    /**
     * Convert an operation that has no features missing from StableHLO.
     *
     * @param op       The operation.
     * @param tier     Its tier, {@link FeatureTier#FULLY_SUPPORTED} or {@link FeatureTier#UNSUPPORTED}.
     * @param rewriter The rewriter.
     * @return Whether the operation was converted.
     */
    protected abstract boolean rewriteSupported(Operation op, FeatureTier tier, ConversionRewriter rewriter);
}
