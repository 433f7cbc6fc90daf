package io.github.eutro.hlo2shlo.core.passes;

import io.github.eutro.hlo2shlo.core.conf.LegalizeOptions;
import io.github.eutro.hlo2shlo.core.conversion.ConversionPattern;
import io.github.eutro.hlo2shlo.core.conversion.HloToStablehloTypeConverter;
import io.github.eutro.hlo2shlo.core.conversion.TypeConverter;
import io.github.eutro.hlo2shlo.core.ir.Dialect;
import io.github.eutro.hlo2shlo.core.ir.Program;
import io.github.eutro.hlo2shlo.core.legalize.*;
import io.github.eutro.hlo2shlo.core.ops.OpKey;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which legalizes every MHLO operation in a program to StableHLO.
 * <p>
 * Procedure signatures are converted too.
 */
public class HloLegalizeToStablehlo implements IRPass<Program, LegalizationResult> {
    /**
     * Legalizes fully, with options read from the {@link LegalizeOptions#fromEnvironment() environment}.
     */
    public static final HloLegalizeToStablehlo INSTANCE =
            new HloLegalizeToStablehlo(LegalizeOptions.fromEnvironment(), ConversionDriver.Mode.FULL);

    private final LegalizeOptions options;
    private final ConversionDriver.Mode mode;

    public HloLegalizeToStablehlo(LegalizeOptions options, ConversionDriver.Mode mode) {
        this.options = options;
        this.mode = mode;
    }

    /**
     * Create the patterns for legalizing MHLO.
     * <p>
     * Every MHLO operation in the {@link DispatchTable} gets a {@link HloToStablehloOpConverter},
     * and the MHLO operations that have no StableHLO counterpart but may be encoded get a
     * {@link HloToStablehloCustomCallOpConverter}.
     *
     * @param typeConverter The type converter.
     * @param options       The options.
     * @return The patterns.
     */
    public static List<ConversionPattern> populatePatterns(TypeConverter typeConverter, LegalizeOptions options) {
        DispatchTable dispatchTable = DispatchTable.load();
        FeatureClassifier classifier = FeatureClassifier.create(dispatchTable);
        AttributeConverter attributeConverter = AttributeConverter.HLO_TO_STABLEHLO;
        FallbackEncoder encoder = new FallbackEncoder(typeConverter, attributeConverter, new RegionExtractor(typeConverter));
        DirectTranslator translator = new DirectTranslator(typeConverter, attributeConverter);

        List<ConversionPattern> patterns = new ArrayList<>();
        for (OpKey source : dispatchTable.sourceKeys()) {
            patterns.add(new HloToStablehloOpConverter(source,
                    dispatchTable.lookup(source),
                    classifier,
                    encoder,
                    translator,
                    options));
        }
        for (OpKey source : HloToStablehloCustomCallOpConverter.ROOT_KEYS) {
            patterns.add(new HloToStablehloCustomCallOpConverter(source, classifier, encoder, options));
        }
        return patterns;
    }

    @Override
    public LegalizationResult run(Program program) {
        TypeConverter typeConverter = HloToStablehloTypeConverter.INSTANCE;
        ConversionDriver driver = new ConversionDriver(
                populatePatterns(typeConverter, options),
                op -> op.getKey().dialect == Dialect.MHLO,
                mode,
                typeConverter);
        return driver.run(program);
    }
}
