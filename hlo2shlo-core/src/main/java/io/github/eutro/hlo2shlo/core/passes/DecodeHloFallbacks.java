package io.github.eutro.hlo2shlo.core.passes;

import io.github.eutro.hlo2shlo.core.conversion.ConversionPattern;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.conversion.StablehloToHloTypeConverter;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ir.Program;
import io.github.eutro.hlo2shlo.core.legalize.AttributeConverter;
import io.github.eutro.hlo2shlo.core.legalize.FallbackDecoder;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.ops.StablehloOps;

import java.util.Collections;

/**
 * A pass which decodes every custom call that encodes an MHLO operation, leaving everything else alone.
 */
public class DecodeHloFallbacks implements IRPass<Program, LegalizationResult> {
    public static final DecodeHloFallbacks INSTANCE = new DecodeHloFallbacks();

    @Override
    public LegalizationResult run(Program program) {
        FallbackDecoder decoder = new FallbackDecoder(
                StablehloToHloTypeConverter.INSTANCE,
                AttributeConverter.STABLEHLO_TO_HLO);
        ConversionPattern pattern = new ConversionPattern() {
            @Override
            public OpKey getRootKey() {
                return StablehloOps.CUSTOM_CALL;
            }

            @Override
            public boolean matchAndRewrite(Operation op, ConversionRewriter rewriter) {
                return FallbackDecoder.isEncoded(op) && decoder.decode(op, rewriter);
            }
        };
        ConversionDriver driver = new ConversionDriver(
                Collections.singletonList(pattern),
                FallbackDecoder::isEncoded,
                ConversionDriver.Mode.PARTIAL,
                null);
        return driver.run(program);
    }
}
