package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.attrs.*;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.conversion.TypeConverter;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ir.Procedure;
import io.github.eutro.hlo2shlo.core.ops.StablehloOps;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Encodes MHLO operations with features that are not in StableHLO as {@code stablehlo.custom_call}s,
 * so that they can be decoded again by {@link FallbackDecoder}.
 * <p>
 * For example,
 * <pre>{@code
 * %0 = "mhlo.dot"(%a, %b) {precision_config = [#mhlo<precision PACKED_NIBBLE>]} : ...
 * }</pre>
 * becomes
 * <pre>{@code
 * %0 = "stablehlo.custom_call"(%a, %b) {
 *   call_target_name = "mhlo.dot",
 *   mhlo.attributes = {precision_config = ["PACKED_NIBBLE"]}
 * } : ...
 * }</pre>
 * The {@code called_computations} attribute names the procedure the region of the operation was
 * {@link RegionExtractor extracted} to, if it had one, and {@code mhlo.version} is the version of
 * the feature, if it is public.
 */
public final class FallbackEncoder {
    private static final Logger log = LoggerFactory.getLogger(FallbackEncoder.class);

    private final TypeConverter typeConverter;
    private final AttributeConverter attributeConverter;
    private final RegionExtractor regionExtractor;

    public FallbackEncoder(TypeConverter typeConverter,
                           AttributeConverter attributeConverter,
                           RegionExtractor regionExtractor) {
        this.typeConverter = typeConverter;
        this.attributeConverter = attributeConverter;
        this.regionExtractor = regionExtractor;
    }

    /**
     * Replace an operation with its custom call encoding.
     * <p>
     * Everything that can fail is checked before the region is extracted,
     * so the symbol table is only touched if the encoding succeeds.
     *
     * @param op       The operation.
     * @param tier     The tier of the operation.
     * @param rewriter The rewriter.
     * @return Whether the operation was encoded.
     */
    public boolean encode(Operation op, FeatureTier tier, ConversionRewriter rewriter) {
        if (op.getNumRegions() > 1) {
            // TODO encode each region as a procedure, in order, once custom calls define how to refer to several
            return rewriter.notifyMatchFailure(op, "custom call encoding of operations with more than one region is not supported");
        }

        List<Type> resultTypes = typeConverter.convertTypes(op.getResultTypes());
        if (resultTypes == null) {
            return rewriter.notifyMatchFailure(op, "failed to convert result types");
        }

        Map<String, Attribute> encodedAttrs = new TreeMap<>();
        for (Map.Entry<String, Attribute> entry : op.getAttributes().entrySet()) {
            String name = entry.getKey();
            if (HloAttrNames.isNoOpSchedule(op.getKey(), name, entry.getValue())) continue;
            Attribute converted = name.equals(HloAttrNames.PRECISION_CONFIG)
                    ? encodePrecisionConfig(entry.getValue())
                    : attributeConverter.convert(entry.getValue());
            if (converted == null) {
                return rewriter.notifyMatchFailure(op, "failed to convert attribute " + name);
            }
            encodedAttrs.put(name, converted);
        }

        Procedure called = null;
        if (op.getNumRegions() == 1) {
            called = regionExtractor.extract(op, rewriter);
            if (called == null) return false;
        }

        Map<String, Attribute> callAttrs = new TreeMap<>();
        callAttrs.put(HloAttrNames.CALL_TARGET_NAME, new StringAttr(op.getName()));
        callAttrs.put(HloAttrNames.ATTRIBUTES, new DictionaryAttr(encodedAttrs));
        if (called != null) {
            callAttrs.put(HloAttrNames.CALLED_COMPUTATIONS, ArrayAttr.of(new SymbolRefAttr(called.getName())));
        }
        if (tier.isPublic()) {
            callAttrs.put(HloAttrNames.VERSION, IntegerAttr.i64(tier.getVersion()));
        }

        Operation customCall = rewriter.create(op,
                StablehloOps.CUSTOM_CALL,
                resultTypes,
                op.getOperands(),
                callAttrs,
                0);
        rewriter.replaceOp(op, customCall);
        log.debug("Encoded {} ({}) as a custom call", op.getName(), tier);
        return true;
    }

    /**
     * Encode a precision config as an array of the names of its precisions.
     * <p>
     * StableHLO has no {@code PACKED_NIBBLE} precision, so the enums cannot be converted directly.
     *
     * @param attr The precision config.
     * @return The encoded config, or null if the attribute is not an array of MHLO precisions.
     */
    public static @Nullable Attribute encodePrecisionConfig(Attribute attr) {
        if (!(attr instanceof ArrayAttr)) return null;
        List<Attribute> names = new ArrayList<>();
        for (Attribute element : (ArrayAttr) attr) {
            MhloEnums.Precision precision = EnumAttr.valueOf(element, MhloEnums.PRECISION);
            if (precision == null) return null;
            names.add(new StringAttr(precision.name()));
        }
        return new ArrayAttr(names);
    }
}
