package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.attrs.*;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.conversion.TypeConverter;
import io.github.eutro.hlo2shlo.core.ir.Dialect;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ir.Procedure;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.ops.StablehloOps;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decodes custom calls produced by {@link FallbackEncoder} back into the MHLO operations they encode.
 * <p>
 * Only the encoded operation itself is decoded. If it had a region, the region is moved back out of
 * its procedure as is, and the procedure is erased.
 */
public final class FallbackDecoder {
    private static final Logger log = LoggerFactory.getLogger(FallbackDecoder.class);

    private static final String HLO_PREFIX = Dialect.MHLO.namespace + ".";

    private final TypeConverter typeConverter;
    private final AttributeConverter attributeConverter;

    public FallbackDecoder(TypeConverter typeConverter, AttributeConverter attributeConverter) {
        this.typeConverter = typeConverter;
        this.attributeConverter = attributeConverter;
    }

    /**
     * Check whether an operation looks like an encoded MHLO operation.
     *
     * @param op The operation.
     * @return Whether it is a custom call with an MHLO target and encoded attributes.
     */
    public static boolean isEncoded(Operation op) {
        if (op.getKey() != StablehloOps.CUSTOM_CALL) return false;
        Attribute target = op.getAttr(HloAttrNames.CALL_TARGET_NAME);
        return target instanceof StringAttr
                && ((StringAttr) target).value.startsWith(HLO_PREFIX)
                && op.getAttr(HloAttrNames.ATTRIBUTES) instanceof DictionaryAttr;
    }

    /**
     * Replace an encoded custom call with the operation it encodes.
     *
     * @param op       The custom call.
     * @param rewriter The rewriter.
     * @return Whether the operation was decoded.
     */
    public boolean decode(Operation op, ConversionRewriter rewriter) {
        if (!isEncoded(op)) {
            return rewriter.notifyMatchFailure(op, "not an encoded MHLO operation");
        }
        OpKey key = OpKey.parse(((StringAttr) op.getAttr(HloAttrNames.CALL_TARGET_NAME)).value);

        List<Type> resultTypes = typeConverter.convertTypes(op.getResultTypes());
        if (resultTypes == null) {
            return rewriter.notifyMatchFailure(op, "failed to convert result types");
        }

        DictionaryAttr encoded = (DictionaryAttr) op.getAttr(HloAttrNames.ATTRIBUTES);
        Map<String, Attribute> attrs = new TreeMap<>();
        for (Map.Entry<String, Attribute> entry : encoded.entries.entrySet()) {
            String name = entry.getKey();
            Attribute decoded = name.equals(HloAttrNames.PRECISION_CONFIG)
                    ? decodePrecisionConfig(entry.getValue())
                    : attributeConverter.convert(entry.getValue());
            if (decoded == null) {
                return rewriter.notifyMatchFailure(op, "failed to convert attribute " + name);
            }
            attrs.put(name, decoded);
        }

        Procedure called = null;
        Attribute computations = op.getAttr(HloAttrNames.CALLED_COMPUTATIONS);
        if (computations != null) {
            if (!(computations instanceof ArrayAttr)
                    || ((ArrayAttr) computations).size() != 1
                    || !(((ArrayAttr) computations).get(0) instanceof SymbolRefAttr)) {
                return rewriter.notifyMatchFailure(op, "expected exactly one called computation");
            }
            String symbol = ((SymbolRefAttr) ((ArrayAttr) computations).get(0)).symbol;
            called = rewriter.getProgram().lookup(symbol);
            if (called == null) {
                return rewriter.notifyMatchFailure(op, "called computation @" + symbol + " does not exist");
            }
        }

        Operation decoded = rewriter.create(op, key, resultTypes, op.getOperands(), attrs, called == null ? 0 : 1);
        if (called != null) {
            rewriter.inlineRegionBefore(called.getBody(), decoded.getRegion(0));
            rewriter.eraseProcedure(called);
            if (!rewriter.convertRegionTypes(decoded.getRegion(0), typeConverter)) {
                return rewriter.notifyMatchFailure(op, "failed to convert region argument types");
            }
        }
        rewriter.replaceOp(op, decoded);
        log.debug("Decoded custom call to {}", key);
        return true;
    }

    /**
     * Decode a precision config encoded by {@link FallbackEncoder#encodePrecisionConfig(Attribute)}.
     *
     * @param attr The encoded config.
     * @return The array of MHLO precisions, or null if the attribute is not an array of precision names.
     */
    public static @Nullable Attribute decodePrecisionConfig(Attribute attr) {
        if (!(attr instanceof ArrayAttr)) return null;
        List<Attribute> precisions = new ArrayList<>();
        for (Attribute element : (ArrayAttr) attr) {
            if (!(element instanceof StringAttr)) return null;
            MhloEnums.Precision precision = MhloEnums.PRECISION.symbolize(((StringAttr) element).value);
            if (precision == null) return null;
            precisions.add(MhloEnums.precision(precision));
        }
        return new ArrayAttr(precisions);
    }
}
