package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.attrs.Attribute;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.conversion.TypeConverter;
import io.github.eutro.hlo2shlo.core.ext.CommonExts;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.types.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Translates an MHLO operation to its StableHLO counterpart one-to-one.
 * <p>
 * Result types and attributes are converted, operands are kept, and each region is moved
 * into the matching region of the new operation, with its block argument types converted.
 */
public final class DirectTranslator {
    private static final Logger log = LoggerFactory.getLogger(DirectTranslator.class);

    private final TypeConverter typeConverter;
    private final AttributeConverter attributeConverter;

    public DirectTranslator(TypeConverter typeConverter, AttributeConverter attributeConverter) {
        this.typeConverter = typeConverter;
        this.attributeConverter = attributeConverter;
    }

    /**
     * Replace an operation with its StableHLO counterpart.
     *
     * @param op       The operation.
     * @param target   The kind of operation to replace it with.
     * @param rewriter The rewriter.
     * @return Whether the operation was translated.
     */
    public boolean translate(Operation op, OpKey target, ConversionRewriter rewriter) {
        List<Type> resultTypes = typeConverter.convertTypes(op.getResultTypes());
        if (resultTypes == null) {
            return rewriter.notifyMatchFailure(op, "failed to convert result types");
        }

        Map<String, Attribute> attrs = new TreeMap<>();
        for (Map.Entry<String, Attribute> entry : op.getAttributes().entrySet()) {
            String name = entry.getKey();
            if (HloAttrNames.isNoOpSchedule(op.getKey(), name, entry.getValue())) continue;
            Attribute converted = attributeConverter.convertDenseArray(target, entry.getValue());
            if (converted == null) {
                converted = attributeConverter.convert(entry.getValue());
            }
            if (converted == null) {
                return rewriter.notifyMatchFailure(op, "failed to convert attribute " + name);
            }
            attrs.put(name, converted);
        }

        // case has one region per branch, everything else a fixed number
        int numRegions = op.getNumRegions();
        if (Boolean.TRUE.equals(target.getNullable(CommonExts.VARIADIC_REGIONS))) {
            if (numRegions == 0) {
                return rewriter.notifyMatchFailure(op, target + " needs at least one region");
            }
        } else {
            Integer expected = target.getNullable(CommonExts.REGION_COUNT);
            int expectedRegions = expected == null ? 0 : expected;
            if (numRegions != expectedRegions) {
                return rewriter.notifyMatchFailure(op, "has " + numRegions + " region(s), but "
                        + target + " has " + expectedRegions);
            }
        }

        Operation translated = rewriter.create(op, target, resultTypes, op.getOperands(), attrs, numRegions);
        for (int i = 0; i < numRegions; i++) {
            rewriter.inlineRegionBefore(op.getRegion(i), translated.getRegion(i));
            if (!rewriter.convertRegionTypes(translated.getRegion(i), typeConverter)) {
                return rewriter.notifyMatchFailure(op, "failed to convert argument types of region " + i);
            }
        }
        rewriter.replaceOp(op, translated);
        log.debug("Translated {} to {}", op.getName(), target);
        return true;
    }
}
