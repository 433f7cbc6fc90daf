package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.attrs.*;
import io.github.eutro.hlo2shlo.core.ir.Dialect;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.ops.StablehloOps;
import io.github.eutro.hlo2shlo.core.util.F;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Converts attributes between the two HLO dialects.
 * <p>
 * Structured records are rebuilt field by field, and enums are converted by name,
 * failing if the target dialect has no symbol of that name. Arrays are converted
 * element-wise, and fail if any element does. Attributes from other dialects, dictionaries
 * included, are passed through unchanged. Attributes from the source dialect which have no
 * counterpart in the target dialect fail to convert.
 */
public final class AttributeConverter {
    private static final Logger log = LoggerFactory.getLogger(AttributeConverter.class);

    public static final AttributeConverter HLO_TO_STABLEHLO = new AttributeConverter(
            Dialect.MHLO,
            Dialect.STABLEHLO,
            MhloEnums.ALL,
            StablehloEnums.ALL,
            Arrays.asList(
                    StablehloOps.BROADCAST,
                    StablehloOps.DYNAMIC_SLICE,
                    StablehloOps.FFT,
                    StablehloOps.PAD,
                    StablehloOps.REVERSE,
                    StablehloOps.SLICE,
                    StablehloOps.TRANSPOSE
            ));

    public static final AttributeConverter STABLEHLO_TO_HLO = new AttributeConverter(
            Dialect.STABLEHLO,
            Dialect.MHLO,
            StablehloEnums.ALL,
            MhloEnums.ALL,
            Collections.emptyList());

    private final Dialect source;
    private final Dialect target;
    private final Map<Class<? extends Attribute>, F<Attribute, Attribute>> records = new HashMap<>();
    private final Map<EnumKind<?>, EnumKind<?>> enumKinds = new IdentityHashMap<>();
    private final Set<OpKey> denseArrayOps;

    private AttributeConverter(Dialect source,
                               Dialect target,
                               List<EnumKind<?>> sourceEnums,
                               List<EnumKind<?>> targetEnums,
                               List<OpKey> denseArrayOps) {
        this.source = source;
        this.target = target;
        this.denseArrayOps = Collections.unmodifiableSet(new HashSet<>(denseArrayOps));

        for (EnumKind<?> sourceKind : sourceEnums) {
            for (EnumKind<?> targetKind : targetEnums) {
                if (sourceKind.name.equals(targetKind.name)) {
                    enumKinds.put(sourceKind, targetKind);
                }
            }
        }

        record(ChannelHandleAttr.class, a -> new ChannelHandleAttr(target, a.handle, a.type));
        record(ConvDimensionNumbersAttr.class, a -> new ConvDimensionNumbersAttr(
                target,
                a.inputBatchDimension,
                a.inputFeatureDimension,
                a.getInputSpatialDimensions(),
                a.kernelInputFeatureDimension,
                a.kernelOutputFeatureDimension,
                a.getKernelSpatialDimensions(),
                a.outputBatchDimension,
                a.outputFeatureDimension,
                a.getOutputSpatialDimensions()));
        record(DotDimensionNumbersAttr.class, a -> new DotDimensionNumbersAttr(
                target,
                a.getLhsBatchingDimensions(),
                a.getRhsBatchingDimensions(),
                a.getLhsContractingDimensions(),
                a.getRhsContractingDimensions()));
        record(GatherDimensionNumbersAttr.class, a -> new GatherDimensionNumbersAttr(
                target,
                a.getOffsetDims(),
                a.getCollapsedSliceDims(),
                a.getStartIndexMap(),
                a.indexVectorDim));
        record(ScatterDimensionNumbersAttr.class, a -> new ScatterDimensionNumbersAttr(
                target,
                a.getUpdateWindowDims(),
                a.getInsertedWindowDims(),
                a.getScatterDimsToOperandDims(),
                a.indexVectorDim));
        record(OutputOperandAliasAttr.class, a -> new OutputOperandAliasAttr(
                target,
                a.getOutputTupleIndices(),
                a.operandIndex,
                a.getOperandTupleIndices()));
    }

    private <T extends Attribute> void record(Class<T> clazz, F<T, Attribute> rebuild) {
        records.put(clazz, attr -> rebuild.apply(clazz.cast(attr)));
    }

    /**
     * Convert an attribute to the target dialect.
     *
     * @param attr The attribute.
     * @return The converted attribute, or null if it has no counterpart in the target dialect.
     */
    public @Nullable Attribute convert(Attribute attr) {
        if (attr instanceof ArrayAttr) {
            List<Attribute> elements = new ArrayList<>(((ArrayAttr) attr).size());
            for (Attribute element : (ArrayAttr) attr) {
                Attribute converted = convert(element);
                if (converted == null) return null;
                elements.add(converted);
            }
            return new ArrayAttr(elements);
        }
        if (attr.getDialect() != source) {
            return attr;
        }
        if (attr instanceof EnumAttr) {
            EnumAttr<?> enumAttr = (EnumAttr<?>) attr;
            EnumKind<?> targetKind = enumKinds.get(enumAttr.kind);
            if (targetKind == null) {
                log.debug("No {} counterpart for enum kind {}", target, enumAttr.kind);
                return null;
            }
            Attribute converted = symbolize(targetKind, enumAttr.value.name());
            if (converted == null) {
                log.debug("No {} counterpart for {}", target, attr);
            }
            return converted;
        }
        F<Attribute, Attribute> rebuild = records.get(attr.getClass());
        if (rebuild == null) {
            log.debug("No {} counterpart for {}", target, attr);
            return null;
        }
        return rebuild.apply(attr);
    }

    private static <E extends Enum<E>> @Nullable Attribute symbolize(EnumKind<E> kind, String symbol) {
        E value = kind.symbolize(symbol);
        return value == null ? null : kind.attr(value);
    }

    /**
     * Convert an attribute that needs a different representation on some kinds of operation.
     * <p>
     * The target dialect represents the dimension lists of some operations, such as
     * {@code stablehlo.transpose}, as {@link DenseI64ArrayAttr}s, where the source
     * dialect uses {@link DenseIntElementsAttr}s.
     *
     * @param targetKey The kind of operation the attribute will be on.
     * @param attr      The attribute.
     * @return The converted attribute, or null if the attribute needs no special handling on that kind of operation.
     */
    public @Nullable Attribute convertDenseArray(OpKey targetKey, Attribute attr) {
        if (!denseArrayOps.contains(targetKey)) return null;
        if (attr instanceof DenseIntElementsAttr) {
            return new DenseI64ArrayAttr(((DenseIntElementsAttr) attr).getValues());
        }
        return null;
    }
}
