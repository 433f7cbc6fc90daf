package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.attrs.*;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ops.HloOps;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.util.F;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Classifies MHLO operations into {@link FeatureTier tiers} of StableHLO support.
 * <p>
 * Each kind of operation has at most one set of {@link FeaturePredicates}. The tiers are tried
 * in order: private, then experimental, then public. An operation that matches none of them is
 * fully supported if it has a StableHLO counterpart in the {@link DispatchTable}, and unsupported otherwise.
 */
public final class FeatureClassifier {
    private final DispatchTable dispatchTable;
    private final Map<OpKey, FeaturePredicates> predicates;

    public FeatureClassifier(DispatchTable dispatchTable, Map<OpKey, FeaturePredicates> predicates) {
        this.dispatchTable = dispatchTable;
        this.predicates = Collections.unmodifiableMap(new HashMap<>(predicates));
    }

    /**
     * Create a classifier with the {@link #defaultPredicates() default predicates}.
     *
     * @param dispatchTable The dispatch table.
     * @return The classifier.
     */
    public static FeatureClassifier create(DispatchTable dispatchTable) {
        return new FeatureClassifier(dispatchTable, defaultPredicates());
    }

    /**
     * The features of an operation kind that are not in StableHLO.
     */
    public static final class FeaturePredicates {
        private Predicate<Operation> isPrivate = op -> false;
        private Predicate<Operation> isExperimental = op -> false;
        private F<Operation, Long> publicVersion = op -> null;

        /**
         * Mark operations matching a predicate as private.
         *
         * @param predicate The predicate.
         * @return This.
         */
        public FeaturePredicates privateIf(Predicate<Operation> predicate) {
            isPrivate = isPrivate.or(predicate);
            return this;
        }

        public FeaturePredicates alwaysPrivate() {
            return privateIf(op -> true);
        }

        /**
         * Mark operations matching a predicate as experimental.
         *
         * @param predicate The predicate.
         * @return This.
         */
        public FeaturePredicates experimentalIf(Predicate<Operation> predicate) {
            isExperimental = isExperimental.or(predicate);
            return this;
        }

        /**
         * Mark operations matching a predicate as public, introduced in some version.
         *
         * @param version   The version.
         * @param predicate The predicate.
         * @return This.
         */
        public FeaturePredicates publicIf(long version, Predicate<Operation> predicate) {
            F<Operation, Long> previous = publicVersion;
            publicVersion = op -> {
                Long v = previous.apply(op);
                if (v != null) return v;
                return predicate.test(op) ? version : null;
            };
            return this;
        }

        public FeaturePredicates alwaysPublic(long version) {
            return publicIf(version, op -> true);
        }
    }

    /**
     * Get the default predicates for MHLO.
     *
     * @return A fresh, mutable map of the predicates.
     */
    public static Map<OpKey, FeaturePredicates> defaultPredicates() {
        Map<OpKey, FeaturePredicates> table = new HashMap<>();
        for (OpKey key : HloOps.PRIVATE_OPS) {
            table.put(key, new FeaturePredicates().alwaysPrivate());
        }
        table.put(HloOps.ALL_REDUCE, new FeaturePredicates()
                .experimentalIf(FeatureClassifier::usesTupleOperands));
        table.put(HloOps.ALL_TO_ALL, new FeaturePredicates()
                .experimentalIf(FeatureClassifier::usesTupleOperands));
        table.put(HloOps.CONVOLUTION, new FeaturePredicates()
                .privateIf(FeatureClassifier::hasUnknownDimensions)
                .experimentalIf(FeatureClassifier::hasPackedNibble));
        table.put(HloOps.CUSTOM_CALL, new FeaturePredicates()
                .privateIf(FeatureClassifier::hasSchedule)
                .publicIf(1, FeatureClassifier::usesTypedFfi));
        table.put(HloOps.DOT, new FeaturePredicates()
                .experimentalIf(FeatureClassifier::hasPackedNibble));
        table.put(HloOps.DOT_GENERAL, new FeaturePredicates()
                .experimentalIf(FeatureClassifier::hasPackedNibble));
        table.put(HloOps.TAN, new FeaturePredicates().alwaysPublic(1));
        table.put(HloOps.TOPK, new FeaturePredicates().alwaysPublic(1));
        return table;
    }

    /**
     * Classify an operation.
     *
     * @param op The operation.
     * @return Its tier.
     */
    public FeatureTier classify(Operation op) {
        FeaturePredicates features = predicates.get(op.getKey());
        if (features != null) {
            if (features.isPrivate.test(op)) return FeatureTier.PRIVATE;
            if (features.isExperimental.test(op)) return FeatureTier.EXPERIMENTAL;
            Long version = features.publicVersion.apply(op);
            if (version != null) return FeatureTier.publicSince(version);
        }
        return dispatchTable.lookup(op.getKey()) != null
                ? FeatureTier.FULLY_SUPPORTED
                : FeatureTier.UNSUPPORTED;
    }

    // all_reduce and all_to_all with several operands
    private static boolean usesTupleOperands(Operation op) {
        return op.getNumOperands() != 1;
    }

    private static boolean hasUnknownDimensions(Operation op) {
        Attribute dimensionNumbers = op.getAttr(HloAttrNames.DIMENSION_NUMBERS);
        return dimensionNumbers != null && dimensionNumbers.toString().contains("?");
    }

    private static boolean hasPackedNibble(Operation op) {
        Attribute config = op.getAttr(HloAttrNames.PRECISION_CONFIG);
        if (!(config instanceof ArrayAttr)) return false;
        for (Attribute precision : (ArrayAttr) config) {
            if (EnumAttr.valueOf(precision, MhloEnums.PRECISION) == MhloEnums.Precision.PACKED_NIBBLE) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasSchedule(Operation op) {
        MhloEnums.CustomCallSchedule schedule = EnumAttr.valueOf(
                op.getAttr(HloAttrNames.CUSTOM_CALL_SCHEDULE),
                MhloEnums.CUSTOM_CALL_SCHEDULE);
        return schedule != null && schedule != MhloEnums.CustomCallSchedule.NONE;
    }

    private static boolean usesTypedFfi(Operation op) {
        Attribute version = op.getAttr(HloAttrNames.API_VERSION);
        return version instanceof IntegerAttr
                && MhloEnums.CustomCallApiVersion.fromValue(((IntegerAttr) version).value)
                == MhloEnums.CustomCallApiVersion.API_VERSION_TYPED_FFI;
    }
}
