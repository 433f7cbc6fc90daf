package io.github.eutro.hlo2shlo.test;

import io.github.eutro.hlo2shlo.core.attrs.*;
import io.github.eutro.hlo2shlo.core.ir.Dialect;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ir.Value;
import io.github.eutro.hlo2shlo.core.legalize.DispatchTable;
import io.github.eutro.hlo2shlo.core.legalize.FeatureClassifier;
import io.github.eutro.hlo2shlo.core.legalize.FeatureTier;
import io.github.eutro.hlo2shlo.core.ops.HloOps;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Map;

import static io.github.eutro.hlo2shlo.core.attrs.MhloEnums.Precision.*;
import static io.github.eutro.hlo2shlo.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class FeatureClassifierTest {
    private final FeatureClassifier classifier = FeatureClassifier.create(DispatchTable.load());

    private static final ConvDimensionNumbersAttr NHWC = new ConvDimensionNumbersAttr(Dialect.MHLO,
            0, 3, new long[]{1, 2},
            2, 3, new long[]{0, 1},
            0, 3, new long[]{1, 2});
    // input dimension 2 is not claimed
    private static final ConvDimensionNumbersAttr UNKNOWN_DIM = new ConvDimensionNumbersAttr(Dialect.MHLO,
            0, 3, new long[]{1},
            1, 2, new long[]{0},
            0, 2, new long[]{1});

    private Operation op(OpKey key, int numOperands, Map<String, Attribute> attrs) {
        Fixture f = new Fixture(F32, F32, F32);
        Value[] operands = new Value[numOperands];
        for (int i = 0; i < numOperands; i++) operands[i] = f.arg(i);
        return f.op(key, Collections.singletonList(F32), attrs, 0, operands);
    }

    private FeatureTier classify(OpKey key, int numOperands, Object... attrs) {
        return classifier.classify(op(key, numOperands, attrs(attrs)));
    }

    @Test
    void privateOps() {
        for (OpKey key : HloOps.PRIVATE_OPS) {
            assertEquals(FeatureTier.PRIVATE, classify(key, 1), key.getName());
        }
    }

    @Test
    void convolutionWithUnknownDimensionsIsPrivate() {
        assertTrue(UNKNOWN_DIM.toString().contains("?"), UNKNOWN_DIM.toString());
        assertEquals(FeatureTier.PRIVATE, classify(HloOps.CONVOLUTION, 2, "dimension_numbers", UNKNOWN_DIM));
        assertEquals(FeatureTier.FULLY_SUPPORTED, classify(HloOps.CONVOLUTION, 2, "dimension_numbers", NHWC));
    }

    @Test
    void convolutionWithHugeDimensionsIsPrivate() {
        ConvDimensionNumbersAttr huge = new ConvDimensionNumbersAttr(Dialect.MHLO,
                0, Long.MAX_VALUE, new long[]{1},
                2, 3, new long[]{0, 1},
                0, (long) Integer.MAX_VALUE + 1, new long[]{1});
        assertEquals(FeatureTier.PRIVATE, classify(HloOps.CONVOLUTION, 2, "dimension_numbers", huge));
    }

    @Test
    void privateWinsOverExperimental() {
        assertEquals(FeatureTier.PRIVATE, classify(HloOps.CONVOLUTION, 2,
                "dimension_numbers", UNKNOWN_DIM,
                "precision_config", MhloEnums.precisionConfig(PACKED_NIBBLE, DEFAULT)));
    }

    @Test
    void privateWinsOverPublic() {
        assertEquals(FeatureTier.PRIVATE, classify(HloOps.CUSTOM_CALL, 1,
                "api_version", MhloEnums.CustomCallApiVersion.API_VERSION_TYPED_FFI.attr(),
                "custom_call_schedule", MhloEnums.CUSTOM_CALL_SCHEDULE.attr(MhloEnums.CustomCallSchedule.LATEST)));
    }

    @Test
    void packedNibbleIsExperimental() {
        for (OpKey key : new OpKey[]{HloOps.CONVOLUTION, HloOps.DOT, HloOps.DOT_GENERAL}) {
            assertEquals(FeatureTier.EXPERIMENTAL, classify(key, 2,
                    "precision_config", MhloEnums.precisionConfig(DEFAULT, PACKED_NIBBLE)), key.getName());
            assertEquals(FeatureTier.FULLY_SUPPORTED, classify(key, 2,
                    "precision_config", MhloEnums.precisionConfig(HIGH, HIGHEST)), key.getName());
        }
    }

    @Test
    void tupleCollectivesAreExperimental() {
        assertEquals(FeatureTier.FULLY_SUPPORTED, classify(HloOps.ALL_REDUCE, 1));
        assertEquals(FeatureTier.EXPERIMENTAL, classify(HloOps.ALL_REDUCE, 2));
        assertEquals(FeatureTier.FULLY_SUPPORTED, classify(HloOps.ALL_TO_ALL, 1));
        assertEquals(FeatureTier.EXPERIMENTAL, classify(HloOps.ALL_TO_ALL, 3));
    }

    @Test
    void publicOps() {
        assertEquals(FeatureTier.publicSince(1), classify(HloOps.TAN, 1));
        assertEquals(FeatureTier.publicSince(1), classify(HloOps.TOPK, 1, "k", IntegerAttr.i64(2)));
        assertEquals(FeatureTier.publicSince(1), classify(HloOps.CUSTOM_CALL, 1,
                "api_version", MhloEnums.CustomCallApiVersion.API_VERSION_TYPED_FFI.attr()));
        assertEquals(1, classify(HloOps.TAN, 1).getVersion());
    }

    @Test
    void customCalls() {
        assertEquals(FeatureTier.FULLY_SUPPORTED, classify(HloOps.CUSTOM_CALL, 1,
                "api_version", MhloEnums.CustomCallApiVersion.API_VERSION_ORIGINAL.attr()));
        assertEquals(FeatureTier.FULLY_SUPPORTED, classify(HloOps.CUSTOM_CALL, 1,
                "custom_call_schedule", MhloEnums.CUSTOM_CALL_SCHEDULE.attr(MhloEnums.CustomCallSchedule.NONE)));
        assertEquals(FeatureTier.PRIVATE, classify(HloOps.CUSTOM_CALL, 1,
                "custom_call_schedule", MhloEnums.CUSTOM_CALL_SCHEDULE.attr(MhloEnums.CustomCallSchedule.EARLIEST)));
    }

    @Test
    void everythingElse() {
        assertEquals(FeatureTier.FULLY_SUPPORTED, classify(HloOps.ADD, 2));
        assertEquals(FeatureTier.FULLY_SUPPORTED, classify(HloOps.TRANSPOSE, 1));
        assertEquals(FeatureTier.UNSUPPORTED, classify(OpKey.of(Dialect.MHLO, "no_such_op"), 1));
    }

    @Test
    void customPredicates() {
        Map<OpKey, FeatureClassifier.FeaturePredicates> predicates = FeatureClassifier.defaultPredicates();
        predicates.put(HloOps.ADD, new FeatureClassifier.FeaturePredicates()
                .experimentalIf(op -> op.getAttr("fancy") != null)
                .publicIf(3, op -> op.getNumOperands() == 2));
        FeatureClassifier custom = new FeatureClassifier(DispatchTable.load(), predicates);
        assertEquals(FeatureTier.EXPERIMENTAL, custom.classify(op(HloOps.ADD, 2, attrs("fancy", UnitAttr.INSTANCE))));
        assertEquals(FeatureTier.publicSince(3), custom.classify(op(HloOps.ADD, 2, attrs())));
        assertEquals(FeatureTier.FULLY_SUPPORTED, custom.classify(op(HloOps.ADD, 1, attrs())));
        assertEquals("PUBLIC(3)", FeatureTier.publicSince(3).toString());
        assertThrows(IllegalStateException.class, FeatureTier.FULLY_SUPPORTED::getVersion);
    }
}
