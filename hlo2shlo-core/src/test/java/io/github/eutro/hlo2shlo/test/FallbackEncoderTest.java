package io.github.eutro.hlo2shlo.test;

import io.github.eutro.hlo2shlo.core.attrs.*;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.conversion.HloToStablehloTypeConverter;
import io.github.eutro.hlo2shlo.core.ir.Dialect;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.ir.Procedure;
import io.github.eutro.hlo2shlo.core.legalize.*;
import io.github.eutro.hlo2shlo.core.ops.HloOps;
import io.github.eutro.hlo2shlo.core.ops.StablehloOps;
import io.github.eutro.hlo2shlo.core.types.AsyncBundleType;
import io.github.eutro.hlo2shlo.core.types.FunctionType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.hlo2shlo.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class FallbackEncoderTest {
    private final FallbackEncoder encoder = new FallbackEncoder(
            HloToStablehloTypeConverter.INSTANCE,
            AttributeConverter.HLO_TO_STABLEHLO,
            new RegionExtractor(HloToStablehloTypeConverter.INSTANCE));

    private static Operation onlyCustomCall(Fixture f) {
        Operation op = f.ops().get(0);
        assertSame(StablehloOps.CUSTOM_CALL, op.getKey());
        return op;
    }

    @Test
    void publicOpWithoutRegions() {
        Fixture f = new Fixture(F32);
        Operation tan = f.op(HloOps.TAN, F32, attrs(), f.arg(0));
        f.ret(tan.getResult(0));

        assertTrue(encoder.encode(tan, FeatureTier.publicSince(1), f.rewriter()));
        assertEquals(2, f.ops().size());
        Operation call = onlyCustomCall(f);
        assertEquals(new StringAttr("mhlo.tan"), call.getAttr(HloAttrNames.CALL_TARGET_NAME));
        assertEquals(IntegerAttr.i64(1), call.getAttr(HloAttrNames.VERSION));
        assertEquals(DictionaryAttr.EMPTY, call.getAttr(HloAttrNames.ATTRIBUTES));
        assertNull(call.getAttr(HloAttrNames.CALLED_COMPUTATIONS));
        assertEquals(Collections.singletonList(f.arg(0)), call.getOperands());
        assertSame(call.getResult(0), f.ops().get(1).getOperands().get(0));
        assertNull(tan.getBlock());
    }

    @Test
    void experimentalOpWithRegion() {
        Fixture f = new Fixture(F32, F32);
        Operation allReduce = f.op(HloOps.ALL_REDUCE, Arrays.asList(F32, F32),
                attrs("channel_handle", new ChannelHandleAttr(Dialect.MHLO, 1, 0)),
                1, f.arg(0), f.arg(1));
        addBody(allReduce.getRegion(0), F32);
        f.ret(allReduce.getResult(0), allReduce.getResult(1));

        assertTrue(encoder.encode(allReduce, FeatureTier.EXPERIMENTAL, f.rewriter()));
        Operation call = onlyCustomCall(f);
        assertEquals(new StringAttr("mhlo.all_reduce"), call.getAttr(HloAttrNames.CALL_TARGET_NAME));
        assertNull(call.getAttr(HloAttrNames.VERSION));
        assertEquals(ArrayAttr.of(new SymbolRefAttr("all_reduce")), call.getAttr(HloAttrNames.CALLED_COMPUTATIONS));
        assertEquals(new DictionaryAttr(attrs("channel_handle",
                        new ChannelHandleAttr(Dialect.STABLEHLO, 1, 0))),
                call.getAttr(HloAttrNames.ATTRIBUTES));
        assertEquals(0, call.getNumRegions());

        Procedure body = f.program.lookup("all_reduce");
        assertNotNull(body);
        assertEquals(new FunctionType(Arrays.asList(F32, F32), Collections.singletonList(F32)), body.getType());
    }

    @Test
    void typedFfiCustomCall() {
        Fixture f = new Fixture(F32);
        Operation customCall = f.op(HloOps.CUSTOM_CALL, F32, attrs(
                HloAttrNames.CALL_TARGET_NAME, new StringAttr("my_kernel"),
                HloAttrNames.API_VERSION, MhloEnums.CustomCallApiVersion.API_VERSION_TYPED_FFI.attr(),
                HloAttrNames.CUSTOM_CALL_SCHEDULE, MhloEnums.CUSTOM_CALL_SCHEDULE.attr(MhloEnums.CustomCallSchedule.NONE)
        ), f.arg(0));

        assertTrue(encoder.encode(customCall, FeatureTier.publicSince(1), f.rewriter()));
        Operation call = onlyCustomCall(f);
        assertEquals(new StringAttr("mhlo.custom_call"), call.getAttr(HloAttrNames.CALL_TARGET_NAME));
        assertEquals(IntegerAttr.i64(1), call.getAttr(HloAttrNames.VERSION));
        assertEquals(new DictionaryAttr(attrs(
                        HloAttrNames.CALL_TARGET_NAME, new StringAttr("my_kernel"),
                        HloAttrNames.API_VERSION, MhloEnums.CustomCallApiVersion.API_VERSION_TYPED_FFI.attr())),
                call.getAttr(HloAttrNames.ATTRIBUTES));
    }

    @Test
    void packedNibbleIsEncodedAsStrings() {
        Fixture f = new Fixture(F32, F32);
        Operation dot = f.op(HloOps.DOT, F32, attrs(HloAttrNames.PRECISION_CONFIG,
                MhloEnums.precisionConfig(MhloEnums.Precision.PACKED_NIBBLE, MhloEnums.Precision.DEFAULT)),
                f.arg(0), f.arg(1));

        assertTrue(encoder.encode(dot, FeatureTier.EXPERIMENTAL, f.rewriter()));
        DictionaryAttr encoded = (DictionaryAttr) onlyCustomCall(f).getAttr(HloAttrNames.ATTRIBUTES);
        assertEquals(ArrayAttr.of(new StringAttr("PACKED_NIBBLE"), new StringAttr("DEFAULT")),
                encoded.get(HloAttrNames.PRECISION_CONFIG));
        assertNull(FallbackEncoder.encodePrecisionConfig(new StringAttr("DEFAULT")));
    }

    @Test
    void multipleRegionsAreNotSupported() {
        Fixture f = new Fixture(F32);
        Operation whileOp = f.op(HloOps.WHILE, Collections.singletonList(F32), attrs(), 2, f.arg(0));
        addBody(whileOp.getRegion(0), F32);
        addBody(whileOp.getRegion(1), F32);

        ConversionRewriter rewriter = f.rewriter();
        assertFalse(encoder.encode(whileOp, FeatureTier.EXPERIMENTAL, rewriter));
        assertSame(whileOp, f.ops().get(0));
        assertEquals(1, f.program.getSymbolTable().size());
        assertEquals(1, rewriter.getDiagnostics().size());
    }

    @Test
    void failuresLeaveNoProcedureBehind() {
        Fixture f = new Fixture(F32);
        Operation badAttr = f.op(HloOps.ALL_REDUCE, Collections.singletonList(F32),
                attrs("schedule", MhloEnums.CUSTOM_CALL_SCHEDULE.attr(MhloEnums.CustomCallSchedule.LATEST)),
                1, f.arg(0));
        addBody(badAttr.getRegion(0), F32);
        Operation badType = f.op(HloOps.ALL_REDUCE, Collections.singletonList(new AsyncBundleType(F32)),
                attrs(), 1, f.arg(0));
        addBody(badType.getRegion(0), F32);

        ConversionRewriter rewriter = f.rewriter();
        assertFalse(encoder.encode(badAttr, FeatureTier.EXPERIMENTAL, rewriter));
        assertFalse(encoder.encode(badType, FeatureTier.EXPERIMENTAL, rewriter));
        assertEquals(1, f.program.getSymbolTable().size());
        assertFalse(badAttr.getRegion(0).isEmpty());
        assertFalse(badType.getRegion(0).isEmpty());
        assertEquals(2, f.ops().size());
    }
}
