package io.github.eutro.hlo2shlo.test;

import io.github.eutro.hlo2shlo.core.attrs.*;
import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.conversion.HloToStablehloTypeConverter;
import io.github.eutro.hlo2shlo.core.ir.Block;
import io.github.eutro.hlo2shlo.core.ir.Dialect;
import io.github.eutro.hlo2shlo.core.ir.OpBuilder;
import io.github.eutro.hlo2shlo.core.ir.Operation;
import io.github.eutro.hlo2shlo.core.legalize.AttributeConverter;
import io.github.eutro.hlo2shlo.core.legalize.DirectTranslator;
import io.github.eutro.hlo2shlo.core.legalize.DispatchTable;
import io.github.eutro.hlo2shlo.core.legalize.HloAttrNames;
import io.github.eutro.hlo2shlo.core.ops.HloOps;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.ops.StablehloOps;
import io.github.eutro.hlo2shlo.core.types.ScalarType;
import io.github.eutro.hlo2shlo.core.types.TensorType;
import io.github.eutro.hlo2shlo.core.types.TokenType;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static io.github.eutro.hlo2shlo.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class DirectTranslatorTest {
    private static DispatchTable table;
    private final DirectTranslator translator = new DirectTranslator(
            HloToStablehloTypeConverter.INSTANCE,
            AttributeConverter.HLO_TO_STABLEHLO);

    @BeforeAll
    static void loadCatalog() {
        table = DispatchTable.load();
    }

    private boolean translate(Operation op, ConversionRewriter rewriter) {
        OpKey target = table.lookup(op.getKey());
        assertNotNull(target, op.getName());
        return translator.translate(op, target, rewriter);
    }

    @Test
    void simpleOp() {
        Fixture f = new Fixture(F32, F32);
        Operation add = f.op(HloOps.ADD, F32, attrs(), f.arg(0), f.arg(1));
        f.ret(add.getResult(0));

        assertTrue(translate(add, f.rewriter()));
        Operation translated = f.ops().get(0);
        assertEquals("stablehlo.add", translated.getName());
        assertEquals(Collections.singletonList(F32), translated.getResultTypes());
        assertSame(translated.getResult(0), f.ops().get(1).getOperands().get(0));
        assertEquals(2, f.ops().size());
    }

    @Test
    void translatingTwiceGivesTheSameResult() {
        Fixture f = new Fixture(F32, F32);
        f.ret(f.op(HloOps.MULTIPLY, F32, attrs(), f.arg(0), f.arg(1)).getResult(0));
        Fixture g = new Fixture(F32, F32);
        g.ret(g.op(HloOps.MULTIPLY, F32, attrs(), g.arg(0), g.arg(1)).getResult(0));

        assertTrue(translate(f.ops().get(0), f.rewriter()));
        assertTrue(translate(g.ops().get(0), g.rewriter()));
        assertEquals(f.program.toString(), g.program.toString());
    }

    @Test
    void attributesAndTypes() {
        Fixture f = new Fixture(F32_2X3, TokenType.MHLO);
        Operation transpose = f.op(HloOps.TRANSPOSE, new TensorType(ScalarType.F32, 3, 2), attrs(
                "permutation", new DenseIntElementsAttr(new TensorType(ScalarType.I64, 2), 1, 0)
        ), f.arg(0));
        Operation compare = f.op(HloOps.COMPARE, new TensorType(ScalarType.I1), attrs(
                "comparison_direction", MhloEnums.COMPARISON_DIRECTION.attr(MhloEnums.ComparisonDirection.LT)
        ), f.arg(0), f.arg(0));
        Operation afterAll = f.op(OpKey.of(Dialect.MHLO, "after_all"), TokenType.MHLO, attrs(), f.arg(1));

        ConversionRewriter rewriter = f.rewriter();
        assertTrue(translate(transpose, rewriter));
        assertTrue(translate(compare, rewriter));
        assertTrue(translate(afterAll, rewriter));

        assertEquals(new DenseI64ArrayAttr(1, 0), f.ops().get(0).getAttr("permutation"));
        assertEquals(StablehloEnums.COMPARISON_DIRECTION.attr(StablehloEnums.ComparisonDirection.LT),
                f.ops().get(1).getAttr("comparison_direction"));
        assertEquals(Collections.singletonList(TokenType.STABLEHLO), f.ops().get(2).getResultTypes());
    }

    @Test
    void untranslatableAttributes() {
        Fixture f = new Fixture(F32, F32);
        Operation dot = f.op(HloOps.DOT, F32, attrs(HloAttrNames.PRECISION_CONFIG,
                MhloEnums.precisionConfig(MhloEnums.Precision.PACKED_NIBBLE)), f.arg(0), f.arg(1));
        ConversionRewriter rewriter = f.rewriter();
        assertFalse(translate(dot, rewriter));
        assertSame(dot, f.ops().get(0));
        assertEquals(1, f.ops().size());
    }

    @Test
    void noOpScheduleIsDropped() {
        Fixture f = new Fixture(F32);
        Operation customCall = f.op(HloOps.CUSTOM_CALL, F32, attrs(
                HloAttrNames.CALL_TARGET_NAME, new StringAttr("foo"),
                HloAttrNames.CUSTOM_CALL_SCHEDULE, MhloEnums.CUSTOM_CALL_SCHEDULE.attr(MhloEnums.CustomCallSchedule.NONE)
        ), f.arg(0));

        assertTrue(translate(customCall, f.rewriter()));
        Operation translated = f.ops().get(0);
        assertSame(StablehloOps.CUSTOM_CALL, translated.getKey());
        assertEquals(Collections.singleton(HloAttrNames.CALL_TARGET_NAME), translated.getAttributes().keySet());
    }

    @Test
    void dictionaryAttributesAreKeptAsIs() {
        Fixture f = new Fixture(F32);
        DictionaryAttr backendConfig = new DictionaryAttr(attrs(
                "sched", MhloEnums.CUSTOM_CALL_SCHEDULE.attr(MhloEnums.CustomCallSchedule.LATEST)));
        Operation customCall = f.op(HloOps.CUSTOM_CALL, F32, attrs(
                HloAttrNames.CALL_TARGET_NAME, new StringAttr("foo"),
                "backend_config", backendConfig
        ), f.arg(0));

        assertTrue(translate(customCall, f.rewriter()));
        Operation translated = f.ops().get(0);
        assertSame(StablehloOps.CUSTOM_CALL, translated.getKey());
        assertSame(backendConfig, translated.getAttr("backend_config"));
    }

    @Test
    void caseWithThreeBranches() {
        Fixture f = new Fixture(I32, F32);
        Operation caseOp = f.op(HloOps.CASE, Collections.singletonList(F32), attrs(), 3, f.arg(0));
        for (int i = 0; i < 3; i++) {
            Block branch = caseOp.getRegion(i).addBlock();
            new OpBuilder(branch).createReturn(HloOps.RETURN, f.arg(1));
        }
        f.ret(caseOp.getResult(0));

        assertTrue(translate(caseOp, f.rewriter()));
        Operation translated = f.ops().get(0);
        assertSame(StablehloOps.CASE, translated.getKey());
        assertEquals(3, translated.getNumRegions());
        for (int i = 0; i < 3; i++) {
            assertTrue(translated.getRegion(i).hasOneBlock());
            assertSame(translated, translated.getRegion(i).getParentOp());
            // nested ops are left for the driver
            assertSame(HloOps.RETURN, translated.getRegion(i).front().getOperations().get(0).getKey());
        }
    }

    @Test
    void whileConvertsRegionArguments() {
        Fixture f = new Fixture(TokenType.MHLO);
        Operation whileOp = f.op(HloOps.WHILE, Collections.singletonList(TokenType.MHLO), attrs(), 2, f.arg(0));
        for (int i = 0; i < 2; i++) {
            Block block = whileOp.getRegion(i).addBlock();
            new OpBuilder(block).createReturn(HloOps.RETURN, block.addArgument(TokenType.MHLO));
        }

        ConversionRewriter rewriter = f.rewriter();
        assertTrue(translate(whileOp, rewriter));
        Operation translated = f.ops().get(0);
        assertEquals(Collections.singletonList(TokenType.STABLEHLO), translated.getResultTypes());
        assertEquals(Collections.singletonList(TokenType.STABLEHLO),
                translated.getRegion(1).front().getArgumentTypes());

        rewriter.rollbackTo(0);
        assertSame(whileOp, f.ops().get(0));
        assertEquals(1, f.ops().size());
        assertEquals(Collections.singletonList(TokenType.MHLO), whileOp.getRegion(1).front().getArgumentTypes());
    }

    @Test
    void regionCountMismatch() {
        Fixture f = new Fixture(F32);
        Operation whileOp = f.op(HloOps.WHILE, Collections.singletonList(F32), attrs(), 1, f.arg(0));
        addBody(whileOp.getRegion(0), F32);
        Operation emptyCase = f.op(HloOps.CASE, Collections.singletonList(F32), attrs(), 0, f.arg(0));
        Operation addWithRegion = f.op(HloOps.ADD, Collections.singletonList(F32), attrs(), 1, f.arg(0), f.arg(0));

        ConversionRewriter rewriter = f.rewriter();
        assertFalse(translate(whileOp, rewriter));
        assertFalse(translate(emptyCase, rewriter));
        assertFalse(translate(addWithRegion, rewriter));
        assertEquals(3, rewriter.getDiagnostics().size());
        assertEquals(3, f.ops().size());
    }
}
