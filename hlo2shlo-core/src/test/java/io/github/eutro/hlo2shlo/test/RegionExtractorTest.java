package io.github.eutro.hlo2shlo.test;

import io.github.eutro.hlo2shlo.core.conversion.ConversionRewriter;
import io.github.eutro.hlo2shlo.core.conversion.Diagnostic;
import io.github.eutro.hlo2shlo.core.conversion.HloToStablehloTypeConverter;
import io.github.eutro.hlo2shlo.core.ir.*;
import io.github.eutro.hlo2shlo.core.legalize.RegionExtractor;
import io.github.eutro.hlo2shlo.core.ops.HloOps;
import io.github.eutro.hlo2shlo.core.types.AsyncBundleType;
import io.github.eutro.hlo2shlo.core.types.FunctionType;
import io.github.eutro.hlo2shlo.core.types.TokenType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.hlo2shlo.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class RegionExtractorTest {
    private final RegionExtractor extractor = new RegionExtractor(HloToStablehloTypeConverter.INSTANCE);

    private static Operation allReduce(Fixture f) {
        Operation op = f.op(HloOps.ALL_REDUCE, Collections.singletonList(F32), attrs(), 1, f.arg(0));
        addBody(op.getRegion(0), F32);
        return op;
    }

    @Test
    void extractsIntoProcedure() {
        Fixture f = new Fixture(F32);
        Operation op = allReduce(f);
        ConversionRewriter rewriter = f.rewriter();

        Procedure procedure = extractor.extract(op, rewriter);
        assertNotNull(procedure);
        assertEquals("all_reduce", procedure.getName());
        assertSame(procedure, f.program.lookup("all_reduce"));
        assertEquals(new FunctionType(Arrays.asList(F32, F32), Collections.singletonList(F32)), procedure.getType());
        assertTrue(op.getRegion(0).isEmpty());
        assertEquals(2, procedure.getEntryBlock().getOperations().size());
        assertSame(procedure, procedure.getEntryBlock().getOperations().get(0).getParentProcedure());
    }

    @Test
    void namesAreUniqued() {
        Fixture f = new Fixture(F32);
        Operation first = allReduce(f);
        Operation second = allReduce(f);
        ConversionRewriter rewriter = f.rewriter();

        Procedure p1 = extractor.extract(first, rewriter);
        Procedure p2 = extractor.extract(second, rewriter);
        assertNotNull(p1);
        assertNotNull(p2);
        assertEquals("all_reduce", p1.getName());
        assertEquals("all_reduce_0", p2.getName());
        assertEquals(3, f.program.getSymbolTable().size());
    }

    @Test
    void rolledBackNamesAreReused() {
        Fixture f = new Fixture(F32);
        Operation first = allReduce(f);
        Operation second = allReduce(f);
        Operation third = allReduce(f);
        ConversionRewriter rewriter = f.rewriter();

        assertNotNull(extractor.extract(first, rewriter));
        int checkpoint = rewriter.checkpoint();
        Procedure discarded = extractor.extract(second, rewriter);
        assertNotNull(discarded);
        assertEquals("all_reduce_0", discarded.getName());
        rewriter.rollbackTo(checkpoint);

        Procedure kept = extractor.extract(third, rewriter);
        assertNotNull(kept);
        assertEquals("all_reduce_0", kept.getName());
        assertEquals(3, f.program.getSymbolTable().size());
    }

    @Test
    void capturesAreErrors() {
        Fixture f = new Fixture(F32);
        Operation op = f.op(HloOps.ALL_REDUCE, Collections.singletonList(F32), attrs(), 1, f.arg(0));
        Block body = op.getRegion(0).addBlock();
        Value x = body.addArgument(F32);
        OpBuilder builder = new OpBuilder(body);
        Value sum = builder.createValue(HloOps.ADD, F32, x, f.arg(0));
        builder.createReturn(HloOps.RETURN, sum);

        assertEquals(Collections.singleton(f.arg(0)), RegionExtractor.getUsedValuesDefinedAbove(op.getRegion(0)));

        ConversionRewriter rewriter = f.rewriter();
        assertNull(extractor.extract(op, rewriter));
        assertEquals(1, f.program.getSymbolTable().size());
        assertFalse(op.getRegion(0).isEmpty());
        assertEquals(1, rewriter.getDiagnostics().size());
        Diagnostic diagnostic = rewriter.getDiagnostics().get(0);
        assertEquals(Diagnostic.Severity.ERROR, diagnostic.severity);
        assertEquals(RegionExtractor.CAPTURE_ERROR, diagnostic.message);
        assertEquals("mhlo.all_reduce", diagnostic.opName);
    }

    @Test
    void nestedDefinitionsAreNotCaptures() {
        Fixture f = new Fixture(F32);
        Operation outer = f.op(HloOps.WHILE, Collections.singletonList(F32), attrs(), 2, f.arg(0));
        Block cond = outer.getRegion(0).addBlock();
        Value c = cond.addArgument(F32);
        Operation inner = new OpBuilder(cond).create(HloOps.ALL_REDUCE,
                Collections.singletonList(F32), Collections.singletonList(c), attrs(), 1);
        // the inner body uses a value of the outer region, which is inside the outer region
        Block innerBody = inner.getRegion(0).addBlock();
        new OpBuilder(innerBody).createReturn(HloOps.RETURN, c);
        new OpBuilder(cond).createReturn(HloOps.RETURN, inner.getResult(0));

        assertTrue(RegionExtractor.getUsedValuesDefinedAbove(outer.getRegion(0)).isEmpty());
        assertEquals(Collections.singleton(c), RegionExtractor.getUsedValuesDefinedAbove(inner.getRegion(0)));
    }

    @Test
    void onlySingleBlockRegions() {
        Fixture f = new Fixture(F32);
        Operation op = allReduce(f);
        op.getRegion(0).addBlock();
        ConversionRewriter rewriter = f.rewriter();
        assertNull(extractor.extract(op, rewriter));
        assertEquals(Diagnostic.Severity.REMARK, rewriter.getDiagnostics().get(0).severity);

        Operation empty = f.op(HloOps.ALL_REDUCE, Collections.singletonList(F32), attrs(), 1, f.arg(0));
        assertNull(extractor.extract(empty, rewriter));
        assertEquals(1, f.program.getSymbolTable().size());

        Operation noRegion = f.op(HloOps.ADD, F32, attrs(), f.arg(0), f.arg(0));
        assertThrows(IllegalArgumentException.class, () -> extractor.extract(noRegion, rewriter));
    }

    @Test
    void convertsTypes() {
        Fixture f = new Fixture(F32);
        Operation op = f.op(HloOps.ALL_REDUCE, Collections.singletonList(F32), attrs(), 1, f.arg(0));
        Block body = op.getRegion(0).addBlock();
        Value token = body.addArgument(TokenType.MHLO);
        new OpBuilder(body).createReturn(HloOps.RETURN, token);

        ConversionRewriter rewriter = f.rewriter();
        Procedure procedure = extractor.extract(op, rewriter);
        assertNotNull(procedure);
        assertEquals(new FunctionType(
                        Collections.singletonList(TokenType.STABLEHLO),
                        Collections.singletonList(TokenType.STABLEHLO)),
                procedure.getType());

        rewriter.rollbackTo(0);
        assertEquals(TokenType.MHLO, token.getType());
        assertNull(f.program.lookup(procedure.getName()));
        assertSame(body, op.getRegion(0).front());
    }

    @Test
    void unconvertibleTypes() {
        Fixture f = new Fixture(F32);
        Operation op = f.op(HloOps.ALL_REDUCE, Collections.singletonList(F32), attrs(), 1, f.arg(0));
        Block body = op.getRegion(0).addBlock();
        Value bundle = body.addArgument(new AsyncBundleType(F32, F32));
        new OpBuilder(body).createReturn(HloOps.RETURN, bundle);

        assertNull(extractor.extract(op, f.rewriter()));
        assertEquals(1, f.program.getSymbolTable().size());
    }
}
