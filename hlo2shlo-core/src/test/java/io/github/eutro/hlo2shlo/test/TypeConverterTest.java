package io.github.eutro.hlo2shlo.test;

import io.github.eutro.hlo2shlo.core.conversion.HloToStablehloTypeConverter;
import io.github.eutro.hlo2shlo.core.conversion.StablehloToHloTypeConverter;
import io.github.eutro.hlo2shlo.core.conversion.TypeConverter;
import io.github.eutro.hlo2shlo.core.types.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.hlo2shlo.test.Utils.F32;
import static io.github.eutro.hlo2shlo.test.Utils.I32;
import static org.junit.jupiter.api.Assertions.*;

public class TypeConverterTest {
    private static final TypeConverter TO_SHLO = HloToStablehloTypeConverter.INSTANCE;
    private static final TypeConverter TO_HLO = StablehloToHloTypeConverter.INSTANCE;

    @Test
    void builtinTypesAreUnchanged() {
        assertSame(F32, TO_SHLO.convertType(F32));
        assertSame(ScalarType.INDEX, TO_SHLO.convertType(ScalarType.INDEX));
        assertSame(I32, TO_HLO.convertType(I32));
    }

    @Test
    void tokensRecursively() {
        TupleType tuple = new TupleType(TokenType.MHLO, new TupleType(F32, TokenType.MHLO));
        assertEquals(new TupleType(TokenType.STABLEHLO, new TupleType(F32, TokenType.STABLEHLO)),
                TO_SHLO.convertType(tuple));
        assertEquals(tuple, TO_HLO.convertType(TO_SHLO.convertType(tuple)));

        FunctionType function = new FunctionType(
                Arrays.asList(TokenType.MHLO, F32),
                Collections.singletonList(new TensorType(ScalarType.UI32, 4)));
        assertEquals(new FunctionType(
                        Arrays.asList(TokenType.STABLEHLO, F32),
                        Collections.singletonList(new TensorType(ScalarType.UI32, 4))),
                TO_SHLO.convertType(function));
    }

    @Test
    void asyncBundlesHaveNoCounterpart() {
        assertNull(TO_SHLO.convertType(new AsyncBundleType(F32, I32)));
        assertNull(TO_SHLO.convertType(new TupleType(F32, new AsyncBundleType(F32))));
        assertNull(TO_SHLO.convertTypes(Arrays.asList(F32, new AsyncBundleType(F32))));
        assertEquals(Arrays.asList(F32, TokenType.STABLEHLO),
                TO_SHLO.convertTypes(Arrays.asList(F32, TokenType.MHLO)));
    }
}
