package io.github.eutro.hlo2shlo.core.conversion;

import io.github.eutro.hlo2shlo.core.ir.Dialect;
import io.github.eutro.hlo2shlo.core.types.*;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Converts MHLO types to StableHLO.
 * <p>
 * Types that are not defined in MHLO are unchanged, except for tensors, tuples and
 * function types, which are converted recursively. MHLO types without a StableHLO
 * counterpart, such as {@link AsyncBundleType}, fail to convert.
 */
public class HloToStablehloTypeConverter implements TypeConverter {
    public static final HloToStablehloTypeConverter INSTANCE = new HloToStablehloTypeConverter();

    @Override
    public @Nullable Type convertType(Type type) {
        if (type instanceof TokenType) {
            return TokenType.STABLEHLO;
        } else if (type instanceof TensorType) {
            TensorType tensor = (TensorType) type;
            Type element = convertType(tensor.elementType);
            if (element == null) return null;
            return element.equals(tensor.elementType) ? tensor : tensor.withElementType(element);
        } else if (type instanceof TupleType) {
            List<Type> elements = convertTypes(((TupleType) type).elements);
            return elements == null ? null : new TupleType(elements);
        } else if (type instanceof FunctionType) {
            FunctionType function = (FunctionType) type;
            List<Type> inputs = convertTypes(function.inputs);
            List<Type> results = convertTypes(function.results);
            if (inputs == null || results == null) return null;
            return new FunctionType(inputs, results);
        } else if (type.getDialect() == Dialect.MHLO) {
            return null;
        }
        return type;
    }
}
