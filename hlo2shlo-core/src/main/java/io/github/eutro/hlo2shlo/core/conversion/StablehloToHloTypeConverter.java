package io.github.eutro.hlo2shlo.core.conversion;

import io.github.eutro.hlo2shlo.core.ir.Dialect;
import io.github.eutro.hlo2shlo.core.types.*;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Converts StableHLO types back to MHLO. Every StableHLO type has an MHLO counterpart.
 */
public class StablehloToHloTypeConverter implements TypeConverter {
    public static final StablehloToHloTypeConverter INSTANCE = new StablehloToHloTypeConverter();

    @Override
    public @Nullable Type convertType(Type type) {
        if (type instanceof TokenType) {
            return TokenType.MHLO;
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
        } else if (type.getDialect() == Dialect.STABLEHLO) {
            return null;
        }
        return type;
    }
}
