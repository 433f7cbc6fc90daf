package io.github.eutro.hlo2shlo.core.conversion;

import io.github.eutro.hlo2shlo.core.types.Type;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts types from one dialect to another.
 */
public interface TypeConverter {
    /**
     * Convert a type.
     *
     * @param type The type.
     * @return The converted type, or null if it cannot be converted.
     */
    @Nullable Type convertType(Type type);

    /**
     * Convert a list of types, failing if any one of them cannot be converted.
     *
     * @param types The types.
     * @return The converted types, or null if any could not be converted.
     */
    default @Nullable List<Type> convertTypes(List<Type> types) {
        List<Type> converted = new ArrayList<>(types.size());
        for (Type type : types) {
            Type result = convertType(type);
            if (result == null) return null;
            converted.add(result);
        }
        return converted;
    }
}
