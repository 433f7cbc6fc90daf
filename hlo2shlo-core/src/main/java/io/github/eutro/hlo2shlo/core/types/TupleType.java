package io.github.eutro.hlo2shlo.core.types;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class TupleType extends Type {
    public final List<Type> elements;

    public TupleType(List<Type> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public TupleType(Type... elements) {
        this(Arrays.asList(elements));
    }

    @Override
    public Dialect getDialect() {
        return Dialect.BUILTIN;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TupleType && ((TupleType) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.stream()
                .map(Object::toString)
                .collect(Collectors.joining(", ", "tuple<", ">"));
    }
}
