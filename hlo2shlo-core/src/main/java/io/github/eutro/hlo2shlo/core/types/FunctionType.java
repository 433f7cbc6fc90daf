package io.github.eutro.hlo2shlo.core.types;

import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The signature of a {@link io.github.eutro.hlo2shlo.core.ir.Procedure}.
 */
public final class FunctionType extends Type {
    public final List<Type> inputs;
    public final List<Type> results;

    public FunctionType(List<Type> inputs, List<Type> results) {
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    @Override
    public Dialect getDialect() {
        return Dialect.BUILTIN;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionType)) return false;
        FunctionType that = (FunctionType) o;
        return inputs.equals(that.inputs) && results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return 31 * inputs.hashCode() + results.hashCode();
    }

    @Override
    public String toString() {
        String ins = inputs.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
        String outs = results.size() == 1
                ? results.get(0).toString()
                : results.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
        return ins + " -> " + outs;
    }
}
