package io.github.eutro.hlo2shlo.core.attrs;

import java.util.*;
import java.util.stream.Collectors;

public final class ArrayAttr extends BuiltinAttribute implements Iterable<Attribute> {
    public final List<Attribute> elements;

    public ArrayAttr(List<? extends Attribute> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static ArrayAttr of(Attribute... elements) {
        return new ArrayAttr(Arrays.asList(elements));
    }

    public int size() {
        return elements.size();
    }

    public Attribute get(int index) {
        return elements.get(index);
    }

    @Override
    public Iterator<Attribute> iterator() {
        return elements.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArrayAttr && ((ArrayAttr) o).elements.equals(elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return elements.stream()
                .map(Object::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
