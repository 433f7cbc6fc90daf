package io.github.eutro.hlo2shlo.core.attrs;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A dictionary of named attributes. Entries are kept sorted by name.
 */
public final class DictionaryAttr extends BuiltinAttribute {
    public static final DictionaryAttr EMPTY = new DictionaryAttr(Collections.emptyMap());

    public final SortedMap<String, Attribute> entries;

    public DictionaryAttr(Map<String, ? extends Attribute> entries) {
        this.entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    }

    public Attribute get(String name) {
        return entries.get(name);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DictionaryAttr && ((DictionaryAttr) o).entries.equals(entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.entrySet().stream()
                .map(e -> e.getKey() + " = " + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
