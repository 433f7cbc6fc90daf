package io.github.eutro.hlo2shlo.core.ir;

/**
 * The namespaces that op keys, attributes and types may belong to.
 */
public enum Dialect {
    BUILTIN("builtin"),
    FUNC("func"),
    MHLO("mhlo"),
    STABLEHLO("stablehlo"),
    ;

    public final String namespace;

    Dialect(String namespace) {
        this.namespace = namespace;
    }

    /**
     * Look up a dialect by its namespace.
     *
     * @param namespace The namespace, e.g. {@code "mhlo"}.
     * @return The dialect, or null if there is no such dialect.
     */
    public static Dialect forNamespace(String namespace) {
        for (Dialect dialect : values()) {
            if (dialect.namespace.equals(namespace)) return dialect;
        }
        return null;
    }

    @Override
    public String toString() {
        return namespace;
    }
}
