package io.github.eutro.hlo2shlo.core.ops;

import io.github.eutro.hlo2shlo.core.ext.ExtHolder;
import io.github.eutro.hlo2shlo.core.ir.Dialect;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An operation key, representing a kind of operation, such as {@code mhlo.add}.
 * <p>
 * Keys are interned, so there is exactly one key per name and they can be compared by identity.
 * Static facts about a kind of operation (whether it is a terminator, how many regions it has)
 * are attached to its key as exts.
 */
public final class OpKey extends ExtHolder {
    private static final Map<String, OpKey> INTERNED = new ConcurrentHashMap<>();

    public final Dialect dialect;
    public final String mnemonic;

    private OpKey(Dialect dialect, String mnemonic) {
        this.dialect = dialect;
        this.mnemonic = mnemonic;
    }

    /**
     * Get the key of an operation.
     *
     * @param dialect  The dialect of the operation.
     * @param mnemonic The name of the operation within its dialect, e.g. {@code "add"}.
     * @return The interned key.
     */
    public static OpKey of(Dialect dialect, String mnemonic) {
        return INTERNED.computeIfAbsent(dialect.namespace + "." + mnemonic, $ -> new OpKey(dialect, mnemonic));
    }

    /**
     * Get the key of an operation by its full name.
     *
     * @param name The full name, e.g. {@code "mhlo.add"}.
     * @return The interned key.
     * @throws IllegalArgumentException If the name has no known dialect prefix.
     */
    public static OpKey parse(String name) {
        OpKey key = INTERNED.get(name);
        if (key != null) return key;
        int dot = name.indexOf('.');
        Dialect dialect = dot < 0 ? null : Dialect.forNamespace(name.substring(0, dot));
        if (dialect == null) {
            throw new IllegalArgumentException("Operation name has no known dialect: " + name);
        }
        return of(dialect, name.substring(dot + 1));
    }

    /**
     * Get the full name of this operation.
     *
     * @return The name, including the dialect prefix.
     */
    public String getName() {
        return dialect.namespace + "." + mnemonic;
    }

    /**
     * Get the name of this operation without its dialect prefix.
     *
     * @return The mnemonic.
     */
    public String getStrippedName() {
        return mnemonic;
    }

    @Override
    public String toString() {
        return getName();
    }
}
