package io.github.eutro.hlo2shlo.core.legalize;

import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.ops.StablehloOps;
import io.github.eutro.hlo2shlo.core.util.Lazy;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * The one-to-one correspondence between MHLO operations and the StableHLO operations
 * they translate to directly, built from the {@link StablehloOps#catalog() StableHLO catalog}.
 * <p>
 * MHLO operations that are not in the table can never be translated directly.
 */
public final class DispatchTable {
    private static final Logger log = LoggerFactory.getLogger(DispatchTable.class);

    private static final Lazy<DispatchTable> DEFAULT = Lazy.lazy(() -> {
        DispatchTable table = fromCatalog(StablehloOps.catalog());
        log.debug("Loaded dispatch table with {} operations", table.size());
        return table;
    });

    private final Map<OpKey, OpKey> hloToStablehlo;
    private final Map<OpKey, OpKey> stablehloToHlo;

    private DispatchTable(Map<OpKey, OpKey> hloToStablehlo, Map<OpKey, OpKey> stablehloToHlo) {
        this.hloToStablehlo = hloToStablehlo;
        this.stablehloToHlo = stablehloToHlo;
    }

    /**
     * Get the table built from the bundled catalog, loading it the first time.
     *
     * @return The table.
     */
    public static DispatchTable load() {
        return DEFAULT.get();
    }

    /**
     * Build a table from catalog entries.
     *
     * @param catalog The entries.
     * @return The table.
     * @throws IllegalArgumentException If an operation appears twice.
     */
    public static DispatchTable fromCatalog(List<StablehloOps.CatalogEntry> catalog) {
        Map<OpKey, OpKey> forward = new LinkedHashMap<>();
        Map<OpKey, OpKey> backward = new LinkedHashMap<>();
        for (StablehloOps.CatalogEntry entry : catalog) {
            if (forward.putIfAbsent(entry.mhlo, entry.stablehlo) != null
                    || backward.putIfAbsent(entry.stablehlo, entry.mhlo) != null) {
                throw new IllegalArgumentException("Duplicate catalog entry: " + entry);
            }
        }
        return new DispatchTable(Collections.unmodifiableMap(forward), Collections.unmodifiableMap(backward));
    }

    /**
     * Get the StableHLO operation an MHLO operation translates to.
     *
     * @param hloKey The MHLO operation.
     * @return The StableHLO operation, or null if there is none.
     */
    public @Nullable OpKey lookup(OpKey hloKey) {
        return hloToStablehlo.get(hloKey);
    }

    /**
     * Get the MHLO operation a StableHLO operation was translated from.
     *
     * @param stablehloKey The StableHLO operation.
     * @return The MHLO operation, or null if there is none.
     */
    public @Nullable OpKey reverseLookup(OpKey stablehloKey) {
        return stablehloToHlo.get(stablehloKey);
    }

    /**
     * Get every MHLO operation in the table, in catalog order.
     *
     * @return The operations.
     */
    public Set<OpKey> sourceKeys() {
        return hloToStablehlo.keySet();
    }

    public int size() {
        return hloToStablehlo.size();
    }
}
