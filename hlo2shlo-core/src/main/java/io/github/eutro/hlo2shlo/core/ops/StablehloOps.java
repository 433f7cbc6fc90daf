package io.github.eutro.hlo2shlo.core.ops;

import io.github.eutro.hlo2shlo.core.ext.CommonExts;
import io.github.eutro.hlo2shlo.core.ir.Dialect;
import io.github.eutro.hlo2shlo.core.util.Lazy;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * StableHLO operations, and the catalog of all of them.
 * <p>
 * The catalog is read from the {@value #CATALOG_RESOURCE} resource the first time it is needed.
 * Reading it also attaches the {@link CommonExts#REGION_COUNT}, {@link CommonExts#VARIADIC_REGIONS}
 * and {@link CommonExts#IS_TERMINATOR} exts to the keys it lists.
 */
public class StablehloOps {
    public static final String CATALOG_RESOURCE = "stablehlo_ops.txt";

    public static final OpKey BROADCAST = op("broadcast");
    public static final OpKey CASE = op("case");
    public static final OpKey CUSTOM_CALL = op("custom_call");
    public static final OpKey DYNAMIC_SLICE = op("dynamic_slice");
    public static final OpKey FFT = op("fft");
    public static final OpKey PAD = op("pad");
    public static final OpKey RETURN = CommonExts.markTerminator(op("return"));
    public static final OpKey REVERSE = op("reverse");
    public static final OpKey SLICE = op("slice");
    public static final OpKey TRANSPOSE = op("transpose");

    private static final Lazy<List<CatalogEntry>> CATALOG = Lazy.lazy(StablehloOps::readCatalog);

    private static OpKey op(String mnemonic) {
        return OpKey.of(Dialect.STABLEHLO, mnemonic);
    }

    /**
     * An operation listed in the catalog, along with its MHLO counterpart.
     */
    public static final class CatalogEntry {
        public final OpKey stablehlo;
        public final OpKey mhlo;

        CatalogEntry(OpKey stablehlo, OpKey mhlo) {
            this.stablehlo = stablehlo;
            this.mhlo = mhlo;
        }

        @Override
        public String toString() {
            return mhlo + " -> " + stablehlo;
        }
    }

    /**
     * Get every entry in the catalog, in catalog order.
     *
     * @return The entries.
     */
    public static List<CatalogEntry> catalog() {
        return CATALOG.get();
    }

    private static List<CatalogEntry> readCatalog() {
        try (InputStream is = StablehloOps.class.getResourceAsStream(CATALOG_RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Could not find StableHLO catalog " + CATALOG_RESOURCE);
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
            return parseCatalog(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parse catalog entries, attaching the exts they declare to their StableHLO keys.
     *
     * @param reader The catalog text.
     * @return The entries.
     * @throws IOException If reading fails.
     * @throws IllegalStateException If the catalog is malformed.
     */
    public static List<CatalogEntry> parseCatalog(BufferedReader reader) throws IOException {
        List<CatalogEntry> entries = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] fields = line.split("\\s+");
            OpKey stablehlo = op(fields[0]);
            OpKey mhlo = OpKey.of(Dialect.MHLO, fields[0]);
            for (int i = 1; i < fields.length; i++) {
                String field = fields[i];
                if (field.startsWith("from=")) {
                    mhlo = OpKey.of(Dialect.MHLO, field.substring("from=".length()));
                } else if (field.equals("regions=variadic")) {
                    stablehlo.attachExt(CommonExts.VARIADIC_REGIONS, true);
                } else if (field.startsWith("regions=")) {
                    try {
                        stablehlo.attachExt(CommonExts.REGION_COUNT, Integer.parseInt(field.substring("regions=".length())));
                    } catch (NumberFormatException e) {
                        throw new IllegalStateException("Bad region count on catalog line " + lineNo + ": " + line, e);
                    }
                } else if (field.equals("terminator")) {
                    CommonExts.markTerminator(stablehlo);
                } else {
                    throw new IllegalStateException("Unknown field on catalog line " + lineNo + ": " + field);
                }
            }
            entries.add(new CatalogEntry(stablehlo, mhlo));
        }
        return Collections.unmodifiableList(entries);
    }
}
