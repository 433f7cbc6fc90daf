package io.github.eutro.hlo2shlo.test;

import io.github.eutro.hlo2shlo.core.ext.CommonExts;
import io.github.eutro.hlo2shlo.core.ir.Dialect;
import io.github.eutro.hlo2shlo.core.legalize.DispatchTable;
import io.github.eutro.hlo2shlo.core.ops.HloOps;
import io.github.eutro.hlo2shlo.core.ops.OpKey;
import io.github.eutro.hlo2shlo.core.ops.StablehloOps;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogTest {
    private static List<StablehloOps.CatalogEntry> parse(String text) throws IOException {
        return StablehloOps.parseCatalog(new BufferedReader(new StringReader(text)));
    }

    @Test
    void parsesEntries() throws IOException {
        List<StablehloOps.CatalogEntry> entries = parse(
                "# comment\n"
                        + "\n"
                        + "catalog_test_plain\n"
                        + "catalog_test_renamed from=catalog_test_old regions=3\n"
                        + "catalog_test_branches regions=variadic\n"
                        + "catalog_test_end terminator\n");
        assertEquals(4, entries.size());

        assertEquals(OpKey.of(Dialect.MHLO, "catalog_test_plain"), entries.get(0).mhlo);
        assertEquals(OpKey.of(Dialect.STABLEHLO, "catalog_test_plain"), entries.get(0).stablehlo);

        assertEquals(OpKey.of(Dialect.MHLO, "catalog_test_old"), entries.get(1).mhlo);
        assertEquals(3, entries.get(1).stablehlo.getNullable(CommonExts.REGION_COUNT));
        assertEquals(Boolean.TRUE, entries.get(2).stablehlo.getNullable(CommonExts.VARIADIC_REGIONS));
        assertEquals(Boolean.TRUE, entries.get(3).stablehlo.getNullable(CommonExts.IS_TERMINATOR));
    }

    @Test
    void rejectsMalformedEntries() {
        assertThrows(IllegalStateException.class, () -> parse("catalog_test_bad colour=blue\n"));
        assertThrows(IllegalStateException.class, () -> parse("catalog_test_bad regions=many\n"));
    }

    @Test
    void bundledCatalog() {
        DispatchTable table = DispatchTable.load();
        assertSame(table, DispatchTable.load());
        assertSame(StablehloOps.CASE, table.lookup(HloOps.CASE));
        assertSame(StablehloOps.TRANSPOSE, table.lookup(HloOps.TRANSPOSE));
        assertSame(HloOps.ADD, table.reverseLookup(OpKey.of(Dialect.STABLEHLO, "add")));
        assertNull(table.lookup(HloOps.TAN));
        assertNull(table.lookup(HloOps.TOPK));
        for (OpKey key : HloOps.PRIVATE_OPS) {
            assertNull(table.lookup(key), key.getName());
        }

        assertEquals(Boolean.TRUE, StablehloOps.CASE.getNullable(CommonExts.VARIADIC_REGIONS));
        assertEquals(2, OpKey.of(Dialect.STABLEHLO, "while").getNullable(CommonExts.REGION_COUNT));
        assertEquals(1, OpKey.of(Dialect.STABLEHLO, "all_reduce").getNullable(CommonExts.REGION_COUNT));
        assertTrue(Boolean.TRUE.equals(StablehloOps.RETURN.getNullable(CommonExts.IS_TERMINATOR)));
    }

    @Test
    void duplicateEntriesAreRejected() throws IOException {
        List<StablehloOps.CatalogEntry> entries = parse("catalog_test_dup\ncatalog_test_dup\n");
        assertThrows(IllegalArgumentException.class, () -> DispatchTable.fromCatalog(entries));
    }
}
