package io.github.yok.doltsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import com.google.common.hash.HashCode;
import io.github.yok.doltsync.db.DialectAdapter;
import io.github.yok.doltsync.db.mysql.MySqlDialectAdapter;
import io.github.yok.doltsync.db.oracle.OracleDialectAdapter;
import io.github.yok.doltsync.model.ColumnType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RowFingerprinterTest {

    private static final List<String> PK = List.of("id");

    @Test
    void fingerprint_正常ケース_同じ行を繰り返しハッシュする_同じ値が返ること() {
        Map<String, Object> row = row("id", 42, "name", "alice");

        HashCode first = RowFingerprinter.fingerprint(row, PK);
        HashCode second = RowFingerprinter.fingerprint(new HashMap<>(row), PK);

        assertEquals(first, second);
        assertEquals(256, first.bits());
    }

    @Test
    void fingerprint_正常ケース_主キー以外の列が異なる_同じ値が返ること() {
        assertEquals(RowFingerprinter.fingerprint(row("id", 1, "name", "a"), PK),
                RowFingerprinter.fingerprint(row("id", 1, "name", "b"), PK));
    }

    @Test
    void fingerprint_正常ケース_数値の表現が異なる_同じ値が返ること() {
        HashCode expected = RowFingerprinter.fingerprint(row("id", 1), PK);

        assertEquals(expected, RowFingerprinter.fingerprint(row("id", 1L), PK));
        assertEquals(expected, RowFingerprinter.fingerprint(row("id", new BigDecimal("1.00")), PK));
        assertEquals(expected, RowFingerprinter.fingerprint(row("id", BigInteger.ONE), PK));
        assertEquals(expected, RowFingerprinter.fingerprint(row("id", (short) 1), PK));
        assertEquals(expected, RowFingerprinter.fingerprint(row("id", 1.0d), PK));
        assertEquals(expected, RowFingerprinter.fingerprint(row("id", true), PK));
    }

    @Test
    void fingerprint_正常ケース_日時の表現が異なる_同じ値が返ること() {
        LocalDateTime ldt = LocalDateTime.of(2024, 3, 1, 12, 30, 15, 500_000_000);

        assertEquals(RowFingerprinter.fingerprint(row("id", ldt), PK),
                RowFingerprinter.fingerprint(row("id", Timestamp.valueOf(ldt)), PK));
        assertEquals(RowFingerprinter.fingerprint(row("id", LocalDate.of(2024, 3, 1)), PK),
                RowFingerprinter.fingerprint(row("id", java.sql.Date.valueOf("2024-03-01")), PK));
        assertEquals(
                RowFingerprinter.fingerprint(
                        row("id", OffsetDateTime.of(ldt, ZoneOffset.ofHours(9))), PK),
                RowFingerprinter.fingerprint(
                        row("id", OffsetDateTime.of(ldt.minusHours(9), ZoneOffset.UTC)), PK));
    }

    @Test
    void fingerprint_正常ケース_型が異なる同じ文字列表現_異なる値が返ること() {
        assertNotEquals(RowFingerprinter.fingerprint(row("id", 1), PK),
                RowFingerprinter.fingerprint(row("id", "1"), PK));
        assertNotEquals(RowFingerprinter.fingerprint(row("id", null), PK),
                RowFingerprinter.fingerprint(row("id", ""), PK));
        assertNotEquals(RowFingerprinter.fingerprint(row("id", null), PK),
                RowFingerprinter.fingerprint(row("id", "\u0000"), PK));
    }

    @Test
    void fingerprint_正常ケース_複合キーの境界が異なる_異なる値が返ること() {
        List<String> pk = List.of("a", "b");

        assertNotEquals(RowFingerprinter.fingerprint(row("a", "ab", "b", "c"), pk),
                RowFingerprinter.fingerprint(row("a", "a", "b", "bc"), pk));
    }

    @Test
    void fingerprint_正常ケース_主キー列の順序が異なる_異なる値が返ること() {
        Map<String, Object> row = row("a", 1, "b", 2);

        assertNotEquals(RowFingerprinter.fingerprint(row, List.of("a", "b")),
                RowFingerprinter.fingerprint(row, List.of("b", "a")));
    }

    @Test
    void fingerprint_正常ケース_MySQLとOracleから読み戻した値_同じ値が返ること() {
        DialectAdapter mysql = new MySqlDialectAdapter(10);
        DialectAdapter oracle = new OracleDialectAdapter(10);
        LocalDate day = LocalDate.of(2024, 1, 31);
        Map<String, Object> logical = row("id", 7, "day", day, "flag", true);
        Map<String, Object> fromOracle = row("id", new BigDecimal("7"),
                "day", oracle.decodeValue(oracle.coerceValue(day), ColumnType.DATE),
                "flag", oracle.decodeValue(oracle.coerceValue(true), ColumnType.BOOLEAN));
        Map<String, Object> fromMysql = row("id", 7L, "day", mysql.coerceValue(day),
                "flag", mysql.coerceValue(true));
        List<String> pk = List.of("id", "day", "flag");

        HashCode expected = RowFingerprinter.fingerprint(logical, pk);

        assertEquals(expected, RowFingerprinter.fingerprint(fromOracle, pk));
        assertEquals(expected, RowFingerprinter.fingerprint(fromMysql, pk));
    }

    @Test
    void fingerprint_異常ケース_主キー列が行に存在しない_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> RowFingerprinter.fingerprint(row("name", "x"), PK));
    }

    @Test
    void contentHash_正常ケース_非キー列が異なる_異なる値が返ること() {
        List<String> columns = List.of("id", "name");

        assertNotEquals(RowFingerprinter.contentHash(row("id", 1, "name", "a"), columns),
                RowFingerprinter.contentHash(row("id", 1, "name", "b"), columns));
        assertEquals(RowFingerprinter.contentHash(row("id", 1, "name", "a"), columns),
                RowFingerprinter.contentHash(row("name", "a", "id", 1L), columns));
    }

    @Test
    void index_正常ケース_行一覧を索引化する_指紋から行が引けること() {
        Map<String, Object> first = row("id", 1, "name", "a");
        Map<String, Object> second = row("id", 2, "name", "b");

        Map<HashCode, Map<String, Object>> index =
                RowFingerprinter.index(List.of(first, second), PK);

        assertEquals(2, index.size());
        assertEquals(second, index.get(RowFingerprinter.fingerprint(row("id", 2L), PK)));
    }

    @Test
    void index_異常ケース_主キーが重複する_IllegalStateExceptionが送出されること() {
        assertThrows(IllegalStateException.class, () -> RowFingerprinter
                .index(List.of(row("id", 1, "name", "a"), row("id", 1L, "name", "b")), PK));
    }

    @Test
    void canonicalize_正常ケース_各型を正規化する_型タグ付きの文字列が返ること() {
        assertEquals("n0", RowFingerprinter.canonicalize(new BigDecimal("0.000")));
        assertEquals("n-1.5", RowFingerprinter.canonicalize(-1.50d));
        assertEquals("n0", RowFingerprinter.canonicalize(false));
        assertEquals("fNaN", RowFingerprinter.canonicalize(Double.NaN));
        assertEquals("d2024-03-01", RowFingerprinter.canonicalize(LocalDate.of(2024, 3, 1)));
        assertEquals("t2024-03-01T10:00:00",
                RowFingerprinter.canonicalize(LocalDateTime.of(2024, 3, 1, 10, 0)));
        assertEquals("x00ff", RowFingerprinter.canonicalize(new byte[] {0, (byte) 0xff}));
        assertEquals("j{\"a\":1,\"b\":[1,2]}",
                RowFingerprinter.canonicalize(row("b", List.of(1, 2), "a", 1)));
        assertEquals("j[\"x\",\"y\"]", RowFingerprinter.canonicalize(new String[] {"x", "y"}));
        assertEquals("sabc", RowFingerprinter.canonicalize("abc"));
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
