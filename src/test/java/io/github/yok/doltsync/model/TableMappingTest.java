package io.github.yok.doltsync.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TableMappingTest {

    @Test
    void constructor_正常ケース_対象テーブル名を省略する_元テーブル名が使われること() {
        TableMapping mapping = new TableMapping("orders", " ", List.of("id", "a"), List.of("id"),
                null);

        assertEquals("orders", mapping.getTargetTable());
        assertEquals(Map.of(), mapping.getColumnTypes());
        assertNull(mapping.declaredType("a"));
    }

    @Test
    void constructor_異常ケース_主キーが列に含まれない_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> TableMapping.of("t", List.of("a"), List.of("id")));
        assertThrows(IllegalArgumentException.class,
                () -> TableMapping.of("t", List.of("id"), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> TableMapping.of("t", List.of(), List.of("id")));
        assertThrows(IllegalArgumentException.class,
                () -> TableMapping.of("t", List.of("id", "id"), List.of("id")));
        assertThrows(IllegalArgumentException.class,
                () -> TableMapping.of(" ", List.of("id"), List.of("id")));
    }

    @Test
    void constructor_異常ケース_宣言型が未知の列を参照する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> new TableMapping("t", "t",
                List.of("id"), List.of("id"), Map.of("x", ColumnType.DATE)));
    }

    @Test
    void reversed_正常ケース_別名の対象テーブル_元と対象が入れ替わること() {
        TableMapping mapping = new TableMapping("orders", "orders_copy", List.of("id", "a"),
                List.of("id"), Map.of("a", ColumnType.JSON));

        TableMapping reversed = mapping.reversed();

        assertEquals("orders_copy", reversed.getSourceTable());
        assertEquals("orders", reversed.getTargetTable());
        assertEquals(ColumnType.JSON, reversed.declaredType("a"));
        assertEquals(mapping, reversed.reversed());
    }

    @Test
    void nonKeyColumns_正常ケース_複合主キー_主キー以外の列が列順で返ること() {
        TableMapping mapping =
                TableMapping.of("t", List.of("a", "k1", "b", "k2"), List.of("k2", "k1"));

        assertEquals(List.of("a", "b"), mapping.nonKeyColumns());
        assertEquals(List.of("k2", "k1"), mapping.getPrimaryKeyColumns());
    }
}
