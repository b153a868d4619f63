package io.github.yok.doltsync.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.doltsync.core.RowFingerprinter;
import io.github.yok.doltsync.model.ChangeRecord;
import io.github.yok.doltsync.model.ColumnType;
import io.github.yok.doltsync.model.TableMapping;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TableSchemaInferenceTest {

    private static final TableMapping MAPPING = new TableMapping("t", "t",
            List.of("id", "amount", "note", "tags"), List.of("id"),
            Map.of("tags", ColumnType.ARRAY));

    @Test
    void infer_正常ケース_複数行の値を観測する_型が拡張され小数の桁が記録されること() {
        List<ChangeRecord> records = List.of(
                insert(row(1, new BigDecimal("12.345"), null, "[]")),
                insert(row(2L, new BigDecimal("1234.5"), null, List.of("a"))));

        List<ColumnDefinition> columns = TableSchemaInference.infer(MAPPING, records);

        assertEquals(4, columns.size());
        assertEquals(new ColumnDefinition("id", ColumnType.BIGINT, true, 0, 0), columns.get(0));
        assertEquals(new ColumnDefinition("amount", ColumnType.DECIMAL, false, 7, 3),
                columns.get(1));
        assertEquals(ColumnType.STRING, columns.get(2).getType());
        assertEquals(ColumnType.ARRAY, columns.get(3).getType());
        assertTrue(columns.get(0).isPrimaryKey());
        assertFalse(columns.get(3).isPrimaryKey());
    }

    @Test
    void infer_正常ケース_行がない_宣言型以外は文字列となること() {
        List<ColumnDefinition> columns = TableSchemaInference.infer(MAPPING, List.of());

        assertEquals(ColumnType.STRING, columns.get(0).getType());
        assertEquals(ColumnType.ARRAY, columns.get(3).getType());
    }

    @Test
    void infer_正常ケース_数値と文字列が混在する_文字列へ拡張されること() {
        List<ChangeRecord> records = List.of(insert(row(1, "x", null, null)),
                insert(row(2, new BigDecimal("1.5"), null, null)));

        assertEquals(ColumnType.STRING,
                TableSchemaInference.infer(MAPPING, records).get(1).getType());
    }

    private static ChangeRecord insert(Map<String, Object> row) {
        return ChangeRecord.insert("t", RowFingerprinter.fingerprint(row, List.of("id")), row);
    }

    private static Map<String, Object> row(Object id, Object amount, Object note, Object tags) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("amount", amount);
        row.put("note", note);
        row.put("tags", tags);
        return row;
    }
}
