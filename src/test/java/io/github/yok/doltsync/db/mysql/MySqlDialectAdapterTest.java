package io.github.yok.doltsync.db.mysql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.doltsync.core.RowFingerprinter;
import io.github.yok.doltsync.db.ColumnDefinition;
import io.github.yok.doltsync.db.DialectType;
import io.github.yok.doltsync.db.WriteKind;
import io.github.yok.doltsync.model.Batch;
import io.github.yok.doltsync.model.ChangeRecord;
import io.github.yok.doltsync.model.ColumnType;
import io.github.yok.doltsync.model.OnConflictPolicy;
import io.github.yok.doltsync.model.TableMapping;
import io.github.yok.doltsync.support.H2Support;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.Test;

class MySqlDialectAdapterTest {

    private static final TableMapping ORDERS =
            TableMapping.of("orders", List.of("id", "status"), List.of("id"));

    private final MySqlDialectAdapter adapter = new MySqlDialectAdapter(100);

    @Test
    void quoteIdentifier_正常ケース_バッククォートを含む_エスケープされること() {
        assertEquals("`a``b`", adapter.quoteIdentifier("a`b"));
        assertEquals(DialectType.MYSQL, adapter.getType());
        assertEquals(100, adapter.getStatementBatchSize());
    }

    @Test
    void buildSql_正常ケース_各書き込み種別_MySQL構文のSQLが返ること() {
        assertEquals("INSERT INTO `orders` (`id`, `status`) VALUES (?, ?)",
                adapter.buildSql(WriteKind.INSERT, ORDERS));
        assertEquals("INSERT INTO `orders` (`id`, `status`) VALUES (?, ?)"
                + " ON DUPLICATE KEY UPDATE `status` = VALUES(`status`)",
                adapter.buildSql(WriteKind.UPSERT, ORDERS));
        assertEquals("INSERT INTO `orders` (`id`, `status`) VALUES (?, ?)"
                + " ON DUPLICATE KEY UPDATE `id` = `id`",
                adapter.buildSql(WriteKind.INSERT_IF_ABSENT, ORDERS));
        assertEquals("DELETE FROM `orders` WHERE `id` = ?",
                adapter.buildSql(WriteKind.DELETE, ORDERS));
    }

    @Test
    void buildUpsertSql_正常ケース_主キー列のみのテーブル_存在しない場合のみ挿入するSQLが返ること() {
        TableMapping keysOnly = TableMapping.of("link", List.of("a", "b"), List.of("a", "b"));

        assertEquals(adapter.buildInsertIfAbsentSql(keysOnly), adapter.buildUpsertSql(keysOnly));
        assertEquals("DELETE FROM `link` WHERE `a` = ? AND `b` = ?",
                adapter.buildDeleteSql(keysOnly));
    }

    @Test
    void sqlType_正常ケース_各論理型_MySQLの型が返ること() {
        assertEquals("VARCHAR(255) NOT NULL", adapter.sqlType(column(ColumnType.STRING, true)));
        assertEquals("TEXT", adapter.sqlType(column(ColumnType.STRING, false)));
        assertEquals("INT NOT NULL", adapter.sqlType(column(ColumnType.INTEGER, true)));
        assertEquals("DATETIME(6)", adapter.sqlType(column(ColumnType.TIMESTAMP, false)));
        assertEquals("LONGTEXT", adapter.sqlType(column(ColumnType.ARRAY, false)));
        assertEquals("LONGBLOB", adapter.sqlType(column(ColumnType.BINARY, false)));
        assertEquals("DECIMAL(38, 10)", adapter.sqlType(column(ColumnType.DECIMAL, false)));
        assertEquals("DECIMAL(7, 3)", adapter.sqlType(
                new ColumnDefinition("amount", ColumnType.DECIMAL, false, 7, 3)));
        assertEquals("DECIMAL(65, 30)", adapter.sqlType(
                new ColumnDefinition("amount", ColumnType.DECIMAL, false, 90, 40)));
    }

    @Test
    void coerceValue_正常ケース_配列とUUIDと大きな整数_書き込み可能な値へ変換されること() {
        UUID uuid = UUID.fromString("00000000-0000-0000-0000-000000000001");

        assertEquals("[\"a\",\"b\"]", adapter.coerceValue(List.of("a", "b")));
        assertEquals("{\"k\":1}", adapter.coerceValue(Map.of("k", 1)));
        assertEquals(uuid.toString(), adapter.coerceValue(uuid));
        assertEquals(new BigDecimal("123"), adapter.coerceValue(BigInteger.valueOf(123)));
        assertEquals("x", adapter.coerceValue("x"));
    }

    @Test
    void apply_正常ケース_H2へ追加更新削除を適用する_テーブル内容が反映されること() throws Exception {
        try (Connection conn = H2Support.open("mysql_apply")) {
            H2Support.execute(conn,
                    "CREATE TABLE orders (id INT PRIMARY KEY, status VARCHAR(20))",
                    "INSERT INTO orders VALUES (1, 'new'), (2, 'new')");
            Batch batch = new Batch(List.of(
                    ChangeRecord.update("orders", fp(1), row(1, "new"), row(1, "paid")),
                    ChangeRecord.delete("orders", fp(2), row(2, "new")),
                    ChangeRecord.insert("orders", fp(3), row(3, null))), "c2", 0);

            long applied = adapter.apply(conn, batch, ORDERS, OnConflictPolicy.UPDATE);
            conn.commit();

            assertEquals(3L, applied);
            ITable table = H2Support.query(conn, "orders", "SELECT * FROM orders ORDER BY id");
            assertEquals(2, table.getRowCount());
            assertEquals("paid", table.getValue(0, "status"));
            assertEquals(3, ((Number) table.getValue(1, "id")).intValue());
        }
    }

    @Test
    void apply_正常ケース_IGNOREポリシーで既存行に挿入する_既存行が保持されること() throws Exception {
        try (Connection conn = H2Support.open("mysql_ignore")) {
            H2Support.execute(conn,
                    "CREATE TABLE orders (id INT PRIMARY KEY, status VARCHAR(20))",
                    "INSERT INTO orders VALUES (1, 'kept')");
            Batch batch = new Batch(
                    List.of(ChangeRecord.insert("orders", fp(1), row(1, "incoming"))), "c2", 0);

            adapter.apply(conn, batch, ORDERS, OnConflictPolicy.IGNORE);
            conn.commit();

            ITable table = H2Support.query(conn, "orders", "SELECT status FROM orders");
            assertEquals("kept", table.getValue(0, "status"));
        }
    }

    @Test
    void createIfNotExists_正常ケース_テーブルが存在しない_推論した型で作成されること() throws Exception {
        try (Connection conn = H2Support.open("mysql_create")) {
            Batch batch = new Batch(List.of(ChangeRecord.insert("orders", fp(1), row(1, "new"))),
                    "c1", 0);

            assertFalse(adapter.tableExists(conn, "orders"));
            assertTrue(adapter.createIfNotExists(conn, ORDERS, batch));
            assertTrue(adapter.tableExists(conn, "ORDERS"));
            assertFalse(adapter.createIfNotExists(conn, ORDERS, batch));
            assertEquals("CREATE TABLE `orders` (`id` INT NOT NULL, `status` TEXT,"
                    + " PRIMARY KEY (`id`))", adapter.buildCreateTableSql(ORDERS, List.of(
                            new ColumnDefinition("id", ColumnType.INTEGER, true, 0, 0),
                            new ColumnDefinition("status", ColumnType.STRING, false, 0, 0))));
        }
    }

    private static ColumnDefinition column(ColumnType type, boolean primaryKey) {
        return new ColumnDefinition("c", type, primaryKey, 0, 0);
    }

    private static com.google.common.hash.HashCode fp(int id) {
        return RowFingerprinter.fingerprint(Map.of("id", id), List.of("id"));
    }

    private static Map<String, Object> row(int id, String status) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("status", status);
        return row;
    }
}
