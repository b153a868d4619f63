package io.github.yok.doltsync.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.doltsync.core.SnapshotDiffer;
import io.github.yok.doltsync.core.SyncOrchestrator;
import io.github.yok.doltsync.core.SyncRequest;
import io.github.yok.doltsync.core.SyncSession;
import io.github.yok.doltsync.db.DialectAdapter;
import io.github.yok.doltsync.db.mysql.MySqlDialectAdapter;
import io.github.yok.doltsync.model.ChangeRecord;
import io.github.yok.doltsync.model.ColumnType;
import io.github.yok.doltsync.model.CursorKey;
import io.github.yok.doltsync.model.OnConflictPolicy;
import io.github.yok.doltsync.model.SyncDirection;
import io.github.yok.doltsync.model.SyncPhase;
import io.github.yok.doltsync.model.SyncResult;
import io.github.yok.doltsync.model.TableMapping;
import io.github.yok.doltsync.state.JdbcSyncStateStore;
import io.github.yok.doltsync.support.H2Support;
import io.github.yok.doltsync.support.InMemoryVersionControl;
import io.github.yok.doltsync.util.CloseableIterator;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * 実DBを同期先とした同期シナリオの共通定義です。
 *
 * <p>
 * Dolt 側は {@link InMemoryVersionControl} で代替し、同期先のみコンテナ上の実DBを利用します。
 * 同期結果の検証は、Dolt のスナップショットと同期先テーブルを {@link SnapshotDiffer} で比較し、
 * 差分がないことで行います。テーブル名はテストごとに一意です。
 * </p>
 */
abstract class TargetSyncScenarios {

    private static final List<String> COLUMNS =
            List.of("id", "customer", "amount", "shipped_on");
    private static final List<String> PK = List.of("id");

    private Connection target;
    private DialectAdapter adapter;
    private InMemoryVersionControl vc;
    private TableMapping mapping;
    private JdbcSyncStateStore store;
    private CursorKey key;

    /**
     * 同期先DBへの自動コミット無効の接続を開きます。
     *
     * @return 接続
     * @throws SQLException 接続に失敗した場合
     */
    abstract Connection openTarget() throws SQLException;

    /**
     * 同期先DBの方言を返します。
     *
     * @return 方言アダプタ
     */
    abstract DialectAdapter targetAdapter();

    @BeforeEach
    void setUpScenario() throws SQLException {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        target = openTarget();
        target.setAutoCommit(false);
        adapter = targetAdapter();
        vc = new InMemoryVersionControl();
        Map<String, ColumnType> types = new LinkedHashMap<>();
        types.put("amount", ColumnType.DECIMAL);
        types.put("shipped_on", ColumnType.DATE);
        mapping = new TableMapping("orders_" + suffix, "orders_" + suffix, COLUMNS, PK, types);
        store = new JdbcSyncStateStore(target, adapter, "cursor_" + suffix, Clock.systemUTC());
        key = new CursorKey(mapping.getSourceTable(), "db1", SyncDirection.FORWARD);
    }

    @AfterEach
    void tearDownScenario() throws SQLException {
        target.rollback();
        target.close();
    }

    @Test
    void sync_正常ケース_初回同期で表を作成する_Doltと同期先の内容が一致すること() throws Exception {
        String a = vc.commit(mapping.getSourceTable(), COLUMNS, PK,
                List.of(row(1, "alice", "10.50", 2024, 1, 31), row(2, "bob", "0.00", 2024, 2, 1),
                        row(3, "carol", "99999.99", 2023, 12, 24)));

        SyncResult result = orchestrator(vc, null).sync(forward().build());

        assertEquals(SyncPhase.DONE, result.getPhase());
        assertEquals(3L, result.getRowsApplied());
        assertTrue(adapter.tableExists(target, mapping.getTargetTable()));
        assertNoDifference(a);
        assertEquals(a, store.get(key).orElseThrow().getLastCommit());
    }

    @Test
    void sync_正常ケース_更新削除追加を含むコミットを同期する_変更が反映されカーソルが進むこと()
            throws Exception {
        vc.commit(mapping.getSourceTable(), COLUMNS, PK,
                List.of(row(1, "alice", "10.50", 2024, 1, 31), row(2, "bob", "0.00", 2024, 2, 1)));
        orchestrator(vc, null).sync(forward().build());
        String b = vc.commit(mapping.getSourceTable(), COLUMNS, PK,
                List.of(row(1, "alice", "12.00", 2024, 3, 1), row(4, "dave", "1.25", 2024, 3, 2)));

        SyncResult result = orchestrator(vc, null).sync(forward().build());

        assertEquals(3L, result.getRowsApplied());
        assertEquals(b, result.getCursorAdvancedTo());
        assertNoDifference(b);
        assertEquals(b, store.get(key).orElseThrow().getLastCommit());

        SyncResult again = orchestrator(vc, null).sync(forward().build());

        assertEquals(0L, again.getRowsApplied());
        assertNoDifference(b);
    }

    @Test
    void sync_正常ケース_IGNOREで既存行と衝突する_既存行が保持されること() throws Exception {
        String a = vc.commit(mapping.getSourceTable(), COLUMNS, PK,
                List.of(row(1, "alice", "1.00", 2024, 1, 1)));
        orchestrator(vc, null).sync(forward().build());
        execute("UPDATE " + adapter.quoteIdentifier(mapping.getTargetTable()) + " SET "
                + adapter.quoteIdentifier("customer") + " = ?", "edited");
        store.reset(key);

        SyncResult result = orchestrator(vc, null)
                .sync(forward().onConflict(OnConflictPolicy.IGNORE).build());

        assertEquals(SyncPhase.DONE, result.getPhase());
        assertEquals(a, store.get(key).orElseThrow().getLastCommit());
        List<ChangeRecord> changes = difference(a);
        assertEquals(1, changes.size());
        assertEquals("edited", changes.get(0).getNewRow().get("customer"));
    }

    @Test
    void sync_正常ケース_同期先の変更を逆方向に同期する_Doltにコミットが作成されること()
            throws Exception {
        Connection dolt = H2Support.open("dolt");
        try {
            String table = mapping.getSourceTable();
            H2Support.execute(dolt, "CREATE TABLE " + table + " (id INT NOT NULL PRIMARY KEY,"
                    + " customer VARCHAR(40), amount DECIMAL(12, 2), shipped_on DATE)",
                    "INSERT INTO " + table + " VALUES (1, 'alice', 10.50, DATE '2024-01-31'),"
                            + " (2, 'bob', 0.00, DATE '2024-02-01')");
            InMemoryVersionControl working = new InMemoryVersionControl(dolt);
            working.track(table, PK);
            working.commitChanges("initial", List.of(table));
            orchestrator(working, dolt).sync(forward().build());
            execute("UPDATE " + adapter.quoteIdentifier(mapping.getTargetTable()) + " SET "
                    + adapter.quoteIdentifier("customer") + " = ? WHERE "
                    + adapter.quoteIdentifier("id") + " = 2", "robert");

            SyncResult result = orchestrator(working, dolt)
                    .sync(forward().direction(SyncDirection.REVERSE).build());

            assertEquals(1L, result.getRowsApplied());
            String head = working.resolveCommit("HEAD");
            assertEquals(head, result.getCursorAdvancedTo());
            assertEquals(2, working.history().size());
            assertEquals("robert", working.rowsAt(table, head).get(1).get("customer"));
        } finally {
            dolt.close();
        }
    }

    private SyncOrchestrator orchestrator(InMemoryVersionControl versionControl,
            Connection dolt) {
        SyncSession session = SyncSession.builder().targetId("db1").doltConnection(dolt)
                .targetConnection(target).versionControl(versionControl)
                .doltAdapter(new MySqlDialectAdapter(50)).targetAdapter(adapter)
                .stateStore(store).build();
        return new SyncOrchestrator(session, "dolt");
    }

    private SyncRequest.SyncRequestBuilder forward() {
        return SyncRequest.builder().mapping(mapping).targetId("db1").batchSize(2);
    }

    private void assertNoDifference(String commit) throws SQLException {
        List<ChangeRecord> changes = difference(commit);
        assertTrue(changes.isEmpty(), () -> "unexpected differences: " + changes);
    }

    private List<ChangeRecord> difference(String commit) throws SQLException {
        try (CloseableIterator<Map<String, Object>> dolt =
                vc.snapshotRows(mapping.getSourceTable(), commit, PK);
                CloseableIterator<Map<String, Object>> rows =
                        new SnapshotDiffer().readTable(target, adapter, mapping)) {
            return new SnapshotDiffer().diff(mapping, dolt, rows);
        } finally {
            target.commit();
        }
    }

    private void execute(String sql, String value) throws SQLException {
        try (PreparedStatement ps = target.prepareStatement(sql)) {
            ps.setString(1, value);
            ps.executeUpdate();
        }
        target.commit();
    }

    private static Map<String, Object> row(int id, String customer, String amount, int year,
            int month, int day) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("customer", customer);
        row.put("amount", new BigDecimal(amount));
        row.put("shipped_on", LocalDate.of(year, month, day));
        return row;
    }
}
