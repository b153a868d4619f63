package io.github.yok.doltsync.core;

import com.google.common.hash.HashCode;
import io.github.yok.doltsync.db.DialectAdapter;
import io.github.yok.doltsync.db.ValueCodec;
import io.github.yok.doltsync.model.ChangeRecord;
import io.github.yok.doltsync.model.TableMapping;
import io.github.yok.doltsync.util.CloseableIterator;
import io.github.yok.doltsync.util.ResultSetIterator;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Computes the changes that turn a Dolt table into the current content of an RDBMS table.
 *
 * <p>
 * The Dolt rows are indexed by fingerprint in one pass, keeping their content hash. The RDBMS rows
 * are then streamed once: an unknown fingerprint is an INSERT, a known fingerprint with a different
 * content hash is an UPDATE. Dolt rows never matched are DELETEs, emitted last in Dolt row order.
 * Both inputs must already be decoded to comparable Java values.
 * </p>
 */
@Slf4j
public class SnapshotDiffer {

    /**
     * Compares two snapshots of the same logical table.
     *
     * @param mapping table mapping (source = Dolt table)
     * @param doltRows rows currently in Dolt
     * @param sourceRows rows currently in the RDBMS
     * @return changes to apply to Dolt, in RDBMS order followed by deletions
     * @throws IllegalStateException if either side has duplicate primary keys
     */
    public List<ChangeRecord> diff(TableMapping mapping, Iterator<Map<String, Object>> doltRows,
            Iterator<Map<String, Object>> sourceRows) {
        List<String> pk = mapping.getPrimaryKeyColumns();
        List<String> columns = mapping.getColumns();
        Map<HashCode, IndexedRow> index = new LinkedHashMap<>();
        while (doltRows.hasNext()) {
            Map<String, Object> row = DiffExtractor.project(mapping, doltRows.next());
            HashCode fp = RowFingerprinter.fingerprint(row, pk);
            if (index.put(fp, new IndexedRow(row, RowFingerprinter.contentHash(row, columns)))
                    != null) {
                throw new IllegalStateException("Duplicate primary key in Dolt table "
                        + mapping.getSourceTable() + ": " + row);
            }
        }
        log.debug("Indexed {} Dolt row(s) of {}", index.size(), mapping.getSourceTable());

        List<ChangeRecord> changes = new ArrayList<>();
        Set<HashCode> seen = new HashSet<>();
        String table = mapping.getTargetTable();
        while (sourceRows.hasNext()) {
            Map<String, Object> row = DiffExtractor.project(mapping, sourceRows.next());
            HashCode fp = RowFingerprinter.fingerprint(row, pk);
            if (!seen.add(fp)) {
                throw new IllegalStateException("Duplicate primary key in table " + table + ": "
                        + row);
            }
            IndexedRow existing = index.remove(fp);
            if (existing == null) {
                changes.add(ChangeRecord.insert(table, fp, row));
            } else if (!existing.contentHash.equals(RowFingerprinter.contentHash(row, columns))) {
                changes.add(ChangeRecord.update(table, fp, existing.row, row));
            }
        }
        index.forEach((fp, remaining) -> changes.add(ChangeRecord.delete(table, fp,
                remaining.row)));
        return changes;
    }

    /**
     * Streams the mapped columns of an RDBMS table ordered by primary key. LOBs are always read
     * into strings and byte arrays; other values are decoded only for declared column types.
     *
     * @param connection RDBMS connection
     * @param adapter dialect of the connection
     * @param mapping table mapping (target = RDBMS table)
     * @return rows keyed by mapping column name
     * @throws SQLException if the query cannot be opened
     */
    public CloseableIterator<Map<String, Object>> readTable(Connection connection,
            DialectAdapter adapter, TableMapping mapping) throws SQLException {
        String sql = "SELECT " + adapter.quotedList(mapping.getColumns()) + " FROM "
                + adapter.quoteIdentifier(mapping.getTargetTable()) + " ORDER BY "
                + adapter.quotedList(mapping.getPrimaryKeyColumns());
        PreparedStatement ps = connection.prepareStatement(sql);
        try {
            return new ResultSetIterator<>(ps, ps.executeQuery(), rs -> {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < mapping.getColumns().size(); i++) {
                    row.put(mapping.getColumns().get(i),
                            ValueCodec.readLob(rs.getObject(i + 1)));
                }
                return decodeRow(adapter, mapping, row);
            }, "table " + mapping.getTargetTable());
        } catch (SQLException e) {
            ps.close();
            throw e;
        }
    }

    /**
     * Decodes the values of a row with the declared column types of the mapping.
     *
     * @param adapter dialect the row was read from
     * @param mapping table mapping
     * @param row row
     * @return decoded row
     */
    public static Map<String, Object> decodeRow(DialectAdapter adapter, TableMapping mapping,
            Map<String, Object> row) {
        if (mapping.getColumnTypes().isEmpty()) {
            return row;
        }
        Map<String, Object> decoded = new LinkedHashMap<>(row);
        mapping.getColumnTypes().forEach((column, type) -> decoded.computeIfPresent(column,
                (c, value) -> adapter.decodeValue(value, type)));
        return decoded;
    }

    private static final class IndexedRow {
        private final Map<String, Object> row;
        private final HashCode contentHash;

        private IndexedRow(Map<String, Object> row, HashCode contentHash) {
            this.row = row;
            this.contentHash = contentHash;
        }
    }
}
