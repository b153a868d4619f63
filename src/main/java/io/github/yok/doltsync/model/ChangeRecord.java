package io.github.yok.doltsync.model;

import com.google.common.base.Preconditions;
import com.google.common.hash.HashCode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Getter;

/**
 * One row-level change of a table between two commits.
 *
 * <p>
 * Invariants enforced at construction:
 * </p>
 * <ul>
 * <li>{@link ChangeOperation#INSERT} has no old row.</li>
 * <li>{@link ChangeOperation#DELETE} has no new row.</li>
 * <li>{@link ChangeOperation#UPDATE} has both rows.</li>
 * </ul>
 *
 * <p>
 * Row maps keep the column order they were given in and allow {@code null} values.
 * </p>
 */
@Getter
public final class ChangeRecord {

    // Name of the table the change belongs to
    private final String tableName;
    // Kind of change
    private final ChangeOperation operation;
    // Hash of the primary-key values (identity across systems)
    private final HashCode fingerprint;
    // Row before the change (null for INSERT)
    private final Map<String, Object> oldRow;
    // Row after the change (null for DELETE)
    private final Map<String, Object> newRow;

    private ChangeRecord(String tableName, ChangeOperation operation, HashCode fingerprint,
            Map<String, Object> oldRow, Map<String, Object> newRow) {
        Preconditions.checkNotNull(tableName, "tableName must not be null");
        Preconditions.checkNotNull(operation, "operation must not be null");
        Preconditions.checkNotNull(fingerprint, "fingerprint must not be null");
        switch (operation) {
            case INSERT:
                Preconditions.checkArgument(oldRow == null && newRow != null,
                        "INSERT requires a new row and no old row");
                break;
            case DELETE:
                Preconditions.checkArgument(oldRow != null && newRow == null,
                        "DELETE requires an old row and no new row");
                break;
            default:
                Preconditions.checkArgument(oldRow != null && newRow != null,
                        "UPDATE requires both old and new rows");
        }
        this.tableName = tableName;
        this.operation = operation;
        this.fingerprint = fingerprint;
        this.oldRow = copy(oldRow);
        this.newRow = copy(newRow);
    }

    /**
     * Creates an INSERT record.
     *
     * @param table table name
     * @param fingerprint primary-key fingerprint
     * @param newRow inserted row
     * @return record
     */
    public static ChangeRecord insert(String table, HashCode fingerprint,
            Map<String, Object> newRow) {
        return new ChangeRecord(table, ChangeOperation.INSERT, fingerprint, null, newRow);
    }

    /**
     * Creates an UPDATE record.
     *
     * @param table table name
     * @param fingerprint primary-key fingerprint
     * @param oldRow row before the change
     * @param newRow row after the change
     * @return record
     */
    public static ChangeRecord update(String table, HashCode fingerprint,
            Map<String, Object> oldRow, Map<String, Object> newRow) {
        return new ChangeRecord(table, ChangeOperation.UPDATE, fingerprint, oldRow, newRow);
    }

    /**
     * Creates a DELETE record.
     *
     * @param table table name
     * @param fingerprint primary-key fingerprint
     * @param oldRow deleted row
     * @return record
     */
    public static ChangeRecord delete(String table, HashCode fingerprint,
            Map<String, Object> oldRow) {
        return new ChangeRecord(table, ChangeOperation.DELETE, fingerprint, oldRow, null);
    }

    /**
     * Creates a record for the given operation.
     *
     * @param table table name
     * @param operation operation
     * @param fingerprint primary-key fingerprint
     * @param oldRow row before the change
     * @param newRow row after the change
     * @return record
     * @throws IllegalArgumentException if the rows violate the operation's invariant
     */
    public static ChangeRecord of(String table, ChangeOperation operation, HashCode fingerprint,
            Map<String, Object> oldRow, Map<String, Object> newRow) {
        return new ChangeRecord(table, operation, fingerprint, oldRow, newRow);
    }

    /**
     * Returns the row that identifies the change: the new row, or the old row for DELETE.
     *
     * @return key-bearing row
     */
    public Map<String, Object> keyRow() {
        return newRow != null ? newRow : oldRow;
    }

    private static Map<String, Object> copy(Map<String, Object> row) {
        if (row == null) {
            return null;
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(row));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChangeRecord)) {
            return false;
        }
        ChangeRecord other = (ChangeRecord) o;
        return tableName.equals(other.tableName) && operation == other.operation
                && fingerprint.equals(other.fingerprint) && Objects.equals(oldRow, other.oldRow)
                && Objects.equals(newRow, other.newRow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, operation, fingerprint, oldRow, newRow);
    }

    @Override
    public String toString() {
        return operation + "(" + tableName + ", " + keyRow() + ")";
    }
}
