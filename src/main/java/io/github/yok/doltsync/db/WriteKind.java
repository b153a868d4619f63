package io.github.yok.doltsync.db;

import io.github.yok.doltsync.model.ChangeOperation;
import io.github.yok.doltsync.model.OnConflictPolicy;

/**
 * Statement shape used to apply one change record.
 *
 * <table>
 * <caption>Resolution by operation and conflict policy</caption>
 * <tr><th>operation</th><th>UPDATE</th><th>IGNORE</th></tr>
 * <tr><td>INSERT</td><td>{@link #INSERT}</td><td>{@link #INSERT_IF_ABSENT}</td></tr>
 * <tr><td>UPDATE</td><td>{@link #UPSERT}</td><td>{@link #INSERT_IF_ABSENT}</td></tr>
 * <tr><td>DELETE</td><td>{@link #DELETE}</td><td>{@link #DELETE}</td></tr>
 * </table>
 *
 * <p>
 * INSERT records of a snapshot batch resolve like UPDATE records.
 * </p>
 */
public enum WriteKind {
    INSERT, UPSERT, INSERT_IF_ABSENT, DELETE;

    /**
     * Resolves the statement shape for a change of a diff or snapshot batch.
     *
     * @param operation change operation
     * @param policy conflict policy
     * @param snapshot whether the change belongs to a full table copy
     * @return statement shape
     */
    public static WriteKind resolve(ChangeOperation operation, OnConflictPolicy policy,
            boolean snapshot) {
        switch (operation) {
            case DELETE:
                return DELETE;
            case INSERT:
                if (policy == OnConflictPolicy.IGNORE) {
                    return INSERT_IF_ABSENT;
                }
                return snapshot ? UPSERT : INSERT;
            default:
                return policy == OnConflictPolicy.IGNORE ? INSERT_IF_ABSENT : UPSERT;
        }
    }
}
