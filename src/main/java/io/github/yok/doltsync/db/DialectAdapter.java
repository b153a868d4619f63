package io.github.yok.doltsync.db;

import io.github.yok.doltsync.model.Batch;
import io.github.yok.doltsync.model.OnConflictPolicy;
import io.github.yok.doltsync.model.TableMapping;
import java.sql.Connection;

/**
 * Writes change records into one target database family.
 *
 * <p>
 * Adapters hold no state between calls and never commit; the caller owns the transaction. This
 * interface composes the grammar, value and schema contracts of the dialect.
 * </p>
 */
public interface DialectAdapter extends DialectSchemaOperations, DialectValueOperations {

    /**
     * Returns the database family.
     *
     * @return dialect type
     */
    DialectType getType();

    /**
     * Returns how many statements are sent per JDBC batch.
     *
     * @return statement batch size
     */
    int getStatementBatchSize();

    /**
     * Applies a batch inside the caller's transaction.
     *
     * @param connection connection with auto-commit disabled
     * @param batch change records
     * @param mapping table mapping
     * @param onConflict conflict policy
     * @return number of change records applied
     * @throws io.github.yok.doltsync.exception.ApplyException if a record cannot be written
     * @throws io.github.yok.doltsync.exception.SyncConnectionException if the connection is lost
     */
    default long apply(Connection connection, Batch batch, TableMapping mapping,
            OnConflictPolicy onConflict) {
        return new StatementBatchExecutor(this, getStatementBatchSize()).execute(connection,
                batch, mapping, onConflict);
    }
}
