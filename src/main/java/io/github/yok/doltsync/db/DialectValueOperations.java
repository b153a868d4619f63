package io.github.yok.doltsync.db;

import io.github.yok.doltsync.model.ColumnType;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Value transcoding between Java values and a target database.
 */
public interface DialectValueOperations {

    /**
     * Converts a value into a form the target can store.
     *
     * @param value source value (may be {@code null})
     * @return storable value
     */
    Object coerceValue(Object value);

    /**
     * Reverses {@link #coerceValue(Object)} for a value read back from the target.
     *
     * @param value value read from the target (may be {@code null})
     * @param type declared logical type, or {@code null} to return the value unchanged
     * @return decoded value
     * @throws IllegalArgumentException if the value cannot be decoded as the type
     */
    default Object decodeValue(Object value, ColumnType type) {
        return ValueCodec.decode(value, type);
    }

    /**
     * Coerces and binds one statement parameter.
     *
     * @param ps statement
     * @param index 1-based parameter index
     * @param value source value (may be {@code null})
     * @throws SQLException on binding failure
     */
    default void bindValue(PreparedStatement ps, int index, Object value) throws SQLException {
        Object coerced = coerceValue(value);
        if (coerced == null) {
            ps.setNull(index, Types.NULL);
        } else if (coerced instanceof byte[]) {
            ps.setBytes(index, (byte[]) coerced);
        } else {
            ps.setObject(index, coerced);
        }
    }
}
