package io.github.yok.doltsync.util;

import io.github.yok.doltsync.exception.SyncConnectionException;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import lombok.extern.slf4j.Slf4j;

/**
 * Lazily maps the rows of an open {@link ResultSet}.
 *
 * <p>
 * The iterator owns the statement and the result set and closes both when it is closed or
 * exhausted. Read failures surface as {@link SyncConnectionException} when the connection is lost
 * and as {@link IllegalStateException} otherwise.
 * </p>
 *
 * @param <T> element type
 */
@Slf4j
public class ResultSetIterator<T> implements CloseableIterator<T> {

    /**
     * Maps the current row of a result set.
     *
     * @param <T> element type
     */
    @FunctionalInterface
    public interface RowMapper<T> {
        /**
         * Maps the current row.
         *
         * @param rs result set positioned on a row
         * @return element
         * @throws SQLException on read failure
         */
        T map(ResultSet rs) throws SQLException;
    }

    private final Statement statement;
    private final ResultSet resultSet;
    private final RowMapper<T> mapper;
    private final String description;
    private Boolean hasRow;
    private boolean closed;

    /**
     * Creates an iterator.
     *
     * @param statement statement that produced the result set
     * @param resultSet open result set
     * @param mapper row mapper
     * @param description label used in error messages
     */
    public ResultSetIterator(Statement statement, ResultSet resultSet, RowMapper<T> mapper,
            String description) {
        this.statement = statement;
        this.resultSet = resultSet;
        this.mapper = mapper;
        this.description = description;
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        if (hasRow == null) {
            try {
                hasRow = resultSet.next();
            } catch (SQLException e) {
                close();
                throw readFailure(e);
            }
            if (!hasRow) {
                close();
            }
        }
        return hasRow;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException(description);
        }
        try {
            return mapper.map(resultSet);
        } catch (SQLException e) {
            close();
            throw readFailure(e);
        } finally {
            hasRow = null;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            resultSet.close();
        } catch (SQLException e) {
            log.warn("Failed to close result set ({}): {}", description, e.getMessage());
        }
        try {
            statement.close();
        } catch (SQLException e) {
            log.warn("Failed to close statement ({}): {}", description, e.getMessage());
        }
    }

    /**
     * Reads the current row into an ordered column map using column labels.
     *
     * @param rs result set positioned on a row
     * @return column label to value map
     * @throws SQLException on read failure
     */
    public static Map<String, Object> readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            row.put(meta.getColumnLabel(i), rs.getObject(i));
        }
        return row;
    }

    private RuntimeException readFailure(SQLException e) {
        if (SyncConnectionException.isConnectionFailure(e)) {
            return new SyncConnectionException("Connection lost while reading " + description, e);
        }
        return new IllegalStateException("Failed to read " + description + ": " + e.getMessage(),
                e);
    }
}
