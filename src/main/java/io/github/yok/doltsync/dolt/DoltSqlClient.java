package io.github.yok.doltsync.dolt;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.github.yok.doltsync.exception.RefNotFoundException;
import io.github.yok.doltsync.exception.SyncConnectionException;
import io.github.yok.doltsync.model.ChangeOperation;
import io.github.yok.doltsync.util.CloseableIterator;
import io.github.yok.doltsync.util.ResultSetIterator;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link VersionControl} over the SQL interface of a running {@code dolt sql-server}.
 *
 * <p>
 * Uses the Dolt system functions and procedures:
 * </p>
 * <ul>
 * <li>{@code HASHOF(ref)} to resolve refs</li>
 * <li>{@code DOLT_LOG(to, '--not', from)} to list commits</li>
 * <li>{@code DOLT_DIFF(from, to, table)} for row-level diffs</li>
 * <li>{@code SELECT ... AS OF commit} for snapshots</li>
 * <li>{@code DOLT_ADD}, {@code dolt_status} and {@code DOLT_COMMIT} to record changes</li>
 * <li>{@code dolt_branches} and {@code DOLT_CHECKOUT} to switch branches</li>
 * </ul>
 *
 * <p>
 * The connection is owned by the caller. With streaming enabled, at most one diff or snapshot
 * iterator may be open at a time, which is a restriction of the MySQL driver.
 * </p>
 */
@Slf4j
public class DoltSqlClient implements VersionControl {

    // MySQL error code for "table doesn't exist"
    private static final int ER_NO_SUCH_TABLE = 1146;

    private final Connection connection;
    private final String author;
    private final boolean streamingResults;

    /**
     * Creates a client.
     *
     * @param connection connection to the Dolt SQL server
     * @param author commit author in {@code Name <email>} form
     * @param streamingResults stream diff and snapshot rows instead of buffering them
     */
    public DoltSqlClient(Connection connection, String author, boolean streamingResults) {
        this.connection = connection;
        this.author = author;
        this.streamingResults = streamingResults;
    }

    @Override
    public String resolveCommit(String ref) {
        try (PreparedStatement ps = connection.prepareStatement("SELECT HASHOF(?)")) {
            ps.setString(1, ref);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next() && rs.getString(1) != null) {
                    return rs.getString(1);
                }
            }
        } catch (SQLException e) {
            if (SyncConnectionException.isConnectionFailure(e)) {
                throw new SyncConnectionException("Connection lost resolving ref " + ref, e);
            }
            throw new RefNotFoundException(ref, e);
        }
        throw new RefNotFoundException(ref, "Ref did not resolve to a commit: " + ref);
    }

    @Override
    public List<String> listCommits(String fromExclusive, String toInclusive) {
        List<String> newestFirst = new ArrayList<>();
        String sql = "SELECT commit_hash FROM DOLT_LOG(?, '--not', ?)";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, toInclusive);
            ps.setString(2, fromExclusive);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    newestFirst.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            throw failure("listing commits " + fromExclusive + ".." + toInclusive, e,
                    toInclusive);
        }
        List<String> commits = ImmutableList.copyOf(Lists.reverse(newestFirst));
        if (!commits.isEmpty() && !commits.get(commits.size() - 1).equals(toInclusive)) {
            throw new IllegalStateException("Commit log does not end at " + toInclusive + ": "
                    + commits);
        }
        log.debug("Commits in ({}, {}]: {}", fromExclusive, toInclusive, commits.size());
        return commits;
    }

    @Override
    public Optional<List<String>> tableColumns(String table, String commit) {
        String sql = "SELECT * FROM " + quote(table) + " AS OF ? LIMIT 0";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, commit);
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData meta = rs.getMetaData();
                List<String> columns = new ArrayList<>(meta.getColumnCount());
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    columns.add(meta.getColumnLabel(i));
                }
                return Optional.of(columns);
            }
        } catch (SQLException e) {
            if (e.getErrorCode() == ER_NO_SUCH_TABLE || "42S02".equals(e.getSQLState())) {
                return Optional.empty();
            }
            throw failure("reading columns of " + table + " at " + commit, e, commit);
        }
    }

    @Override
    public CloseableIterator<RowDiff> diffRows(String table, String fromCommit,
            String toCommit) {
        String sql = "SELECT * FROM DOLT_DIFF(?, ?, ?)";
        String description = "diff of " + table + " " + fromCommit + ".." + toCommit;
        return query(sql, description, toCommit, DoltSqlClient::toRowDiff, fromCommit, toCommit,
                table);
    }

    @Override
    public CloseableIterator<Map<String, Object>> snapshotRows(String table, String commit,
            List<String> orderBy) {
        String sql = "SELECT * FROM " + quote(table) + " AS OF ?";
        if (!orderBy.isEmpty()) {
            sql += " ORDER BY "
                    + orderBy.stream().map(DoltSqlClient::quote).collect(Collectors.joining(", "));
        }
        return query(sql, "snapshot of " + table + " at " + commit, commit,
                ResultSetIterator::readRow, commit);
    }

    @Override
    public String commitChanges(String message, List<String> tables) {
        Preconditions.checkArgument(!tables.isEmpty(), "no tables to commit");
        try {
            for (String table : tables) {
                try (PreparedStatement ps = connection.prepareStatement("CALL DOLT_ADD(?)")) {
                    ps.setString(1, table);
                    ps.execute();
                }
            }
            if (!hasStagedChanges(tables)) {
                String head = resolveCommit("HEAD");
                log.warn("Nothing to commit for {}; Dolt HEAD stays at {}", tables, head);
                return head;
            }
            try (PreparedStatement ps =
                    connection.prepareStatement("CALL DOLT_COMMIT('-m', ?, '--author', ?)")) {
                ps.setString(1, message);
                ps.setString(2, author);
                if (ps.execute()) {
                    try (ResultSet rs = ps.getResultSet()) {
                        if (rs.next()) {
                            String hash = rs.getString(1);
                            log.info("Dolt commit {} created: {}", hash, message);
                            return hash;
                        }
                    }
                }
            }
        } catch (SQLException e) {
            if (SyncConnectionException.isConnectionFailure(e)) {
                throw new SyncConnectionException("Connection lost during DOLT_COMMIT", e);
            }
            throw new IllegalStateException("DOLT_COMMIT failed: " + e.getMessage(), e);
        }
        throw new IllegalStateException("DOLT_COMMIT returned no commit hash");
    }

    @Override
    public void checkoutBranch(String branch) {
        try {
            boolean exists;
            try (PreparedStatement ps = connection
                    .prepareStatement("SELECT COUNT(*) FROM dolt_branches WHERE name = ?")) {
                ps.setString(1, branch);
                try (ResultSet rs = ps.executeQuery()) {
                    exists = rs.next() && rs.getLong(1) > 0;
                }
            }
            String sql = exists ? "CALL DOLT_CHECKOUT(?)" : "CALL DOLT_CHECKOUT('-b', ?)";
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                ps.setString(1, branch);
                ps.execute();
            }
            if (exists) {
                log.debug("Checked out Dolt branch {}", branch);
            } else {
                log.info("Created Dolt branch {} from HEAD", branch);
            }
        } catch (SQLException e) {
            throw failure("checking out branch " + branch, e, branch);
        }
    }

    private boolean hasStagedChanges(List<String> tables) throws SQLException {
        String placeholders = tables.stream().map(t -> "?").collect(Collectors.joining(", "));
        String sql = "SELECT COUNT(*) FROM dolt_status WHERE staged = TRUE AND table_name IN ("
                + placeholders + ")";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (int i = 0; i < tables.size(); i++) {
                ps.setString(i + 1, tables.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        }
    }

    /**
     * Quotes an identifier with backticks.
     *
     * @param identifier identifier
     * @return quoted identifier
     */
    static String quote(String identifier) {
        return "`" + identifier.replace("`", "``") + "`";
    }

    /**
     * Splits a {@code DOLT_DIFF} row into its from- and to-images.
     *
     * @param rs result set positioned on a diff row
     * @return diff row
     * @throws SQLException on read failure
     */
    static RowDiff toRowDiff(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> from = new LinkedHashMap<>();
        Map<String, Object> to = new LinkedHashMap<>();
        String diffType = null;
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            String label = meta.getColumnLabel(i);
            if ("diff_type".equalsIgnoreCase(label)) {
                diffType = rs.getString(i);
            } else if (label.startsWith("from_") && !isCommitColumn(label, "from_")) {
                from.put(label.substring("from_".length()), rs.getObject(i));
            } else if (label.startsWith("to_") && !isCommitColumn(label, "to_")) {
                to.put(label.substring("to_".length()), rs.getObject(i));
            }
        }
        ChangeOperation operation = ChangeOperation.fromDiffType(diffType);
        return new RowDiff(operation, operation == ChangeOperation.INSERT ? null : from,
                operation == ChangeOperation.DELETE ? null : to);
    }

    private static boolean isCommitColumn(String label, String prefix) {
        String rest = label.substring(prefix.length());
        return "commit".equals(rest) || "commit_date".equals(rest);
    }

    private <T> CloseableIterator<T> query(String sql, String description, String ref,
            ResultSetIterator.RowMapper<T> mapper, String... params) {
        PreparedStatement ps = null;
        try {
            ps = connection.prepareStatement(sql, ResultSet.TYPE_FORWARD_ONLY,
                    ResultSet.CONCUR_READ_ONLY);
            if (streamingResults) {
                ps.setFetchSize(Integer.MIN_VALUE);
            }
            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            log.debug("Opening {}", description);
            return new ResultSetIterator<>(ps, ps.executeQuery(), mapper, description);
        } catch (SQLException e) {
            closeQuietly(ps);
            throw failure(description, e, ref);
        }
    }

    private RuntimeException failure(String what, SQLException e, String ref) {
        if (SyncConnectionException.isConnectionFailure(e)) {
            return new SyncConnectionException("Connection lost while " + what, e);
        }
        String message =
                e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("not found") && !message.contains("table not found")) {
            return new RefNotFoundException(ref, e);
        }
        return new IllegalStateException("Failed " + what + ": " + e.getMessage(), e);
    }

    private static void closeQuietly(PreparedStatement ps) {
        if (ps == null) {
            return;
        }
        try {
            ps.close();
        } catch (SQLException e) {
            log.warn("Failed to close statement: {}", e.getMessage());
        }
    }
}
