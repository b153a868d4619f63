package io.github.yok.doltsync.exception;

import java.util.Set;
import lombok.Getter;

/**
 * The columns of a table changed in a way the table mapping cannot express. Fatal; the mapping must
 * be redefined.
 */
@Getter
public class SchemaMismatchException extends SyncException {

    private static final long serialVersionUID = 1L;

    private final String table;
    private final Set<String> missingColumns;

    /**
     * Creates an exception.
     *
     * @param table table name
     * @param missingColumns mapped columns absent on one side
     * @param message detail message
     */
    public SchemaMismatchException(String table, Set<String> missingColumns, String message) {
        super(message);
        this.table = table;
        this.missingColumns = Set.copyOf(missingColumns);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
