package io.github.yok.doltsync.exception;

import io.github.yok.doltsync.model.ChangeRecord;
import lombok.Getter;

/**
 * A batch could not be committed on the target. The whole batch is rolled back; progress made by
 * earlier batches is kept and a re-run resumes from the cursor.
 */
@Getter
public class ApplyException extends SyncException {

    private static final long serialVersionUID = 1L;

    // Position of the offending record within its batch (-1 when unknown)
    private final int recordIndex;

    // Offending record (null when unknown)
    private final transient ChangeRecord record;

    /**
     * Creates an exception.
     *
     * @param message detail message
     * @param recordIndex position of the failing record in the batch
     * @param record failing record
     * @param cause driver error
     */
    public ApplyException(String message, int recordIndex, ChangeRecord record, Throwable cause) {
        super(message, cause);
        this.recordIndex = recordIndex;
        this.record = record;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
