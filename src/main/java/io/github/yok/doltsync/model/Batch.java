package io.github.yok.doltsync.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Ordered, bounded group of change records applied in one target transaction.
 *
 * <p>
 * {@code boundaryCommit} is the commit the cursor may move to once the batch is committed and
 * {@code stepOffset} is the number of records of the same commit step applied before this batch.
 * A snapshot batch copies a whole table; its INSERT records may hit rows the target already holds.
 * </p>
 */
@Getter
@ToString(exclude = "records")
public final class Batch {

    private final List<ChangeRecord> records;
    private final String boundaryCommit;
    private final long stepOffset;
    private final boolean snapshot;

    /**
     * Creates a batch of diff records.
     *
     * @param records records in diff order
     * @param boundaryCommit commit reached when the step containing this batch completes
     * @param stepOffset records of the step applied before this batch
     */
    public Batch(List<ChangeRecord> records, String boundaryCommit, long stepOffset) {
        this(records, boundaryCommit, stepOffset, false);
    }

    /**
     * Creates a batch.
     *
     * @param records records in diff order
     * @param boundaryCommit commit reached when the step containing this batch completes
     * @param stepOffset records of the step applied before this batch
     * @param snapshot whether the records are a full table copy
     */
    public Batch(List<ChangeRecord> records, String boundaryCommit, long stepOffset,
            boolean snapshot) {
        this.records = ImmutableList.copyOf(records);
        this.boundaryCommit = boundaryCommit;
        this.stepOffset = stepOffset;
        this.snapshot = snapshot;
    }

    /**
     * Returns the number of records.
     *
     * @return size
     */
    public int size() {
        return records.size();
    }

    /**
     * Returns whether the batch has no records.
     *
     * @return {@code true} when empty
     */
    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Returns the record at the given position.
     *
     * @param index position in the batch
     * @return record
     */
    public ChangeRecord get(int index) {
        return records.get(index);
    }
}
