package io.github.yok.doltsync.dolt;

import io.github.yok.doltsync.model.ChangeOperation;
import java.util.Map;
import lombok.Value;

/**
 * One row of a version-control diff, before projection onto a table mapping.
 */
@Value
public class RowDiff {
    // INSERT for "added", UPDATE for "modified", DELETE for "removed"
    ChangeOperation operation;
    // Column values at the from-commit (null for INSERT)
    Map<String, Object> fromRow;
    // Column values at the to-commit (null for DELETE)
    Map<String, Object> toRow;
}
