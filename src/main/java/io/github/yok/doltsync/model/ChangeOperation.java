package io.github.yok.doltsync.model;

import java.util.Locale;

/**
 * Kind of row-level change between two commits of a versioned table.
 */
public enum ChangeOperation {

    /**
     * Row exists only in the newer commit.
     */
    INSERT,

    /**
     * Row exists in both commits with different non-key values.
     */
    UPDATE,

    /**
     * Row exists only in the older commit.
     */
    DELETE;

    /**
     * Resolves an operation from the {@code diff_type} column of Dolt's diff functions.
     *
     * @param diffType {@code added}, {@code modified} or {@code removed}
     * @return matching operation
     * @throws IllegalArgumentException if the diff type is unknown
     */
    public static ChangeOperation fromDiffType(String diffType) {
        if (diffType == null) {
            throw new IllegalArgumentException("diff_type must not be null");
        }
        switch (diffType.toLowerCase(Locale.ROOT)) {
            case "added":
                return INSERT;
            case "modified":
                return UPDATE;
            case "removed":
                return DELETE;
            default:
                throw new IllegalArgumentException("Unknown diff_type: " + diffType);
        }
    }
}
