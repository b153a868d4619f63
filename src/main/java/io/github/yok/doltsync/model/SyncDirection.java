package io.github.yok.doltsync.model;

import java.util.Locale;

/**
 * Direction of a sync job.
 */
public enum SyncDirection {

    /**
     * Dolt commits are replayed onto a relational target.
     */
    FORWARD,

    /**
     * A relational table is copied into Dolt and committed.
     */
    REVERSE;

    /**
     * Parses a CLI/configuration value.
     *
     * <p>
     * Accepts {@code forward}/{@code reverse} as well as the aliases {@code dolt-to-target} and
     * {@code target-to-dolt}, case-insensitively.
     * </p>
     *
     * @param value raw value
     * @return direction
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static SyncDirection parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("direction must not be blank");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "forward":
            case "dolt-to-target":
                return FORWARD;
            case "reverse":
            case "target-to-dolt":
                return REVERSE;
            default:
                throw new IllegalArgumentException("Unknown sync direction: " + value);
        }
    }
}
