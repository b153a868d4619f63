package io.github.yok.doltsync.model;

/**
 * Behavior when a written row already exists on the target side.
 *
 * <ul>
 * <li>{@link #UPDATE}: the incoming row overwrites the existing one (upsert).</li>
 * <li>{@link #IGNORE}: the existing row is kept; the incoming row is written only when absent.</li>
 * </ul>
 */
public enum OnConflictPolicy {
    UPDATE, IGNORE
}
