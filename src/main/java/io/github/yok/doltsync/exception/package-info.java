/**
 * Failure taxonomy of the sync engine.
 *
 * <p>
 * {@code RefNotFoundException} and {@code SchemaMismatchException} are fatal;
 * {@code ApplyException} and {@code SyncConnectionException} are retryable by re-invoking the sync,
 * which resumes from the last advanced cursor.
 * </p>
 */
package io.github.yok.doltsync.exception;
