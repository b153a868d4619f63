/**
 * Dialect adapters that translate change records into target-specific SQL.
 *
 * <p>
 * {@link io.github.yok.doltsync.db.DialectAdapter} composes the grammar, value and schema
 * contracts; one implementation exists per database family.
 * </p>
 */
package io.github.yok.doltsync.db;
