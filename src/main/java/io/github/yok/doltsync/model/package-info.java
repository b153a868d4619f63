/**
 * Value types of the sync engine: change records, table mappings, batches, cursors and results.
 */
package io.github.yok.doltsync.model;
