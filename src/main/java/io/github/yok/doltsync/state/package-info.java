/**
 * Persistence of sync cursors.
 */
package io.github.yok.doltsync.state;
