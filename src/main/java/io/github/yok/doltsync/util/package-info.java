/**
 * Small helpers: JDBC connection handling, JSON transcoding and CLI error reporting.
 */
package io.github.yok.doltsync.util;
