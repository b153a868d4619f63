/**
 * The sync pipeline: fingerprinting, extraction, snapshot comparison and orchestration.
 */
package io.github.yok.doltsync.core;
