/**
 * Access to the version-control surface of Dolt.
 */
package io.github.yok.doltsync.dolt;
