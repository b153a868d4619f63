package io.github.yok.doltsync.db;

/**
 * Target database families with a dedicated dialect adapter.
 */
public enum DialectType {
    MYSQL, POSTGRESQL, ORACLE
}
