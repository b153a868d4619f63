package io.github.yok.doltsync.db;

import io.github.yok.doltsync.model.ColumnType;
import lombok.Value;

/**
 * Column of a table about to be created.
 *
 * <p>
 * {@code precision} and {@code scale} are only meaningful for {@link ColumnType#DECIMAL} and are
 * {@code 0} when nothing was observed.
 * </p>
 */
@Value
public class ColumnDefinition {
    String name;
    ColumnType type;
    boolean primaryKey;
    int precision;
    int scale;
}
