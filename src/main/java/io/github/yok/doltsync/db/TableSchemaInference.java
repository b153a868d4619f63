package io.github.yok.doltsync.db;

import com.google.common.collect.ImmutableList;
import io.github.yok.doltsync.model.ChangeRecord;
import io.github.yok.doltsync.model.ColumnType;
import io.github.yok.doltsync.model.TableMapping;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import lombok.Generated;

/**
 * Infers column definitions for a missing target table from the rows of a batch.
 *
 * <p>
 * A declared type in the mapping wins. Otherwise the observed Java types of the column are widened
 * with {@link ColumnType#widen(ColumnType, ColumnType)}; a column with only {@code null} values is
 * {@link ColumnType#STRING}. For decimals the widest integer part and the largest scale seen are
 * recorded so that dialects with bounded {@code DECIMAL} can size the column.
 * </p>
 */
public final class TableSchemaInference {

    /**
     * Prevents instantiation.
     */
    @Generated
    private TableSchemaInference() {}

    /**
     * Infers column definitions in mapping order.
     *
     * @param mapping table mapping
     * @param records records whose rows are inspected (may be empty)
     * @return column definitions
     */
    public static List<ColumnDefinition> infer(TableMapping mapping, List<ChangeRecord> records) {
        ImmutableList.Builder<ColumnDefinition> columns = ImmutableList.builder();
        for (String column : mapping.getColumns()) {
            ColumnType type = mapping.declaredType(column);
            int integerDigits = 0;
            int scale = 0;
            boolean observe = type == null;
            for (ChangeRecord record : records) {
                Map<String, Object> row = record.keyRow();
                Object value = row.get(column);
                if (observe) {
                    type = ColumnType.widen(type, ColumnType.infer(value));
                }
                BigDecimal decimal = toDecimal(value);
                if (decimal != null) {
                    integerDigits = Math.max(integerDigits, decimal.precision() - decimal.scale());
                    scale = Math.max(scale, Math.max(decimal.scale(), 0));
                }
            }
            if (type == null) {
                type = ColumnType.STRING;
            }
            boolean pk = mapping.getPrimaryKeyColumns().contains(column);
            int precision = type == ColumnType.DECIMAL ? integerDigits + scale : 0;
            columns.add(new ColumnDefinition(column, type, pk, precision,
                    type == ColumnType.DECIMAL ? scale : 0));
        }
        return columns.build();
    }

    private static BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        return null;
    }
}
