package io.github.yok.chunkload.db;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * Destination table with its columns in ordinal order.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TableDefinition {

    // Table name as stored by the database
    String name;

    List<TableColumn> columns;

    /**
     * Returns whether the table was not found or has no columns.
     *
     * @return {@code true} when no column is known
     */
    public boolean isEmpty() {
        return columns.isEmpty();
    }

    /**
     * Returns the primary-key column names in ordinal order.
     *
     * @return primary-key columns, empty when the table has no primary key
     */
    public List<String> getPrimaryKeyColumns() {
        return columns.stream().filter(TableColumn::isPrimaryKey).map(TableColumn::getName)
                .collect(Collectors.toList());
    }
}
