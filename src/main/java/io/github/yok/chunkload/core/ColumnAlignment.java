package io.github.yok.chunkload.core;

import io.github.yok.chunkload.db.TableColumn;
import io.github.yok.chunkload.db.TableDefinition;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;

/**
 * Result of matching a chunk header against the destination table.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ColumnAlignment {

    TableDefinition table;

    // Number of fields in the chunk header; data rows of any other width are malformed
    int headerSize;

    // Columns written on insert, in header order
    List<AlignedColumn> columns;

    // Header names with no destination column, plus repeated header names
    List<String> droppedColumns;

    // Destination columns absent from the header, left to their default on insert
    List<String> unfilledColumns;

    /**
     * Returns the destination names of the written columns in header order.
     *
     * @return destination column names
     */
    public List<String> destinationNames() {
        return columns.stream().map(c -> c.getDestination().getName())
                .collect(Collectors.toList());
    }

    /**
     * Returns whether the header names exactly the destination columns, each once.
     *
     * @return {@code true} when nothing is dropped and nothing is left unfilled
     */
    public boolean isExact() {
        return droppedColumns.isEmpty() && unfilledColumns.isEmpty()
                && columns.size() == headerSize;
    }

    /**
     * A header field mapped to its destination column.
     */
    @Value
    public static class AlignedColumn {

        // Zero-based position of the field in each record
        int headerIndex;

        TableColumn destination;
    }
}
