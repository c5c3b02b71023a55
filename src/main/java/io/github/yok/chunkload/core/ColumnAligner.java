package io.github.yok.chunkload.core;

import io.github.yok.chunkload.core.ColumnAlignment.AlignedColumn;
import io.github.yok.chunkload.db.TableColumn;
import io.github.yok.chunkload.db.TableDefinition;
import io.github.yok.chunkload.exception.SchemaMismatchException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Intersects a chunk header with the columns of the destination table.
 *
 * <p>
 * Names are compared case-insensitively after trimming; generated SQL uses the destination's
 * spelling. Each dropped header column is reported by one warning naming it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class ColumnAligner {

    /**
     * Aligns a header with a destination table.
     *
     * @param header chunk header names in file order
     * @param table destination table read from metadata
     * @return the alignment
     * @throws SchemaMismatchException if the table has no columns or shares none with the header
     */
    public ColumnAlignment align(List<String> header, TableDefinition table) {
        if (table.isEmpty()) {
            throw new SchemaMismatchException(
                    "Destination table " + table.getName() + " does not exist or has no columns");
        }

        Map<String, TableColumn> byKey = new LinkedHashMap<>();
        for (TableColumn column : table.getColumns()) {
            byKey.putIfAbsent(key(column.getName()), column);
        }

        List<AlignedColumn> aligned = new ArrayList<>();
        List<String> dropped = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i);
            String key = key(name);
            if (!seen.add(key)) {
                log.warn("[{}] Duplicate column '{}' in chunk header ignored", table.getName(),
                        name);
                dropped.add(name);
                continue;
            }
            TableColumn destination = byKey.get(key);
            if (destination == null) {
                log.warn("[{}] Column '{}' does not exist in the destination table; dropped",
                        table.getName(), name);
                dropped.add(name);
                continue;
            }
            aligned.add(new AlignedColumn(i, destination));
        }

        if (aligned.isEmpty()) {
            throw new SchemaMismatchException("No column of the chunk header " + header
                    + " exists in destination table " + table.getName());
        }

        List<String> unfilled = new ArrayList<>();
        for (Map.Entry<String, TableColumn> entry : byKey.entrySet()) {
            if (!seen.contains(entry.getKey())) {
                unfilled.add(entry.getValue().getName());
            }
        }
        if (!unfilled.isEmpty()) {
            log.debug("[{}] Columns not present in the chunk, left to defaults: {}",
                    table.getName(), unfilled);
        }
        return new ColumnAlignment(table, header.size(), aligned, dropped, unfilled);
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
