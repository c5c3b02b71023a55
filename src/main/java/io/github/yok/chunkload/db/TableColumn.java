package io.github.yok.chunkload.db;

import lombok.Value;

/**
 * Column of a destination table as reported by JDBC metadata.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TableColumn {

    // Column name as stored by the database
    String name;

    // java.sql.Types code
    int sqlType;

    // Database type name, for example int4 or timestamptz
    String typeName;

    boolean primaryKey;
}
