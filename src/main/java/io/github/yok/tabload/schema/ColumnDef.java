package io.github.yok.tabload.schema;

import lombok.Value;

/**
 * One declared column: lower-case name and semantic type.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ColumnDef {

    // Column name as used in SQL and in the source header
    String name;

    // Semantic type
    ColumnType type;
}
