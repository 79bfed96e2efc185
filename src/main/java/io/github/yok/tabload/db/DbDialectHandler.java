package io.github.yok.tabload.db;

import io.github.yok.tabload.config.BackendType;
import io.github.yok.tabload.config.TargetDescriptor;
import io.github.yok.tabload.schema.TableSchema;
import org.dbunit.dataset.datatype.IDataTypeFactory;

/**
 * Backend-specific DBUnit setup and DDL used by the sink.
 *
 * <p>
 * The DDL defaults use syntax shared by all supported backends ({@code IF EXISTS} /
 * {@code IF NOT EXISTS}); implementations override where their grammar differs.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DbDialectHandler {

    /**
     * Returns the backend this handler serves.
     *
     * @return backend type
     */
    BackendType getBackendType();

    /**
     * Resolves the schema DBUnit should read table metadata from.
     *
     * @param target target descriptor
     * @return schema name
     */
    String resolveSchema(TargetDescriptor target);

    /**
     * Returns the DBUnit data type factory for this backend.
     *
     * @return data type factory
     */
    IDataTypeFactory getDataTypeFactory();

    /**
     * Returns the JDBC table types DBUnit should treat as tables.
     *
     * @return table types
     */
    default String[] getTableTypes() {
        return new String[] {"TABLE"};
    }

    /**
     * Whether the sink provisions indexes on this backend. Only the embedded backend is
     * index-managed; networked schemas are left to external schema management.
     *
     * @return {@code true} if indexes are created after a load
     */
    default boolean supportsIndexManagement() {
        return getBackendType().isEmbedded();
    }

    default String dropTableSql(String table) {
        return "DROP TABLE IF EXISTS " + table;
    }

    default String createTableSql(TableSchema schema, String table) {
        return "CREATE TABLE IF NOT EXISTS " + table + " (" + schema.toColumnDeclarations() + ")";
    }

    /**
     * Returns an idempotent index creation statement.
     *
     * @param table table name
     * @param column indexed column
     * @return DDL
     */
    default String createIndexSql(String table, String column) {
        return "CREATE INDEX IF NOT EXISTS " + indexName(table, column) + " ON " + table + " ("
                + column + ")";
    }

    default String indexName(String table, String column) {
        return "idx_" + table + "_" + column;
    }
}
