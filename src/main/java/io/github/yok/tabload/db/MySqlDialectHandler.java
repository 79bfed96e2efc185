package io.github.yok.tabload.db;

import io.github.yok.tabload.config.BackendType;
import io.github.yok.tabload.config.TargetDescriptor;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.mysql.MySqlDataTypeFactory;

/**
 * Dialect handler for MySQL. The DBUnit schema is the database named in the JDBC URL.
 *
 * @author Yasuharu.Okawauchi
 */
public class MySqlDialectHandler implements DbDialectHandler {

    private final IDataTypeFactory dataTypeFactory = new MySqlDataTypeFactory();

    @Override
    public BackendType getBackendType() {
        return BackendType.MYSQL;
    }

    @Override
    public String resolveSchema(TargetDescriptor target) {
        return resolveDatabase(target.getUrl());
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return dataTypeFactory;
    }

    /**
     * Extracts the database name from a MySQL JDBC URL.
     *
     * @param jdbcUrl JDBC URL
     * @return database name
     * @throws IllegalArgumentException if the URL names no database
     */
    static String resolveDatabase(String jdbcUrl) {
        int slash = jdbcUrl == null ? -1 : jdbcUrl.lastIndexOf('/');
        if (slash < 0 || slash == jdbcUrl.length() - 1) {
            throw new IllegalArgumentException("No database in MySQL URL: " + jdbcUrl);
        }
        String tail = jdbcUrl.substring(slash + 1);
        int q = tail.indexOf('?');
        String dbName = q >= 0 ? tail.substring(0, q) : tail;
        if (dbName.isBlank()) {
            throw new IllegalArgumentException("No database in MySQL URL: " + jdbcUrl);
        }
        return dbName;
    }
}
