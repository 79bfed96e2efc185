package io.github.yok.tabload.db;

import io.github.yok.tabload.config.BackendType;
import io.github.yok.tabload.config.TargetDescriptor;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.postgresql.PostgresqlDataTypeFactory;

/**
 * Dialect handler for PostgreSQL. Tables live in the {@code public} schema.
 *
 * @author Yasuharu.Okawauchi
 */
public class PostgresqlDialectHandler implements DbDialectHandler {

    private final IDataTypeFactory dataTypeFactory = new PostgresqlDataTypeFactory();

    @Override
    public BackendType getBackendType() {
        return BackendType.POSTGRESQL;
    }

    @Override
    public String resolveSchema(TargetDescriptor target) {
        return "public";
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return dataTypeFactory;
    }
}
