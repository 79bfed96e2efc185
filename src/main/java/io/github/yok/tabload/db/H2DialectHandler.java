package io.github.yok.tabload.db;

import io.github.yok.tabload.config.BackendType;
import io.github.yok.tabload.config.TargetDescriptor;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.dbunit.ext.h2.H2DataTypeFactory;

/**
 * Dialect handler for the embedded H2 file backend.
 *
 * @author Yasuharu.Okawauchi
 */
public class H2DialectHandler implements DbDialectHandler {

    private final IDataTypeFactory dataTypeFactory = new H2DataTypeFactory();

    @Override
    public BackendType getBackendType() {
        return BackendType.H2;
    }

    @Override
    public String resolveSchema(TargetDescriptor target) {
        return "PUBLIC";
    }

    @Override
    public IDataTypeFactory getDataTypeFactory() {
        return dataTypeFactory;
    }

    // H2 2.x reports ordinary tables as "BASE TABLE"
    @Override
    public String[] getTableTypes() {
        return new String[] {"TABLE", "BASE TABLE"};
    }
}
