package io.github.yok.tabload.db;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.dataset.datatype.IDataTypeFactory;
import org.junit.jupiter.api.Test;

class DbUnitConfigFactoryTest {

    @Test
    void configure_正常ケース_方言とバッチサイズが適用されること() {
        DbDialectHandler dialect = mock(DbDialectHandler.class);
        IDataTypeFactory dataTypeFactory = mock(IDataTypeFactory.class);
        String[] tableTypes = {"TABLE", "BASE TABLE"};
        when(dialect.getDataTypeFactory()).thenReturn(dataTypeFactory);
        when(dialect.getTableTypes()).thenReturn(tableTypes);
        DatabaseConfig cfg = mock(DatabaseConfig.class);

        new DbUnitConfigFactory().configure(cfg, dialect, 250);

        verify(cfg).setProperty(eq(DatabaseConfig.PROPERTY_DATATYPE_FACTORY), eq(dataTypeFactory));
        verify(cfg).setProperty(eq(DatabaseConfig.PROPERTY_TABLE_TYPE), eq(tableTypes));
        verify(cfg).setProperty(eq(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS), eq(true));
        verify(cfg).setProperty(eq(DatabaseConfig.FEATURE_BATCHED_STATEMENTS), eq(true));
        verify(cfg).setProperty(eq(DatabaseConfig.PROPERTY_BATCH_SIZE), eq(250));
    }
}
