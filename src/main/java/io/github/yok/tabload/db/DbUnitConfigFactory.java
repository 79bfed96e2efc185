package io.github.yok.tabload.db;

import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.DatabaseConfig;
import org.springframework.stereotype.Component;

/**
 * Applies the sink's settings to DBUnit's {@link DatabaseConfig} in one place.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbUnitConfigFactory {

    /**
     * Configures a DBUnit connection for batched inserts.
     *
     * @param cfg DBUnit configuration of the connection
     * @param dialect backend dialect
     * @param batchSize rows per JDBC batch
     */
    public void configure(DatabaseConfig cfg, DbDialectHandler dialect, int batchSize) {
        // 1) Data type factory
        cfg.setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY, dialect.getDataTypeFactory());
        log.debug("DBUnit: DataTypeFactory set to {}",
                dialect.getDataTypeFactory().getClass().getSimpleName());

        // 2) Table types visible to metadata lookups
        cfg.setProperty(DatabaseConfig.PROPERTY_TABLE_TYPE, dialect.getTableTypes());

        // 3) Empty strings are data, not missing values
        cfg.setProperty(DatabaseConfig.FEATURE_ALLOW_EMPTY_FIELDS, Boolean.TRUE);

        // 4) Batched statements sized to the load batch
        cfg.setProperty(DatabaseConfig.FEATURE_BATCHED_STATEMENTS, Boolean.TRUE);
        cfg.setProperty(DatabaseConfig.PROPERTY_BATCH_SIZE, batchSize);
        log.debug("DBUnit: batched statements enabled, batch size = {}", batchSize);
    }
}
