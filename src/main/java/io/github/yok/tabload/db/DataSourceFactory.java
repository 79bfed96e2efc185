package io.github.yok.tabload.db;

import io.github.yok.tabload.config.TargetDescriptor;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link DataSource} for a target.
 *
 * <p>
 * The data source is not pooled: each {@code getConnection()} opens a fresh connection, which the
 * caller closes when its logical operation ends.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DataSourceFactory {

    /**
     * Creates a non-pooling data source.
     *
     * @param target target descriptor
     * @return data source
     * @throws IllegalStateException if the JDBC driver class cannot be loaded
     */
    public DataSource create(TargetDescriptor target) {
        DriverManagerDataSource ds = new DriverManagerDataSource(target.getUrl(),
                target.getUser(), target.getPassword());
        ds.setDriverClassName(target.getBackendType().getDriverClass());
        log.debug("DataSource created: {}", target.describe());
        return ds;
    }
}
