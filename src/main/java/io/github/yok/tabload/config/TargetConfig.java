package io.github.yok.tabload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code target} section in {@code application.yml}.
 *
 * <pre>
 * target:
 *   type: h2            # h2 | postgresql | mysql
 *   host: localhost     # networked backends only
 *   port: 5432          # networked backends only
 *   database: ./data/employees
 *   table: employees
 *   mode: replace       # append | replace
 *   batch-size: 10000
 *   create-indexes: true
 * </pre>
 *
 * <p>
 * Credentials are never read from this file; see {@link TargetDescriptorFactory}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "target")
@Data
public class TargetConfig {

    // Backend kind name, resolved through BackendType#fromValue
    private String type;

    // Host name of a networked backend
    private String host;

    // Port of a networked backend; the backend default is used when unset
    private Integer port;

    // Database name, or the database file path for the embedded backend
    private String database;

    // Target table name
    private String table = "employees";

    // Load mode name, resolved through LoadMode#fromValue
    private String mode = "append";

    // Rows submitted per insert batch
    private int batchSize = TargetDescriptor.DEFAULT_BATCH_SIZE;

    // Whether to provision indexes after a load (embedded backend only)
    private boolean createIndexes = true;
}
