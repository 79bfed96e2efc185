package io.github.yok.tabload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code source} section in {@code application.yml}.
 *
 * <pre>
 * source:
 *   file-path: data/employees.csv
 *   delimiter: ","
 *   header: true
 *   encoding: UTF-8
 * </pre>
 *
 * <p>
 * Values are checked by {@link ConfigValidator#validateSource(SourceConfig)} before a reader is
 * built from them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "source")
@Data
public class SourceConfig {

    // Path of the delimited file to ingest
    private String filePath;

    // Single-character field delimiter
    private String delimiter = ",";

    // Whether the first record is a header row
    private boolean header = true;

    // Character set of the source file
    private String encoding = "UTF-8";
}
