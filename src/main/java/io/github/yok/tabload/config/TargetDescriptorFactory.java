package io.github.yok.tabload.config;

import io.github.yok.tabload.exception.ConfigInvalidException;
import java.nio.file.Paths;
import java.util.function.UnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link TargetDescriptor} from a {@link TargetConfig}.
 *
 * <p>
 * URL shapes:
 * </p>
 * <ul>
 * <li>embedded: {@code jdbc:h2:file:<absolute database path>}</li>
 * <li>networked: {@code jdbc:<scheme>://<host>:<port>/<database>}</li>
 * </ul>
 *
 * <p>
 * Credentials of networked backends come from the process environment ({@value #ENV_USER},
 * {@value #ENV_PASSWORD}) and are passed to the driver separately, never embedded in the URL. The
 * embedded backend falls back to H2's default account when the variables are unset.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class TargetDescriptorFactory {

    /**
     * Environment variable holding the database user.
     */
    public static final String ENV_USER = "DB_USER";

    /**
     * Environment variable holding the database password.
     */
    public static final String ENV_PASSWORD = "DB_PASSWORD";

    private final ConfigValidator validator;

    // Environment lookup (replaceable in tests)
    private final UnaryOperator<String> environment;

    /**
     * Creates a factory reading credentials from {@link System#getenv(String)}.
     */
    public TargetDescriptorFactory() {
        this(new ConfigValidator(), System::getenv);
    }

    /**
     * Creates a factory with a custom validator and environment lookup.
     *
     * @param validator configuration validator
     * @param environment environment variable lookup
     */
    TargetDescriptorFactory(ConfigValidator validator, UnaryOperator<String> environment) {
        this.validator = validator;
        this.environment = environment;
    }

    /**
     * Validates the configuration and builds the descriptor.
     *
     * @param config target configuration
     * @return immutable descriptor
     * @throws ConfigInvalidException if the configuration or the credentials are incomplete
     */
    public TargetDescriptor create(TargetConfig config) {
        validator.validateTarget(config);
        BackendType type = BackendType.fromValue(config.getType());

        String user = environment.apply(ENV_USER);
        String password = environment.apply(ENV_PASSWORD);
        if (type.isEmbedded()) {
            user = StringUtils.defaultIfBlank(user, "sa");
            password = StringUtils.defaultString(password);
        } else if (StringUtils.isBlank(user)) {
            throw new ConfigInvalidException(ENV_USER,
                    "environment variable is required for backend '" + type.getScheme() + "'");
        }

        TargetDescriptor descriptor = TargetDescriptor.builder().backendType(type)
                .url(buildUrl(type, config)).user(user).password(password)
                .table(config.getTable().trim()).mode(LoadMode.fromValue(config.getMode()))
                .batchSize(config.getBatchSize()).createIndexes(config.isCreateIndexes())
                .build();
        log.info("Target resolved: {}", descriptor.describe());
        return descriptor;
    }

    /**
     * Builds the JDBC URL for the backend.
     *
     * @param type backend type
     * @param config target configuration
     * @return JDBC URL without credentials
     */
    String buildUrl(BackendType type, TargetConfig config) {
        String database = config.getDatabase().trim();
        if (type.isEmbedded()) {
            // H2 rejects paths that are implicitly relative to the working directory
            return "jdbc:" + type.getScheme() + ":file:"
                    + Paths.get(database).toAbsolutePath().normalize();
        }
        int port = config.getPort() != null ? config.getPort() : type.getDefaultPort();
        return "jdbc:" + type.getScheme() + "://" + config.getHost().trim() + ":" + port + "/"
                + database;
    }
}
