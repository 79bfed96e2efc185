package io.github.yok.tabload.db;

import io.github.yok.tabload.config.BackendType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory class that creates a {@link DbDialectHandler} according to the backend type.
 *
 * <ul>
 * <li>{@code H2}: {@link H2DialectHandler}</li>
 * <li>{@code POSTGRESQL}: {@link PostgresqlDialectHandler}</li>
 * <li>{@code MYSQL}: {@link MySqlDialectHandler}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DbDialectHandlerFactory {

    /**
     * Creates the handler for a backend.
     *
     * @param type backend type
     * @return dialect handler
     * @throws IllegalArgumentException if the type is {@code null}
     */
    public DbDialectHandler create(BackendType type) {
        if (type == null) {
            throw new IllegalArgumentException("Backend type must not be null");
        }
        switch (type) {
            case H2:
                return new H2DialectHandler();
            case POSTGRESQL:
                return new PostgresqlDialectHandler();
            case MYSQL:
                return new MySqlDialectHandler();
            default:
                String msg = "Unsupported backend type: " + type;
                log.error(msg);
                throw new IllegalArgumentException(msg);
        }
    }
}
