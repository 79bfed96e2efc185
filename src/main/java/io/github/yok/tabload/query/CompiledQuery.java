package io.github.yok.tabload.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Value;

/**
 * SQL template with named placeholders ({@code :name}) and the value bound to each placeholder.
 *
 * <p>
 * Every placeholder in {@link #getSql()} has exactly one entry in {@link #getParameters()}; no
 * caller-supplied value appears in the SQL text.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class CompiledQuery {

    String sql;

    // placeholder name (without colon) -> bound value, in placeholder order
    Map<String, Object> parameters;

    public CompiledQuery(String sql, Map<String, Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
