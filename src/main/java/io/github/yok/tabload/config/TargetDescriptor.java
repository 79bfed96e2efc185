package io.github.yok.tabload.config;

import io.github.yok.tabload.util.MaskingLogUtil;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Immutable, validated description of where and how rows are written.
 *
 * <p>
 * Built by {@link TargetDescriptorFactory}; every sink and query component takes one in its
 * constructor instead of reading shared configuration.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class TargetDescriptor {

    /**
     * Rows per insert batch when nothing else is configured.
     */
    public static final int DEFAULT_BATCH_SIZE = 10_000;

    BackendType backendType;

    // Full JDBC URL without credentials
    String url;

    String user;

    @ToString.Exclude
    String password;

    String table;

    LoadMode mode;

    @Builder.Default
    int batchSize = DEFAULT_BATCH_SIZE;

    @Builder.Default
    boolean createIndexes = true;

    /**
     * Returns a one-line summary that is safe to log.
     *
     * @return masked summary
     */
    public String describe() {
        return "type=" + backendType.getScheme() + ", url=" + url
                + ", user=" + MaskingLogUtil.maskText(user) + ", table=" + table + ", mode="
                + mode + ", batchSize=" + batchSize;
    }
}
