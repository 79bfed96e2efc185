package io.github.yok.tabload.core;

import io.github.yok.tabload.config.LoadMode;
import java.util.List;
import lombok.Value;

/**
 * Outcome of a successful {@link RelationalSink#load}.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class LoadResult {

    String table;

    LoadMode mode;

    // Rows inserted by this load
    int rowsWritten;

    // Number of insert batches submitted
    int batches;

    // Index statements executed after the load (empty when not index-managed)
    List<String> indexes;
}
