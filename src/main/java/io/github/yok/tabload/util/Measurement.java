package io.github.yok.tabload.util;

import lombok.Value;

/**
 * Result of an operation measured by {@link PerformanceMonitor}, together with its metrics.
 *
 * @param <T> result type
 * @author Yasuharu.Okawauchi
 */
@Value
public class Measurement<T> {

    // Label given by the caller
    String label;

    // Value returned by the operation
    T result;

    long elapsedMillis;

    // Heap in use after the operation minus heap in use before it
    double memoryDeltaMb;

    // Heap in use after the operation
    double memoryAfterMb;
}
