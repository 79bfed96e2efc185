package io.github.yok.tabload.util;

import com.google.common.base.Stopwatch;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Explicit wrapper that times an operation and samples heap usage around it.
 *
 * <p>
 * Callers compose it around the step they want measured; nothing is attached implicitly. Metrics
 * are logged at INFO and returned with the result. Exceptions thrown by the operation propagate
 * unchanged and no metrics are produced for it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class PerformanceMonitor {

    private static final double MB = 1024d * 1024d;

    // Heap bytes in use (replaceable in tests)
    private final LongSupplier usedBytes;

    /**
     * Creates a monitor over the current JVM.
     */
    public PerformanceMonitor() {
        this(() -> Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory());
    }

    PerformanceMonitor(LongSupplier usedBytes) {
        this.usedBytes = usedBytes;
    }

    /**
     * Runs and measures an operation.
     *
     * @param label name logged with the metrics
     * @param operation operation to run
     * @param <T> result type
     * @return result and metrics
     */
    public <T> Measurement<T> measure(String label, Supplier<T> operation) {
        double before = usedMb();
        Stopwatch stopwatch = Stopwatch.createStarted();
        T result = operation.get();
        long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        double after = usedMb();

        Measurement<T> m = new Measurement<>(label, result, elapsed, after - before, after);
        log.info("Performance metrics for {}: time={} ms, memory delta={} MB, heap in use={} MB",
                label, elapsed, String.format("%.2f", m.getMemoryDeltaMb()),
                String.format("%.2f", after));
        return m;
    }

    private double usedMb() {
        return usedBytes.getAsLong() / MB;
    }
}
