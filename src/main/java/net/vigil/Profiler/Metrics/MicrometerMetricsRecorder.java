package net.vigil.Profiler.Metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.vigil.Profiler.CustomObject.TraceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of MetricsRecorder.
 */
public class MicrometerMetricsRecorder implements MetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetricsRecorder.class);

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final MeterRegistry meterRegistry;

    public MicrometerMetricsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordTrace(TraceKind kind, double runtimeMs, boolean failed) {
        try {
            Timer.builder("vigil.trace.runtime")
                    .tag("kind", kind.tag())
                    .tag("status", failed ? "failure" : "success")
                    .register(meterRegistry)
                    .record((long) (runtimeMs * NANOS_PER_MILLI), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            logger.warn("failed to record trace metrics for kind {}: {}", kind, e.getMessage());
        }
    }

    @Override
    public void recordError(String exceptionType) {
        try {
            Counter.builder("vigil.error.count")
                    .tag("exception", exceptionType)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record error metrics for {}: {}", exceptionType, e.getMessage());
        }
    }

    @Override
    public void recordDeliveryFailure(String endpoint) {
        try {
            Counter.builder("vigil.delivery.failure")
                    .tag("endpoint", endpoint)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record delivery failure metrics for {}: {}", endpoint, e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
