package net.vigil.Profiler.Metrics;

import net.vigil.Profiler.CustomObject.TraceKind;

/**
 * No-Op implementation of MetricsRecorder.
 * Used when no MeterRegistry is available.
 */
public class NoOpMetricsRecorder implements MetricsRecorder {

    @Override
    public void recordTrace(TraceKind kind, double runtimeMs, boolean failed) {
        // No-Op
    }

    @Override
    public void recordError(String exceptionType) {
        // No-Op
    }

    @Override
    public void recordDeliveryFailure(String endpoint) {
        // No-Op
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
