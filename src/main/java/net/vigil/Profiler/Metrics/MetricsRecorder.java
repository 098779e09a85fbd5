package net.vigil.Profiler.Metrics;

import net.vigil.Profiler.CustomObject.TraceKind;

/**
 * Interface responsible for recording metrics about the agent's own activity.
 * Decouples the agent from specific metrics implementations like Micrometer.
 */
public interface MetricsRecorder {

    /**
     * Records a finished trace.
     *
     * @param kind      request or job
     * @param runtimeMs the runtime of the trace in milliseconds
     * @param failed    whether an error report was attached to the trace
     */
    void recordTrace(TraceKind kind, double runtimeMs, boolean failed);

    /**
     * Records an error report sent out of band by catchError/recordError.
     *
     * @param exceptionType the fully-qualified exception type name
     */
    void recordError(String exceptionType);

    /**
     * Records a payload the client failed to deliver.
     *
     * @param endpoint the API path the payload was meant for
     */
    void recordDeliveryFailure(String endpoint);

    /**
     * Checks if metrics recording is available.
     *
     * @return true if metrics recording is enabled and available
     */
    boolean isAvailable();
}
