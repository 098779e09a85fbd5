package net.vigil.Profiler.Delivery;

import net.vigil.Profiler.CustomObject.Trace;

import java.util.List;

/**
 * Receives finished traces from many threads and transmits them asynchronously.
 *
 * Submission must be safe to call concurrently and must return quickly: a slow or
 * failing backend may never stall the thread that finished the trace.
 */
public interface DeliveryQueue {

    /**
     * Submits a finished request trace.
     *
     * @param trace the trace, no longer referenced by the submitting thread
     */
    void pushRequest(Trace trace);

    /**
     * Submits a finished job trace.
     *
     * @param trace the trace, no longer referenced by the submitting thread
     */
    void pushJob(Trace trace);

    /**
     * Gets the most recently completed request traces, oldest first.
     *
     * @return an immutable snapshot
     */
    List<Trace> recentRequests();
}
