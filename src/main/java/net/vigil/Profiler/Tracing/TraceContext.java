package net.vigil.Profiler.Tracing;

import io.micrometer.core.instrument.Clock;
import net.vigil.Profiler.CustomObject.Trace;
import net.vigil.Profiler.CustomObject.TraceKind;
import org.springframework.lang.Nullable;

/**
 * Per-thread slot holding the trace currently being recorded.
 *
 * Each thread sees only its own trace, so no locking is involved. A trace enters the
 * slot through {@link #initialize} and leaves it through {@link #cleanup}, which
 * empties the slot in the same step so that a finished trace is handed out once.
 */
public class TraceContext {

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final ThreadLocal<Trace> slot = new ThreadLocal<>();
    private final Clock clock;

    public TraceContext(Clock clock) {
        this.clock = clock;
    }

    /**
     * Replaces the thread's slot with a fresh trace started now.
     */
    public Trace initialize(String name, TraceKind kind) {
        Trace trace = new Trace(name, kind, now());
        slot.set(trace);
        return trace;
    }

    public boolean isActive() {
        return slot.get() != null;
    }

    @Nullable
    public Trace current() {
        return slot.get();
    }

    /**
     * Removes and returns the thread's trace.
     *
     * @return the trace, or null if the slot was already empty
     */
    @Nullable
    public Trace cleanup() {
        Trace trace = slot.get();
        slot.remove();
        return trace;
    }

    /**
     * @return the monotonic time in milliseconds
     */
    public double now() {
        return clock.monotonicTime() / NANOS_PER_MILLI;
    }
}
