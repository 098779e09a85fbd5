package net.vigil.Profiler;

import io.micrometer.core.instrument.Clock;
import net.vigil.Profiler.Config.VigilProperties;
import net.vigil.Profiler.CustomObject.ErrorReport;
import net.vigil.Profiler.CustomObject.Section;
import net.vigil.Profiler.CustomObject.Trace;
import net.vigil.Profiler.CustomObject.TraceKind;
import net.vigil.Profiler.Delivery.Client;
import net.vigil.Profiler.Delivery.DeliveryQueue;
import net.vigil.Profiler.Errors.ErrorReportFactory;
import net.vigil.Profiler.Errors.IgnoreFilter;
import net.vigil.Profiler.Errors.LocationFinder;
import net.vigil.Profiler.Metrics.MetricsRecorder;
import net.vigil.Profiler.Tracing.SectionRecorder;
import net.vigil.Profiler.Tracing.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Entry point for producers: starts and stops the traces of requests and jobs, times
 * nested sections and reports errors.
 *
 * Each thread is either idle or recording exactly one trace. Starting a request or a
 * job while a trace is active is a no-op, so re-entrant dispatch never double counts.
 * Nothing in this class changes what the wrapped work returns or throws, with the
 * single exception of {@link #catchError}, which returns the exception instead of
 * throwing it.
 */
public class Agent {

    private static final Logger logger = LoggerFactory.getLogger(Agent.class);

    public static final String ERRORS_PATH = "/errors";

    private final TraceContext context;
    private final SectionRecorder sectionRecorder;
    private final ErrorReportFactory errorReportFactory;
    private final IgnoreFilter ignoreFilter;
    private final DeliveryQueue queue;
    private final Client client;
    private final MetricsRecorder metricsRecorder;

    public Agent(TraceContext context,
                 SectionRecorder sectionRecorder,
                 ErrorReportFactory errorReportFactory,
                 IgnoreFilter ignoreFilter,
                 DeliveryQueue queue,
                 Client client,
                 MetricsRecorder metricsRecorder) {
        this.context = context;
        this.sectionRecorder = sectionRecorder;
        this.errorReportFactory = errorReportFactory;
        this.ignoreFilter = ignoreFilter;
        this.queue = queue;
        this.client = client;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * Builds an agent and its internals from configuration.
     */
    public Agent(VigilProperties properties,
                 DeliveryQueue queue,
                 Client client,
                 MetricsRecorder metricsRecorder,
                 Clock clock) {
        this(properties, new TraceContext(clock), new LocationFinder(properties.getAppRoot()),
                queue, client, metricsRecorder);
    }

    private Agent(VigilProperties properties,
                  TraceContext context,
                  LocationFinder locationFinder,
                  DeliveryQueue queue,
                  Client client,
                  MetricsRecorder metricsRecorder) {
        this(context,
                new SectionRecorder(context, locationFinder),
                new ErrorReportFactory(locationFinder),
                new IgnoreFilter(properties.getIgnoreExceptions(), properties.getIgnoreActions()),
                queue, client, metricsRecorder);
        logger.info("starting vigil agent from app root {}", locationFinder.getAppRoot());
    }

    // ==================== Requests ====================

    /**
     * Starts the trace of a request on the current thread. Ignored when a trace is
     * already active.
     */
    public void startRequest(String name, @Nullable String path) {
        if (context.isActive()) {
            return;
        }
        context.initialize(name, TraceKind.REQUEST).setPath(path);
    }

    /**
     * Stops the request trace of the current thread and submits it. Does nothing when
     * no request is being traced.
     */
    public void stopRequest() {
        Trace trace = context.current();
        if (trace == null || trace.getKind() != TraceKind.REQUEST) {
            return;
        }
        deliver(context.cleanup());
    }

    // ==================== Jobs and sections ====================

    /**
     * Runs {@code work} as a traced job. The trace is always stopped and submitted,
     * whether {@code work} returns or throws. A non-ignored exception is attached to
     * the trace together with {@code parameters} before being rethrown unchanged.
     *
     * When a trace is already active {@code work} simply runs.
     */
    public <T, E extends Throwable> T measureJob(String name, @Nullable Map<String, ?> parameters,
                                                 MeasuredCallable<T, E> work) throws E {
        if (context.isActive()) {
            return work.call();
        }
        context.initialize(name, TraceKind.JOB);
        try {
            return work.call();
        } catch (Throwable error) {
            pushException(error, parameters);
            throw error;
        } finally {
            deliver(context.cleanup());
        }
    }

    /**
     * Times {@code work} as a section of the active trace, or as a job of its own when
     * the thread is idle.
     */
    public <T, E extends Throwable> T measureBlock(String name, @Nullable String kind,
                                                   MeasuredCallable<T, E> work) throws E {
        if (context.isActive()) {
            return measureSection(name, kind, false, work);
        }
        return measureJob(name, null, work);
    }

    public <T, E extends Throwable> T measureBlock(String name, MeasuredCallable<T, E> work) throws E {
        return measureBlock(name, Section.DEFAULT_KIND, work);
    }

    /**
     * Times {@code work} as a section of the active trace. Without an active trace
     * {@code work} runs untracked.
     */
    public <T, E extends Throwable> T measureSection(String name, @Nullable String kind, boolean appendableCommand,
                                                     MeasuredCallable<T, E> work) throws E {
        return sectionRecorder.start(name, kind, appendableCommand, work);
    }

    // ==================== Errors ====================

    /**
     * Runs {@code work} and reports the exception it throws, if any, right away.
     *
     * {@code work} produces no value. A block that computes a result assigns it to a
     * variable of its caller, since the return value here only tells failure from success.
     *
     * @return the exception thrown by {@code work}, ignored or not, or null when it
     * completed
     */
    @Nullable
    public Exception catchError(@Nullable Map<String, ?> extraDetails, MeasuredRunnable work) {
        try {
            work.run();
            return null;
        } catch (Exception error) {
            if (!ignoreFilter.isIgnoredException(error)) {
                recordError(error, extraDetails);
            }
            return error;
        }
    }

    /**
     * Reports {@code error} immediately, independently of any trace.
     */
    public void recordError(Throwable error, @Nullable Map<String, ?> extraDetails) {
        try {
            ErrorReport report = errorReportFactory.create(error, extraDetails);
            client.postAsync(ERRORS_PATH, Map.of("error", report));
            metricsRecorder.recordError(report.getException());
        } catch (Exception e) {
            logger.error("failed to report error {}: {}", error.getClass().getName(), e.getMessage(), e);
        }
    }

    /**
     * Attaches {@code error} to the trace of the current thread.
     *
     * @return the attached report, or null when no trace is active or the error is
     * ignored
     */
    @Nullable
    public ErrorReport pushException(Throwable error, @Nullable Map<String, ?> parameters) {
        Trace trace = context.current();
        if (trace == null || ignoreFilter.isIgnoredException(error)) {
            return null;
        }
        try {
            ErrorReport report = errorReportFactory.create(error, null, parameters);
            trace.setError(report);
            return report;
        } catch (Exception e) {
            logger.error("failed to capture error {}: {}", error.getClass().getName(), e.getMessage(), e);
            return null;
        }
    }

    // ==================== Filters ====================

    public boolean isIgnoredAction(String name) {
        return ignoreFilter.isIgnoredAction(name);
    }

    public boolean isIgnoredException(Throwable error) {
        return ignoreFilter.isIgnoredException(error);
    }

    /**
     * @return the trace recorded by the current thread, or null when idle
     */
    @Nullable
    public Trace currentTrace() {
        return context.current();
    }

    public DeliveryQueue getQueue() {
        return queue;
    }

    private void deliver(@Nullable Trace trace) {
        if (trace == null) {
            return;
        }
        try {
            trace.stop(context.now());
            if (trace.getKind() == TraceKind.REQUEST) {
                queue.pushRequest(trace);
            } else {
                queue.pushJob(trace);
            }
            metricsRecorder.recordTrace(trace.getKind(), trace.getRuntime(), trace.getError() != null);
        } catch (Exception e) {
            logger.error("failed to submit {} trace {}: {}", trace.getKind().tag(), trace.getName(), e.getMessage(), e);
        }
    }
}
