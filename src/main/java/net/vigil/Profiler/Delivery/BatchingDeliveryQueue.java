package net.vigil.Profiler.Delivery;

import net.vigil.Profiler.Config.VigilProperties;
import net.vigil.Profiler.CustomObject.Trace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ExecutorConfigurationSupport;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivery queue buffering traces in memory and posting them in batches from a
 * scheduler thread.
 *
 * Buffers are flushed every {@code flushInterval}, or as soon as one of them holds
 * {@code flushThreshold} traces. Submitting threads only take a short lock on the
 * buffers; all network I/O happens on the scheduler.
 */
public class BatchingDeliveryQueue implements DeliveryQueue {

    private static final Logger logger = LoggerFactory.getLogger(BatchingDeliveryQueue.class);

    public static final String REQUESTS_PATH = "/requests";
    public static final String JOBS_PATH = "/jobs";

    private final Client client;
    private final TaskScheduler taskScheduler;
    private final Duration flushInterval;
    private final int flushThreshold;
    private final int recentRequestsLimit;

    private final Object lock = new Object();
    private List<Trace> requests = new ArrayList<>();
    private List<Trace> jobs = new ArrayList<>();
    private final Deque<Trace> recentRequests = new ArrayDeque<>();

    private final AtomicBoolean flushPending = new AtomicBoolean();
    private volatile ScheduledFuture<?> periodicFlush;

    public BatchingDeliveryQueue(Client client, TaskScheduler taskScheduler, VigilProperties properties) {
        this.client = client;
        this.taskScheduler = taskScheduler;
        this.flushInterval = properties.getFlushInterval();
        this.flushThreshold = properties.getFlushThreshold();
        this.recentRequestsLimit = properties.getRecentRequestsLimit();
    }

    /**
     * Starts the periodic flush. Calling it again has no effect.
     */
    public synchronized void start() {
        if (periodicFlush != null) {
            return;
        }
        periodicFlush = taskScheduler.scheduleAtFixedRate(this::flush, Instant.now().plus(flushInterval), flushInterval);
        logger.info("delivery queue started, flushing every {} or every {} traces", flushInterval, flushThreshold);
    }

    @Override
    public void pushRequest(Trace trace) {
        boolean full;
        synchronized (lock) {
            requests.add(trace);
            if (recentRequestsLimit > 0) {
                recentRequests.addLast(trace);
                while (recentRequests.size() > recentRequestsLimit) {
                    recentRequests.removeFirst();
                }
            }
            full = requests.size() >= flushThreshold;
        }
        if (full) {
            requestFlush();
        }
    }

    @Override
    public void pushJob(Trace trace) {
        boolean full;
        synchronized (lock) {
            jobs.add(trace);
            full = jobs.size() >= flushThreshold;
        }
        if (full) {
            requestFlush();
        }
    }

    @Override
    public List<Trace> recentRequests() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(recentRequests));
        }
    }

    /**
     * Posts everything buffered so far. Runs on the scheduler, but may be called
     * directly.
     */
    public void flush() {
        flushPending.set(false);
        List<Trace> pulledJobs;
        List<Trace> pulledRequests;
        synchronized (lock) {
            pulledJobs = jobs;
            pulledRequests = requests;
            jobs = new ArrayList<>();
            requests = new ArrayList<>();
        }
        if (!pulledJobs.isEmpty()) {
            send(JOBS_PATH, Map.of("jobs", pulledJobs), pulledJobs.size());
        }
        if (!pulledRequests.isEmpty()) {
            send(REQUESTS_PATH, Map.of("requests", pulledRequests), pulledRequests.size());
        }
    }

    /**
     * Stops the periodic flush and posts whatever is still buffered.
     */
    public void shutdown() {
        ScheduledFuture<?> future = periodicFlush;
        if (future != null) {
            future.cancel(false);
        }
        flush();
        if (taskScheduler instanceof ExecutorConfigurationSupport executor) {
            executor.shutdown();
        }
        logger.info("delivery queue stopped");
    }

    private void requestFlush() {
        if (!flushPending.compareAndSet(false, true)) {
            return;
        }
        try {
            taskScheduler.schedule(this::flush, Instant.now());
        } catch (TaskRejectedException e) {
            flushPending.set(false);
            logger.warn("could not schedule flush, traces stay buffered until the next one: {}", e.getMessage());
        }
    }

    private void send(String path, Object payload, int count) {
        try {
            client.post(path, payload);
            logger.debug("flushed {} traces to {}", count, path);
        } catch (Exception e) {
            // keep the periodic task alive
            logger.error("failed to flush {} traces to {}: {}", count, path, e.getMessage(), e);
        }
    }
}
