package net.vigil.Profiler.Tracing;

import net.vigil.Profiler.CustomObject.Section;
import net.vigil.Profiler.CustomObject.Trace;
import net.vigil.Profiler.Errors.FrameLocation;
import net.vigil.Profiler.Errors.LocationFinder;
import net.vigil.Profiler.MeasuredCallable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Opens and closes timed sections inside the trace of the current thread.
 *
 * Without an active trace every call falls straight through to the wrapped work: no
 * section is allocated and the clock is not read.
 */
public class SectionRecorder {

    private static final Logger logger = LoggerFactory.getLogger(SectionRecorder.class);

    private final TraceContext context;
    private final LocationFinder locationFinder;

    public SectionRecorder(TraceContext context, LocationFinder locationFinder) {
        this.context = context;
        this.locationFinder = locationFinder;
    }

    /**
     * Runs {@code work} inside a new section of the current trace.
     *
     * @param command           what the section executes, e.g. query text or template name
     * @param kind              category tag, {@link Section#DEFAULT_KIND} when null
     * @param appendableCommand whether differently worded siblings of the same kind merge
     *                          into one growing command
     * @param work              the work to time
     * @return whatever {@code work} returns
     * @throws E whatever {@code work} throws, unchanged
     */
    public <T, E extends Throwable> T start(String command, @Nullable String kind, boolean appendableCommand,
                                            MeasuredCallable<T, E> work) throws E {
        if (!context.isActive()) {
            return work.call();
        }
        try (SectionScope scope = open(command, kind, appendableCommand)) {
            return work.call();
        }
    }

    /**
     * Opens a section in the current trace. The returned scope must be closed, use
     * try-with-resources.
     *
     * @return the scope of the section, a no-op scope when no trace is active
     */
    public SectionScope open(String command, @Nullable String kind, boolean appendableCommand) {
        Trace trace = context.current();
        if (trace == null) {
            return NoOpSectionScope.INSTANCE;
        }
        FrameLocation location = locationFinder.callerLocation();
        Section section = new Section(command, kind, appendableCommand, context.now(),
                locationFinder.relativePath(location.file()), location.line());
        trace.openSection(section);
        return new ActiveSectionScope(this, trace, section);
    }

    /**
     * Closes {@code section}. Sections opened inside it and still open are closed first,
     * at the same instant, so that the stack never keeps a section whose scope is gone.
     */
    void close(Trace trace, Section section) {
        if (context.current() != trace) {
            logger.debug("section {} closed after its trace was stopped, dropping it", section.getCommand());
            return;
        }
        if (!trace.isOpen(section)) {
            logger.debug("section {} was already closed with its parent", section.getCommand());
            return;
        }
        double now = context.now();
        Section nested = trace.currentSection();
        while (nested != null && nested != section) {
            logger.warn("section {} still open when {} closed, closing it", nested.getCommand(), section.getCommand());
            nested.stop(now);
            trace.closeSection(nested);
            nested = trace.currentSection();
        }
        section.stop(now);
        trace.closeSection(section);
    }
}
