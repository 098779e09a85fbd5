package net.vigil.Profiler.Tracing;

import net.vigil.Profiler.CustomObject.Section;
import net.vigil.Profiler.CustomObject.Trace;

/**
 * Scope of a section opened inside an active trace. Closing it more than once has no
 * further effect.
 */
final class ActiveSectionScope implements SectionScope {

    private final SectionRecorder recorder;
    private final Trace trace;
    private final Section section;
    private boolean closed;

    ActiveSectionScope(SectionRecorder recorder, Trace trace, Section section) {
        this.recorder = recorder;
        this.trace = trace;
        this.section = section;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        recorder.close(trace, section);
    }
}
