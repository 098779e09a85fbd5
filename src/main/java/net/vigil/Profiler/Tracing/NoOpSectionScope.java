package net.vigil.Profiler.Tracing;

/**
 * Scope handed out when the thread is not recording a trace. Nothing was opened, so
 * there is nothing to close.
 */
public final class NoOpSectionScope implements SectionScope {

    /** Shared by every untraced call, the scope holds no state */
    public static final NoOpSectionScope INSTANCE = new NoOpSectionScope();

    private NoOpSectionScope() {
    }

    @Override
    public void close() {
        // nothing was opened
    }
}
