package net.vigil.Profiler.Tracing;

/**
 * The open lifetime of a section. Closing the scope closes the section and files it
 * under its parent.
 *
 * Example usage:
 * <pre>
 * try (SectionScope scope = sectionRecorder.open("SELECT * FROM orders", "sql", false)) {
 *     // run the query
 * }
 * </pre>
 */
public interface SectionScope extends AutoCloseable {

    /**
     * Closes the section. Unlike AutoCloseable.close(), this method does not throw
     * exceptions.
     */
    @Override
    void close();
}
