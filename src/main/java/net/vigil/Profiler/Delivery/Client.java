package net.vigil.Profiler.Delivery;

/**
 * Transport to the backend API. Implementations must never throw into the caller:
 * delivery failures are logged and dropped.
 */
public interface Client {

    /**
     * Posts {@code payload} as JSON to {@code path} and waits for the answer.
     *
     * @param path    API path relative to the configured api url, e.g. {@code /jobs}
     * @param payload object serialized to JSON
     */
    void post(String path, Object payload);

    /**
     * Posts {@code payload} without waiting. Fire-and-forget.
     *
     * @param path    API path relative to the configured api url, e.g. {@code /errors}
     * @param payload object serialized to JSON
     */
    void postAsync(String path, Object payload);
}
