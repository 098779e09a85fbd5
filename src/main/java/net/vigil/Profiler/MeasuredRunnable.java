package net.vigil.Profiler;

/**
 * Work without a result, as accepted by {@link Agent#catchError}.
 */
@FunctionalInterface
public interface MeasuredRunnable {

    void run() throws Exception;
}
