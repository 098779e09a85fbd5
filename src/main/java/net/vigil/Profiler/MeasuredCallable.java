package net.vigil.Profiler;

/**
 * Work wrapped by the agent. The exception type is carried through the measuring
 * methods so that callers see exactly what the work itself throws.
 *
 * @param <T> the result type
 * @param <E> the exception the work may throw
 */
@FunctionalInterface
public interface MeasuredCallable<T, E extends Throwable> {

    T call() throws E;
}
