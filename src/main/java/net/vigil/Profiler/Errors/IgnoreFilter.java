package net.vigil.Profiler.Errors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Set;

/**
 * Holds the configured ignore sets.
 *
 * Exceptions are matched by their exact fully-qualified class name. Subclasses of an
 * ignored type are still reported: ignoring {@code java.io.IOException} does not
 * ignore {@code java.io.FileNotFoundException}.
 */
public class IgnoreFilter {

    private static final Logger logger = LoggerFactory.getLogger(IgnoreFilter.class);

    private final Set<String> ignoredExceptions;
    private final Set<String> ignoredActions;

    public IgnoreFilter(Collection<String> ignoredExceptions, Collection<String> ignoredActions) {
        this.ignoredExceptions = Set.copyOf(ignoredExceptions);
        this.ignoredActions = Set.copyOf(ignoredActions);
    }

    public boolean isIgnoredException(Throwable exception) {
        if (ignoredExceptions.isEmpty() || exception == null) {
            return false;
        }
        String type = exception.getClass().getName();
        if (ignoredExceptions.contains(type)) {
            logger.debug("exception {} is ignored", type);
            return true;
        }
        return false;
    }

    public boolean isIgnoredAction(String name) {
        return name != null && ignoredActions.contains(name);
    }
}
