package net.vigil.Profiler.Errors;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the most relevant frame of a stack: the first one whose source lies under the
 * configured application root, or the first frame when none does.
 */
public class LocationFinder {

    private static final int MAX_CALLER_FRAMES = 128;

    private static final List<String> INTERNAL_PREFIXES = List.of(
            "net.vigil.Profiler.",
            "org.springframework.aop.",
            "org.aspectj.",
            "java.lang.reflect.",
            "jdk.internal.reflect.");

    private static final FrameLocation UNKNOWN = new FrameLocation("", "unknown", 0);

    @Nullable
    private final String appRoot;

    public LocationFinder(@Nullable String appRoot) {
        this.appRoot = FramePaths.normalizeRoot(appRoot);
    }

    @Nullable
    public String getAppRoot() {
        return appRoot;
    }

    public boolean isUnderAppRoot(String file) {
        return appRoot != null && file != null && file.startsWith(appRoot + "/");
    }

    /**
     * @param frames the frames of a stack, innermost first; must not be empty
     * @return the first frame under the application root, else the first frame
     */
    public FrameLocation mostRelevant(List<FrameLocation> frames) {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("frames cannot be empty");
        }
        for (FrameLocation frame : frames) {
            if (isUnderAppRoot(frame.file())) {
                return frame;
            }
        }
        return frames.get(0);
    }

    /**
     * Strips the application root from {@code file}. Paths outside the root are
     * returned unchanged.
     */
    public String relativePath(String file) {
        if (isUnderAppRoot(file)) {
            return file.substring(appRoot.length());
        }
        return file;
    }

    /**
     * Locates the application code that called into the agent from the current thread,
     * skipping the agent's own frames and proxy plumbing.
     */
    public FrameLocation callerLocation() {
        List<FrameLocation> frames = StackWalker.getInstance().walk(stream -> stream
                .filter(frame -> !isInternal(frame.getClassName()))
                .limit(MAX_CALLER_FRAMES)
                .map(FrameLocation::of)
                .collect(Collectors.toList()));
        if (frames.isEmpty()) {
            return UNKNOWN;
        }
        return mostRelevant(frames);
    }

    private static boolean isInternal(String className) {
        if (className.contains("$$")) {
            return true;
        }
        for (String prefix : INTERNAL_PREFIXES) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
