package net.vigil.Profiler.Errors;

/**
 * A source location taken from a stack frame.
 *
 * @param className the declaring class of the frame
 * @param file      the source path of the frame, e.g. {@code com/acme/shop/OrderService.java}
 * @param line      the line number, 0 when unknown
 */
public record FrameLocation(String className, String file, int line) {

    public static FrameLocation of(StackTraceElement element) {
        return new FrameLocation(element.getClassName(),
                FramePaths.sourcePath(element.getClassName(), element.getFileName()),
                Math.max(element.getLineNumber(), 0));
    }

    public static FrameLocation of(StackWalker.StackFrame frame) {
        return new FrameLocation(frame.getClassName(),
                FramePaths.sourcePath(frame.getClassName(), frame.getFileName()),
                Math.max(frame.getLineNumber(), 0));
    }
}
