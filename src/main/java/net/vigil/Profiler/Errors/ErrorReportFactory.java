package net.vigil.Profiler.Errors;

import net.vigil.Profiler.CustomObject.ErrorReport;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds {@link ErrorReport}s from thrown exceptions.
 */
public class ErrorReportFactory {

    private final LocationFinder locationFinder;

    public ErrorReportFactory(LocationFinder locationFinder) {
        this.locationFinder = locationFinder;
    }

    /**
     * Creates a report for {@code exception}.
     *
     * @param exception    the exception to describe
     * @param extraDetails caller supplied context, may be null
     * @return the report, never null
     */
    public ErrorReport create(Throwable exception, @Nullable Map<String, ?> extraDetails) {
        StackTraceElement[] stackTrace = exception.getStackTrace();

        ErrorReport.ErrorReportBuilder report = ErrorReport.builder()
                .message(exception.getMessage())
                .exception(exception.getClass().getName())
                .extraDetails(extraDetails);

        if (stackTrace == null || stackTrace.length == 0) {
            return report
                    .file(ErrorReport.NO_BACKTRACE)
                    .line(1)
                    .backtrace(List.of(ErrorReport.NO_BACKTRACE))
                    .build();
        }

        List<FrameLocation> frames = Arrays.stream(stackTrace)
                .map(FrameLocation::of)
                .collect(Collectors.toList());
        FrameLocation location = locationFinder.mostRelevant(frames);

        return report
                .file(locationFinder.relativePath(location.file()))
                .line(location.line())
                .backtrace(Arrays.stream(stackTrace)
                        .map(StackTraceElement::toString)
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * Creates a report for an exception raised by a job, carrying the job parameters.
     */
    public ErrorReport create(Throwable exception, @Nullable Map<String, ?> extraDetails,
                              @Nullable Map<String, ?> parameters) {
        ErrorReport report = create(exception, extraDetails);
        if (parameters == null) {
            return report;
        }
        return report.toBuilder().parameters(parameters).build();
    }
}
