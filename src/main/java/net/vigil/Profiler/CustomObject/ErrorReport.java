package net.vigil.Profiler.CustomObject;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Structured capture of a thrown exception: where it happened in the application,
 * what it said and what type it was.
 */
@Getter
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorReport {

    /**
     * File used when the exception carries no stack trace at all.
     */
    public static final String NO_BACKTRACE = "No backtrace";

    @JsonProperty("file")
    private final String file;

    @JsonProperty("line")
    private final int line;

    @JsonProperty("message")
    private final String message;

    @JsonProperty("backtrace")
    private final List<String> backtrace;

    @JsonProperty("exception")
    private final String exception;

    @JsonProperty("extra_details")
    private final Map<String, ?> extraDetails;

    @JsonProperty("parameters")
    private final Map<String, ?> parameters;

    @Override
    public String toString() {
        return "ErrorReport{" +
                "exception='" + exception + '\'' +
                ", message='" + message + '\'' +
                ", file='" + file + '\'' +
                ", line=" + line +
                '}';
    }
}
