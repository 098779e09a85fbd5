package net.vigil.Profiler.CustomObject;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The unit of work a trace describes.
 */
public enum TraceKind {

    REQUEST("request"),
    JOB("job");

    private final String tag;

    TraceKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
