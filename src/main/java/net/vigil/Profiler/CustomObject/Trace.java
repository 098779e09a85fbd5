package net.vigil.Profiler.CustomObject;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.lang.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * The timed record of one request or job.
 *
 * A trace is owned by the thread executing it until it is handed to the delivery
 * queue. Open sections are kept on a stack; closed ones are attached to whichever
 * section is open at that moment, or to the trace root.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Trace {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("kind")
    private final TraceKind kind;

    @JsonProperty("started_at")
    private final double startedAt;

    @Setter
    @JsonProperty("path")
    private String path;

    @JsonProperty("runtime")
    private Double runtime;

    @JsonProperty("sections")
    private final Siblings sections = new Siblings();

    @Setter
    @JsonProperty("error")
    private ErrorReport error;

    @JsonIgnore
    private final Deque<Section> sectionStack = new ArrayDeque<>();

    public Trace(String name, TraceKind kind, double startedAt) {
        this.name = name;
        this.kind = kind;
        this.startedAt = startedAt;
    }

    /**
     * Records the runtime of the trace up to {@code stoppedAt}.
     */
    public void stop(double stoppedAt) {
        this.runtime = stoppedAt - startedAt;
    }

    public void openSection(Section section) {
        sectionStack.push(section);
    }

    /**
     * @return the innermost open section, or null at the trace root
     */
    @Nullable
    @JsonIgnore
    public Section currentSection() {
        return sectionStack.peek();
    }

    /**
     * @return whether {@code section} is still on the open stack
     */
    public boolean isOpen(Section section) {
        for (Section open : sectionStack) {
            if (open == section) {
                return true;
            }
        }
        return false;
    }

    /**
     * Pops {@code section} off the open stack and attaches it to its parent.
     *
     * @return false if {@code section} was not the innermost open section
     */
    public boolean closeSection(Section section) {
        if (sectionStack.peek() != section) {
            return false;
        }
        sectionStack.pop();
        Section parent = sectionStack.peek();
        if (parent != null) {
            parent.addChild(section);
        } else {
            sections.add(section);
        }
        return true;
    }

    @JsonIgnore
    public boolean isStopped() {
        return runtime != null;
    }

    @Override
    public String toString() {
        return "Trace{" +
                "name='" + name + '\'' +
                ", kind=" + kind +
                ", path='" + path + '\'' +
                ", runtime=" + runtime +
                ", sections=" + sections.size() +
                ", error=" + error +
                '}';
    }
}
