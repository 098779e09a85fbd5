package net.vigil.Profiler.CustomObject;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

/**
 * A timed, named sub-unit of work inside a trace: a query, a template render, an
 * outgoing HTTP call or any instrumented block.
 *
 * Runtimes are in milliseconds read from the monotonic clock. A section that absorbed
 * identical siblings reports the summed runtime and the number of calls it stands for.
 */
@Getter
public class Section {

    public static final String DEFAULT_KIND = "code";

    @JsonProperty("command")
    private String command;

    @JsonProperty("kind")
    private final String kind;

    @JsonIgnore
    private final boolean appendableCommand;

    @JsonProperty("file")
    private final String file;

    @JsonProperty("line")
    private final int line;

    @JsonProperty("started_at")
    private final double startedAt;

    @JsonProperty("calls")
    private int calls = 1;

    @JsonProperty("total_runtime")
    private double totalRuntime;

    @JsonProperty("children_runtime")
    private double childrenRuntime;

    @JsonProperty("children")
    private final Siblings children = new Siblings();

    public Section(String command, String kind, boolean appendableCommand,
                   double startedAt, String file, int line) {
        this.command = command;
        this.kind = kind != null ? kind : DEFAULT_KIND;
        this.appendableCommand = appendableCommand;
        this.startedAt = startedAt;
        this.file = file;
        this.line = line;
    }

    /**
     * Closes the section, recording its runtime up to {@code stoppedAt}.
     */
    public void stop(double stoppedAt) {
        this.totalRuntime = stoppedAt - startedAt;
    }

    /**
     * Records a closed child section under this one.
     */
    public void addChild(Section child) {
        childrenRuntime += child.getTotalRuntime();
        children.add(child);
    }

    /**
     * Folds an identical sibling into this section.
     */
    void merge(Section sibling) {
        calls += sibling.calls;
        totalRuntime += sibling.totalRuntime;
        childrenRuntime += sibling.childrenRuntime;
        if (appendableCommand) {
            appendCommand(sibling.command);
        }
        children.addAll(sibling.children);
    }

    private void appendCommand(String other) {
        if (other == null || other.isEmpty()) {
            return;
        }
        if (command == null || command.isEmpty()) {
            command = other;
            return;
        }
        // already part of the joined command
        if (command.contains(other)) {
            return;
        }
        command = command + "\n" + other;
    }

    /**
     * @return the time spent in this section itself, excluding its children
     */
    @JsonIgnore
    public double getSelfRuntime() {
        return totalRuntime - childrenRuntime;
    }

    @Override
    public String toString() {
        return "Section{" +
                "kind='" + kind + '\'' +
                ", command='" + command + '\'' +
                ", calls=" + calls +
                ", totalRuntime=" + totalRuntime +
                '}';
    }
}
