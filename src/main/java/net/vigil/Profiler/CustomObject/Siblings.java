package net.vigil.Profiler.CustomObject;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed sections sharing the same parent, in first-seen order.
 *
 * Adding a section that has the same {@link SectionKey} as an existing entry folds it
 * into that entry instead of appending it.
 */
public class Siblings {

    private final Map<SectionKey, Section> sections = new LinkedHashMap<>();

    public void add(Section section) {
        SectionKey key = SectionKey.of(section);
        Section sibling = sections.get(key);
        if (sibling != null) {
            sibling.merge(section);
        } else {
            sections.put(key, section);
        }
    }

    public void addAll(Siblings other) {
        for (Section section : other.sections.values()) {
            add(section);
        }
    }

    public int size() {
        return sections.size();
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    /**
     * @return a snapshot of the sections in first-seen order
     */
    @JsonValue
    public List<Section> asList() {
        return new ArrayList<>(sections.values());
    }

    /**
     * @return the sum of the total runtimes of these sections, in milliseconds
     */
    public double totalRuntime() {
        return sections.values().stream().mapToDouble(Section::getTotalRuntime).sum();
    }
}
