package net.vigil.Profiler.CustomObject;

/**
 * Identity of a section among its siblings.
 *
 * Regular sections are identified by their kind and command. Appendable sections
 * leave the command out so that differently worded commands of the same kind
 * collapse into a single entry.
 */
public record SectionKey(String kind, String command, boolean appendable) {

    public static SectionKey of(Section section) {
        if (section.isAppendableCommand()) {
            return new SectionKey(section.getKind(), null, true);
        }
        return new SectionKey(section.getKind(), section.getCommand(), false);
    }
}
