package com.allsets.plays;

/**
 * Immutable record representing one list item of the sets document.
 * <p>
 * {@code link} is empty for items that are not published yet; those are echoed unchanged.
 * {@code rawLine} is the trimmed source line.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public record SetEntry(String name, String link, String rawLine) {

    public SetEntry {
        name = name == null ? "" : name;
        link = link == null ? "" : link;
        rawLine = rawLine == null ? "" : rawLine;
    }

    public boolean isLinked() {
        return !link.isEmpty();
    }

    /**
     * Identity used to collapse duplicate list items: the link when present, else the raw line.
     */
    public String dedupKey() {
        return isLinked() ? link : rawLine;
    }
}
