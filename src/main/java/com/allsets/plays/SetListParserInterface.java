package com.allsets.plays;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for reading the sets document into typed entries.
 */
public interface SetListParserInterface {
    /**
     * Parses the list items of a markdown document.
     * @param path Path to the sets document
     * @return Entries in first-seen order, deduplicated by {@link SetEntry#dedupKey()}
     * @throws IOException if the file cannot be opened or read
     */
    List<SetEntry> parse(Path path) throws IOException;
}
