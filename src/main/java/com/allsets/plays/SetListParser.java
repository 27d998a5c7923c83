package com.allsets.plays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the sets document and yields one {@link SetEntry} per unique list item.
 * <p>
 * Only lines whose trimmed form starts with {@code "* "} are list items. A list item containing a
 * markdown link {@code * [name](url)} becomes a linked entry; any other list item (for example
 * {@code * Faixa Azul (June 2023) _// NOT PUBLISHED YET_}) becomes an unlinked entry whose name is
 * the trimmed line.
 *
 * @author All Sets Plays Team
 * @since 1.0
 */
public class SetListParser implements SetListParserInterface {
    private static final Logger logger = LoggerFactory.getLogger(SetListParser.class);

    static final String LIST_MARKER = "* ";
    private static final Pattern LINK_ITEM = Pattern.compile("\\* \\[(.*?)\\]\\((.*?)\\)");

    @Override
    public List<SetEntry> parse(Path path) throws IOException {
        logger.debug("Opening sets file: {}", path);
        List<SetEntry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String line : readLines(path)) {
            SetEntry entry = parseLine(line);
            if (entry == null) continue;
            if (!seen.add(entry.dedupKey())) {
                logger.debug("Skipping duplicate list item: {}", entry.dedupKey());
                continue;
            }
            if (entry.isLinked()) {
                logger.debug("Found set (linked): {} ({})", entry.name(), entry.link());
            } else {
                logger.debug("Found set (unlinked/raw): {}", entry.rawLine());
            }
            entries.add(entry);
        }
        logger.debug("Extracted {} unique sets (including unlinked) from {}", entries.size(), path);
        return entries;
    }

    /**
     * Reads the document as UTF-8. Malformed bytes become U+FFFD instead of failing the read.
     * @throws IOException only if the file cannot be opened or read
     */
    static List<String> readLines(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8).lines().toList();
    }

    /**
     * Parses a single source line.
     * @param line Raw line of the document
     * @return The entry, or null when the line is not a list item
     */
    static SetEntry parseLine(String line) {
        if (line == null) return null;
        String trim = line.strip();
        if (!trim.startsWith(LIST_MARKER)) return null;
        Matcher m = LINK_ITEM.matcher(trim);
        if (m.find()) {
            return new SetEntry(m.group(1), m.group(2), trim);
        }
        return new SetEntry(trim, "", trim);
    }
}
