package com.allsets.plays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SetListParserTest {

    @TempDir
    Path tempDir;

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("all-sets.md");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testParsesLinkedAndUnlinkedItemsInOrder() throws IOException {
        Path file = write(String.join("\n",
            "# All sets",
            "",
            "Some intro text with a [link](https://example.test/ignored).",
            "* [Sunset Session](https://example.test/sets/sunset)",
            "* Faixa Azul (June 2023) _// NOT PUBLISHED YET_",
            "  * [Indented Set](https://example.test/sets/indented)  ",
            "- [Dash item](https://example.test/sets/dash)"
        ));

        List<SetEntry> entries = new SetListParser().parse(file);

        assertEquals(3, entries.size());
        assertEquals(new SetEntry("Sunset Session", "https://example.test/sets/sunset",
            "* [Sunset Session](https://example.test/sets/sunset)"), entries.get(0));
        SetEntry unlinked = entries.get(1);
        assertFalse(unlinked.isLinked());
        assertEquals("* Faixa Azul (June 2023) _// NOT PUBLISHED YET_", unlinked.name());
        assertEquals(unlinked.rawLine(), unlinked.dedupKey());
        assertEquals("Indented Set", entries.get(2).name());
        assertEquals("* [Indented Set](https://example.test/sets/indented)", entries.get(2).rawLine());
    }

    @Test
    void testDeduplicatesByLinkThenByRawLine() throws IOException {
        Path file = write(String.join("\n",
            "* [First](https://example.test/a)",
            "* [Same link, other name](https://example.test/a)",
            "* Unpublished",
            "* Unpublished",
            "* Unpublished too",
            "* [Second](https://example.test/b)"
        ));

        List<SetEntry> entries = new SetListParser().parse(file);

        assertEquals(List.of("https://example.test/a", "* Unpublished", "* Unpublished too", "https://example.test/b"),
            entries.stream().map(SetEntry::dedupKey).toList());
        assertEquals("First", entries.get(0).name());
    }

    @Test
    void testEmptyLinkIsKeyedByRawLine() {
        SetEntry entry = SetListParser.parseLine("* [Draft]()");
        assertNotNull(entry);
        assertFalse(entry.isLinked());
        assertEquals("* [Draft]()", entry.dedupKey());
    }

    @Test
    void testNonListLinesAreIgnored() {
        assertNull(SetListParser.parseLine("Plain paragraph"));
        assertNull(SetListParser.parseLine("*bold*"));
        assertNull(SetListParser.parseLine(""));
    }

    @Test
    void testInvalidUtf8BytesAreReplacedNotFatal() throws IOException {
        Path file = tempDir.resolve("latin1.md");
        Files.write(file, "* Café Session (draft)\n* [Live](https://example.test/live)\n".getBytes(StandardCharsets.ISO_8859_1));

        List<SetEntry> entries = new SetListParser().parse(file);

        assertEquals(2, entries.size());
        assertEquals("* Caf\uFFFD Session (draft)", entries.get(0).rawLine());
        assertFalse(entries.get(0).isLinked());
        assertEquals("https://example.test/live", entries.get(1).link());
    }

    @Test
    void testMissingFileFails() {
        assertThrows(IOException.class, () -> new SetListParser().parse(tempDir.resolve("missing.md")));
    }
}
