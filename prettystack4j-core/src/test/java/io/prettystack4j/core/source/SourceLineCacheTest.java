/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceLineCacheTest {

    @TempDir
    Path dir;

    private String first;
    private String second;

    @BeforeEach
    void writeSources() throws IOException {
        first = write("First.java", "class First {\n    void run() {\n        go();   \n    }\n}\n");
        second = write("Second.java", "class Second {}\r\n\tint x = 1;\r\n");
    }

    @Test
    void returnsTrimmedOneIndexedLine() {
        SourceLineCache cache = new SourceLineCache();

        assertEquals("class First {", cache.line(first, 1));
        assertEquals("go();", cache.line(first, 3));
        assertEquals("}", cache.line(first, 5));
    }

    @Test
    void trimsCarriageReturns() {
        SourceLineCache cache = new SourceLineCache();

        assertEquals("class Second {}", cache.line(second, 1));
        assertEquals("int x = 1;", cache.line(second, 2));
    }

    @Test
    void stripsUnicodeWhitespace() throws IOException {
        String wide = write("Wide.java", "\u3000\u2003call();\u2003\n");
        SourceLineCache cache = new SourceLineCache();

        assertEquals("call();", cache.line(wide, 1));
    }

    @Test
    void outOfRangeLinesArePlaceholders() {
        SourceLineCache cache = new SourceLineCache();

        assertEquals("???", cache.line(first, 0));
        assertEquals("???", cache.line(first, -2));
        assertEquals("???", cache.line(first, 7));
        assertEquals("???", cache.line(first, 1000));
    }

    @Test
    void unreadableFileIsPlaceholder() {
        SourceLineCache cache = new SourceLineCache();

        assertEquals("???", cache.line(dir.resolve("Missing.java").toString(), 1));
        assertEquals("???", cache.line(dir.toString(), 1)); // a directory
        assertEquals("???", cache.line(null, 1));
        assertNull(cache.cachedFile());
    }

    @Test
    void consecutiveLookupsInSameFileReadOnce() {
        SourceLineCache cache = new SourceLineCache();

        cache.line(first, 1);
        cache.line(first, 2);
        cache.line(first, 3);

        assertEquals(1, cache.reads());
        assertEquals(first, cache.cachedFile());
    }

    @Test
    void holdsOnlyOneFile() {
        SourceLineCache cache = new SourceLineCache();

        cache.line(first, 1);
        cache.line(second, 1);
        cache.line(first, 2);

        // single slot: returning to a file read two lookups ago reads it again
        assertEquals(3, cache.reads());
        assertEquals(first, cache.cachedFile());
    }

    @Test
    void failedReadClearsPreviousFile() {
        SourceLineCache cache = new SourceLineCache();

        assertEquals("class First {", cache.line(first, 1));
        assertEquals("???", cache.line(dir.resolve("Gone.java").toString(), 1));
        assertNull(cache.cachedFile());
        assertEquals("class First {", cache.line(first, 1));
    }

    private String write(String name, String content) throws IOException {
        Path p = dir.resolve(name);
        Files.write(p, content.getBytes(StandardCharsets.UTF_8));
        return p.toString();
    }
}
