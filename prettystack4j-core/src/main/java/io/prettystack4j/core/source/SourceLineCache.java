/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.source;

import io.prettystack4j.core.model.FrameView;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Source line lookup backed by a single-slot cache: only the most recently read file is kept.
 * Consecutive frames from the same file (recursion, helper chains) read it once; switching files
 * drops the previous content. This is not an LRU and must not grow into one.
 *
 * <p>Not thread-safe. Create one per render call.
 */
@Slf4j
public final class SourceLineCache {

    private String cachedFile; // null when the slot is empty
    private List<String> lines = List.of();
    private int reads;

    /**
     * Trimmed 1-indexed line {@code n} of {@code file}, or {@link FrameView#UNKNOWN} when the
     * file cannot be read or {@code n} is out of range.
     */
    public String line(String file, int n) {
        if (file == null) return FrameView.UNKNOWN;
        if (!file.equals(cachedFile)) load(file);

        int idx = n - 1; // stack traces are 1-indexed
        if (idx < 0 || idx >= lines.size()) return FrameView.UNKNOWN;
        return lines.get(idx).strip();
    }

    private void load(String file) {
        reads++;
        try {
            byte[] data = Files.readAllBytes(Paths.get(file));
            lines = Arrays.asList(new String(data, StandardCharsets.UTF_8).split("\n", -1));
            cachedFile = file;
        } catch (IOException | RuntimeException e) {
            log.debug("Source not readable, lines of {} will show as {}: {}", file, FrameView.UNKNOWN, e.toString());
            lines = List.of();
            cachedFile = null;
        }
    }

    /** Number of read attempts so far. */
    int reads() {
        return reads;
    }

    String cachedFile() {
        return cachedFile;
    }
}
