/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.walk;

import io.prettystack4j.core.model.FrameView;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Frames captured earlier, e.g. by a {@link Throwable}. Depth 0 is the first element;
 * there is nothing below it, so a negative skip behaves like 0.
 * Stack trace elements carry no bytecode index, so their {@code pc} is 0.
 */
public final class CapturedFrameSource implements FrameSource {

    private final List<FrameView> frames;

    public CapturedFrameSource(List<FrameView> frames) {
        this.frames = List.copyOf(Objects.requireNonNull(frames, "frames"));
    }

    public static CapturedFrameSource of(Throwable t, SourcePathResolver paths) {
        return of(t == null ? null : t.getStackTrace(), paths);
    }

    public static CapturedFrameSource of(StackTraceElement[] elements, SourcePathResolver paths) {
        Objects.requireNonNull(paths, "paths");
        if (elements == null) return new CapturedFrameSource(List.of());
        List<FrameView> out = new ArrayList<>(elements.length);
        for (StackTraceElement el : elements) {
            if (el == null) continue;
            out.add(new FrameView(
                    0L,
                    paths.resolve(el.getClassName(), el.getFileName()),
                    el.getLineNumber(),
                    FrameView.symbolOf(el.getModuleName(), el.getClassName(), el.getMethodName())));
        }
        return new CapturedFrameSource(out);
    }

    @Override
    public List<FrameView> frames(int skip) {
        int from = Math.max(0, skip);
        if (from >= frames.size()) return List.of();
        return frames.subList(from, frames.size());
    }

    int depth() {
        return frames.size();
    }
}
