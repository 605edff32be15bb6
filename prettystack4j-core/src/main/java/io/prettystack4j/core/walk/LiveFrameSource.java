/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.walk;

import io.prettystack4j.core.model.FrameView;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Walks the calling thread with {@link StackWalker}.
 *
 * <p>Depth 0 is the outermost frame of the entry point class, i.e. the public method the
 * caller invoked to request the report. Skip 1 therefore hides the reporting call itself.
 * The frames between the walk and the entry point (this class, the renderer plumbing) lie
 * below depth 0 and only show up with a negative skip.
 */
public final class LiveFrameSource implements FrameSource {

    private static final StackWalker WALKER = StackWalker.getInstance();

    private final String entryPoint;
    private final SourcePathResolver paths;

    public LiveFrameSource(Class<?> entryPoint, SourcePathResolver paths) {
        this.entryPoint = Objects.requireNonNull(entryPoint, "entryPoint").getName();
        this.paths = Objects.requireNonNull(paths, "paths");
    }

    @Override
    public List<FrameView> frames(int skip) {
        List<StackWalker.StackFrame> stack = WALKER.walk(s -> s.collect(Collectors.toList()));
        long from = Math.max(0L, (long) depthZero(stack) + skip);
        if (from >= stack.size()) return List.of();

        List<FrameView> out = new ArrayList<>(stack.size() - (int) from);
        for (int i = (int) from; i < stack.size(); i++) {
            out.add(toView(stack.get(i)));
        }
        return out;
    }

    /** Index of the last frame in the first run of entry point frames; 0 if there is none. */
    private int depthZero(List<StackWalker.StackFrame> stack) {
        int i = 0;
        while (i < stack.size() && !entryPoint.equals(stack.get(i).getClassName())) i++;
        if (i == stack.size()) return 0;
        while (i + 1 < stack.size() && entryPoint.equals(stack.get(i + 1).getClassName())) i++;
        return i;
    }

    private FrameView toView(StackWalker.StackFrame f) {
        StackTraceElement el = f.toStackTraceElement();
        long pc = f.isNativeMethod() ? 0L : Math.max(0, f.getByteCodeIndex());
        return new FrameView(
                pc,
                paths.resolve(f.getClassName(), f.getFileName()),
                f.getLineNumber(),
                FrameView.symbolOf(el.getModuleName(), f.getClassName(), f.getMethodName()));
    }
}
