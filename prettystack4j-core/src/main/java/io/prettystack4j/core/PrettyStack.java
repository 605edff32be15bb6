/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core;

import io.prettystack4j.core.config.StackTraceConfig;
import io.prettystack4j.core.config.StackTraceOption;
import io.prettystack4j.core.model.FrameView;
import io.prettystack4j.core.render.StackTraceRenderer;
import io.prettystack4j.core.walk.CapturedFrameSource;
import io.prettystack4j.core.walk.FrameSource;
import io.prettystack4j.core.walk.LiveFrameSource;
import io.prettystack4j.core.walk.SourcePathResolver;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point. Renders a stack as text, by default with every detail switched on:
 *
 * <pre>
 * /work/app/src/main/java/com/acme/Orders.java:42 (0x1f)
 * 	place: validator.check(order);
 * </pre>
 *
 * Rendering never throws for unreadable sources, unknown lines or symbols, or odd options;
 * those degrade to {@code ???} or to fewer frames.
 */
@Slf4j
public final class PrettyStack {
    private PrettyStack() {}

    /**
     * Stack of the calling thread. With skip 0 the first frame is this method;
     * use {@code skipFrames(1)} to start at the caller.
     */
    public static byte[] newStackTrace(StackTraceOption... options) {
        return render(new LiveFrameSource(PrettyStack.class, SourcePathResolver.defaults()), options);
    }

    /** {@link #newStackTrace} as a string. */
    public static String newStackTraceString(StackTraceOption... options) {
        return renderString(new LiveFrameSource(PrettyStack.class, SourcePathResolver.defaults()), asList(options));
    }

    /** Frames captured by {@code t}, its first element at depth 0. */
    public static byte[] render(Throwable t, StackTraceOption... options) {
        return render(CapturedFrameSource.of(t, SourcePathResolver.defaults()), options);
    }

    public static byte[] render(FrameSource source, StackTraceOption... options) {
        return render(source, asList(options));
    }

    public static byte[] render(FrameSource source, List<? extends StackTraceOption> options) {
        return renderString(source, options).getBytes(StandardCharsets.UTF_8);
    }

    public static String renderString(FrameSource source, List<? extends StackTraceOption> options) {
        Objects.requireNonNull(source, "source");
        StackTraceConfig cfg = StackTraceConfig.resolve(options);
        List<FrameView> frames = source.frames(cfg.skipFrames());
        log.trace("Rendering {} frames with {}", frames.size(), cfg);
        return new StackTraceRenderer(cfg).render(frames);
    }

    private static List<StackTraceOption> asList(StackTraceOption[] options) {
        return options == null ? List.of() : Arrays.asList(options);
    }
}
