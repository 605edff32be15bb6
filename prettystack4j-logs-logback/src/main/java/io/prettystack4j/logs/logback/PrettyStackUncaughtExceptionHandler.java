/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.logs.logback;

import ch.qos.logback.classic.spi.ThrowableProxy;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.prettystack4j.core.config.StackTraceOption;
import io.prettystack4j.core.walk.SourcePathResolver;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs a dying thread's exception, its suppressed exceptions and its causes as a pretty report at
 * ERROR, then hands it to the handler that was installed before (if any). The raw throwable is not
 * passed to the logger, so the appender does not print the default trace a second time.
 */
@Slf4j
public final class PrettyStackUncaughtExceptionHandler implements Thread.UncaughtExceptionHandler {

    private final Thread.UncaughtExceptionHandler previous; // nullable
    private final List<StackTraceOption> options;
    private final SourcePathResolver paths;

    /** Keeps the previous handler by reference; it is owned by the runtime and never exposed. */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The previous handler is runtime-managed; copying it is meaningless.")
    public PrettyStackUncaughtExceptionHandler(
            Thread.UncaughtExceptionHandler previous, List<? extends StackTraceOption> options) {
        this.previous = previous;
        this.options = List.copyOf(options == null ? List.of() : options);
        this.paths = SourcePathResolver.defaults();
    }

    /** Installs a handler as the JVM-wide default, chaining to the current default. */
    public static PrettyStackUncaughtExceptionHandler install(StackTraceOption... options) {
        var handler = new PrettyStackUncaughtExceptionHandler(
                Thread.getDefaultUncaughtExceptionHandler(),
                options == null ? List.of() : Arrays.asList(options));
        Thread.setDefaultUncaughtExceptionHandler(handler);
        return handler;
    }

    @Override
    public void uncaughtException(Thread t, Throwable e) {
        try {
            String report = ThrowableReport.render(new ThrowableProxy(e), options, paths);
            log.error("Uncaught exception in thread \"{}\": {}", t.getName(), report);
        } catch (RuntimeException renderFailure) {
            // e.g. a broken getMessage(); still report the original failure
            log.error("Uncaught exception in thread \"{}\"", t.getName(), e);
        }
        if (previous != null) previous.uncaughtException(t, e);
    }
}
