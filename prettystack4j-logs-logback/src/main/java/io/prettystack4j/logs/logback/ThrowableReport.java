/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.logs.logback;

import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.CoreConstants;
import io.prettystack4j.core.PrettyStack;
import io.prettystack4j.core.config.StackTraceOption;
import io.prettystack4j.core.walk.SourcePathResolver;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Renders a throwable proxy with its suppressed exceptions and full cause chain:
 * header line, pretty frames, then each {@code Suppressed:} entry, then {@code Caused by:}.
 * A proxy already printed is named once more and not walked again.
 */
final class ThrowableReport {
    private ThrowableReport() {}

    static String render(IThrowableProxy tp, List<? extends StackTraceOption> options, SourcePathResolver paths) {
        if (tp == null) return CoreConstants.EMPTY_STRING;
        StringBuilder sb = new StringBuilder(512);
        append(sb, tp, null, options, paths, Collections.newSetFromMap(new IdentityHashMap<>()));
        return sb.toString();
    }

    private static void append(
            StringBuilder sb,
            IThrowableProxy tp,
            String prefix,
            List<? extends StackTraceOption> options,
            SourcePathResolver paths,
            Set<IThrowableProxy> seen) {
        if (prefix != null) sb.append(prefix);
        sb.append(tp.getClassName());
        if (tp.getMessage() != null) sb.append(": ").append(tp.getMessage());

        if (!seen.add(tp)) {
            sb.append(" [CIRCULAR REFERENCE]").append(CoreConstants.LINE_SEPARATOR);
            return;
        }
        sb.append(CoreConstants.LINE_SEPARATOR);

        String frames = PrettyStack.renderString(ThrowableFrameAdapter.toSource(tp, paths), options);
        if (!frames.isEmpty()) sb.append(frames).append(CoreConstants.LINE_SEPARATOR);

        IThrowableProxy[] suppressed = tp.getSuppressed();
        if (suppressed != null) {
            for (IThrowableProxy s : suppressed) {
                if (s != null) append(sb, s, CoreConstants.SUPPRESSED, options, paths, seen);
            }
        }
        if (tp.getCause() != null) append(sb, tp.getCause(), CoreConstants.CAUSED_BY, options, paths, seen);
    }
}
