/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.logs.logback;

import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.StackTraceElementProxy;
import io.prettystack4j.core.walk.CapturedFrameSource;
import io.prettystack4j.core.walk.SourcePathResolver;

final class ThrowableFrameAdapter {
    private ThrowableFrameAdapter() {}

    static CapturedFrameSource toSource(IThrowableProxy tp, SourcePathResolver paths) {
        StackTraceElementProxy[] arr = tp == null ? null : tp.getStackTraceElementProxyArray();
        if (arr == null) return CapturedFrameSource.of((StackTraceElement[]) null, paths);

        StackTraceElement[] elements = new StackTraceElement[arr.length];
        for (int i = 0; i < arr.length; i++) {
            elements[i] = arr[i] == null ? null : arr[i].getStackTraceElement();
        }
        return CapturedFrameSource.of(elements, paths);
    }
}
