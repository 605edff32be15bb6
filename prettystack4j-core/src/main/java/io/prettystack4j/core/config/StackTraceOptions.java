/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.config;

/** The complete set of configuration options, one per field of {@link StackTraceConfig}. */
public final class StackTraceOptions {
    private StackTraceOptions() {}

    public static StackTraceOption skipFrames(int skip) {
        return cfg -> cfg.skipFrames(skip);
    }

    public static StackTraceOption includeSourceCode(boolean include) {
        return cfg -> cfg.includeSourceCode(include);
    }

    public static StackTraceOption includePC(boolean include) {
        return cfg -> cfg.includePC(include);
    }

    public static StackTraceOption shortFuncNames(boolean shortNames) {
        return cfg -> cfg.shortFuncNames(shortNames);
    }

    public static StackTraceOption showFullPath(boolean full) {
        return cfg -> cfg.showFullPath(full);
    }

    public static StackTraceOption showLineNumbers(boolean show) {
        return cfg -> cfg.showLineNumbers(show);
    }

    public static StackTraceOption frameSeparator(String separator) {
        return cfg -> cfg.frameSeparator(separator);
    }

    public static StackTraceOption chunkSeparator(String separator) {
        return cfg -> cfg.chunkSeparator(separator);
    }

    public static StackTraceOption chunkIndentation(String indentation) {
        return cfg -> cfg.chunkIndentation(indentation);
    }
}
