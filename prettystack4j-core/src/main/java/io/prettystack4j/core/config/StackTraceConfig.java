/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.config;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Effective rendering configuration. Built once per render call from the defaults plus an
 * ordered list of {@link StackTraceOption}s and never changed afterwards.
 *
 * @param skipFrames innermost frames to omit; not validated, negative values are passed through
 * @param includeSourceCode embed the trimmed source line of each frame
 * @param includePC append the bytecode index as {@code (0xHEX)} to the header
 * @param shortFuncNames print the bare method name instead of the qualified symbol
 * @param showFullPath print the resolved source path instead of the file name only
 * @param showLineNumbers append {@code :line} to the header
 * @param frameSeparator placed between two rendered frames
 * @param chunkSeparator placed between the header and the body of one frame
 * @param chunkIndentation prefix of the body of each frame
 */
public record StackTraceConfig(
        int skipFrames,
        boolean includeSourceCode,
        boolean includePC,
        boolean shortFuncNames,
        boolean showFullPath,
        boolean showLineNumbers,
        String frameSeparator,
        String chunkSeparator,
        String chunkIndentation) {

    public static StackTraceConfig defaults() {
        return new Builder().build();
    }

    public static StackTraceConfig resolve(StackTraceOption... options) {
        return resolve(options == null ? List.of() : Arrays.asList(options));
    }

    /** Applies the options in order against the defaults; a later option wins over an earlier one. */
    public static StackTraceConfig resolve(List<? extends StackTraceOption> options) {
        Builder b = new Builder();
        if (options != null) {
            for (StackTraceOption opt : options) {
                if (opt != null) opt.applyTo(b);
            }
        }
        return b.build();
    }

    Builder toBuilder() {
        return new Builder()
                .skipFrames(skipFrames)
                .includeSourceCode(includeSourceCode)
                .includePC(includePC)
                .shortFuncNames(shortFuncNames)
                .showFullPath(showFullPath)
                .showLineNumbers(showLineNumbers)
                .frameSeparator(frameSeparator)
                .chunkSeparator(chunkSeparator)
                .chunkIndentation(chunkIndentation);
    }

    /** Mutable working copy the options write into. Separators are never null. */
    public static final class Builder {
        private int skipFrames = 0;
        private boolean includeSourceCode = true;
        private boolean includePC = true;
        private boolean shortFuncNames = true;
        private boolean showFullPath = true;
        private boolean showLineNumbers = true;
        private String frameSeparator = "\n";
        private String chunkSeparator = "\n";
        private String chunkIndentation = "\t";

        Builder() {}

        public Builder skipFrames(int skip) {
            this.skipFrames = skip;
            return this;
        }

        public Builder includeSourceCode(boolean include) {
            this.includeSourceCode = include;
            return this;
        }

        public Builder includePC(boolean include) {
            this.includePC = include;
            return this;
        }

        public Builder shortFuncNames(boolean shortNames) {
            this.shortFuncNames = shortNames;
            return this;
        }

        public Builder showFullPath(boolean full) {
            this.showFullPath = full;
            return this;
        }

        public Builder showLineNumbers(boolean show) {
            this.showLineNumbers = show;
            return this;
        }

        public Builder frameSeparator(String separator) {
            this.frameSeparator = Objects.requireNonNullElse(separator, "");
            return this;
        }

        public Builder chunkSeparator(String separator) {
            this.chunkSeparator = Objects.requireNonNullElse(separator, "");
            return this;
        }

        public Builder chunkIndentation(String indentation) {
            this.chunkIndentation = Objects.requireNonNullElse(indentation, "");
            return this;
        }

        public StackTraceConfig build() {
            return new StackTraceConfig(
                    skipFrames,
                    includeSourceCode,
                    includePC,
                    shortFuncNames,
                    showFullPath,
                    showLineNumbers,
                    frameSeparator,
                    chunkSeparator,
                    chunkIndentation);
        }
    }
}
