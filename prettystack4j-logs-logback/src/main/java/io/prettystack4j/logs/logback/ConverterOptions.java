/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.logs.logback;

import io.prettystack4j.core.config.StackTraceOption;
import io.prettystack4j.core.config.StackTraceOptions;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses {@code key=value} entries of a conversion word option list into options.
 * Keys are the configuration field names, case-insensitive. Separator values understand
 * the escapes {@code \n}, {@code \t}, {@code \s} (space) and {@code \c} (comma), since Logback
 * trims option text and splits the option list on commas.
 */
final class ConverterOptions {
    private ConverterOptions() {}

    /** Empty when the entry is malformed or names an unknown field. */
    static Optional<StackTraceOption> parse(String entry) {
        if (entry == null) return Optional.empty();
        int eq = entry.indexOf('=');
        if (eq <= 0) return Optional.empty();
        String key = entry.substring(0, eq).trim().toLowerCase(Locale.ROOT);
        String value = entry.substring(eq + 1).trim();

        return switch (key) {
            case "skipframes" -> parseInt(value).map(StackTraceOptions::skipFrames);
            case "includesourcecode" -> parseBool(value).map(StackTraceOptions::includeSourceCode);
            case "includepc" -> parseBool(value).map(StackTraceOptions::includePC);
            case "shortfuncnames" -> parseBool(value).map(StackTraceOptions::shortFuncNames);
            case "showfullpath" -> parseBool(value).map(StackTraceOptions::showFullPath);
            case "showlinenumbers" -> parseBool(value).map(StackTraceOptions::showLineNumbers);
            case "frameseparator" -> Optional.of(StackTraceOptions.frameSeparator(unescape(value)));
            case "chunkseparator" -> Optional.of(StackTraceOptions.chunkSeparator(unescape(value)));
            case "chunkindentation" -> Optional.of(StackTraceOptions.chunkIndentation(unescape(value)));
            default -> Optional.empty();
        };
    }

    private static Optional<Integer> parseInt(String v) {
        try {
            return Optional.of(Integer.parseInt(v));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Boolean> parseBool(String v) {
        if ("true".equalsIgnoreCase(v)) return Optional.of(Boolean.TRUE);
        if ("false".equalsIgnoreCase(v)) return Optional.of(Boolean.FALSE);
        return Optional.empty();
    }

    static String unescape(String v) {
        StringBuilder sb = new StringBuilder(v.length());
        for (int i = 0; i < v.length(); i++) {
            char c = v.charAt(i);
            if (c == '\\' && i + 1 < v.length()) {
                char n = v.charAt(++i);
                switch (n) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 's' -> sb.append(' ');
                    case 'c' -> sb.append(',');
                    default -> sb.append(n);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
