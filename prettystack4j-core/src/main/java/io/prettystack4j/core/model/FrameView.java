/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.model;

/**
 * One frame of a walked stack.
 *
 * @param pc bytecode index of the execution point (0 when the source cannot tell)
 * @param file source path as resolved by the frame source; nullable
 * @param line 1-indexed line number; zero or negative when unknown
 * @param symbol qualified function name, e.g. {@code java.base/java.lang.Thread.run}; nullable
 */
public record FrameView(long pc, String file, int line, String symbol) {

    /** Substituted for any value that cannot be resolved. */
    public static final String UNKNOWN = "???";

    /** {@code module/class.method}, the same qualification {@link StackTraceElement#toString()} uses. */
    public static String symbolOf(String moduleName, String className, String methodName) {
        if (className == null || methodName == null) return null;
        String qualified = className + "." + methodName;
        return (moduleName == null || moduleName.isEmpty()) ? qualified : moduleName + "/" + qualified;
    }
}
