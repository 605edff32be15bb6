/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.config;

/** Sets exactly one field of the configuration being resolved. See {@link StackTraceOptions}. */
@FunctionalInterface
public interface StackTraceOption {
    void applyTo(StackTraceConfig.Builder cfg);
}
