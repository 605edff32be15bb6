/**
 * Logback adapter for PrettyStack4J:
 * - PrettyStackConverter: {@code %prettyStack} conversion word for event throwables.
 * - PrettyStackUncaughtExceptionHandler: logs uncaught exceptions with the rendered report.
 */
package io.prettystack4j.logs.logback;
