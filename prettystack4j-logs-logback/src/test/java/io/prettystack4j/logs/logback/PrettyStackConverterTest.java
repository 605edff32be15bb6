/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.logs.logback;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.status.Status;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PrettyStackConverterTest {

    private static final String NL = CoreConstants.LINE_SEPARATOR;

    private LoggerContext context;
    private Logger logger;

    @BeforeEach
    void setUp() {
        context = new LoggerContext();
        logger = context.getLogger(PrettyStackConverterTest.class);
    }

    @Test
    void rendersThrowableAndCauses() {
        PrettyStackConverter converter = converter(
                "includeSourceCode=false", "includePC=false", "showLineNumbers=false", "showFullPath=false");
        Exception root = new IllegalArgumentException("bad input");
        Exception wrapped = new IllegalStateException("failed", root);

        String out = converter.convert(event(wrapped));

        String[] lines = out.split("\\R");
        assertEquals("java.lang.IllegalStateException: failed", lines[0]);
        assertEquals("PrettyStackConverterTest.java", lines[1]);
        assertEquals("\trendersThrowableAndCauses", lines[2]);
        assertTrue(out.contains(NL + "Caused by: java.lang.IllegalArgumentException: bad input" + NL), out);
        assertTrue(out.endsWith(NL), out);
    }

    @Test
    void rendersSuppressedBeforeCause() {
        PrettyStackConverter converter = converter(
                "includeSourceCode=false", "includePC=false", "showLineNumbers=false", "showFullPath=false");
        Exception primary = new IllegalStateException("write failed", new IllegalArgumentException("bad row"));
        primary.addSuppressed(new UnsupportedOperationException("close failed"));

        String out = converter.convert(event(primary));

        int suppressed = out.indexOf(NL + "Suppressed: java.lang.UnsupportedOperationException: close failed" + NL);
        int cause = out.indexOf(NL + "Caused by: java.lang.IllegalArgumentException: bad row" + NL);
        assertTrue(suppressed > 0, out);
        assertTrue(cause > suppressed, out);
        assertTrue(out.indexOf("\trendersSuppressedBeforeCause", suppressed) > suppressed, out);
    }

    @Test
    void cyclicCauseChainTerminates() {
        PrettyStackConverter converter = converter("includeSourceCode=false");
        Exception a = new IllegalStateException("a");
        Exception b = new IllegalArgumentException("b", a);
        a.initCause(b);

        String out = converter.convert(event(a));

        assertTrue(out.contains("Caused by: java.lang.IllegalArgumentException: b" + NL), out);
    }

    @Test
    void skipAppliesPerThrowable() {
        PrettyStackConverter converter = converter("skipFrames=1", "includeSourceCode=false");
        Exception e = thrown();

        String out = converter.convert(event(e));

        String[] lines = out.split("\\R");
        assertEquals("java.lang.IllegalStateException: boom", lines[0]);
        assertEquals("\tskipAppliesPerThrowable", lines[2]);
        assertFalse(out.contains("\tthrown"), out);
    }

    @Test
    void noThrowableRendersNothing() {
        PrettyStackConverter converter = converter();

        assertEquals("", converter.convert(new LoggingEvent("fqcn", logger, Level.INFO, "hi", null, null)));
    }

    @Test
    void includesSourceLineByDefault() {
        PrettyStackConverter converter = converter("includePC=false");

        String out = converter.convert(event(thrown()));

        assertTrue(out.contains("\tthrown: return new IllegalStateException(\"boom\");"), out);
    }

    @Test
    void warnsAboutUnknownOptions() {
        converter("colour=red", "includePC=false");

        List<Status> warnings = context.getStatusManager().getCopyOfStatusList();
        assertTrue(
                warnings.stream().anyMatch(s -> s.getLevel() == Status.WARN && s.getMessage().contains("colour=red")),
                warnings.toString());
    }

    private PrettyStackConverter converter(String... options) {
        PrettyStackConverter converter = new PrettyStackConverter();
        converter.setContext(context);
        converter.setOptionList(List.of(options));
        converter.start();
        return converter;
    }

    private LoggingEvent event(Throwable t) {
        return new LoggingEvent("fqcn", logger, Level.ERROR, "failure", t, null);
    }

    private static Exception thrown() {
        return new IllegalStateException("boom");
    }
}
