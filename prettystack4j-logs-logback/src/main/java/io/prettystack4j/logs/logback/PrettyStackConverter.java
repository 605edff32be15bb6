/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.logs.logback;

import ch.qos.logback.classic.pattern.ThrowableHandlingConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import io.prettystack4j.core.config.StackTraceOption;
import io.prettystack4j.core.walk.SourcePathResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Logback conversion word rendering the event's throwable, its suppressed exceptions and its causes
 * in the pretty format.
 * Register with {@code <conversionRule conversionWord="prettyStack" converterClass="...PrettyStackConverter"/>}
 * and use as {@code %prettyStack{shortFuncNames=false, includePC=false}}.
 * Unknown or malformed options are reported to the status manager and ignored.
 */
public class PrettyStackConverter extends ThrowableHandlingConverter {

    private List<StackTraceOption> options = List.of();
    private SourcePathResolver paths;

    @Override
    public void start() {
        List<String> raw = getOptionList();
        List<StackTraceOption> parsed = new ArrayList<>();
        if (raw != null) {
            for (String entry : raw) {
                Optional<StackTraceOption> opt = ConverterOptions.parse(entry);
                if (opt.isPresent()) {
                    parsed.add(opt.get());
                } else {
                    addWarn("Ignoring unrecognized prettyStack option [" + entry + "]");
                }
            }
        }
        this.options = List.copyOf(parsed);
        this.paths = SourcePathResolver.defaults();
        super.start();
    }

    @Override
    public String convert(ILoggingEvent event) {
        return ThrowableReport.render(event.getThrowableProxy(), options, resolver());
    }

    private SourcePathResolver resolver() {
        // convert may run before start() when the converter is built by hand
        if (paths == null) paths = SourcePathResolver.defaults();
        return paths;
    }
}
