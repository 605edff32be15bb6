/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.render;

import io.prettystack4j.core.config.StackTraceConfig;
import io.prettystack4j.core.model.FrameView;
import io.prettystack4j.core.source.SourceLineCache;
import io.prettystack4j.core.symbol.FunctionNames;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders frames as text. Each frame is a header ({@code path:line (0xPC)}, optional parts left
 * out) and a body ({@code <indent>name: source line}) joined by the chunk separator; frames are
 * joined by the frame separator. Unresolvable values render as {@link FrameView#UNKNOWN}.
 */
public final class StackTraceRenderer {

    private final StackTraceConfig cfg;

    public StackTraceRenderer(StackTraceConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public String render(List<FrameView> frames) {
        if (frames == null || frames.isEmpty()) return "";
        SourceLineCache sources = new SourceLineCache();

        List<String> rendered = new ArrayList<>(frames.size());
        for (FrameView f : frames) {
            rendered.add(header(f) + cfg.chunkSeparator() + body(f, sources));
        }
        return String.join(cfg.frameSeparator(), rendered);
    }

    String header(FrameView f) {
        StringBuilder sb = new StringBuilder(64);
        sb.append(displayFile(f.file()));
        if (cfg.showLineNumbers()) sb.append(':').append(f.line());
        if (cfg.includePC()) sb.append(" (0x").append(Long.toHexString(f.pc())).append(')');
        return sb.toString();
    }

    String body(FrameView f, SourceLineCache sources) {
        String name = FunctionNames.resolve(f.symbol(), cfg.shortFuncNames());
        if (!cfg.includeSourceCode()) return cfg.chunkIndentation() + name;
        return cfg.chunkIndentation() + name + ": " + sources.line(f.file(), f.line());
    }

    private String displayFile(String file) {
        if (file == null) return FrameView.UNKNOWN;
        if (cfg.showFullPath()) return file;
        int i = Math.max(file.lastIndexOf('/'), file.lastIndexOf('\\'));
        return i >= 0 ? file.substring(i + 1) : file;
    }
}
