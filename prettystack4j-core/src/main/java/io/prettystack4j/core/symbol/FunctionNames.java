/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.symbol;

import io.prettystack4j.core.model.FrameView;

/** Turns a qualified symbol into the name printed in a frame body. */
public final class FunctionNames {
    private FunctionNames() {}

    private static final String CENTER_DOT = "\u00b7";
    // the centre dot read back as Latin-1
    private static final String CENTER_DOT_MOJIBAKE = "\u00c2\u00b7";

    /** Returns {@link FrameView#UNKNOWN} for a null symbol; the symbol unchanged unless {@code shortNames}. */
    public static String resolve(String symbol, boolean shortNames) {
        if (symbol == null) return FrameView.UNKNOWN;
        return shortNames ? shorten(symbol) : symbol;
    }

    /**
     * {@code example.com/mod/pkg.Type.Method} becomes {@code Method}:
     * drop the module path up to the last '/', normalize centre dots to '.', then drop the
     * enclosing qualifier up to the last '.'.
     */
    public static String shorten(String symbol) {
        String name = symbol;
        int slash = name.lastIndexOf('/');
        if (slash >= 0) name = name.substring(slash + 1);

        name = name.replace(CENTER_DOT_MOJIBAKE, ".").replace(CENTER_DOT, ".");

        int dot = name.lastIndexOf('.');
        if (dot >= 0) name = name.substring(dot + 1);
        return name;
    }
}
