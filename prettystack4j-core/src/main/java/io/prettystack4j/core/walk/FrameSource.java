/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.walk;

import io.prettystack4j.core.model.FrameView;
import java.util.List;

/** Supplies the frames of one stack, innermost first. */
public interface FrameSource {

    /**
     * Frames from depth {@code skip} outward. A skip at or past the stack depth yields an empty list;
     * what a negative skip yields is up to the source, but it must not fail.
     */
    List<FrameView> frames(int skip);
}
