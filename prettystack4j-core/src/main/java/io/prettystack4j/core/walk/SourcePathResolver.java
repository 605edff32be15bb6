/*
 * Copyright (c) 2025 PrettyStack4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.prettystack4j.core.walk;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps a frame's declaring class and source file name to a path on disk.
 * The JVM records only the bare file name ({@code Foo.java}), so the package directory
 * is rebuilt from the class name and looked up under each source root in order.
 * A miss returns the package-relative path ({@code com/acme/Foo.java}).
 */
@Slf4j
public final class SourcePathResolver {

    public static final List<String> DEFAULT_ROOTS =
            List.of("src/main/java", "src/test/java", "src/main/kotlin", "src/test/kotlin", "");

    private final List<Path> roots;

    public SourcePathResolver(List<Path> roots) {
        this.roots = List.copyOf(Objects.requireNonNull(roots, "roots"));
    }

    /** {@link #DEFAULT_ROOTS} relative to the working directory. */
    public static SourcePathResolver defaults() {
        Path base = Paths.get(System.getProperty("user.dir", "."));
        List<Path> out = new ArrayList<>(DEFAULT_ROOTS.size());
        for (String r : DEFAULT_ROOTS) out.add(r.isEmpty() ? base : base.resolve(r));
        return new SourcePathResolver(out);
    }

    List<Path> roots() {
        return roots;
    }

    /** Returns null when the file name is unknown (native or synthetic frames). */
    public String resolve(String className, String fileName) {
        if (fileName == null || fileName.isEmpty()) return null;
        String relative = packageDir(className) + fileName;
        for (Path root : roots) {
            try {
                Path candidate = root.resolve(relative);
                if (Files.isRegularFile(candidate)) {
                    return candidate.toAbsolutePath().normalize().toString();
                }
            } catch (InvalidPathException | SecurityException e) {
                log.trace("Cannot look up {} under {}: {}", relative, root, e.toString());
            }
        }
        return relative;
    }

    private static String packageDir(String className) {
        if (className == null) return "";
        int i = className.lastIndexOf('.');
        return i > 0 ? className.substring(0, i).replace('.', '/') + "/" : "";
    }
}
