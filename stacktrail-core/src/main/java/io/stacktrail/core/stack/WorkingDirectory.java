/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core.stack;

import java.io.File;
import java.util.Objects;

/**
 * Directory that rendered file paths are made relative to.
 *
 * <p>{@link #current()} is read from {@code user.dir} once, when this class is initialized,
 * and never changes afterwards.
 */
public final class WorkingDirectory {

    private static final WorkingDirectory PROCESS = of(System.getProperty("user.dir", ""));

    private final String path;
    private final String prefix;

    private WorkingDirectory(String path) {
        this.path = path;
        this.prefix = path.isEmpty() || path.endsWith(File.separator) ? path : path + File.separator;
    }

    public static WorkingDirectory of(String path) {
        return new WorkingDirectory(Objects.requireNonNull(path, "path").trim());
    }

    /** The process working directory at startup. */
    public static WorkingDirectory current() {
        return PROCESS;
    }

    public String path() {
        return path;
    }

    /** Strips this directory from {@code file}; paths outside of it are returned unchanged. */
    public String relativize(String file) {
        if (file == null || prefix.isEmpty()) return file;
        return file.startsWith(prefix) ? file.substring(prefix.length()) : file;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WorkingDirectory other && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }
}
