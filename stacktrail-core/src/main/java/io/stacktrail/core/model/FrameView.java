/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core.model;

import io.stacktrail.core.stack.WorkingDirectory;
import java.util.Objects;

/** A resolved call site: fully qualified function, source file and line. */
public record FrameView(String function, String file, int line) {

    /** Placeholder for fields the runtime could not resolve. */
    public static final String UNKNOWN = "unknown";

    public static final FrameView UNRESOLVED = new FrameView(UNKNOWN, UNKNOWN, 0);

    public FrameView {
        function = Objects.requireNonNullElse(function, UNKNOWN);
        file = Objects.requireNonNullElse(file, UNKNOWN);
        line = Math.max(0, line);
    }

    /** {@code function(file:line)} with the file shown relative to {@code dir}. */
    public String pretty(WorkingDirectory dir) {
        return function + "(" + dir.relativize(file) + ":" + line + ")";
    }
}
