/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core.stack;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns frames into text, with file paths relative to a fixed {@link WorkingDirectory}.
 *
 * <p>The process-wide default is fixed once: either explicitly through {@link #installDefault}
 * at startup or, failing that, on first use with {@link WorkingDirectory#current()}.
 */
public final class FrameRenderer {

    /** Written before every frame of a verbose trail. */
    public static final String TRAIL_PREFIX = "\n\tat ";

    private static final AtomicReference<FrameRenderer> DEFAULT = new AtomicReference<>();

    private final WorkingDirectory workingDirectory;

    public FrameRenderer(WorkingDirectory workingDirectory) {
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    public static FrameRenderer defaultRenderer() {
        FrameRenderer r = DEFAULT.get();
        if (r != null) return r;
        DEFAULT.compareAndSet(null, new FrameRenderer(WorkingDirectory.current()));
        return DEFAULT.get();
    }

    /**
     * Makes {@code renderer} the process default.
     *
     * @return false if a default was already fixed, in which case it is left alone
     */
    public static boolean installDefault(FrameRenderer renderer) {
        return DEFAULT.compareAndSet(null, Objects.requireNonNull(renderer, "renderer"));
    }

    public WorkingDirectory workingDirectory() {
        return workingDirectory;
    }

    /** {@code function(file:line)}. */
    public String render(Frame frame) {
        return frame.resolve().pretty(workingDirectory);
    }

    /** One {@code "\n\tat function(file:line)"} entry per frame, newest first. */
    public String renderTrail(CallStack stack) {
        if (stack.isEmpty()) return "";
        StringBuilder sb = new StringBuilder(64 * stack.size());
        for (Frame f : stack) {
            sb.append(TRAIL_PREFIX).append(render(f));
        }
        return sb.toString();
    }
}
