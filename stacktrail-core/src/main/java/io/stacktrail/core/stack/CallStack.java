/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core.stack;

import java.util.ArrayList;
import java.util.Formattable;
import java.util.FormattableFlags;
import java.util.Formatter;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, newest-first sequence of {@link Frame}s.
 *
 * <p>{@code %s} renders nothing, {@code %#s} renders one {@code "\n\tat function(file:line)"}
 * entry per frame. An empty stack renders as an empty string in both forms.
 */
public final class CallStack implements Iterable<Frame>, Formattable {

    private static final StackWalker WALKER = StackWalker.getInstance();
    private static final CallStack EMPTY = new CallStack(List.of());

    private final List<Frame> frames;

    private CallStack(List<Frame> frames) {
        this.frames = frames;
    }

    public static CallStack empty() {
        return EMPTY;
    }

    public static CallStack of(Frame... frames) {
        return of(List.of(frames));
    }

    public static CallStack of(List<Frame> frames) {
        return frames.isEmpty() ? EMPTY : new CallStack(List.copyOf(frames));
    }

    /**
     * Captures a single frame, {@code skip} levels above this method: {@code 0} is {@code capture}
     * itself, {@code 1} its caller, and so on. Yields {@link Frame#unknown()} if the thread's
     * stack is not that deep.
     */
    public static CallStack capture(int skip) {
        Frame frame = WALKER.walk(s -> s.skip(skip).findFirst())
                .map(Frame::new)
                .orElseGet(Frame::unknown);
        return new CallStack(List.of(frame));
    }

    /** {@code newer} followed by {@code older}; neither argument is modified. */
    public static CallStack append(CallStack newer, CallStack older) {
        Objects.requireNonNull(newer, "newer");
        Objects.requireNonNull(older, "older");
        if (older.isEmpty()) return newer;
        if (newer.isEmpty()) return older;
        List<Frame> merged = new ArrayList<>(newer.size() + older.size());
        merged.addAll(newer.frames);
        merged.addAll(older.frames);
        return new CallStack(List.copyOf(merged));
    }

    public List<Frame> frames() {
        return frames;
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public StackTraceElement[] toStackTraceElements() {
        StackTraceElement[] out = new StackTraceElement[frames.size()];
        for (int i = 0; i < out.length; i++) out[i] = frames.get(i).toStackTraceElement();
        return out;
    }

    @Override
    public Iterator<Frame> iterator() {
        return frames.iterator();
    }

    @Override
    public void formatTo(Formatter formatter, int flags, int width, int precision) {
        String text =
                (flags & FormattableFlags.ALTERNATE) != 0 ? FrameRenderer.defaultRenderer().renderTrail(this) : "";
        Formatting.write(formatter, text, flags, width, precision);
    }

    /** The verbose trail, as {@code %#s} would print it. */
    @Override
    public String toString() {
        return FrameRenderer.defaultRenderer().renderTrail(this);
    }
}
