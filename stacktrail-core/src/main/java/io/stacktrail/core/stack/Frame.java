/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core.stack;

import io.stacktrail.core.model.FrameView;
import java.util.Formattable;
import java.util.FormattableFlags;
import java.util.Formatter;

/**
 * A single captured call site.
 *
 * <p>The frame keeps the walker's token and only resolves class, method, file and line when it
 * is rendered. Formatting with {@code %s} prints {@code function(file:line)}; the alternate
 * form {@code %#s} prints the same text as a trail entry, {@code "\n\tat function(file:line)"}.
 */
public final class Frame implements Formattable {

    private static final Frame UNKNOWN = new Frame(null);

    private final StackWalker.StackFrame pc; // null when nothing could be captured

    Frame(StackWalker.StackFrame pc) {
        this.pc = pc;
    }

    /** A frame that renders as {@code unknown(unknown:0)}. */
    public static Frame unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return pc == null;
    }

    public FrameView resolve() {
        if (pc == null) return FrameView.UNRESOLVED;
        return new FrameView(pc.getClassName() + "." + pc.getMethodName(), pc.getFileName(), pc.getLineNumber());
    }

    public StackTraceElement toStackTraceElement() {
        if (pc == null) return new StackTraceElement(FrameView.UNKNOWN, FrameView.UNKNOWN, FrameView.UNKNOWN, 0);
        return pc.toStackTraceElement();
    }

    @Override
    public void formatTo(Formatter formatter, int flags, int width, int precision) {
        String text = FrameRenderer.defaultRenderer().render(this);
        if ((flags & FormattableFlags.ALTERNATE) != 0) text = FrameRenderer.TRAIL_PREFIX + text;
        Formatting.write(formatter, text, flags, width, precision);
    }

    @Override
    public String toString() {
        return FrameRenderer.defaultRenderer().render(this);
    }
}
