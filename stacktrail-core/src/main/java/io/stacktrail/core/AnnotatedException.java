/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.stacktrail.core.stack.CallStack;
import io.stacktrail.core.stack.Formatting;
import io.stacktrail.core.stack.FrameRenderer;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Formattable;
import java.util.FormattableFlags;
import java.util.Formatter;
import java.util.Objects;

/**
 * Decorates an underlying error with the call sites it passed through.
 *
 * <p>The wrapper adds no text of its own: {@link #getMessage()} is the underlying error's message
 * and {@link #getCause()} is the underlying error, so chain searches see straight through it.
 * The call sites only show up in the verbose form:
 *
 * <pre>{@code
 * String.format("%#s", err)   // message + "\n\tat fn(File.java:12)" per frame, newest first
 * String.format("%s", err)    // message only
 * }</pre>
 *
 * <p>No JVM stack trace is filled in; {@link #getStackTrace()} reports the recorded call sites.
 * Suppressed exceptions (e.g. from a failing {@code close()} in try-with-resources) are kept.
 */
public class AnnotatedException extends RuntimeException implements HasCallStack, Formattable {

    private static final long serialVersionUID = 1L;

    @SuppressFBWarnings(
            value = "SE_TRANSIENT_FIELD_NOT_RESTORED",
            justification = "Call sites are in-process debug data; a deserialized copy renders without them.")
    private transient CallStack callStack;

    public AnnotatedException(Throwable error, CallStack callStack) {
        super(null, Objects.requireNonNull(error, "error"), true, false);
        this.callStack = Objects.requireNonNull(callStack, "callStack");
    }

    @Override
    public String getMessage() {
        return Errors.messageOf(getCause());
    }

    @Override
    public CallStack callStack() {
        return callStack == null ? CallStack.empty() : callStack;
    }

    @Override
    public void prependCallStack(CallStack newer) {
        this.callStack = CallStack.append(newer, callStack());
    }

    /** Message followed by the trail, rendered with the default {@link FrameRenderer}. */
    public String toVerboseString() {
        return toVerboseString(FrameRenderer.defaultRenderer());
    }

    public String toVerboseString(FrameRenderer renderer) {
        return getMessage() + renderer.renderTrail(callStack());
    }

    @Override
    public StackTraceElement[] getStackTrace() {
        return callStack().toStackTraceElements();
    }

    @Override
    public void printStackTrace(PrintStream s) {
        s.println(toVerboseString());
        for (Throwable suppressed : getSuppressed()) {
            s.println("\tSuppressed: " + suppressed);
        }
    }

    @Override
    public void printStackTrace(PrintWriter s) {
        s.println(toVerboseString());
        for (Throwable suppressed : getSuppressed()) {
            s.println("\tSuppressed: " + suppressed);
        }
    }

    @Override
    public void formatTo(Formatter formatter, int flags, int width, int precision) {
        String text = (flags & FormattableFlags.ALTERNATE) != 0 ? toVerboseString() : getMessage();
        Formatting.write(formatter, text, flags, width, precision);
    }
}
