/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core;

import io.stacktrail.core.stack.CallStack;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Entry points for creating and annotating errors with call-site provenance.
 *
 * <p>Every operation records the line it was called from. Re-annotating an error that already
 * carries a {@link HasCallStack} node folds the new frame into that node, so a chain never
 * grows a second stack-bearing wrapper; operations that produce a new message always allocate a
 * fresh {@link AnnotatedException}, carrying the earlier frames after the new one.
 *
 * <pre>{@code
 * Throwable err = Errors.wrap(ioException, "loading settings");
 * if (Errors.is(err, ioException)) { ... }
 * log.error("{}", String.format("%#s", err));
 * }</pre>
 *
 * <p>Every method that takes an error returns {@code null} for a {@code null} error. None of them
 * throws.
 */
public final class Errors {

    // Frames above CallStack.capture: 0 = capture, 1 = its caller, ...
    private static final int DIRECT = 2;
    private static final int VIA_HELPER = 3;

    private Errors() {}

    public static AnnotatedException newError(String message) {
        return new AnnotatedException(new MessageException(message), CallStack.capture(DIRECT));
    }

    /** Like {@link #newError} with a {@link String#format} message. */
    public static AnnotatedException errorf(String format, Object... args) {
        return new AnnotatedException(new MessageException(String.format(format, args)), CallStack.capture(DIRECT));
    }

    /**
     * Records the current call site on {@code err}. If the chain already has a {@link HasCallStack}
     * node, that node gets the frame and is returned; otherwise {@code err} is wrapped.
     *
     * <p>When that node sits below plain exceptions, those outer exceptions are not part of the
     * result: {@code withStack(new RuntimeException("outer", annotated))} returns {@code annotated},
     * and {@code is(result, outer)} is false. Use {@link #wrap} to keep the outer context.
     */
    public static Throwable withStack(Throwable err) {
        if (err == null) return null;
        return annotate(err, VIA_HELPER);
    }

    /** A new error with message {@code "<message>: <err message>"} and cause {@code err}. */
    public static AnnotatedException wrap(Throwable err, String message) {
        if (err == null) return null;
        return wrapWithMessage(err, message, VIA_HELPER);
    }

    public static AnnotatedException wrapf(Throwable err, String format, Object... args) {
        if (err == null) return null;
        return wrapWithMessage(err, String.format(format, args), VIA_HELPER);
    }

    /** Same as {@link #wrap}. */
    public static AnnotatedException withMessage(Throwable err, String message) {
        if (err == null) return null;
        return wrapWithMessage(err, message, VIA_HELPER);
    }

    /** Same as {@link #wrapf}. */
    public static AnnotatedException withMessagef(Throwable err, String format, Object... args) {
        if (err == null) return null;
        return wrapWithMessage(err, String.format(format, args), VIA_HELPER);
    }

    /**
     * Joins {@code err} with the {@code cause} that produced it: the message is
     * {@code "<err>: <cause>"} and both stay reachable through {@link #is} and {@link #as}. The
     * trail lists this call site, then the frames already on {@code err}, then those on
     * {@code cause}. A {@code null} cause behaves like {@link #withStack(Throwable)}.
     */
    public static Throwable wrapWithCause(Throwable err, Throwable cause) {
        if (err == null) return null;
        if (cause == null) return annotate(err, VIA_HELPER);

        JoinedException joined = new JoinedException(err, cause);
        CallStack stack = CallStack.capture(DIRECT);
        stack = withExistingFrames(stack, err);
        stack = withExistingFrames(stack, cause);
        return new AnnotatedException(joined, stack);
    }

    /** Whether {@code target} (by {@code equals}) appears anywhere in {@code err}'s chain. */
    public static boolean is(Throwable err, Throwable target) {
        if (err == null || target == null) return err == target;
        return Chains.find(err, t -> t.equals(target)).isPresent();
    }

    /** The first error in {@code err}'s chain that is an instance of {@code type}. */
    public static <T> Optional<T> as(Throwable err, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return Chains.find(err, type::isInstance).map(type::cast);
    }

    /** One level down the chain; for a joined error, the first branch. */
    public static Throwable unwrap(Throwable err) {
        return err == null ? null : err.getCause();
    }

    /** The last error reached by repeatedly unwrapping {@code err}. */
    public static Throwable rootCause(Throwable err) {
        if (err == null) return null;
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable t = err;
        while (t.getCause() != null && seen.add(t)) {
            t = t.getCause();
        }
        return t;
    }

    /** The message of {@code t}, or its {@code toString()} when it has none; {@code null} for {@code null}. */
    public static String messageOf(Throwable t) {
        if (t == null) return null;
        String m = t.getMessage();
        return m != null ? m : t.toString();
    }

    // ---------------- construct-or-merge ----------------

    private static Throwable annotate(Throwable err, int skip) {
        CallStack captured = CallStack.capture(skip);
        Optional<Throwable> existing = Chains.find(err, HasCallStack.class::isInstance);
        if (existing.isPresent()) {
            ((HasCallStack) existing.get()).prependCallStack(captured);
            return existing.get();
        }
        return new AnnotatedException(err, captured);
    }

    private static AnnotatedException wrapWithMessage(Throwable err, String message, int skip) {
        MessageException withMessage = new MessageException(message + ": " + messageOf(err), err);
        CallStack stack = CallStack.capture(skip);
        return new AnnotatedException(withMessage, withExistingFrames(stack, err));
    }

    private static CallStack withExistingFrames(CallStack stack, Throwable err) {
        return as(err, HasCallStack.class)
                .map(w -> CallStack.append(stack, w.callStack()))
                .orElse(stack);
    }
}
