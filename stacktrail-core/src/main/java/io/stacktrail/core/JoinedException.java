/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core;

import java.util.List;
import java.util.Objects;

/**
 * An error joined with the cause that led to it. The message is {@code "<error>: <cause>"}; both
 * are reachable from chain searches, {@link #getCause()} returns the error.
 */
public class JoinedException extends RuntimeException implements MultiCause {

    private static final long serialVersionUID = 1L;

    private final Throwable joinedCause;

    public JoinedException(Throwable error, Throwable cause) {
        super(
                Errors.messageOf(Objects.requireNonNull(error, "error")) + ": "
                        + Errors.messageOf(Objects.requireNonNull(cause, "cause")),
                error,
                true,
                false);
        this.joinedCause = cause;
    }

    @Override
    public List<Throwable> causes() {
        return List.of(getCause(), joinedCause);
    }
}
