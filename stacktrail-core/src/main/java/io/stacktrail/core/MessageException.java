/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core;

/**
 * Plain message error, optionally wrapping a single cause. Fills no JVM stack trace: call sites
 * are recorded by the {@link AnnotatedException} around it.
 */
public class MessageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public MessageException(String message) {
        this(message, null);
    }

    public MessageException(String message, Throwable cause) {
        super(message, cause, true, false);
    }
}
