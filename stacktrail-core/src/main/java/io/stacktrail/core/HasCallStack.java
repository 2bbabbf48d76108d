/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core;

import io.stacktrail.core.stack.CallStack;

/**
 * An exception in a chain that carries call-site provenance.
 *
 * <p>Annotating an error whose chain already contains one of these extends its stack instead of
 * adding another stack-bearing node. Implementations are not thread-safe: the same error must
 * not be annotated from several threads at once.
 */
public interface HasCallStack {

    CallStack callStack();

    /** Replaces the stack with {@code newer} followed by the current frames. */
    void prependCallStack(CallStack newer);
}
