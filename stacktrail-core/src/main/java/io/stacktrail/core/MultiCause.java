/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core;

import java.util.List;

/** An exception with several parallel causes; chain searches visit each of them in order. */
public interface MultiCause {
    List<Throwable> causes();
}
