/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/** Depth-first, pre-order search over cause chains, branching at {@link MultiCause} nodes. */
final class Chains {
    private Chains() {}

    static Optional<Throwable> find(Throwable root, Predicate<Throwable> match) {
        if (root == null) return Optional.empty();
        Deque<Throwable> pending = new ArrayDeque<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        pending.push(root);
        while (!pending.isEmpty()) {
            Throwable t = pending.pop();
            if (!seen.add(t)) continue; // cyclic cause chain
            if (match.test(t)) return Optional.of(t);
            List<Throwable> next = children(t);
            for (int i = next.size() - 1; i >= 0; i--) {
                pending.push(next.get(i));
            }
        }
        return Optional.empty();
    }

    private static List<Throwable> children(Throwable t) {
        if (t instanceof MultiCause mc) {
            return mc.causes().stream().filter(Objects::nonNull).toList();
        }
        Throwable cause = t.getCause();
        return cause == null ? List.of() : List.of(cause);
    }
}
