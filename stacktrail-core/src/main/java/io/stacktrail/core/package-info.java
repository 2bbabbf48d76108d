/**
 * Exceptions annotated with the call sites they passed through.
 *
 * <ul>
 *   <li>{@link io.stacktrail.core.Errors}: creating, wrapping and inspecting errors.</li>
 *   <li>{@link io.stacktrail.core.AnnotatedException}: the stack-bearing wrapper.</li>
 *   <li>{@link io.stacktrail.core.HasCallStack}: what construct-or-merge looks for in a chain.</li>
 * </ul>
 */
package io.stacktrail.core;
