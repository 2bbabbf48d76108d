/**
 * Logback adapter for stacktrail:
 * - StackTrailConverter: {@code %trail} pattern word printing annotated errors with their call sites.
 */
package io.stacktrail.logback;
