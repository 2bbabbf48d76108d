/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.logback;

import ch.qos.logback.classic.pattern.ThrowableProxyConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxy;
import ch.qos.logback.core.CoreConstants;
import io.stacktrail.core.Errors;
import io.stacktrail.core.HasCallStack;
import io.stacktrail.core.stack.FrameRenderer;

/**
 * Renders annotated errors in their verbose form: message, then one {@code at} line per recorded
 * call site, newest first. Any other throwable is printed exactly as {@code %ex} would.
 *
 * <pre>{@code
 * <conversionRule conversionWord="trail" converterClass="io.stacktrail.logback.StackTrailConverter"/>
 * <pattern>%d %-5level %logger - %msg%n%trail</pattern>
 * }</pre>
 *
 * Using {@code %trail} in a pattern also stops logback from appending its default {@code %ex}.
 */
public class StackTrailConverter extends ThrowableProxyConverter {

    @Override
    public String convert(ILoggingEvent event) {
        IThrowableProxy tp = event.getThrowableProxy();
        if (!(tp instanceof ThrowableProxy proxy)) return super.convert(event);

        Throwable t = proxy.getThrowable();
        if (!(t instanceof HasCallStack annotated)) return super.convert(event);

        return Errors.messageOf(t)
                + FrameRenderer.defaultRenderer().renderTrail(annotated.callStack())
                + CoreConstants.LINE_SEPARATOR;
    }
}
