/*
 * Copyright (c) 2025 Stacktrail Contributors
 * Licensed under the Apache License 2.0
 */
package io.stacktrail.core.stack;

import java.util.FormattableFlags;
import java.util.Formatter;
import java.util.Locale;

/** Applies the precision, {@code UPPERCASE}, width and {@code LEFT_JUSTIFY} parts of a {@code %s} spec. */
public final class Formatting {
    private Formatting() {}

    public static void write(Formatter formatter, String text, int flags, int width, int precision) {
        String out = text;
        if (precision >= 0 && out.length() > precision) out = out.substring(0, precision);
        if ((flags & FormattableFlags.UPPERCASE) != 0) out = out.toUpperCase(Locale.ROOT);
        if (width > out.length()) {
            String pad = " ".repeat(width - out.length());
            out = (flags & FormattableFlags.LEFT_JUSTIFY) != 0 ? out + pad : pad + out;
        }
        formatter.format("%s", out);
    }
}
