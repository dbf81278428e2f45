// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * Centralized debug tracer for outbound messages and session lifecycle.
 *
 * <p>Messages use SLF4J placeholders and are sanitized before they are written.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("io.livequery.debug");

    private DebugLogger() {
    }

    public static void logPublish(final String message, final Object... args) {
        if (!LiveQueryDebug.isPublishTracingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logLifecycle(final String message, final Object... args) {
        if (!LiveQueryDebug.isLifecycleTracingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!LiveQueryDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0)
                ? message
                : MessageFormatter.arrayFormat(message, args).getMessage();
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
