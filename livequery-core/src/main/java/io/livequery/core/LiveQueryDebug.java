// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core;

/**
 * Global toggle for verbose debug tracing across LiveQuery modules.
 *
 * <p>Thread safety: the individual flags are volatile, so updates are visible
 * across threads. {@link #isEnabled()} reads both flags non-atomically; a brief
 * inconsistency only affects whether a trace line is written.
 */
public final class LiveQueryDebug {

    private static volatile boolean publishTracing = false;
    private static volatile boolean lifecycleTracing = false;

    private LiveQueryDebug() {
    }

    /**
     * Checks if any debug tracing is enabled.
     *
     * @return true if either publication or lifecycle tracing is enabled
     */
    public static boolean isEnabled() {
        return publishTracing || lifecycleTracing;
    }

    public static void setEnabled(final boolean enabled) {
        publishTracing = enabled;
        lifecycleTracing = enabled;
    }

    public static void setPublishTracing(final boolean enabled) {
        publishTracing = enabled;
    }

    public static boolean isPublishTracingEnabled() {
        return publishTracing;
    }

    public static void setLifecycleTracing(final boolean enabled) {
        lifecycleTracing = enabled;
    }

    public static boolean isLifecycleTracingEnabled() {
        return lifecycleTracing;
    }
}
