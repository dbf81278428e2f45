// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine;

/**
 * Lifecycle of a subscription session: {@code INITIALIZING -> STREAMING -> STOPPED}.
 * A session may also stop directly from {@code INITIALIZING}.
 */
public enum SessionState {
    INITIALIZING,
    STREAMING,
    STOPPED
}
