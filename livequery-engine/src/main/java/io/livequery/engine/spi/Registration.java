// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.engine.spi;

/**
 * Handle for a registered listener. Closing it is idempotent.
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

    @Override
    void close();
}
