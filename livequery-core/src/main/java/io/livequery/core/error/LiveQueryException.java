// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core.error;

/**
 * Base runtime exception for all LiveQuery failures.
 *
 * <p>
 * Every failure carries a stable {@link #code()} that transports can forward to
 * remote subscribers unchanged.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * LiveQueryException
 * ├── {@link NotAllowedException} - permission check rejected the subscription
 * ├── {@link QueryValidationException} - malformed query definition or options
 * ├── {@link QueryExecutionException} - search engine or document store failure
 * └── {@link RefreshException} - aggregate refresh failed repeatedly
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     registry.subscribe(context, definition, options, channel);
 * } catch (NotAllowedException e) {
 *     // Reject the request
 * } catch (LiveQueryException e) {
 *     // Catch-all for any other LiveQuery error
 * }
 * }</pre>
 */
public sealed class LiveQueryException extends RuntimeException
        permits NotAllowedException,
        QueryValidationException,
        QueryExecutionException,
        RefreshException {

    private final String code;

    public LiveQueryException(final String code, final String message) {
        super(message);
        this.code = code;
    }

    public LiveQueryException(final String code, final String message, final Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Returns the stable error code, e.g. {@code "not-allowed"}.
     *
     * @return the error code
     */
    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code=" + code + ", message=" + getMessage() + "}";
    }
}
