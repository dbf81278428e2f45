// SPDX-License-Identifier: MIT OR Apache-2.0
package io.livequery.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts values of credential-like fields found in published documents</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /**
     * Matches {@code key=value} (map toString) and {@code "key":"value"} (JSON) forms
     * of sensitive fields, case-insensitively.
     */
    private static final Pattern SENSITIVE_PATTERN = Pattern.compile(
            "(?i)(\"?(?:password|token|secret|apiKey)\"?\\s*[=:]\\s*)(\"[^\"]*\"|[^,}\\s]+)");

    private static final String REDACTED = "$1***[REDACTED]***";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = SENSITIVE_PATTERN.matcher(input).replaceAll(REDACTED);

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
