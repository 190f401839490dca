// SPDX-License-Identifier: MIT OR Apache-2.0
package io.sluice.core;

import java.util.regex.Pattern;

/**
 * Utility that removes sensitive data from debug log payloads.
 *
 * <p>
 * Performs three sanitization operations:
 * <ul>
 * <li>Redacts wallet secret keys (string or byte-array form)</li>
 * <li>Redacts provider API keys embedded in RPC URLs</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized log output. Logs exceeding this will be truncated.
     */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern SECRET_KEY_STRING =
            Pattern.compile("\"secretKey\"\\s*:\\s*\"[^\"]+\"");
    private static final Pattern SECRET_KEY_ARRAY =
            Pattern.compile("\"secretKey\"\\s*:\\s*\\[[^\\]]*\\]");
    private static final Pattern API_KEY_PARAM =
            Pattern.compile("(?i)(api[-_]?key=)[^&\\s\"]+");

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"secretKey\"")) {
            sanitized = SECRET_KEY_STRING.matcher(sanitized).replaceAll("\"secretKey\":\"***[REDACTED]***\"");
            sanitized = SECRET_KEY_ARRAY.matcher(sanitized).replaceAll("\"secretKey\":\"***[REDACTED]***\"");
        }

        sanitized = API_KEY_PARAM.matcher(sanitized).replaceAll("$1***[REDACTED]***");

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
