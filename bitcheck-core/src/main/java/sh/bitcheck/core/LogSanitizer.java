// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core;

/**
 * Makes untrusted address input safe to write into logs.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Replaces control and non-ASCII characters with {@code \\uXXXX} escapes,
 * so input cannot forge log lines or terminal sequences</li>
 * <li>Truncates excessively long values</li>
 * </ul>
 */
public final class LogSanitizer {

    /**
     * Maximum length for sanitized output. Real addresses are at most 90
     * characters; the limit leaves room for the surrounding message.
     */
    static final int MAX_LOG_LENGTH = 512;

    /** Suffix appended to truncated logs. */
    static final String TRUNCATION_SUFFIX = "...(truncated)";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        final StringBuilder sb = new StringBuilder(Math.min(input.length(), MAX_LOG_LENGTH) + 16);
        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            if (c < 0x20 || c > 0x7E) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
            if (sb.length() > MAX_LOG_LENGTH) {
                break;
            }
        }

        if (sb.length() > MAX_LOG_LENGTH) {
            final int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sb.setLength(truncateAt);
            sb.append(TRUNCATION_SUFFIX);
        }
        return sb.toString();
    }
}
