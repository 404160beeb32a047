// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger, gated by {@link BitcheckDebug}.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.bitcheck.debug");

    private DebugLogger() {
    }

    /**
     * Logs at INFO when debug logging is enabled. Arguments use {@link String#formatted}
     * placeholders and the result is sanitized before it is written.
     */
    public static void log(final String message, final Object... args) {
        if (!BitcheckDebug.isEnabled()) {
            return;
        }
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
