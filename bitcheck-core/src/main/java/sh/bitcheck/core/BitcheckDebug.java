// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.bitcheck.core;

/**
 * Global toggle for verbose debug logging of classification decisions.
 *
 * <p>Starts from the {@code bitcheck.debug} system property ({@code true} to
 * enable) and can be flipped at runtime. The flag is volatile; a change is
 * visible to classifications started afterwards on any thread.
 */
public final class BitcheckDebug {

    /** System property read once at class initialization. */
    public static final String PROPERTY = "bitcheck.debug";

    private static volatile boolean enabled = Boolean.getBoolean(PROPERTY);

    private BitcheckDebug() {
    }

    public static boolean isEnabled() {
        return enabled;
    }

    public static void setEnabled(final boolean value) {
        enabled = value;
    }
}
