// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cellframe.core;

/**
 * ANSI color palette for terminal output with automatic TTY detection.
 *
 * <p>
 * Colors are disabled when not running in a TTY environment unless
 * {@code FORCE_COLOR=true} is set.
 *
 * <ul>
 * <li><b>TEAL</b> - success indicators
 * <li><b>CORAL</b> - error indicators
 * <li><b>INDIGO</b> - RPC calls
 * <li><b>AMBER</b> - fees
 * <li><b>LAVENDER</b> - transaction operations
 * <li><b>SLATE</b> - metadata and secondary information
 * </ul>
 *
 * @since 0.1.0
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code - clears all formatting */
    public static final String RESET = ansi("0");

    /** Teal - success indicators */
    public static final String TEAL = ansi("38;5;44");

    /** Soft coral - error indicators */
    public static final String CORAL = ansi("38;5;204");

    /** Indigo - RPC calls */
    public static final String INDIGO = ansi("38;5;99");

    /** Amber - fee related output */
    public static final String AMBER = ansi("38;5;214");

    /** Slate gray - metadata and secondary information */
    public static final String SLATE = ansi("38;5;247");

    /** Lavender - transaction operations */
    public static final String LAVENDER = ansi("38;5;183");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
