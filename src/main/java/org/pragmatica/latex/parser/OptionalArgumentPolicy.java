package org.pragmatica.latex.parser;

/**
 * How an optional argument is recognized after a command name.
 */
public enum OptionalArgumentPolicy {
    /**
     * {@code [} must follow immediately: {@code \foo[x]} takes an argument, {@code \foo [x]} does not.
     */
    STRICT,

    /**
     * Blanks between the command and {@code [} are skipped, as LaTeX itself does.
     */
    LENIENT
}
