package org.pragmatica.latex.symbol;

import java.util.Map;
import java.util.Optional;

/**
 * Commands that declare new commands or environments, grouped by their syntax.
 */
public enum DefinitionKind {
    /**
     * {@code \newcommand{\name}[n][default]{body}} and its relatives.
     */
    NEW_COMMAND,

    /**
     * {@code \def\name#1#2{body}} and the global/expanded variants.
     */
    DEF,

    /**
     * {@code \let\name\other} or {@code \let\name=\other}.
     */
    LET,

    /**
     * {@code \newenvironment{name}[n][default]{begin}{end}}.
     */
    NEW_ENVIRONMENT;

    private static final Map<String, DefinitionKind> BY_NAME = Map.ofEntries(
        Map.entry("newcommand", NEW_COMMAND),
        Map.entry("renewcommand", NEW_COMMAND),
        Map.entry("providecommand", NEW_COMMAND),
        Map.entry("DeclareRobustCommand", NEW_COMMAND),
        Map.entry("def", DEF),
        Map.entry("gdef", DEF),
        Map.entry("edef", DEF),
        Map.entry("xdef", DEF),
        Map.entry("let", LET),
        Map.entry("newenvironment", NEW_ENVIRONMENT),
        Map.entry("renewenvironment", NEW_ENVIRONMENT)
    );

    /**
     * Kind of the given command name; a trailing {@code *} is ignored.
     */
    public static Optional<DefinitionKind> of(String commandName) {
        var base = commandName.endsWith("*")
                   ? commandName.substring(0, commandName.length() - 1)
                   : commandName;
        return Optional.ofNullable(BY_NAME.get(base));
    }

    /**
     * Whether the declared name is written before the optional arguments, as in
     * {@code \newcommand{\name}[1]{...}}.
     */
    public boolean nameBeforeOptionals() {
        return this == NEW_COMMAND || this == NEW_ENVIRONMENT;
    }

    /**
     * {@code \providecommand} keeps an existing definition.
     */
    public static boolean keepsExisting(String commandName) {
        return commandName.startsWith("providecommand");
    }
}
