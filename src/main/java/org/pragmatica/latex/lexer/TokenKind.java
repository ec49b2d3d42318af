package org.pragmatica.latex.lexer;

/**
 * Lexical classes produced by {@link LatexLexer}.
 */
public enum TokenKind {
    COMMAND,
    TEXT,
    COMMENT,
    GROUP_OPEN,
    GROUP_CLOSE,
    MATH_INLINE_DELIM,
    MATH_DISPLAY_DELIM,
    SPECIAL_CHAR,
    END_OF_INPUT
}
