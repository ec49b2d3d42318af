package org.pragmatica.latex.lexer;

import org.pragmatica.latex.tree.SourceSpan;

/**
 * Token types for the LaTeX lexer.
 */
public sealed interface LatexToken {
    SourceSpan span();

    TokenKind kind();

    /**
     * Payload: command name without backslash, literal text, comment body or the special character.
     */
    String text();

    // \name or \<one non-letter>
    record Command(SourceSpan span, String name) implements LatexToken {
        @Override
        public TokenKind kind() {
            return TokenKind.COMMAND;
        }

        @Override
        public String text() {
            return name;
        }

        public boolean is(String candidate) {
            return name.equals(candidate);
        }
    }

    record Text(SourceSpan span, String text) implements LatexToken {
        @Override
        public TokenKind kind() {
            return TokenKind.TEXT;
        }
    }

    // % up to end of line, without the %
    record Comment(SourceSpan span, String text) implements LatexToken {
        @Override
        public TokenKind kind() {
            return TokenKind.COMMENT;
        }
    }

    record GroupOpen(SourceSpan span) implements LatexToken {
        @Override
        public TokenKind kind() {
            return TokenKind.GROUP_OPEN;
        }

        @Override
        public String text() {
            return "{";
        }
    }

    record GroupClose(SourceSpan span) implements LatexToken {
        @Override
        public TokenKind kind() {
            return TokenKind.GROUP_CLOSE;
        }

        @Override
        public String text() {
            return "}";
        }
    }

    // $
    record MathInlineDelim(SourceSpan span) implements LatexToken {
        @Override
        public TokenKind kind() {
            return TokenKind.MATH_INLINE_DELIM;
        }

        @Override
        public String text() {
            return "$";
        }
    }

    // $$
    record MathDisplayDelim(SourceSpan span) implements LatexToken {
        @Override
        public TokenKind kind() {
            return TokenKind.MATH_DISPLAY_DELIM;
        }

        @Override
        public String text() {
            return "$$";
        }
    }

    record SpecialChar(SourceSpan span, char character) implements LatexToken {
        @Override
        public TokenKind kind() {
            return TokenKind.SPECIAL_CHAR;
        }

        @Override
        public String text() {
            return String.valueOf(character);
        }

        public boolean is(char candidate) {
            return character == candidate;
        }
    }

    record EndOfInput(SourceSpan span) implements LatexToken {
        @Override
        public TokenKind kind() {
            return TokenKind.END_OF_INPUT;
        }

        @Override
        public String text() {
            return "";
        }
    }
}
