package org.pragmatica.latex.lexer;

import org.pragmatica.latex.tree.SourceLocation;
import org.pragmatica.latex.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lexer for LaTeX source. Produces tokens lazily, one per {@link #next()} call.
 *
 * <p>The lexer never fails: every character ends up in some token, and the sequence always
 * finishes with exactly one {@link LatexToken.EndOfInput}. Once that token has been returned
 * the iterator is exhausted and cannot be restarted.
 */
public final class LatexLexer implements Iterator<LatexToken> {
    private static final int MAX_INPUT_SIZE = 10_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final String input;
    private int pos;
    private int line;
    private int column;
    private boolean finished;

    private LatexLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.finished = false;
    }

    /**
     * Lazy token sequence over the given source.
     */
    public static Iterator<LatexToken> tokenize(String input) {
        Objects.requireNonNull(input, "input");
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "LaTeX input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new LatexLexer(input);
    }

    /**
     * All tokens of the given source, ending with {@link LatexToken.EndOfInput}.
     */
    public static List<LatexToken> tokenizeAll(String input) {
        var tokens = new ArrayList<LatexToken>();
        tokenize(input).forEachRemaining(tokens::add);
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public LatexToken next() {
        if (finished) {
            throw new NoSuchElementException("Token sequence already reached end of input");
        }
        if (isAtEnd()) {
            finished = true;
            return new LatexToken.EndOfInput(SourceSpan.at(currentLocation()));
        }
        return nextToken();
    }

    private LatexToken nextToken() {
        var start = currentLocation();
        char c = peek();
        switch (c) {
            case '\\':
                return scanCommand(start);
            case '{':
                advance();
                return new LatexToken.GroupOpen(span(start));
            case '}':
                advance();
                return new LatexToken.GroupClose(span(start));
            case '$':
                return scanMathDelimiter(start);
            case '%':
                return scanComment(start);
            default:
                if (isSpecial(c)) {
                    advance();
                    return new LatexToken.SpecialChar(span(start), c);
                }
                return scanText(start);
        }
    }

    private LatexToken scanCommand(SourceLocation start) {
        advance();
        // skip backslash
        if (isAtEnd()) {
            return new LatexToken.Text(span(start), "\\");
        }
        if (!isLetter(peek())) {
            var name = String.valueOf(advance());
            return new LatexToken.Command(span(start), name);
        }
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isLetter(peek())) {
            sb.append(advance());
        }
        return new LatexToken.Command(span(start), sb.toString());
    }

    private LatexToken scanMathDelimiter(SourceLocation start) {
        advance();
        if (!isAtEnd() && peek() == '$') {
            advance();
            return new LatexToken.MathDisplayDelim(span(start));
        }
        return new LatexToken.MathInlineDelim(span(start));
    }

    private LatexToken scanComment(SourceLocation start) {
        advance();
        // skip %
        int bodyStart = pos;
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
        return new LatexToken.Comment(span(start), input.substring(bodyStart, pos));
    }

    private LatexToken scanText(SourceLocation start) {
        int textStart = pos;
        while (!isAtEnd() && isTextChar(peek())) {
            advance();
        }
        return new LatexToken.Text(span(start), input.substring(textStart, pos));
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++ );
        if (c == '\n') {
            line++ ;
            column = 1;
        }else {
            column++ ;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, pos);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * Characters emitted as {@link LatexToken.SpecialChar}.
     */
    public static boolean isSpecial(char c) {
        return c == '~' || c == '&' || c == '#' || c == '_' || c == '^' || c == '[' || c == ']';
    }

    private static boolean isTextChar(char c) {
        return c != '\\' && c != '{' && c != '}' && c != '$' && c != '%' && !isSpecial(c);
    }
}
