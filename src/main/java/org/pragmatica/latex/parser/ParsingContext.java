package org.pragmatica.latex.parser;

import org.pragmatica.latex.error.Diagnostic;
import org.pragmatica.latex.error.StructuralError;
import org.pragmatica.latex.lexer.LatexToken;
import org.pragmatica.latex.symbol.SymbolTable;
import org.pragmatica.latex.tree.SourceLocation;
import org.pragmatica.latex.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Mutable state of a single parse: token cursor with lookahead, nesting stack,
 * symbol table and collected problems. Never shared between parses.
 */
public final class ParsingContext {
    private static final Logger log = LoggerFactory.getLogger(ParsingContext.class);

    private final Iterator<LatexToken> tokens;
    private final ParserConfig config;
    private final SymbolTable symbols;
    private final List<LatexToken> lookahead;
    private final Deque<ScopeMarker> scopes;
    private final List<StructuralError> problems;

    private SourceLocation lastEnd;
    private LatexToken.EndOfInput endOfInput;
    private int consumed;

    private ParsingContext(Iterator<LatexToken> tokens, ParserConfig config) {
        this.tokens = tokens;
        this.config = config;
        this.symbols = config.symbols();
        this.lookahead = new ArrayList<>();
        this.scopes = new ArrayDeque<>();
        this.problems = new ArrayList<>();
        this.lastEnd = SourceLocation.START;
        this.consumed = 0;
    }

    public static ParsingContext create(Iterator<LatexToken> tokens, ParserConfig config) {
        return new ParsingContext(tokens, config);
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * The symbol table of this parse. Definitions found in the document are registered here.
     */
    public SymbolTable symbols() {
        return symbols;
    }

    // === Token Cursor ===

    public LatexToken peek() {
        return peek(0);
    }

    /**
     * Look {@code distance} tokens ahead. Past the end this keeps returning the end-of-input token.
     */
    public LatexToken peek(int distance) {
        while (lookahead.size() <= distance) {
            lookahead.add(pull());
        }
        return lookahead.get(distance);
    }

    public LatexToken advance() {
        var token = peek();
        if (token instanceof LatexToken.EndOfInput) {
            throw new IllegalStateException("Attempt to consume tokens past end of input at " + token.span().start());
        }
        lookahead.remove(0);
        lastEnd = token.span().end();
        consumed++ ;
        return token;
    }

    /**
     * Return the unconsumed tail of a token to the front of the stream.
     */
    public void pushBack(LatexToken token) {
        lookahead.add(0, token);
        lastEnd = token.span().start();
    }

    public boolean isAtEnd() {
        return peek() instanceof LatexToken.EndOfInput;
    }

    /**
     * End of the last consumed token.
     */
    public SourceLocation lastEnd() {
        return lastEnd;
    }

    public SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, lastEnd);
    }

    public int consumedTokens() {
        return consumed;
    }

    private LatexToken pull() {
        if (endOfInput != null) {
            return endOfInput;
        }
        if (!tokens.hasNext()) {
            // Token sources without a terminal token are closed where the last token ended
            var last = lookahead.isEmpty() ? lastEnd : lookahead.get(lookahead.size() - 1).span().end();
            endOfInput = new LatexToken.EndOfInput(SourceSpan.at(last));
            return endOfInput;
        }
        var token = tokens.next();
        if (token instanceof LatexToken.EndOfInput end) {
            endOfInput = end;
        }
        return token;
    }

    // === Nesting Stack ===

    void open(ScopeMarker marker) {
        scopes.push(marker);
    }

    void close(ScopeMarker marker) {
        var top = scopes.pop();
        if (top != marker) {
            throw new IllegalStateException("Nesting stack out of order: closing " + marker + " but top is " + top);
        }
    }

    /**
     * Innermost open scope, or null at document level.
     */
    ScopeMarker innermost() {
        return scopes.peek();
    }

    boolean isInnermost(Class<? extends ScopeMarker> type) {
        return type.isInstance(scopes.peek());
    }

    boolean hasOpen(Class<? extends ScopeMarker> type) {
        return scopes.stream()
                     .anyMatch(type::isInstance);
    }

    public int depth() {
        return scopes.size();
    }

    // === Problem Collection ===

    public void report(StructuralError problem) {
        log.trace("Recovering from {} at {}", problem.message(), problem.span().start());
        problems.add(problem);
    }

    public List<StructuralError> problems() {
        return List.copyOf(problems);
    }

    /**
     * Diagnostics of all reported problems, ordered by source position.
     */
    public List<Diagnostic> diagnostics() {
        return problems.stream()
                       .map(StructuralError::toDiagnostic)
                       .sorted(Diagnostic.BY_POSITION)
                       .toList();
    }
}
