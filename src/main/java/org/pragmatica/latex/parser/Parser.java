package org.pragmatica.latex.parser;

import org.pragmatica.latex.lexer.LatexToken;

import java.util.Iterator;

/**
 * Parser interface - turns LaTeX source into a document tree.
 *
 * <p>Implementations are immutable; every call starts from a fresh copy of the configured
 * symbol table, so one parser can serve many documents and threads.
 */
public interface Parser {

    /**
     * Tokenize and parse LaTeX source.
     */
    ParseResult parse(String source);

    /**
     * Parse an already tokenized document. The sequence must end with
     * {@link LatexToken.EndOfInput}; it is consumed and cannot be reused.
     */
    ParseResult parse(Iterator<LatexToken> tokens);

    /**
     * The configuration this parser was built with.
     */
    ParserConfig config();
}
