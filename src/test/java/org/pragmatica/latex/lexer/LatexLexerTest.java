package org.pragmatica.latex.lexer;

import org.junit.jupiter.api.Test;
import org.pragmatica.latex.tree.SourceLocation;

import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LatexLexerTest {

    private static List<TokenKind> kinds(String input) {
        return LatexLexer.tokenizeAll(input)
                         .stream()
                         .map(LatexToken::kind)
                         .toList();
    }

    @Test
    void commandWithGroup_producesTokensWithSpans() {
        var tokens = LatexLexer.tokenizeAll("\\textbf{hello}");

        assertThat(tokens).hasSize(5);
        var command = assertInstanceOf(LatexToken.Command.class, tokens.get(0));
        assertEquals("textbf", command.name());
        assertEquals(0, command.span().start().offset());
        assertEquals(7, command.span().end().offset());
        assertInstanceOf(LatexToken.GroupOpen.class, tokens.get(1));
        var text = assertInstanceOf(LatexToken.Text.class, tokens.get(2));
        assertEquals("hello", text.text());
        assertEquals(SourceLocation.at(1, 9, 8), text.span().start());
        assertInstanceOf(LatexToken.GroupClose.class, tokens.get(3));
        var end = assertInstanceOf(LatexToken.EndOfInput.class, tokens.get(4));
        assertEquals(14, end.span().start().offset());
    }

    @Test
    void emptyInput_yieldsOnlyEndOfInput() {
        var tokens = LatexLexer.tokenizeAll("");

        assertThat(tokens).hasSize(1);
        assertEquals(SourceLocation.START, tokens.get(0).span().start());
        assertEquals(TokenKind.END_OF_INPUT, tokens.get(0).kind());
    }

    @Test
    void controlSymbol_isOneCharacterCommand() {
        var tokens = LatexLexer.tokenizeAll("\\%\\\\\\,");

        assertEquals("%", ((LatexToken.Command) tokens.get(0)).name());
        assertEquals("\\", ((LatexToken.Command) tokens.get(1)).name());
        assertEquals(",", ((LatexToken.Command) tokens.get(2)).name());
        assertEquals(TokenKind.END_OF_INPUT, tokens.get(3).kind());
    }

    @Test
    void controlWord_stopsAtNonLetter() {
        var tokens = LatexLexer.tokenizeAll("\\section*{A}");

        assertEquals("section", ((LatexToken.Command) tokens.get(0)).name());
        assertEquals("*", ((LatexToken.Text) tokens.get(1)).text());
    }

    @Test
    void loneTrailingBackslash_isText() {
        var tokens = LatexLexer.tokenizeAll("a\\");

        assertThat(kinds("a\\")).containsExactly(TokenKind.TEXT, TokenKind.TEXT, TokenKind.END_OF_INPUT);
        assertEquals("\\", tokens.get(1).text());
    }

    @Test
    void doubleDollar_isDisplayDelimiter() {
        assertThat(kinds("$$x$"))
            .containsExactly(TokenKind.MATH_DISPLAY_DELIM, TokenKind.TEXT, TokenKind.MATH_INLINE_DELIM,
                             TokenKind.END_OF_INPUT);
    }

    @Test
    void parenAndBracketMath_stayCommands() {
        var tokens = LatexLexer.tokenizeAll("\\(x\\)\\[y\\]");

        assertEquals("(", tokens.get(0).text());
        assertEquals(")", tokens.get(2).text());
        assertEquals("[", tokens.get(3).text());
        assertEquals("]", tokens.get(5).text());
        assertThat(tokens.subList(0, 6)).allMatch(token -> token.kind() == TokenKind.COMMAND
                                                           || token.kind() == TokenKind.TEXT);
    }

    @Test
    void comment_runsToEndOfLineWithoutNewline() {
        var tokens = LatexLexer.tokenizeAll("a % note\nb");

        assertEquals("a ", tokens.get(0).text());
        var comment = assertInstanceOf(LatexToken.Comment.class, tokens.get(1));
        assertEquals(" note", comment.text());
        assertEquals("\nb", tokens.get(2).text());
    }

    @Test
    void commentAtEndOfInput_isClosedByEnd() {
        var tokens = LatexLexer.tokenizeAll("%last");

        assertEquals("last", tokens.get(0).text());
        assertEquals(TokenKind.END_OF_INPUT, tokens.get(1).kind());
    }

    @Test
    void specialCharacters_eachBecomeOneToken() {
        var tokens = LatexLexer.tokenizeAll("~&#_^[]");

        assertThat(tokens).hasSize(8);
        assertThat(tokens.subList(0, 7)).allMatch(token -> token.kind() == TokenKind.SPECIAL_CHAR);
        assertEquals('^', ((LatexToken.SpecialChar) tokens.get(4)).character());
    }

    @Test
    void textRun_includesWhitespaceAndNewlines() {
        var tokens = LatexLexer.tokenizeAll("one two\n\nthree");

        assertThat(tokens).hasSize(2);
        assertEquals("one two\n\nthree", tokens.get(0).text());
    }

    @Test
    void positions_trackLinesAndColumns() {
        var tokens = LatexLexer.tokenizeAll("a\nb\\x");

        var command = tokens.get(1);
        assertEquals(SourceLocation.at(2, 2, 3), command.span().start());
        assertEquals(SourceLocation.at(2, 4, 5), command.span().end());
    }

    @Test
    void iterator_isLazyAndNotRestartable() {
        var lexer = LatexLexer.tokenize("x");

        assertTrue(lexer.hasNext());
        assertEquals(TokenKind.TEXT, lexer.next().kind());
        assertEquals(TokenKind.END_OF_INPUT, lexer.next().kind());
        assertFalse(lexer.hasNext());
        assertThrows(NoSuchElementException.class, lexer::next);
    }

    @Test
    void tokenize_rejectsOversizedInput() {
        var huge = "x".repeat(10_000_001);

        assertThrows(IllegalArgumentException.class, () -> LatexLexer.tokenize(huge));
    }

    @Test
    void tokenize_rejectsNull() {
        assertThrows(NullPointerException.class, () -> LatexLexer.tokenize(null));
    }
}
