package org.pragmatica.latex;

import org.junit.jupiter.api.Test;
import org.pragmatica.latex.error.Diagnostic;
import org.pragmatica.latex.parser.ParserConfig;
import org.pragmatica.latex.tree.LatexNode;
import org.pragmatica.latex.tree.Nodes;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Inputs at the boundaries of what the lexer and parser accept.
 */
class EdgeCaseTest {

    // === Empty and trivial input ===

    @Test
    void emptyInput_yieldsEmptyDocument() {
        var result = LatexParser.parse("");

        assertTrue(result.isSuccess());
        assertThat(result.document().children()).isEmpty();
        assertEquals(0, result.document().span().start().offset());
        assertEquals(0, result.document().span().end().offset());
    }

    @Test
    void onlyComment_yieldsSingleComment() {
        var result = LatexParser.parse("% just a note");

        assertTrue(result.isSuccess());
        var comment = assertInstanceOf(LatexNode.Comment.class, result.document().children().get(0));
        assertEquals(" just a note", comment.text());
    }

    @Test
    void trailingBackslash_isLiteralText() {
        var result = LatexParser.parse("a\\");

        assertTrue(result.isSuccess());
        assertEquals("a\\", Nodes.textContent(result.document()));
    }

    // === Nesting ===

    @Test
    void deeplyNestedGroups_areBalanced() {
        var depth = 200;
        var source = "{".repeat(depth) + "x" + "}".repeat(depth);

        var result = LatexParser.parse(source);

        assertTrue(result.isSuccess());
        assertThat(Nodes.findAll(result.document(), LatexNode.Group.class)).hasSize(depth);
        assertEquals("x", Nodes.textContent(result.document()));
    }

    @Test
    void nestingBeyondDefaultLimit_isFlattenedWithWarning() {
        var depth = 20_000;
        var result = LatexParser.parse("{".repeat(depth) + "x" + "}".repeat(depth));

        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                                        .containsExactly("W004");
        assertEquals(ParserConfig.DEFAULT_MAX_NESTING_DEPTH, result.diagnostics().get(0).span().start().offset());
        assertFalse(result.hasErrors());
        assertThat(Nodes.findAll(result.document(), LatexNode.Group.class)).hasSize(depth);
        assertThat(Nodes.findAll(result.document(), LatexNode.Text.class)).extracting(LatexNode.Text::text)
                                                                         .containsExactly("x");
    }

    @Test
    void manyUnclosedGroups_reportEachOnce() {
        var result = LatexParser.parse("{{{x");

        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                                        .containsExactly("E001", "E001", "E001");
        assertThat(result.diagnostics()).extracting(d -> d.span().start().offset())
                                        .containsExactly(0, 1, 2);
    }

    // === Scale ===

    @Test
    void longRunOfEscapedCharacters_mergesInLinearTime() {
        var repeats = 400_000;
        var source = "a\\&".repeat(repeats);

        var result = assertTimeout(Duration.ofSeconds(10), () -> LatexParser.parse(source));

        assertThat(result.document().children()).hasSize(1);
        var text = (LatexNode.Text) result.document().children().get(0);
        assertEquals(2 * repeats, text.text().length());
        assertEquals(source.length(), text.span().end().offset());
    }

    @Test
    void textMerging_keepsNodesSeparatedByOtherContent() {
        var result = LatexParser.parse("a\\&b~c\\%d");

        assertThat(result.document().children()).hasSize(3);
        assertEquals("a&b", ((LatexNode.Text) result.document().children().get(0)).text());
        assertEquals("c%d", ((LatexNode.Text) result.document().children().get(2)).text());
    }

    // === Arguments ===

    @Test
    void singleCharacterArgument_keepsSurrogatePairsTogether() {
        var result = LatexParser.parse("\\textbf 😀x");

        var command = (LatexNode.Command) result.document().children().get(0);
        assertEquals("😀", ((LatexNode.Text) command.mandatoryArgs().get(0)).text());
        assertEquals("x", ((LatexNode.Text) result.document().children().get(1)).text());
    }

    @Test
    void commandAsArgument_isTakenBare() {
        var result = LatexParser.parse("\\hat\\alpha b");

        assertTrue(result.isSuccess());
        var hat = (LatexNode.Command) result.document().children().get(0);
        var alpha = assertInstanceOf(LatexNode.Command.class, hat.mandatoryArgs().get(0));
        assertEquals("alpha", alpha.name());
        assertFalse(alpha.hasArguments());
    }

    @Test
    void lineAndColumn_trackNewlines() {
        var result = LatexParser.parse("first\n  \\textbf{x}");

        var command = (LatexNode.Command) result.document().children().get(1);
        assertEquals(2, command.span().start().line());
        assertEquals(3, command.span().start().column());
        assertEquals(8, command.span().start().offset());
        assertEquals("\\textbf{x}", command.span().extract("first\n  \\textbf{x}"));
    }
}
