package org.pragmatica.latex.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.latex.LatexParser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class NodesTest {

    private static LatexNode.Document parse(String source) {
        return LatexParser.parse(source).document();
    }

    @Test
    void findAll_includesNestedNodesInDocumentOrder() {
        var document = parse("\\emph{a}{\\emph{b}}\\begin{center}\\emph{c}\\end{center}");

        assertThat(Nodes.commands(document, "emph")).extracting(Nodes::textContent)
                                                    .containsExactly("a", "b", "c");
        assertThat(Nodes.findAll(document, LatexNode.Document.class)).containsExactly(document);
        assertThat(Nodes.environments(document, "center")).hasSize(1);
    }

    @Test
    void firstCommand_emptyWhenAbsent() {
        var document = parse("plain text");

        assertTrue(Nodes.firstCommand(document, "section").isEmpty());
        assertTrue(Nodes.firstEnvironment(document, "itemize").isEmpty());
    }

    @Test
    void textContent_flattensArgumentsAndSkipsComments() {
        var document = parse("A~\\textbf{bold}% hidden\n and $x^2$");

        assertEquals("A bold\n and $x^2$", Nodes.textContent(document));
    }

    @Test
    void title_usesPlainTextOfFirstTitle() {
        var document = parse("\\title{ On \\textbf{Big} Trees }\\title{Other}");

        assertEquals("On Big Trees", Nodes.title(document).orElseThrow());
    }

    @Test
    void abstractOf_readsEnvironmentBody() {
        var document = parse("\\begin{abstract} We show~that $x$ holds. % note\n\\end{abstract}");

        assertEquals("We show that $x$ holds.", Nodes.abstractOf(document).orElseThrow());
        assertTrue(Nodes.title(document).isEmpty());
    }

    @Test
    void citationKeys_collectsAllCitationCommands() {
        var document = parse("See \\cite{a, b} and \\citep[p.~3]{c}.\\begin{quote}\\citet{d,}\\end{quote}");

        assertThat(Nodes.citationKeys(document)).containsExactly("a", "b", "c", "d");
    }

    @Test
    void footnotes_returnsContentInDocumentOrder() {
        var document = parse("Text\\footnote{First \\emph{note}} more\\footnote[7]{Second}");

        assertThat(Nodes.footnotes(document)).extracting(Nodes::textContent)
                                              .containsExactly("First note", "Second");
        assertThat(Nodes.footnotes(parse("none"))).isEmpty();
    }
}
