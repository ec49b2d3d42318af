package org.pragmatica.latex.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.latex.tree.SourceLocation;
import org.pragmatica.latex.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static final String SOURCE = "\\begin{itemize}\nx\n\\end{enumerate}";

    private static final SourceSpan BEGIN = SourceSpan.of(SourceLocation.at(1, 1, 0), SourceLocation.at(1, 16, 15));
    private static final SourceSpan END = SourceSpan.of(SourceLocation.at(3, 1, 18), SourceLocation.at(3, 16, 33));

    @Test
    void mismatch_formatsBothLinesWithLabels() {
        var diagnostic = new StructuralError.EnvironmentMismatch(END, "itemize", "enumerate", BEGIN).toDiagnostic();

        var formatted = diagnostic.format(SOURCE, "paper.tex");

        assertThat(formatted).startsWith("error[E004]: environment mismatch");
        assertThat(formatted).contains("  --> paper.tex:3:1");
        assertThat(formatted).contains("1 | \\begin{itemize}");
        assertThat(formatted).contains("---------------" + " opened here");
        assertThat(formatted).contains("3 | \\end{enumerate}");
        assertThat(formatted).contains("^^^^^^^^^^^^^^^ expected \\end{itemize}");
        assertThat(formatted).doesNotContain("2 | x");
    }

    @Test
    void formatSimple_isSingleLine() {
        var diagnostic = new StructuralError.UnexpectedClose(END, "\\end{enumerate}").toDiagnostic();

        assertEquals("paper.tex:3:1: error[E006]: unexpected close '\\end{enumerate}'",
                     diagnostic.formatSimple("paper.tex"));
    }

    @Test
    void warning_withoutLabels_getsImplicitUnderline() {
        var span = SourceSpan.of(SourceLocation.at(1, 3, 2), SourceLocation.at(1, 5, 4));
        var diagnostic = Diagnostic.warning("W001", "missing argument for \\frac", span);

        var formatted = diagnostic.format("a \\frac", null);

        assertFalse(diagnostic.isError());
        assertThat(formatted).startsWith("warning[W001]: missing argument for \\frac");
        assertThat(formatted).contains("  --> 1:3");
        assertThat(formatted).contains("  ^^");
    }

    @Test
    void notes_areListedAfterSource() {
        var diagnostic = new StructuralError.MalformedDefinition(BEGIN, "newcommand", "expected a command name")
            .toDiagnostic();

        var formatted = diagnostic.format(SOURCE, "paper.tex");

        assertEquals(Diagnostic.Severity.WARNING, diagnostic.severity());
        assertEquals("W003", diagnostic.code());
        assertThat(formatted).contains("= the definition is kept in the tree but not registered");
    }

    @Test
    void builders_doNotMutateOriginal() {
        var original = Diagnostic.error("E001", "unterminated group", BEGIN);

        var labelled = original.withLabel("here").withHelp("close it");

        assertThat(original.labels()).isEmpty();
        assertThat(original.notes()).isEmpty();
        assertThat(labelled.labels()).hasSize(1);
        assertEquals("help: close it", labelled.notes().get(0));
    }

    @Test
    void everyStructuralError_hasStableCode() {
        var span = BEGIN;

        assertEquals("E001", new StructuralError.UnterminatedGroup(span, "{").toDiagnostic().code());
        assertEquals("E002", new StructuralError.UnterminatedEnvironment(span, "a").toDiagnostic().code());
        assertEquals("E003", new StructuralError.UnterminatedMath(span, "$", "$").toDiagnostic().code());
        assertEquals("E004", new StructuralError.EnvironmentMismatch(span, "a", "", span).toDiagnostic().code());
        assertEquals("E005", new StructuralError.MathDelimiterMismatch(span, "$", "\\)", span).toDiagnostic().code());
        assertEquals("E006", new StructuralError.UnexpectedClose(span, "}").toDiagnostic().code());
        assertEquals("W001", new StructuralError.MissingArgument(span, "frac", 2, 1).toDiagnostic().code());
        assertEquals("W002", new StructuralError.MissingEnvironmentName(span, "begin").toDiagnostic().code());
        assertEquals("W003", new StructuralError.MalformedDefinition(span, "def", "x").toDiagnostic().code());
        var tooDeep = new StructuralError.NestingTooDeep(span, 256).toDiagnostic();
        assertEquals("W004", tooDeep.code());
        assertEquals(Diagnostic.Severity.WARNING, tooDeep.severity());
    }
}
