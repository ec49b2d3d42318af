package org.pragmatica.latex.parser;

import org.pragmatica.latex.error.Diagnostic;
import org.pragmatica.latex.tree.LatexNode;

import java.util.List;

/**
 * Result of parsing a LaTeX document: always a complete tree, plus the diagnostics
 * collected while recovering from malformed input.
 *
 * <p>When the input is well formed {@code diagnostics} is empty. Otherwise the document
 * still satisfies every structural invariant (recovery closes open scopes and drops stray
 * closers) and {@code diagnostics} lists each problem, ordered by source position.
 *
 * @param document    The parsed document
 * @param diagnostics Diagnostics ordered by source position (empty on full success)
 * @param source      The original source text (for formatting diagnostics), empty when parsed from tokens
 */
public record ParseResult(
    LatexNode.Document document,
    List<Diagnostic> diagnostics,
    String source
) {
    public static ParseResult of(LatexNode.Document document, List<Diagnostic> diagnostics, String source) {
        return new ParseResult(document, List.copyOf(diagnostics), source);
    }

    /**
     * Check if parsing succeeded without any diagnostic.
     */
    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }

    /**
     * Check if there were any errors (warnings do not count).
     */
    public boolean hasErrors() {
        return diagnostics.stream()
                          .anyMatch(Diagnostic::isError);
    }

    /**
     * Format all diagnostics in Rust style.
     *
     * @param filename Optional filename for display
     * @return Formatted diagnostics string
     */
    public String formatDiagnostics(String filename) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, filename));
            sb.append("\n");
        }
        return sb.toString();
    }

    /**
     * Format all diagnostics with default filename "input".
     */
    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }

    public int errorCount() {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == Diagnostic.Severity.ERROR)
                                .count();
    }

    public int warningCount() {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
                                .count();
    }
}
