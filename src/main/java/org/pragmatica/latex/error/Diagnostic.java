package org.pragmatica.latex.error;

import org.pragmatica.latex.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Problem found while parsing a LaTeX document, with enough context for Rust-style reporting.
 *
 * <p>Example output:
 * <pre>
 * error[E004]: environment mismatch
 *   --> paper.tex:3:1
 *    |
 *  1 | \begin{itemize}
 *    | --------------- opened here
 *  3 | \end{enumerate}
 *    | ^^^^^^^^^^^^^^^ expected \end{itemize}
 *    |
 * </pre>
 *
 * @param severity    Error or warning
 * @param code        Stable diagnostic code (e.g., "E001"), may be null
 * @param message     Primary message
 * @param span        Source span the diagnostic points at
 * @param labels      Labeled spans for context
 * @param notes       Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    /**
     * Orders diagnostics by source offset of their primary span.
     */
    public static final Comparator<Diagnostic> BY_POSITION =
        Comparator.comparingInt(d -> d.span().start().offset());

    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span providing additional context.
     *
     * @param span    Source span for this label
     * @param message Label message
     * @param primary Whether this is the primary label (shown with ^^^)
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, code, message, span, List.of(), List.of());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Add a primary label.
     */
    public Diagnostic withLabel(String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, message));
        return new Diagnostic(severity, code, this.message, span, List.copyOf(newLabels), notes);
    }

    /**
     * Add a secondary label at a different span.
     */
    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, message));
        return new Diagnostic(severity, code, this.message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The LaTeX source the diagnostic refers to
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append(severity.display());
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        var shownLines = new TreeSet<Integer>();
        addLines(shownLines, span);
        for (var label : labels) {
            addLines(shownLines, label.span());
        }

        int gutterWidth = String.valueOf(shownLines.isEmpty() ? 1 : shownLines.last()).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum : shownLines) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var lineContent = stripCarriageReturn(lines[lineNum - 1]);
            var lineNumStr = String.format("%" + gutterWidth + "d", lineNum);

            sb.append(lineNumStr).append(" | ").append(lineContent).append("\n");

            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth)).append(" | ");
                sb.append(formatUnderlines(lineNum, lineContent, lineLabels));
                sb.append("\n");
            }
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Single-line format: {@code file:line:column: severity[code]: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s%s: %s",
                             filename == null ? "input" : filename,
                             loc.line(),
                             loc.column(),
                             severity.display(),
                             code == null ? "" : "[" + code + "]",
                             message);
    }

    public String formatSimple() {
        return formatSimple("input");
    }

    // Only the first and last line of a multi-line span are shown
    private static void addLines(SortedSet<Integer> target, SourceSpan span) {
        target.add(span.start().line());
        target.add(span.end().line());
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();
        if (labels.stream().noneMatch(Label::primary) && span.start().line() == lineNum) {
            result.add(Label.primary(span, ""));
        }
        for (var label : labels) {
            if (label.span().start().line() == lineNum) {
                result.add(label);
            }
        }
        return result;
    }

    private String formatUnderlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;

        var sorted = lineLabels.stream()
                               .sorted(Comparator.comparingInt(l -> l.span().start().column()))
                               .toList();

        for (var label : sorted) {
            int startCol = label.span().start().column();
            int endCol = label.span().end().line() == lineNum
                         ? label.span().end().column()
                         : lineContent.length() + 1;

            if (startCol < currentCol) {
                // Overlapping labels on one line are shown only once
                continue;
            }
            while (currentCol < startCol) {
                sb.append(" ");
                currentCol++;
            }

            char underlineChar = label.primary() ? '^' : '-';
            int underlineLen = Math.max(1, endCol - startCol);
            sb.append(String.valueOf(underlineChar).repeat(underlineLen));
            currentCol += underlineLen;

            if (!label.message().isEmpty()) {
                sb.append(" ").append(label.message());
                currentCol += label.message().length() + 1;
            }
        }

        return sb.toString();
    }
}
