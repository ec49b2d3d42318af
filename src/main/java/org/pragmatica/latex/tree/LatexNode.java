package org.pragmatica.latex.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * LaTeX Abstract Syntax Tree node.
 * Every node keeps the source span it was parsed from.
 */
public sealed interface LatexNode {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * Direct sub-nodes in source order. For commands and environments this includes
     * the arguments; leaves return an empty list.
     */
    List<LatexNode> children();

    /**
     * Root of a parsed document.
     */
    record Document(SourceSpan span, List<LatexNode> children) implements LatexNode {}

    /**
     * Command invocation such as {@code \textbf{x}}. The name carries no backslash.
     */
    record Command(
    SourceSpan span,
    String name,
    List<LatexNode> optionalArgs,
    List<LatexNode> mandatoryArgs) implements LatexNode {
        public static Command bare(SourceSpan span, String name) {
            return new Command(span, name, List.of(), List.of());
        }

        @Override
        public List<LatexNode> children() {
            return concat(optionalArgs, mandatoryArgs);
        }

        public boolean hasArguments() {
            return !optionalArgs.isEmpty() || !mandatoryArgs.isEmpty();
        }
    }

    /**
     * {@code \begin{name}...\end{name}} block with its begin-arguments and body.
     */
    record Environment(
    SourceSpan span,
    String name,
    List<LatexNode> optionalArgs,
    List<LatexNode> mandatoryArgs,
    List<LatexNode> body) implements LatexNode {
        @Override
        public List<LatexNode> children() {
            return concat(concat(optionalArgs, mandatoryArgs), body);
        }
    }

    /**
     * Balanced {@code {...}} group, or a {@code [...]} optional argument.
     */
    record Group(SourceSpan span, Delimiter delimiter, List<LatexNode> children) implements LatexNode {
        public enum Delimiter {
            BRACE("{", "}"),
            BRACKET("[", "]");

            private final String open;
            private final String close;

            Delimiter(String open, String close) {
                this.open = open;
                this.close = close;
            }

            public String open() {
                return open;
            }

            public String close() {
                return close;
            }
        }
    }

    /**
     * Literal text. Escaped special characters are already resolved.
     */
    record Text(SourceSpan span, String text) implements LatexNode {
        @Override
        public List<LatexNode> children() {
            return List.of();
        }
    }

    /**
     * Reserved character ({@code ~ & # _ ^ [ ]}) whose meaning depends on context.
     */
    record SpecialChar(SourceSpan span, char character) implements LatexNode {
        @Override
        public List<LatexNode> children() {
            return List.of();
        }
    }

    /**
     * Inline or display math span.
     */
    record Math(SourceSpan span, MathDelimiter delimiter, List<LatexNode> children) implements LatexNode {
        public enum Mode {
            INLINE,
            DISPLAY
        }

        public Mode mode() {
            return delimiter.mode();
        }

        public boolean isDisplay() {
            return mode() == Mode.DISPLAY;
        }
    }

    /**
     * Comment body from after {@code %} to the end of the line.
     */
    record Comment(SourceSpan span, String text) implements LatexNode {
        @Override
        public List<LatexNode> children() {
            return List.of();
        }
    }

    private static List<LatexNode> concat(List<LatexNode> first, List<LatexNode> second) {
        if (first.isEmpty()) {
            return second;
        }
        if (second.isEmpty()) {
            return first;
        }
        var all = new ArrayList<LatexNode>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return List.copyOf(all);
    }
}
