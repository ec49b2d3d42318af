package org.pragmatica.latex.tree;

import java.util.List;

/**
 * Renders a node and its descendants as an indented box-drawing tree, one line per node.
 *
 * <pre>
 * Document
 * └── Command: \textbf
 *     └── Group {}
 *         └── Text: 'hello'
 * </pre>
 */
public final class TreePrinter {
    private static final int MAX_TEXT = 20;

    private TreePrinter() {}

    public static String print(LatexNode node) {
        var sb = new StringBuilder();
        sb.append(describe(node))
          .append('\n');
        appendChildren(sb, node.children(), "");
        return sb.toString();
    }

    private static void appendChildren(StringBuilder sb, List<LatexNode> children, String prefix) {
        for (int i = 0; i < children.size(); i++ ) {
            var child = children.get(i);
            var last = i == children.size() - 1;
            sb.append(prefix)
              .append(last ? "└── " : "├── ")
              .append(describe(child))
              .append('\n');
            appendChildren(sb, child.children(), prefix + (last ? "    " : "│   "));
        }
    }

    /**
     * One-line description of a node, without its children.
     */
    public static String describe(LatexNode node) {
        if (node instanceof LatexNode.Document) {
            return "Document";
        }
        if (node instanceof LatexNode.Command command) {
            return "Command: \\" + command.name();
        }
        if (node instanceof LatexNode.Environment environment) {
            return "Environment: " + environment.name();
        }
        if (node instanceof LatexNode.Group group) {
            return "Group " + group.delimiter().open() + group.delimiter().close();
        }
        if (node instanceof LatexNode.Text text) {
            return "Text: '" + abbreviate(text.text()) + "'";
        }
        if (node instanceof LatexNode.Math math) {
            return math.isDisplay() ? "Math (Display)" : "Math (Inline)";
        }
        if (node instanceof LatexNode.Comment comment) {
            return "Comment: '" + abbreviate(comment.text()) + "'";
        }
        var special = (LatexNode.SpecialChar) node;
        return "SpecialChar: '" + special.character() + "'";
    }

    private static String abbreviate(String text) {
        var escaped = text.replace("\n", "\\n");
        return escaped.length() > MAX_TEXT
               ? escaped.substring(0, MAX_TEXT) + "..."
               : escaped;
    }
}
