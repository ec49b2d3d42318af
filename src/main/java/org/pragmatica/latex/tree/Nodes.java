package org.pragmatica.latex.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Queries over a parsed tree.
 */
public final class Nodes {
    private static final Set<String> CITATIONS = Set.of("cite", "citep", "citet");

    private Nodes() {}

    /**
     * All nodes of the given type in document order, {@code root} included.
     */
    public static <T extends LatexNode> List<T> findAll(LatexNode root, Class<T> type) {
        var found = new ArrayList<T>();
        var pending = new ArrayDeque<LatexNode>();
        pending.push(root);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (type.isInstance(node)) {
                found.add(type.cast(node));
            }
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i-- ) {
                pending.push(children.get(i));
            }
        }
        return found;
    }

    public static List<LatexNode.Command> commands(LatexNode root, String name) {
        return findAll(root, LatexNode.Command.class).stream()
                                                     .filter(command -> command.name().equals(name))
                                                     .toList();
    }

    public static List<LatexNode.Environment> environments(LatexNode root, String name) {
        return findAll(root, LatexNode.Environment.class).stream()
                                                         .filter(environment -> environment.name().equals(name))
                                                         .toList();
    }

    public static Optional<LatexNode.Command> firstCommand(LatexNode root, String name) {
        return commands(root, name).stream()
                                   .findFirst();
    }

    public static Optional<LatexNode.Environment> firstEnvironment(LatexNode root, String name) {
        return environments(root, name).stream()
                                       .findFirst();
    }

    /**
     * Plain text of a node: literal text, the mandatory arguments of commands, environment
     * bodies, and math written with its delimiters. Comments contribute nothing and a tie
     * ({@code ~}) reads as a space.
     */
    public static String textContent(LatexNode node) {
        var sb = new StringBuilder();
        appendText(node, sb);
        return sb.toString();
    }

    private static void appendText(LatexNode node, StringBuilder sb) {
        if (node instanceof LatexNode.Text text) {
            sb.append(text.text());
        }else if (node instanceof LatexNode.SpecialChar special) {
            sb.append(special.character() == '~' ? ' ' : special.character());
        }else if (node instanceof LatexNode.Command command) {
            command.mandatoryArgs().forEach(argument -> appendText(argument, sb));
        }else if (node instanceof LatexNode.Environment environment) {
            environment.body().forEach(child -> appendText(child, sb));
        }else if (node instanceof LatexNode.Math math) {
            sb.append(math.delimiter().open());
            math.children().forEach(child -> appendText(child, sb));
            sb.append(math.delimiter().close());
        }else if (!(node instanceof LatexNode.Comment)) {
            node.children().forEach(child -> appendText(child, sb));
        }
    }

    /**
     * Text of the first {@code \title}.
     */
    public static Optional<String> title(LatexNode.Document document) {
        return firstCommand(document, "title").map(command -> textContent(command).trim());
    }

    /**
     * Text of the first {@code abstract} environment.
     */
    public static Optional<String> abstractOf(LatexNode.Document document) {
        return firstEnvironment(document, "abstract").map(environment -> textContent(environment).trim());
    }

    /**
     * Keys cited by {@code \cite}, {@code \citep} and {@code \citet} in document order,
     * with duplicates kept.
     */
    public static List<String> citationKeys(LatexNode.Document document) {
        return findAll(document, LatexNode.Command.class).stream()
                                                         .filter(Nodes::isCitation)
                                                         .flatMap(Nodes::keysOf)
                                                         .toList();
    }

    /**
     * Content argument of every {@code \footnote} in document order, nested footnotes included.
     */
    public static List<LatexNode> footnotes(LatexNode.Document document) {
        return commands(document, "footnote").stream()
                                             .filter(footnote -> !footnote.mandatoryArgs().isEmpty())
                                             .map(footnote -> footnote.mandatoryArgs().get(0))
                                             .toList();
    }

    private static boolean isCitation(LatexNode.Command command) {
        var name = command.name();
        return CITATIONS.contains(name.endsWith("*") ? name.substring(0, name.length() - 1) : name);
    }

    private static Stream<String> keysOf(LatexNode.Command command) {
        if (command.mandatoryArgs().isEmpty()) {
            return Stream.empty();
        }
        var keys = textContent(command.mandatoryArgs().get(command.mandatoryArgs().size() - 1));
        return Arrays.stream(keys.split(","))
                     .map(String::trim)
                     .filter(key -> !key.isEmpty());
    }
}
