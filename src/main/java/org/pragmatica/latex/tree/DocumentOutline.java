package org.pragmatica.latex.tree;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sectioning structure of a document: every heading command in document order.
 */
public final class DocumentOutline {
    private static final Map<String, Integer> LEVELS = Map.of(
        "part", 0,
        "chapter", 1,
        "section", 2,
        "subsection", 3,
        "subsubsection", 4,
        "paragraph", 5,
        "subparagraph", 6
    );

    private DocumentOutline() {}

    /**
     * One heading of the outline.
     *
     * @param level      0 for {@code \part} down to 6 for {@code \subparagraph}
     * @param command    the heading command without star
     * @param title      plain text of the title argument
     * @param shortTitle plain text of the optional argument, if given
     * @param numbered   false for starred headings
     * @param span       the heading command in source
     */
    public record Heading(
        int level,
        String command,
        String title,
        Optional<String> shortTitle,
        boolean numbered,
        SourceSpan span
    ) {}

    public static List<Heading> of(LatexNode.Document document) {
        return Nodes.findAll(document, LatexNode.Command.class)
                    .stream()
                    .filter(command -> LEVELS.containsKey(baseName(command.name())))
                    .map(DocumentOutline::heading)
                    .toList();
    }

    /**
     * Level of a heading command, empty for other commands.
     */
    public static Optional<Integer> levelOf(String commandName) {
        return Optional.ofNullable(LEVELS.get(baseName(commandName)));
    }

    private static Heading heading(LatexNode.Command command) {
        var base = baseName(command.name());
        var title = command.mandatoryArgs()
                           .isEmpty()
                    ? ""
                    : Nodes.textContent(command.mandatoryArgs().get(0)).trim();
        var shortTitle = command.optionalArgs()
                                .stream()
                                .findFirst()
                                .map(argument -> Nodes.textContent(argument).trim());
        return new Heading(LEVELS.get(base), base, title, shortTitle, !command.name().endsWith("*"), command.span());
    }

    private static String baseName(String name) {
        return name.endsWith("*") ? name.substring(0, name.length() - 1) : name;
    }
}
