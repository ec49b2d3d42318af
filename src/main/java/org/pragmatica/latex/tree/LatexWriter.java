package org.pragmatica.latex.tree;

import org.pragmatica.latex.symbol.DefinitionKind;

import java.util.List;

/**
 * Serializes a tree back to LaTeX source.
 *
 * <p>The output is not byte-identical to the parsed input (skipped blanks between a command
 * and its arguments are gone, recovered scopes get their closers) but parsing it again with
 * the same configuration yields a tree of the same shape. The one exception is an empty
 * {@code $} formula, which can only be written with {@code \(\)} delimiters.
 */
public final class LatexWriter {
    private static final String ESCAPED = "#$%&_{}";

    private final StringBuilder out = new StringBuilder();
    private boolean afterControlWord;

    private LatexWriter() {}

    public static String write(LatexNode node) {
        var writer = new LatexWriter();
        writer.node(node);
        return writer.out.toString();
    }

    private void node(LatexNode node) {
        if (node instanceof LatexNode.Document document) {
            children(document.children());
        }else if (node instanceof LatexNode.Command command) {
            command(command);
        }else if (node instanceof LatexNode.Environment environment) {
            environment(environment);
        }else if (node instanceof LatexNode.Group group) {
            raw(group.delimiter().open());
            children(group.children());
            raw(group.delimiter().close());
        }else if (node instanceof LatexNode.Math math) {
            var delimiter = spelling(math);
            raw(delimiter.open());
            children(math.children());
            raw(delimiter.close());
        }else if (node instanceof LatexNode.Text text) {
            raw(escape(text.text()));
        }else if (node instanceof LatexNode.SpecialChar special) {
            raw(String.valueOf(special.character()));
        }else if (node instanceof LatexNode.Comment comment) {
            raw("%" + comment.text());
        }
    }

    // "$$" always lexes as a display delimiter, so an empty inline formula is written as \(\)
    private static MathDelimiter spelling(LatexNode.Math math) {
        return math.delimiter() == MathDelimiter.DOLLAR && math.children().isEmpty()
               ? MathDelimiter.PAREN
               : math.delimiter();
    }

    private void children(List<LatexNode> children) {
        for (int i = 0; i < children.size(); i++ ) {
            var child = children.get(i);
            node(child);
            // a comment runs to the end of the line, so whatever follows must start on a new one
            if (child instanceof LatexNode.Comment && !startsWithNewline(children, i + 1)) {
                raw("\n");
            }
        }
    }

    private static boolean startsWithNewline(List<LatexNode> children, int index) {
        return index < children.size()
               && children.get(index) instanceof LatexNode.Text text
               && text.text().startsWith("\n");
    }

    private void command(LatexNode.Command command) {
        controlSequence(command.name());
        var nameFirst = DefinitionKind.of(command.name())
                                      .map(DefinitionKind::nameBeforeOptionals)
                                      .orElse(false);
        if (nameFirst && !command.mandatoryArgs().isEmpty()) {
            node(command.mandatoryArgs().get(0));
            command.optionalArgs().forEach(this::node);
            command.mandatoryArgs()
                   .subList(1, command.mandatoryArgs().size())
                   .forEach(this::mandatoryArgument);
            return;
        }
        command.optionalArgs().forEach(this::node);
        command.mandatoryArgs().forEach(this::mandatoryArgument);
    }

    // A bare '[' argument must not be read back as the start of an optional argument
    private void mandatoryArgument(LatexNode argument) {
        if (argument instanceof LatexNode.SpecialChar special && special.character() == '[') {
            raw(" ");
        }
        node(argument);
    }

    private void environment(LatexNode.Environment environment) {
        controlSequence("begin");
        raw("{" + environment.name() + "}");
        environment.optionalArgs().forEach(this::node);
        environment.mandatoryArgs().forEach(this::mandatoryArgument);
        children(environment.body());
        controlSequence("end");
        raw("{" + environment.name() + "}");
    }

    private void controlSequence(String name) {
        raw("\\" + name);
        afterControlWord = Character.isLetter(name.charAt(name.length() - 1));
    }

    private void raw(String text) {
        if (text.isEmpty()) {
            return;
        }
        if (afterControlWord && Character.isLetter(text.charAt(0))) {
            out.append(' ');
        }
        afterControlWord = false;
        out.append(text);
    }

    private static String escape(String text) {
        var sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++ ) {
            var c = text.charAt(i);
            if (ESCAPED.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
