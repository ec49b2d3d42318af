package org.pragmatica.latex.parser;

import org.pragmatica.latex.error.StructuralError;
import org.pragmatica.latex.lexer.LatexToken;
import org.pragmatica.latex.symbol.Arity;
import org.pragmatica.latex.symbol.DefinitionKind;
import org.pragmatica.latex.tree.LatexNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.pragmatica.latex.parser.TokenScanner.isSkippableBlank;
import static org.pragmatica.latex.parser.TokenScanner.leaf;

/**
 * Parses definition commands and registers what they declare in the parse's symbol table.
 *
 * <p>Definition bodies are read as raw token lists: braces nest, everything else is kept as
 * leaves. A registration takes effect for the tokens that follow the definition only.
 */
final class MacroDefinitions {
    private static final Logger log = LoggerFactory.getLogger(MacroDefinitions.class);

    private MacroDefinitions() {}

    private record Declared(LatexNode node, String name) {}

    private record Signature(List<LatexNode> nodes, Arity arity, boolean valid) {}

    static LatexNode.Command parse(ParsingContext ctx, LatexToken.Command token, DefinitionKind kind) {
        return switch (kind) {
            case NEW_COMMAND -> parseNewCommand(ctx, token);
            case NEW_ENVIRONMENT -> parseNewEnvironment(ctx, token);
            case DEF -> parseDef(ctx, token);
            case LET -> parseLet(ctx, token);
        };
    }

    // === \newcommand ===

    private static LatexNode.Command parseNewCommand(ParsingContext ctx, LatexToken.Command token) {
        var start = token.span().start();
        var declared = readDeclaredCommand(ctx);
        if (declared.isEmpty()) {
            ctx.report(new StructuralError.MalformedDefinition(token.span(), token.name(), "expected a command name"));
            return LatexNode.Command.bare(ctx.spanFrom(start), token.name());
        }
        var signature = readSignature(ctx, token);
        var mandatory = new ArrayList<LatexNode>();
        mandatory.add(declared.get().node());
        var body = readBody(ctx);
        body.ifPresent(mandatory::add);
        if (body.isEmpty()) {
            ctx.report(new StructuralError.MalformedDefinition(token.span(), token.name(), "missing definition body"));
        }else if (signature.valid()) {
            registerCommand(ctx, token.name(), declared.get().name(), signature.arity());
        }
        return new LatexNode.Command(ctx.spanFrom(start), token.name(), signature.nodes(), List.copyOf(mandatory));
    }

    private static void registerCommand(ParsingContext ctx, String definer, String name, Arity arity) {
        if (DefinitionKind.keepsExisting(definer) && ctx.symbols().hasCommand(name)) {
            log.debug("\\{} keeps existing definition of \\{}", definer, name);
            return;
        }
        ctx.symbols().defineCommand(name, arity);
        log.debug("Registered command \\{} with arity {}", name, arity);
    }

    private static Optional<Declared> readDeclaredCommand(ParsingContext ctx) {
        skipBlanks(ctx);
        var token = ctx.peek();
        if (token instanceof LatexToken.Command command) {
            ctx.advance();
            return Optional.of(new Declared(LatexNode.Command.bare(command.span(), command.name()), command.name()));
        }
        if (token instanceof LatexToken.GroupOpen
            && ctx.peek(1) instanceof LatexToken.Command command
            && ctx.peek(2) instanceof LatexToken.GroupClose) {
            var start = ctx.advance().span().start();
            ctx.advance();
            ctx.advance();
            var group = new LatexNode.Group(ctx.spanFrom(start),
                                            LatexNode.Group.Delimiter.BRACE,
                                            List.of(LatexNode.Command.bare(command.span(), command.name())));
            return Optional.of(new Declared(group, command.name()));
        }
        return Optional.empty();
    }

    // === \newenvironment ===

    private static LatexNode.Command parseNewEnvironment(ParsingContext ctx, LatexToken.Command token) {
        var start = token.span().start();
        var declared = TokenScanner.readEnvironmentName(ctx);
        if (declared.isEmpty()) {
            ctx.report(new StructuralError.MalformedDefinition(token.span(), token.name(), "expected an environment name"));
            return LatexNode.Command.bare(ctx.spanFrom(start), token.name());
        }
        var signature = readSignature(ctx, token);
        var mandatory = new ArrayList<LatexNode>();
        mandatory.add(declared.get().group());
        var begin = readBody(ctx);
        begin.ifPresent(mandatory::add);
        var end = begin.isPresent() ? readBody(ctx) : Optional.<LatexNode>empty();
        end.ifPresent(mandatory::add);
        if (end.isEmpty()) {
            ctx.report(new StructuralError.MalformedDefinition(token.span(),
                                                               token.name(),
                                                               "expected begin and end code"));
        }else if (signature.valid()) {
            var name = declared.get().name();
            ctx.symbols().defineEnvironment(name, signature.arity());
            log.debug("Registered environment {} with arity {}", name, signature.arity());
        }
        return new LatexNode.Command(ctx.spanFrom(start), token.name(), signature.nodes(), List.copyOf(mandatory));
    }

    /**
     * Reads the optional {@code [n][default]} part of {@code \newcommand} and {@code \newenvironment}.
     */
    private static Signature readSignature(ParsingContext ctx, LatexToken.Command token) {
        var nodes = new ArrayList<LatexNode>();
        var count = readBracketList(ctx);
        if (count.isEmpty()) {
            return new Signature(List.of(), Arity.NONE, true);
        }
        nodes.add(count.get());
        var total = parseCount(count.get());
        var hasDefault = false;
        var defaultValue = readBracketList(ctx);
        if (defaultValue.isPresent()) {
            nodes.add(defaultValue.get());
            hasDefault = true;
        }
        if (total < 0) {
            ctx.report(new StructuralError.MalformedDefinition(count.get().span(),
                                                               token.name(),
                                                               "argument count must be a number from 0 to "
                                                               + Arity.MAX_ARGUMENTS));
            return new Signature(List.copyOf(nodes), Arity.NONE, false);
        }
        return new Signature(List.copyOf(nodes), Arity.declared(total, hasDefault), true);
    }

    private static int parseCount(LatexNode.Group group) {
        var text = new StringBuilder();
        for (var child : group.children()) {
            if (!(child instanceof LatexNode.Text part)) {
                return -1;
            }
            text.append(part.text());
        }
        var digits = text.toString().trim();
        if (digits.length() != 1 || !isDigit(digits.charAt(0))) {
            return -1;
        }
        return digits.charAt(0) - '0';
    }

    // TeX reads argument counts and parameter numbers as ASCII digits only
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    // === \def ===

    private static LatexNode.Command parseDef(ParsingContext ctx, LatexToken.Command token) {
        var start = token.span().start();
        skipBlanks(ctx);
        if (!(ctx.peek() instanceof LatexToken.Command declared)) {
            ctx.report(new StructuralError.MalformedDefinition(token.span(), token.name(), "expected a command name"));
            return LatexNode.Command.bare(ctx.spanFrom(start), token.name());
        }
        ctx.advance();
        var mandatory = new ArrayList<LatexNode>();
        mandatory.add(LatexNode.Command.bare(declared.span(), declared.name()));
        int parameters = 0;
        while (!(ctx.peek() instanceof LatexToken.GroupOpen)) {
            var next = ctx.peek();
            if (next instanceof LatexToken.EndOfInput || next instanceof LatexToken.GroupClose) {
                ctx.report(new StructuralError.MalformedDefinition(token.span(), token.name(), "missing definition body"));
                return new LatexNode.Command(ctx.spanFrom(start), token.name(), List.of(), List.copyOf(mandatory));
            }
            mandatory.addAll(TokenScanner.rawNodes(ctx.advance()));
            if (TokenScanner.isSpecial(next, '#')
                && ctx.peek() instanceof LatexToken.Text digit
                && isDigit(digit.text().charAt(0))) {
                parameters = Math.max(parameters, digit.text().charAt(0) - '0');
            }
        }
        mandatory.add(TokenScanner.readTokenGroup(ctx));
        var arity = Arity.mandatory(Math.min(parameters, Arity.MAX_ARGUMENTS));
        ctx.symbols().defineCommand(declared.name(), arity);
        log.debug("Registered command \\{} with arity {}", declared.name(), arity);
        return new LatexNode.Command(ctx.spanFrom(start), token.name(), List.of(), List.copyOf(mandatory));
    }

    // === \let ===

    private static LatexNode.Command parseLet(ParsingContext ctx, LatexToken.Command token) {
        var start = token.span().start();
        skipBlanks(ctx);
        if (!(ctx.peek() instanceof LatexToken.Command declared)) {
            ctx.report(new StructuralError.MalformedDefinition(token.span(), token.name(), "expected a command name"));
            return LatexNode.Command.bare(ctx.spanFrom(start), token.name());
        }
        ctx.advance();
        var mandatory = new ArrayList<LatexNode>();
        mandatory.add(LatexNode.Command.bare(declared.span(), declared.name()));
        readEquals(ctx).ifPresent(mandatory::add);
        skipBlanks(ctx);
        var target = ctx.peek();
        Arity arity;
        if (target instanceof LatexToken.Command command) {
            ctx.advance();
            mandatory.add(leaf(command));
            arity = ctx.symbols().commandArity(command.name());
        }else if (target instanceof LatexToken.Text) {
            mandatory.add(TokenScanner.takeCharacter(ctx, 0));
            arity = Arity.NONE;
        }else if (target instanceof LatexToken.SpecialChar) {
            mandatory.add(leaf(ctx.advance()));
            arity = Arity.NONE;
        }else {
            ctx.report(new StructuralError.MalformedDefinition(token.span(), token.name(), "expected a token to copy"));
            return new LatexNode.Command(ctx.spanFrom(start), token.name(), List.of(), List.copyOf(mandatory));
        }
        ctx.symbols().defineCommand(declared.name(), arity);
        log.debug("Registered command \\{} as copy with arity {}", declared.name(), arity);
        return new LatexNode.Command(ctx.spanFrom(start), token.name(), List.of(), List.copyOf(mandatory));
    }

    private static Optional<LatexNode> readEquals(ParsingContext ctx) {
        var index = isSkippableBlank(ctx.peek()) ? 1 : 0;
        if (!(ctx.peek(index) instanceof LatexToken.Text text) || !text.text().startsWith("=")) {
            return Optional.empty();
        }
        if (index == 1) {
            ctx.advance();
        }
        return Optional.of(TokenScanner.takeCharacter(ctx, 0));
    }

    // === Token lists ===

    private static Optional<LatexNode> readBody(ParsingContext ctx) {
        TokenScanner.skipBlanksBefore(ctx,
                                      next -> next instanceof LatexToken.GroupOpen
                                              || next instanceof LatexToken.Command);
        var token = ctx.peek();
        if (token instanceof LatexToken.GroupOpen) {
            return Optional.of(TokenScanner.readTokenGroup(ctx));
        }
        if (token instanceof LatexToken.Command command) {
            ctx.advance();
            return Optional.of(leaf(command));
        }
        return Optional.empty();
    }

    private static Optional<LatexNode.Group> readBracketList(ParsingContext ctx) {
        TokenScanner.skipBlanksBefore(ctx, next -> TokenScanner.isSpecial(next, '['));
        if (!TokenScanner.isSpecial(ctx.peek(), '[')) {
            return Optional.empty();
        }
        var open = ctx.advance();
        var children = TokenScanner.readTokenList(ctx, true);
        if (TokenScanner.isSpecial(ctx.peek(), ']')) {
            ctx.advance();
        }else {
            ctx.report(new StructuralError.UnterminatedGroup(open.span(), "["));
        }
        return Optional.of(new LatexNode.Group(ctx.spanFrom(open.span().start()),
                                               LatexNode.Group.Delimiter.BRACKET,
                                               children));
    }

    private static void skipBlanks(ParsingContext ctx) {
        while (isSkippableBlank(ctx.peek())) {
            ctx.advance();
        }
    }
}
