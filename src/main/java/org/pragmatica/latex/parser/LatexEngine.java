package org.pragmatica.latex.parser;

import org.pragmatica.latex.error.StructuralError;
import org.pragmatica.latex.lexer.LatexLexer;
import org.pragmatica.latex.lexer.LatexToken;
import org.pragmatica.latex.symbol.Arity;
import org.pragmatica.latex.symbol.DefinitionKind;
import org.pragmatica.latex.tree.LatexNode;
import org.pragmatica.latex.tree.MathDelimiter;
import org.pragmatica.latex.tree.SourceLocation;
import org.pragmatica.latex.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static org.pragmatica.latex.parser.TokenScanner.isCommand;
import static org.pragmatica.latex.parser.TokenScanner.isSpecial;
import static org.pragmatica.latex.parser.TokenScanner.leaf;

/**
 * Recursive-descent LaTeX parser.
 *
 * <p>Each scope (group, optional argument, environment, math) pushes a marker on the
 * nesting stack of the {@link ParsingContext} and parses children until a token that closes
 * it or an enclosing scope. A scope that cannot consume its own closer reports itself as
 * unterminated and returns what it has, so one stray token never invalidates the rest of
 * the tree.
 */
public final class LatexEngine implements Parser {
    private static final Logger log = LoggerFactory.getLogger(LatexEngine.class);

    /**
     * Commands that never serve as a single-token argument.
     */
    private static final Set<String> STRUCTURAL_COMMANDS = Set.of("begin", "end", "(", ")", "[", "]");

    private final ParserConfig config;

    private LatexEngine(ParserConfig config) {
        this.config = config;
    }

    public static LatexEngine create(ParserConfig config) {
        return new LatexEngine(Objects.requireNonNull(config, "config"));
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public ParseResult parse(String source) {
        Objects.requireNonNull(source, "source");
        return run(LatexLexer.tokenize(source), source);
    }

    @Override
    public ParseResult parse(Iterator<LatexToken> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        return run(tokens, "");
    }

    private ParseResult run(Iterator<LatexToken> tokens, String source) {
        var ctx = ParsingContext.create(tokens, config);
        var document = parseDocument(ctx);
        var diagnostics = ctx.diagnostics();
        log.debug("Parsed {} tokens into {} top-level nodes, {} diagnostics",
                  ctx.consumedTokens(),
                  document.children()
                          .size(),
                  diagnostics.size());
        return ParseResult.of(document, diagnostics, source);
    }

    private LatexNode.Document parseDocument(ParsingContext ctx) {
        var children = parseChildren(ctx);
        var end = ctx.peek()
                     .span()
                     .end();
        return new LatexNode.Document(SourceSpan.of(SourceLocation.START, end), children);
    }

    // === Children ===

    /**
     * Parse elements until end of input or a token that closes an open scope.
     * The closing token is left for the scope to consume.
     */
    private List<LatexNode> parseChildren(ParsingContext ctx) {
        var children = new ChildList(config.mergeText());
        while (true) {
            var token = ctx.peek();
            if (token instanceof LatexToken.EndOfInput || closesOpenScope(ctx, token)) {
                return children.toList();
            }
            if (dropStrayClose(ctx, token)) {
                continue;
            }
            if (atNestingLimit(ctx) && opensScope(token)) {
                children.addAll(flatten(ctx));
            }else {
                children.add(parseElement(ctx));
            }
        }
    }

    private static boolean closesOpenScope(ParsingContext ctx, LatexToken token) {
        if (token instanceof LatexToken.GroupClose) {
            return ctx.hasOpen(ScopeMarker.Group.class);
        }
        if (isSpecial(token, ']')) {
            return ctx.isInnermost(ScopeMarker.OptionalArgument.class);
        }
        if (token instanceof LatexToken.MathInlineDelim || token instanceof LatexToken.MathDisplayDelim) {
            return ctx.isInnermost(ScopeMarker.Math.class);
        }
        if (isCommand(token, "end")) {
            return ctx.hasOpen(ScopeMarker.Environment.class);
        }
        if (isCommand(token, ")") || isCommand(token, "]")) {
            return ctx.hasOpen(ScopeMarker.Math.class);
        }
        return false;
    }

    /**
     * Consume a closing token that no open scope accepts. Returns false for any other token.
     */
    private static boolean dropStrayClose(ParsingContext ctx, LatexToken token) {
        if (token instanceof LatexToken.GroupClose) {
            ctx.advance();
            ctx.report(new StructuralError.UnexpectedClose(token.span(), "}"));
            return true;
        }
        if (isCommand(token, "end")) {
            ctx.advance();
            var name = TokenScanner.readEnvironmentName(ctx);
            var text = name.map(found -> "\\end{" + found.name() + "}")
                           .orElse("\\end");
            ctx.report(new StructuralError.UnexpectedClose(ctx.spanFrom(token.span().start()), text));
            return true;
        }
        if (isCommand(token, ")") || isCommand(token, "]")) {
            ctx.advance();
            ctx.report(new StructuralError.UnexpectedClose(token.span(), "\\" + ((LatexToken.Command) token).name()));
            return true;
        }
        return false;
    }

    private boolean atNestingLimit(ParsingContext ctx) {
        return ctx.depth() >= config.maxNestingDepth();
    }

    private static boolean opensScope(LatexToken token) {
        return token instanceof LatexToken.GroupOpen
               || token instanceof LatexToken.MathInlineDelim
               || token instanceof LatexToken.MathDisplayDelim
               || isCommand(token, "begin")
               || isCommand(token, "(")
               || isCommand(token, "[");
    }

    /**
     * Past the nesting limit a scope is not opened: a brace group is read as a raw token
     * list and any other opener is kept as a leaf.
     */
    private List<LatexNode> flatten(ParsingContext ctx) {
        var token = ctx.peek();
        if (token instanceof LatexToken.GroupOpen) {
            return List.of(flattenGroup(ctx));
        }
        ctx.report(new StructuralError.NestingTooDeep(token.span(), config.maxNestingDepth()));
        return TokenScanner.rawNodes(ctx.advance());
    }

    private LatexNode.Group flattenGroup(ParsingContext ctx) {
        ctx.report(new StructuralError.NestingTooDeep(ctx.peek().span(), config.maxNestingDepth()));
        return TokenScanner.readTokenGroup(ctx);
    }

    private LatexNode parseElement(ParsingContext ctx) {
        var token = ctx.peek();
        if (token instanceof LatexToken.GroupOpen) {
            return parseGroup(ctx);
        }
        if (token instanceof LatexToken.MathInlineDelim) {
            return parseMath(ctx, MathDelimiter.DOLLAR);
        }
        if (token instanceof LatexToken.MathDisplayDelim) {
            return parseMath(ctx, MathDelimiter.DOUBLE_DOLLAR);
        }
        if (token instanceof LatexToken.Command command) {
            return parseCommandToken(ctx, command);
        }
        return leaf(ctx.advance());
    }

    private LatexNode parseCommandToken(ParsingContext ctx, LatexToken.Command command) {
        if (command.is("begin")) {
            return parseEnvironment(ctx);
        }
        if (command.is("(")) {
            return parseMath(ctx, MathDelimiter.PAREN);
        }
        if (command.is("[")) {
            return parseMath(ctx, MathDelimiter.BRACKET);
        }
        if (TokenScanner.isEscapedSpecial(command.name())) {
            return leaf(ctx.advance());
        }
        var start = ctx.advance()
                       .span()
                       .start();
        var name = readStar(ctx, command.name());
        var definition = DefinitionKind.of(name);
        if (definition.isPresent()) {
            return MacroDefinitions.parse(ctx, new LatexToken.Command(ctx.spanFrom(start), name), definition.get());
        }
        var arguments = parseArguments(ctx, name, ctx.symbols()
                                                     .commandArity(name), start);
        return new LatexNode.Command(ctx.spanFrom(start), name, arguments.optional(), arguments.mandatory());
    }

    /**
     * {@code \name*} is the starred variant when the table knows it; otherwise the star is text.
     */
    private static String readStar(ParsingContext ctx, String name) {
        var starred = name + "*";
        if (ctx.peek() instanceof LatexToken.Text text
            && text.text().startsWith("*")
            && text.span().start().equals(ctx.lastEnd())
            && ctx.symbols().hasCommand(starred)) {
            TokenScanner.takeCharacter(ctx, 0);
            return starred;
        }
        return name;
    }

    // === Scopes ===

    private LatexNode.Group parseGroup(ParsingContext ctx) {
        if (atNestingLimit(ctx)) {
            return flattenGroup(ctx);
        }
        var open = ctx.advance();
        var marker = new ScopeMarker.Group(open.span());
        ctx.open(marker);
        var children = parseChildren(ctx);
        if (ctx.peek() instanceof LatexToken.GroupClose) {
            ctx.advance();
        }else {
            ctx.report(marker.unterminated());
        }
        ctx.close(marker);
        return new LatexNode.Group(ctx.spanFrom(open.span().start()), LatexNode.Group.Delimiter.BRACE, children);
    }

    private LatexNode.Group parseOptionalArgument(ParsingContext ctx) {
        var open = ctx.advance();
        var marker = new ScopeMarker.OptionalArgument(open.span());
        ctx.open(marker);
        var children = parseChildren(ctx);
        if (isSpecial(ctx.peek(), ']')) {
            ctx.advance();
        }else {
            ctx.report(marker.unterminated());
        }
        ctx.close(marker);
        return new LatexNode.Group(ctx.spanFrom(open.span().start()), LatexNode.Group.Delimiter.BRACKET, children);
    }

    private LatexNode parseEnvironment(ParsingContext ctx) {
        var begin = ctx.advance();
        var start = begin.span()
                         .start();
        var declared = TokenScanner.readEnvironmentName(ctx);
        if (declared.isEmpty()) {
            ctx.report(new StructuralError.MissingEnvironmentName(begin.span(), "begin"));
            return LatexNode.Command.bare(begin.span(), "begin");
        }
        var name = declared.get()
                           .name();
        var marker = new ScopeMarker.Environment(name, ctx.spanFrom(start));
        var arguments = parseArguments(ctx, "begin{" + name + "}", ctx.symbols()
                                                                      .environmentArity(name), start);
        ctx.open(marker);
        var body = parseChildren(ctx);
        closeEnvironment(ctx, marker);
        ctx.close(marker);
        return new LatexNode.Environment(ctx.spanFrom(start), name, arguments.optional(), arguments.mandatory(), body);
    }

    /**
     * Consume the {@code \end} of the environment. An {@code \end} with another name, or
     * with none, still closes this environment and is reported as a mismatch.
     */
    private static void closeEnvironment(ParsingContext ctx, ScopeMarker.Environment marker) {
        var token = ctx.peek();
        if (!isCommand(token, "end")) {
            ctx.report(marker.unterminated());
            return;
        }
        ctx.advance();
        var name = TokenScanner.readEnvironmentName(ctx);
        if (name.isEmpty() || !name.get().name().equals(marker.name())) {
            ctx.report(new StructuralError.EnvironmentMismatch(ctx.spanFrom(token.span().start()),
                                                               marker.name(),
                                                               name.map(TokenScanner.EnvironmentName::name)
                                                                   .orElse(""),
                                                               marker.openedAt()));
        }
    }

    private LatexNode.Math parseMath(ParsingContext ctx, MathDelimiter delimiter) {
        var open = ctx.advance();
        var marker = new ScopeMarker.Math(delimiter, open.span());
        ctx.open(marker);
        var children = parseChildren(ctx);
        closeMath(ctx, marker);
        ctx.close(marker);
        return new LatexNode.Math(ctx.spanFrom(open.span().start()), delimiter, children);
    }

    private static void closeMath(ParsingContext ctx, ScopeMarker.Math marker) {
        var token = ctx.peek();
        var found = mathCloser(token);
        if (found.isEmpty()) {
            ctx.report(marker.unterminated());
            return;
        }
        ctx.advance();
        var closer = found.get();
        var span = token.span();
        if (token instanceof LatexToken.MathDisplayDelim && marker.delimiter() == MathDelimiter.DOLLAR) {
            // $a$$b$: the first dollar closes, the second one opens again
            var start = span.start();
            var middle = SourceLocation.at(start.line(), start.column() + 1, start.offset() + 1);
            ctx.pushBack(new LatexToken.MathInlineDelim(SourceSpan.of(middle, span.end())));
            closer = MathDelimiter.DOLLAR.close();
        }
        if (!closer.equals(marker.delimiter().close())) {
            ctx.report(new StructuralError.MathDelimiterMismatch(span,
                                                                 marker.delimiter().close(),
                                                                 closer,
                                                                 marker.openedAt()));
        }
    }

    private static Optional<String> mathCloser(LatexToken token) {
        if (token instanceof LatexToken.MathInlineDelim) {
            return Optional.of(MathDelimiter.DOLLAR.close());
        }
        if (token instanceof LatexToken.MathDisplayDelim) {
            return Optional.of(MathDelimiter.DOUBLE_DOLLAR.close());
        }
        if (isCommand(token, ")")) {
            return Optional.of(MathDelimiter.PAREN.close());
        }
        if (isCommand(token, "]")) {
            return Optional.of(MathDelimiter.BRACKET.close());
        }
        return Optional.empty();
    }

    // === Arguments ===

    private record Arguments(List<LatexNode> optional, List<LatexNode> mandatory) {}

    private Arguments parseArguments(ParsingContext ctx, String name, Arity arity, SourceLocation start) {
        var optional = new ArrayList<LatexNode>();
        for (int i = 0; i < arity.optional(); i++ ) {
            if (config.optionalArguments() == OptionalArgumentPolicy.LENIENT) {
                TokenScanner.skipBlanksBefore(ctx, next -> isSpecial(next, '['));
            }
            if (!isSpecial(ctx.peek(), '[') || atNestingLimit(ctx)) {
                break;
            }
            optional.add(parseOptionalArgument(ctx));
        }
        var mandatory = new ArrayList<LatexNode>();
        for (int i = 0; i < arity.mandatory(); i++ ) {
            var argument = parseMandatoryArgument(ctx);
            if (argument.isEmpty()) {
                ctx.report(new StructuralError.MissingArgument(ctx.spanFrom(start), name, arity.mandatory(), i));
                break;
            }
            mandatory.add(argument.get());
        }
        return new Arguments(List.copyOf(optional), List.copyOf(mandatory));
    }

    /**
     * A braced group or a single token, after skipping blanks that do not form a paragraph break.
     */
    private Optional<LatexNode> parseMandatoryArgument(ParsingContext ctx) {
        var token = ctx.peek();
        if (token instanceof LatexToken.Text text) {
            var skip = TokenScanner.blankPrefix(text.text());
            if (skip < 0) {
                return Optional.empty();
            }
            if (skip < text.text()
                           .length()) {
                return Optional.of(TokenScanner.takeCharacter(ctx, skip));
            }
            if (!startsArgument(ctx, ctx.peek(1))) {
                return Optional.empty();
            }
            ctx.advance();
            return parseMandatoryArgument(ctx);
        }
        if (!startsArgument(ctx, token)) {
            return Optional.empty();
        }
        if (token instanceof LatexToken.GroupOpen) {
            return Optional.of(parseGroup(ctx));
        }
        return Optional.of(leaf(ctx.advance()));
    }

    private static boolean startsArgument(ParsingContext ctx, LatexToken token) {
        if (token instanceof LatexToken.Text text) {
            var skip = TokenScanner.blankPrefix(text.text());
            return skip >= 0 && skip < text.text()
                                           .length();
        }
        if (token instanceof LatexToken.GroupOpen) {
            return true;
        }
        if (token instanceof LatexToken.SpecialChar special) {
            return !(special.is(']') && ctx.isInnermost(ScopeMarker.OptionalArgument.class));
        }
        if (token instanceof LatexToken.Command command) {
            return !STRUCTURAL_COMMANDS.contains(command.name());
        }
        return false;
    }

    /**
     * Child list that optionally joins adjacent text runs into one node. A run is collected
     * in a buffer and becomes a node only when something else follows, so merging stays linear.
     */
    private static final class ChildList {
        private final boolean mergeText;
        private final List<LatexNode> nodes = new ArrayList<>();
        private final StringBuilder run = new StringBuilder();
        private LatexNode.Text runHead;
        private SourceSpan runSpan;

        ChildList(boolean mergeText) {
            this.mergeText = mergeText;
        }

        void add(LatexNode node) {
            if (mergeText && node instanceof LatexNode.Text text) {
                if (runSpan != null && runSpan.end().equals(text.span().start())) {
                    run.append(text.text());
                    runSpan = runSpan.through(text.span());
                    return;
                }
                flushRun();
                runHead = text;
                runSpan = text.span();
                run.append(text.text());
                return;
            }
            flushRun();
            nodes.add(node);
        }

        void addAll(List<LatexNode> added) {
            added.forEach(this::add);
        }

        List<LatexNode> toList() {
            flushRun();
            return List.copyOf(nodes);
        }

        private void flushRun() {
            if (runSpan == null) {
                return;
            }
            nodes.add(runSpan.equals(runHead.span())
                      ? runHead
                      : new LatexNode.Text(runSpan, run.toString()));
            run.setLength(0);
            runHead = null;
            runSpan = null;
        }
    }
}
