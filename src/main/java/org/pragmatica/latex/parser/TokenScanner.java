package org.pragmatica.latex.parser;

import org.pragmatica.latex.error.StructuralError;
import org.pragmatica.latex.lexer.LatexToken;
import org.pragmatica.latex.tree.LatexNode;
import org.pragmatica.latex.tree.SourceLocation;
import org.pragmatica.latex.tree.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Token-level helpers shared by the engine and the definition parser.
 */
final class TokenScanner {
    private static final String ESCAPABLE = "#$%&_{}";
    private static final int MAX_NAME_TOKENS = 16;

    private TokenScanner() {}

    /**
     * Name of an environment together with the group it was written in.
     */
    record EnvironmentName(String name, LatexNode.Group group) {}

    /**
     * {@code \#}, {@code \%} and friends stand for the literal character.
     */
    static boolean isEscapedSpecial(String commandName) {
        return commandName.length() == 1 && ESCAPABLE.contains(commandName);
    }

    /**
     * Length of the leading blank run (spaces, tabs, at most one line break) of {@code text},
     * or -1 when the run contains a paragraph break.
     */
    static int blankPrefix(String text) {
        int newlines = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                newlines++ ;
                if (newlines > 1) {
                    return -1;
                }
            }else if (c != ' ' && c != '\t' && c != '\r') {
                break;
            }
            i++ ;
        }
        return i;
    }

    /**
     * Whether the token is a text run of blanks that TeX skips between arguments.
     */
    static boolean isSkippableBlank(LatexToken token) {
        return token instanceof LatexToken.Text text
               && !text.text().isEmpty()
               && blankPrefix(text.text()) == text.text().length();
    }

    /**
     * Consume skippable blanks, but only when {@code next} accepts the token that follows them.
     */
    static void skipBlanksBefore(ParsingContext ctx, Predicate<LatexToken> next) {
        if (isSkippableBlank(ctx.peek()) && next.test(ctx.peek(1))) {
            ctx.advance();
        }
    }

    static boolean isSpecial(LatexToken token, char character) {
        return token instanceof LatexToken.SpecialChar special && special.is(character);
    }

    static boolean isCommand(LatexToken token, String name) {
        return token instanceof LatexToken.Command command && command.is(name);
    }

    static SourceLocation locationAt(LatexToken.Text token, int index) {
        var start = token.span().start();
        int line = start.line();
        int column = start.column();
        var text = token.text();
        for (int i = 0; i < index; i++ ) {
            if (text.charAt(i) == '\n') {
                line++ ;
                column = 1;
            }else {
                column++ ;
            }
        }
        return SourceLocation.at(line, column, start.offset() + index);
    }

    /**
     * Consume the text token at the cursor, keep the single character at {@code index} as a
     * node and push the rest back. Characters before {@code index} are dropped.
     */
    static LatexNode.Text takeCharacter(ParsingContext ctx, int index) {
        var token = (LatexToken.Text) ctx.advance();
        var text = token.text();
        int end = index + Character.charCount(text.codePointAt(index));
        var head = new LatexNode.Text(SourceSpan.of(locationAt(token, index), locationAt(token, end)),
                                      text.substring(index, end));
        if (end < text.length()) {
            ctx.pushBack(new LatexToken.Text(SourceSpan.of(head.span().end(), token.span().end()),
                                             text.substring(end)));
        }
        return head;
    }

    /**
     * Name written in the {@code {name}} group at the cursor, without consuming anything.
     */
    static Optional<String> peekEnvironmentName(ParsingContext ctx) {
        int index = isSkippableBlank(ctx.peek()) ? 1 : 0;
        if (!(ctx.peek(index) instanceof LatexToken.GroupOpen)) {
            return Optional.empty();
        }
        var name = new StringBuilder();
        for (int i = index + 1; i <= index + MAX_NAME_TOKENS; i++ ) {
            var token = ctx.peek(i);
            if (token instanceof LatexToken.GroupClose) {
                var trimmed = name.toString().trim();
                return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
            }
            if (!(token instanceof LatexToken.Text) && !(token instanceof LatexToken.SpecialChar)) {
                return Optional.empty();
            }
            name.append(token.text());
        }
        return Optional.empty();
    }

    /**
     * Read {@code {name}} at the cursor, optionally preceded by blanks. Nothing is consumed
     * when the tokens do not form a plain name group.
     */
    static Optional<EnvironmentName> readEnvironmentName(ParsingContext ctx) {
        var name = peekEnvironmentName(ctx);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        if (isSkippableBlank(ctx.peek())) {
            ctx.advance();
        }
        var start = ctx.advance().span().start();
        var parts = new ArrayList<LatexNode>();
        while (!(ctx.peek() instanceof LatexToken.GroupClose)) {
            parts.add(leaf(ctx.advance()));
        }
        ctx.advance();
        var group = new LatexNode.Group(ctx.spanFrom(start), LatexNode.Group.Delimiter.BRACE, List.copyOf(parts));
        return Optional.of(new EnvironmentName(name.get(), group));
    }

    /**
     * Node for a single token taken without structural interpretation.
     */
    static LatexNode leaf(LatexToken token) {
        if (token instanceof LatexToken.Text text) {
            return new LatexNode.Text(text.span(), text.text());
        }
        if (token instanceof LatexToken.SpecialChar special) {
            return new LatexNode.SpecialChar(special.span(), special.character());
        }
        if (token instanceof LatexToken.Comment comment) {
            return new LatexNode.Comment(comment.span(), comment.text());
        }
        if (token instanceof LatexToken.Command command) {
            return isEscapedSpecial(command.name())
                   ? new LatexNode.Text(command.span(), command.name())
                   : LatexNode.Command.bare(command.span(), command.name());
        }
        throw new IllegalArgumentException("Token is not a leaf: " + token);
    }

    /**
     * Nodes for a token read without opening scopes. Math delimiters are kept as dollar
     * characters; they do not open math there.
     */
    static List<LatexNode> rawNodes(LatexToken token) {
        if (token instanceof LatexToken.MathInlineDelim) {
            return List.of(new LatexNode.SpecialChar(token.span(), '$'));
        }
        if (token instanceof LatexToken.MathDisplayDelim) {
            var start = token.span().start();
            var middle = SourceLocation.at(start.line(), start.column() + 1, start.offset() + 1);
            return List.of(new LatexNode.SpecialChar(SourceSpan.of(start, middle), '$'),
                           new LatexNode.SpecialChar(SourceSpan.of(middle, token.span().end()), '$'));
        }
        return List.of(leaf(token));
    }

    /**
     * A brace group read as a raw token list: braces nest, nothing else opens a scope.
     */
    static LatexNode.Group readTokenGroup(ParsingContext ctx) {
        var open = ctx.advance();
        var children = readTokenList(ctx, false);
        if (ctx.peek() instanceof LatexToken.GroupClose) {
            ctx.advance();
        }else {
            ctx.report(new StructuralError.UnterminatedGroup(open.span(), "{"));
        }
        return new LatexNode.Group(ctx.spanFrom(open.span().start()), LatexNode.Group.Delimiter.BRACE, children);
    }

    /**
     * Brace opened inside a token list, with the list it will be added to once closed.
     */
    private record PendingGroup(LatexToken open, List<LatexNode> outer) {}

    /**
     * Reads tokens up to the closer of the enclosing list. Nested braces are tracked on a
     * local stack, so arbitrarily deep bodies do not grow the call stack.
     */
    static List<LatexNode> readTokenList(ParsingContext ctx, boolean untilBracket) {
        var pending = new ArrayDeque<PendingGroup>();
        List<LatexNode> children = new ArrayList<>();
        while (true) {
            var token = ctx.peek();
            var atEnd = token instanceof LatexToken.EndOfInput;
            if (pending.isEmpty()
                && (atEnd || token instanceof LatexToken.GroupClose || untilBracket && isSpecial(token, ']'))) {
                return List.copyOf(children);
            }
            if (token instanceof LatexToken.GroupOpen) {
                pending.push(new PendingGroup(ctx.advance(), children));
                children = new ArrayList<>();
            }else if (atEnd || token instanceof LatexToken.GroupClose) {
                var group = pending.pop();
                if (atEnd) {
                    ctx.report(new StructuralError.UnterminatedGroup(group.open().span(), "{"));
                }else {
                    ctx.advance();
                }
                var node = new LatexNode.Group(ctx.spanFrom(group.open().span().start()),
                                               LatexNode.Group.Delimiter.BRACE,
                                               List.copyOf(children));
                children = group.outer();
                children.add(node);
            }else {
                children.addAll(rawNodes(ctx.advance()));
            }
        }
    }
}
