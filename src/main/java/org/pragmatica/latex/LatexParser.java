package org.pragmatica.latex;

import org.pragmatica.latex.parser.LatexEngine;
import org.pragmatica.latex.parser.OptionalArgumentPolicy;
import org.pragmatica.latex.parser.ParseResult;
import org.pragmatica.latex.parser.Parser;
import org.pragmatica.latex.parser.ParserConfig;
import org.pragmatica.latex.symbol.Arity;
import org.pragmatica.latex.symbol.SymbolTable;

import java.util.Objects;

/**
 * Entry point for parsing LaTeX.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = LatexParser.parse("\\section{Intro} Hello \\textbf{world}");
 * result.document().children();
 *
 * var parser = LatexParser.builder()
 *                         .command("vec", Arity.mandatory(1))
 *                         .optionalArguments(OptionalArgumentPolicy.LENIENT)
 *                         .build();
 * }</pre>
 */
public final class LatexParser {
    private LatexParser() {}

    /**
     * Parse with the built-in symbol table and default options.
     */
    public static ParseResult parse(String source) {
        return parse(source, ParserConfig.DEFAULT);
    }

    public static ParseResult parse(String source, ParserConfig config) {
        return create(config).parse(source);
    }

    /**
     * Create a reusable parser. The returned instance is immutable and thread-safe.
     */
    public static Parser create(ParserConfig config) {
        return LatexEngine.create(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final SymbolTable symbols = SymbolTable.builtins();
        private OptionalArgumentPolicy optionalArguments = OptionalArgumentPolicy.STRICT;
        private boolean mergeText = true;
        private int maxNestingDepth = ParserConfig.DEFAULT_MAX_NESTING_DEPTH;

        private Builder() {}

        /**
         * Declare (or override) the arity of a command, as if the document had defined it.
         */
        public Builder command(String name, Arity arity) {
            symbols.defineCommand(name, arity);
            return this;
        }

        public Builder environment(String name, Arity arity) {
            symbols.defineEnvironment(name, arity);
            return this;
        }

        /**
         * Add every entry of the given table on top of what is already declared.
         */
        public Builder symbols(SymbolTable table) {
            symbols.defineAll(Objects.requireNonNull(table, "table"));
            return this;
        }

        public Builder optionalArguments(OptionalArgumentPolicy policy) {
            this.optionalArguments = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder mergeText(boolean merge) {
            this.mergeText = merge;
            return this;
        }

        /**
         * Scopes nested deeper than this are not parsed as a tree; see {@link ParserConfig#maxNestingDepth()}.
         */
        public Builder maxNestingDepth(int depth) {
            this.maxNestingDepth = depth;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(optionalArguments, mergeText, maxNestingDepth, symbols));
        }
    }
}
