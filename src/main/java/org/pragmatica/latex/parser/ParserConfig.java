package org.pragmatica.latex.parser;

import org.pragmatica.latex.symbol.SymbolTable;

import java.util.Objects;

/**
 * Parser configuration options.
 *
 * @param optionalArguments how optional arguments are recognized
 * @param mergeText         merge adjacent text runs (e.g. around escaped characters) into one node
 * @param maxNestingDepth   deepest scope nesting parsed as a tree; braces below it are flattened
 * @param symbols           arities every parse starts with; each parse works on its own copy
 */
public record ParserConfig(
    OptionalArgumentPolicy optionalArguments,
    boolean mergeText,
    int maxNestingDepth,
    SymbolTable symbols
) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

    public static final ParserConfig DEFAULT = new ParserConfig(
        OptionalArgumentPolicy.STRICT,
        true,
        DEFAULT_MAX_NESTING_DEPTH,
        SymbolTable.builtins()
    );

    public ParserConfig {
        Objects.requireNonNull(optionalArguments, "optionalArguments");
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Nesting depth must be positive: " + maxNestingDepth);
        }
        symbols = Objects.requireNonNull(symbols, "symbols").copy();
    }

    /**
     * A copy of the seed table, safe to mutate.
     */
    @Override
    public SymbolTable symbols() {
        return symbols.copy();
    }
}
