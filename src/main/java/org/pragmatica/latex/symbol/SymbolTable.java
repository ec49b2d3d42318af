package org.pragmatica.latex.symbol;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Known argument arities of commands and environments.
 *
 * <p>A table is mutable and not thread-safe. The parser works on its own {@link #copy()} for
 * every parse, so definitions found in one document never leak into the next one.
 * Re-registering a name replaces the previous entry.
 */
public final class SymbolTable {
    private final Map<String, Arity> commands;
    private final Map<String, Arity> environments;

    private SymbolTable(Map<String, Arity> commands, Map<String, Arity> environments) {
        this.commands = commands;
        this.environments = environments;
    }

    public static SymbolTable empty() {
        return new SymbolTable(new HashMap<>(), new HashMap<>());
    }

    /**
     * Fresh table seeded with the built-in LaTeX commands and environments.
     */
    public static SymbolTable builtins() {
        var table = empty();
        BuiltinSymbols.seed(table);
        return table;
    }

    public SymbolTable copy() {
        return new SymbolTable(new HashMap<>(commands), new HashMap<>(environments));
    }

    public SymbolTable defineCommand(String name, Arity arity) {
        commands.put(requireName(name), Objects.requireNonNull(arity, "arity"));
        return this;
    }

    public SymbolTable defineEnvironment(String name, Arity arity) {
        environments.put(requireName(name), Objects.requireNonNull(arity, "arity"));
        return this;
    }

    /**
     * Copy every entry of {@code other} into this table, replacing entries with equal names.
     */
    public SymbolTable defineAll(SymbolTable other) {
        commands.putAll(other.commands);
        environments.putAll(other.environments);
        return this;
    }

    public Optional<Arity> command(String name) {
        return Optional.ofNullable(commands.get(name));
    }

    public Optional<Arity> environment(String name) {
        return Optional.ofNullable(environments.get(name));
    }

    public boolean hasCommand(String name) {
        return commands.containsKey(name);
    }

    public boolean hasEnvironment(String name) {
        return environments.containsKey(name);
    }

    /**
     * Arity of a command, zero arguments when unknown.
     */
    public Arity commandArity(String name) {
        return commands.getOrDefault(name, Arity.NONE);
    }

    public Arity environmentArity(String name) {
        return environments.getOrDefault(name, Arity.NONE);
    }

    public Map<String, Arity> commands() {
        return Collections.unmodifiableMap(commands);
    }

    public Map<String, Arity> environments() {
        return Collections.unmodifiableMap(environments);
    }

    private static String requireName(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name must not be empty");
        }
        return name;
    }

    @Override
    public String toString() {
        return "SymbolTable[" + commands.size() + " commands, " + environments.size() + " environments]";
    }
}
