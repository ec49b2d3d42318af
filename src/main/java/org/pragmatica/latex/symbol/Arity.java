package org.pragmatica.latex.symbol;

/**
 * Number of optional ({@code [...]}) and mandatory arguments a command or environment takes.
 * Optional arguments always precede mandatory ones.
 */
public record Arity(int optional, int mandatory) {
    /**
     * TeX allows at most nine parameters per macro.
     */
    public static final int MAX_ARGUMENTS = 9;

    public static final Arity NONE = new Arity(0, 0);

    public Arity {
        if (optional < 0 || mandatory < 0) {
            throw new IllegalArgumentException("Arity counts must not be negative: " + optional + "/" + mandatory);
        }
        if (optional + mandatory > MAX_ARGUMENTS) {
            throw new IllegalArgumentException("Arity exceeds " + MAX_ARGUMENTS + " arguments: " + optional + "/" + mandatory);
        }
    }

    public static Arity of(int optional, int mandatory) {
        return new Arity(optional, mandatory);
    }

    public static Arity mandatory(int count) {
        return new Arity(0, count);
    }

    /**
     * Arity declared by {@code \newcommand{\name}[total][default]}: a default value turns
     * the first of the {@code total} parameters into an optional argument.
     */
    public static Arity declared(int total, boolean hasDefault) {
        if (hasDefault && total > 0) {
            return new Arity(1, total - 1);
        }
        return new Arity(0, total);
    }

    public int total() {
        return optional + mandatory;
    }

    @Override
    public String toString() {
        return "[" + optional + "]{" + mandatory + "}";
    }
}
