package org.pragmatica.latex.error;

import org.pragmatica.latex.tree.SourceSpan;

/**
 * Structural problems the parser recovers from. Each converts into a {@link Diagnostic}
 * carrying a stable code.
 */
public sealed interface StructuralError {
    /**
     * Where the problem is reported.
     */
    SourceSpan span();

    String message();

    Diagnostic toDiagnostic();

    /**
     * An opening brace, or the bracket of an optional argument, that is never closed.
     */
    record UnterminatedGroup(SourceSpan span, String opener) implements StructuralError {
        @Override
        public String message() {
            return "unterminated group";
        }

        @Override
        public Diagnostic toDiagnostic() {
            var closer = "[".equals(opener) ? "]" : "}";
            return Diagnostic.error("E001", message(), span)
                             .withLabel("'" + opener + "' is never closed")
                             .withHelp("add a matching '" + closer + "'");
        }
    }

    record UnterminatedEnvironment(SourceSpan span, String name) implements StructuralError {
        @Override
        public String message() {
            return "unterminated environment '" + name + "'";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E002", message(), span)
                             .withLabel("opened here")
                             .withHelp("add \\end{" + name + "}");
        }
    }

    record UnterminatedMath(SourceSpan span, String opener, String closer) implements StructuralError {
        @Override
        public String message() {
            return "unterminated math";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E003", message(), span)
                             .withLabel("'" + opener + "' is never closed")
                             .withHelp("add a matching '" + closer + "'");
        }
    }

    /**
     * {@code \end} whose name differs from the innermost open environment, or has no name.
     *
     * @param found the name given to {@code \end}, empty when missing
     */
    record EnvironmentMismatch(SourceSpan span, String expected, String found, SourceSpan openedAt)
    implements StructuralError {
        @Override
        public String message() {
            return found.isEmpty()
                   ? "environment mismatch: \\end without a name closes '" + expected + "'"
                   : "environment mismatch: \\end{" + found + "} closes '" + expected + "'";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E004", message(), span)
                             .withLabel("expected \\end{" + expected + "}")
                             .withSecondaryLabel(openedAt, "opened here");
        }
    }

    record MathDelimiterMismatch(SourceSpan span, String expected, String found, SourceSpan openedAt)
    implements StructuralError {
        @Override
        public String message() {
            return "math delimiter mismatch: expected '" + expected + "', found '" + found + "'";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E005", message(), span)
                             .withLabel("expected '" + expected + "'")
                             .withSecondaryLabel(openedAt, "opened here");
        }
    }

    /**
     * Closing token with no compatible open scope. The token is dropped.
     */
    record UnexpectedClose(SourceSpan span, String token) implements StructuralError {
        @Override
        public String message() {
            return "unexpected close '" + token + "'";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E006", message(), span)
                             .withLabel("nothing to close");
        }
    }

    /**
     * @param command the command name, or {@code begin{name}} for the arguments of an environment
     */
    record MissingArgument(SourceSpan span, String command, int expected, int found) implements StructuralError {
        @Override
        public String message() {
            return "missing argument for \\" + command;
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.warning("W001", message(), span)
                             .withLabel("expects " + expected + " mandatory argument" + (expected == 1 ? "" : "s")
                                        + ", found " + found);
        }
    }

    record MissingEnvironmentName(SourceSpan span, String command) implements StructuralError {
        @Override
        public String message() {
            return "missing environment name after \\" + command;
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.warning("W002", message(), span)
                             .withHelp("write \\" + command + "{name}");
        }
    }

    record MalformedDefinition(SourceSpan span, String command, String reason) implements StructuralError {
        @Override
        public String message() {
            return "malformed \\" + command + ": " + reason;
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.warning("W003", message(), span)
                             .withNote("the definition is kept in the tree but not registered");
        }
    }

    /**
     * A scope opened below the configured nesting limit. Its content is kept as a raw token list.
     */
    record NestingTooDeep(SourceSpan span, int limit) implements StructuralError {
        @Override
        public String message() {
            return "nesting deeper than " + limit + " levels";
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.warning("W004", message(), span)
                             .withLabel("this scope is not parsed as a tree")
                             .withNote("commands inside it take no arguments and math delimiters are kept as '$' characters");
        }
    }
}
