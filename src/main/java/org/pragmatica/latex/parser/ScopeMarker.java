package org.pragmatica.latex.parser;

import org.pragmatica.latex.error.StructuralError;
import org.pragmatica.latex.tree.MathDelimiter;
import org.pragmatica.latex.tree.SourceSpan;

/**
 * Entry of the nesting stack: a scope that has been opened and not yet closed.
 */
sealed interface ScopeMarker {
    /**
     * Span of the token(s) that opened the scope.
     */
    SourceSpan openedAt();

    /**
     * The problem reported when the scope is still open at end of input or at an outer close.
     */
    StructuralError unterminated();

    record Group(SourceSpan openedAt) implements ScopeMarker {
        @Override
        public StructuralError unterminated() {
            return new StructuralError.UnterminatedGroup(openedAt, "{");
        }
    }

    record OptionalArgument(SourceSpan openedAt) implements ScopeMarker {
        @Override
        public StructuralError unterminated() {
            return new StructuralError.UnterminatedGroup(openedAt, "[");
        }
    }

    record Environment(String name, SourceSpan openedAt) implements ScopeMarker {
        @Override
        public StructuralError unterminated() {
            return new StructuralError.UnterminatedEnvironment(openedAt, name);
        }
    }

    record Math(MathDelimiter delimiter, SourceSpan openedAt) implements ScopeMarker {
        @Override
        public StructuralError unterminated() {
            return new StructuralError.UnterminatedMath(openedAt, delimiter.open(), delimiter.close());
        }
    }
}
