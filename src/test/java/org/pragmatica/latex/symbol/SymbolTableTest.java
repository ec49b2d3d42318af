package org.pragmatica.latex.symbol;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest {

    @Test
    void builtins_knowCommonCommandsAndEnvironments() {
        var table = SymbolTable.builtins();

        assertEquals(Arity.mandatory(1), table.commandArity("textbf"));
        assertEquals(Arity.mandatory(2), table.commandArity("frac"));
        assertEquals(Arity.of(1, 1), table.commandArity("section"));
        assertEquals(Arity.mandatory(1), table.commandArity("section*"));
        assertEquals(Arity.of(1, 0), table.commandArity("item"));
        assertEquals(Arity.of(1, 1), table.environmentArity("tabular"));
        assertTrue(table.hasCommand("\\"));
    }

    @Test
    void unknownNames_haveNoArguments() {
        var table = SymbolTable.empty();

        assertEquals(Arity.NONE, table.commandArity("whatever"));
        assertEquals(Arity.NONE, table.environmentArity("whatever"));
        assertThat(table.command("whatever")).isEmpty();
    }

    @Test
    void commandsAndEnvironments_areSeparateNamespaces() {
        var table = SymbolTable.empty()
                               .defineCommand("box", Arity.mandatory(1))
                               .defineEnvironment("box", Arity.mandatory(2));

        assertEquals(Arity.mandatory(1), table.commandArity("box"));
        assertEquals(Arity.mandatory(2), table.environmentArity("box"));
    }

    @Test
    void redefinition_replacesEntry() {
        var table = SymbolTable.empty()
                               .defineCommand("foo", Arity.mandatory(1))
                               .defineCommand("foo", Arity.mandatory(3));

        assertEquals(Arity.mandatory(3), table.commandArity("foo"));
        assertThat(table.commands()).hasSize(1);
    }

    @Test
    void copy_isIndependent() {
        var original = SymbolTable.empty()
                                  .defineCommand("foo", Arity.NONE);
        var copy = original.copy();

        copy.defineCommand("bar", Arity.NONE);

        assertTrue(copy.hasCommand("foo"));
        assertFalse(original.hasCommand("bar"));
    }

    @Test
    void defineAll_overlaysOtherTable() {
        var base = SymbolTable.builtins();
        var extra = SymbolTable.empty()
                               .defineCommand("textbf", Arity.mandatory(2))
                               .defineEnvironment("proof", Arity.of(1, 0));

        base.defineAll(extra);

        assertEquals(Arity.mandatory(2), base.commandArity("textbf"));
        assertTrue(base.hasEnvironment("proof"));
    }

    @Test
    void views_areUnmodifiable() {
        var table = SymbolTable.builtins();

        assertThrows(UnsupportedOperationException.class, () -> table.commands().put("x", Arity.NONE));
    }

    @Test
    void emptyName_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> SymbolTable.empty().defineCommand("", Arity.NONE));
        assertThrows(NullPointerException.class, () -> SymbolTable.empty().defineCommand("x", null));
    }
}
