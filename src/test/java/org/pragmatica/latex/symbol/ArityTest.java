package org.pragmatica.latex.symbol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArityTest {

    @Test
    void declared_withoutDefault_isAllMandatory() {
        assertEquals(Arity.of(0, 3), Arity.declared(3, false));
    }

    @Test
    void declared_withDefault_makesFirstOptional() {
        assertEquals(Arity.of(1, 2), Arity.declared(3, true));
        assertEquals(Arity.NONE, Arity.declared(0, true));
    }

    @Test
    void negativeCounts_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> Arity.of(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> Arity.mandatory(-2));
    }

    @Test
    void moreThanNineArguments_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> Arity.of(2, 8));
        assertEquals(9, Arity.of(1, 8).total());
    }

    @Test
    void toString_showsBothCounts() {
        assertEquals("[1]{2}", Arity.of(1, 2).toString());
    }
}
