package com.agl.grammar.regular;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;
import org.junit.jupiter.api.Test;

final class StructuralValidatorTest {

    private static StructuralValidator validator(String canonical) {
        return new StructuralValidator(RegularGrammar.parseCanonical(canonical, new Random(0)));
    }

    @Test
    void backEdgeFromFiveToOneIsACycle() {
        String withBackEdge = "M R S V X/M>1;R>2,S>3;V>4;X>4;M>5;R>6,S>1;*";
        String withoutBackEdge = "M R S V X/M>1;R>2,S>3;V>4;X>4;M>5;R>6;*";
        assertTrue(validator(withBackEdge).hasCycle());
        assertFalse(validator(withoutBackEdge).hasCycle());
    }

    @Test
    void selfLoopIsACycle() {
        assertTrue(validator("M R/M>0,R>1;*").hasCycle());
        assertFalse(validator("M R/M>1;R>2;*").hasCycle());
    }

    @Test
    void loopWithoutExitIsADeadCycle() {
        // 1 -> 3 -> 5 -> 1 never reaches the exit offered by state 4
        StructuralValidator dead = validator("M R S V X/M>1,R>2;S>3;V>4;X>5;*;M>1");
        assertTrue(dead.hasDeadCycle());
        assertEquals(StructuralValidator.UNREACHABLE, dead.shortestPathThrough(1));
        assertFalse(dead.isAcceptable(RegularGrammar.MIN_PATH_LENGTH));

        // without its loop-closing edge, state 5 is left offering only the exit
        StructuralValidator open = validator("M R S V X/M>1,R>2;S>3;V>4;X>5;*;*");
        assertFalse(open.hasDeadCycle());
        assertEquals(2, open.shortestPathThrough(1));
    }

    @Test
    void shortestPathCountsSymbolSteps() {
        StructuralValidator reber = new StructuralValidator(RegularGrammar.reber1967());
        assertEquals(3, reber.shortestPathThrough());
        assertEquals(1, reber.shortestPathThrough(4));
        assertEquals(0, reber.shortestPathThrough(5));
        assertTrue(reber.isAcceptable(RegularGrammar.MIN_PATH_LENGTH));
        assertFalse(reber.isAcceptable(4), "exit is only three steps away");
    }

    @Test
    void unreachableStateBreaksConnectivity() {
        StructuralValidator validator = validator("M R/M>1;*;R>1");
        assertFalse(validator.isConnected());
        assertTrue(validator("M R/M>1;R>2;*").isConnected());
    }

    @Test
    void graphWithoutExitIsRejected() {
        StructuralValidator validator = validator("M R/M>1;R>0");
        assertFalse(validator.hasExit());
        assertTrue(validator.hasDeadCycle());
        assertFalse(validator.isAcceptable(0));
    }
}
