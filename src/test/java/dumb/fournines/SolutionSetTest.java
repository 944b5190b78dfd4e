package dumb.fournines;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SolutionSetTest extends AbstractTest {

    @Test
    void keepsStrictlyShorter() {
        var set = new SolutionSet();
        assertTrue(set.offer(Solution.of(5, 10, parse("((5 + 5) - (5 - 5))"))));
        assertFalse(set.offer(Solution.of(5, 10, parse("((5 + 5) + (5 - 5))"))));
        assertTrue(set.offer(Solution.of(5, 10, parse("(55 / 5.5)"))));
        assertEquals("(55 / 5.5)", set.get(5, 10).orElseThrow().expression());
        assertEquals(1, set.size());
    }

    @Test
    void solutionDerivesComplexityAndOperators() {
        var s = Solution.of(5, 10, parse("((5 + 5) - (5 - 5))"));
        assertEquals(s.expression().length(), s.complexity());
        assertEquals(2, s.uniqueOperators());
        assertEquals(2, s.toJson().get("unique_operators").asInt());
    }

    @Test
    void mergeCountsChanges() {
        var a = new SolutionSet();
        a.offer(new Solution(1, 1, "((1 / 1) * (1 / 1))", 19, 2));
        var b = new SolutionSet();
        b.offer(new Solution(1, 1, "(11 / 11)", 9, 1));
        b.offer(new Solution(1, 2, "((1 / 1) + (1 / 1))", 19, 2));
        b.offer(new Solution(2, 1, "(22 / 22)", 9, 1));

        assertEquals(3, a.merge(b));
        assertEquals(0, a.merge(b));
        assertEquals(9, a.get(1, 1).orElseThrow().complexity());
        assertEquals(2, a.forSeed(1).size());
        assertTrue(a.forSeed(7).isEmpty());
        assertTrue(a.get(7, 1).isEmpty());
    }

    @Test
    void copyIsIndependent() {
        var a = new SolutionSet();
        a.offer(new Solution(3, 3, "(3 - ((3 - 3) * 3))", 19, 2));
        var c = a.copy();
        c.offer(new Solution(3, 5, "((3 + 3) - (3 / 3))", 19, 3));
        assertEquals(1, a.size());
        assertEquals(2, c.size());
    }
}
