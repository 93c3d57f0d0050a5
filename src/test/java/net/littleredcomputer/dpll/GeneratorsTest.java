package net.littleredcomputer.dpll;

import org.junit.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertThat;

public class GeneratorsTest {

    @Test
    public void random3SATShape() {
        CNFFormula f = Generators.random3SAT(3, 5, new SGBRandom(1));
        assertThat(f.nClauses(), is(5));
        assertThat(f.is3SAT(), is(true));
        assertThat(f.nVariables(), lessThanOrEqualTo(3));
        for (List<Integer> c : f.clauses()) {
            for (int l : c) assertThat(Math.abs(l) >= 1 && Math.abs(l) <= 3, is(true));
        }
    }

    @Test
    public void random3SATIsReproducible() {
        CNFFormula f = Generators.random3SAT(10, 40, new SGBRandom(99));
        CNFFormula g = Generators.random3SAT(10, 40, new SGBRandom(99));
        assertThat(f.clauses(), is(g.clauses()));
    }

    @Test
    public void randomKSATMatchesKnuth() {
        // Knuth's example rand-3-1061-250-314159.sat, except our variables are 1-based and his are 0-based
        CNFFormula r = Generators.randomKSAT(3, 250, 1061, 314159);
        assertThat(r.width(), is(3));
        assertThat(r.nClauses(), is(1061));
        assertThat(r.nVariables(), lessThanOrEqualTo(250));
        assertThat(r.getClause(0), contains(-165, 123, 90));
        assertThat(r.getClause(1060), contains(172, 93, 30));
    }

    @Test
    public void randomKSATUsesDistinctVariables() {
        CNFFormula f = Generators.randomKSAT(4, 6, 200, new SGBRandom(5));
        for (List<Integer> c : f.clauses()) {
            assertThat(c.stream().map(Math::abs).distinct().count(), is(4L));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void randomKSATWidthBound() {
        Generators.randomKSAT(4, 3, 10, 0);
    }

    @Test
    public void noClausesRequested() {
        assertThat(Generators.randomKSAT(3, 5, 0, 7).nClauses(), is(0));
        assertThat(Generators.random3SAT(5, 0, new SGBRandom(7)).nClauses(), is(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void randomKSATVariableBound() {
        Generators.randomKSAT(3, 100000000, 1, 0);
    }

    @Test
    public void waerdenShape() {
        // Progressions of length 3 in [1, 9]: 7 + 5 + 3 + 1 of them, once for each color
        CNFFormula w = Generators.waerden(3, 3, 9);
        assertThat(w.nClauses(), is(32));
        assertThat(w.nVariables(), is(9));
        assertThat(w.getClause(0), contains(1, 2, 3));
        assertThat(w.getClause(16), contains(-1, -2, -3));
    }

    @Test
    public void waerdenBoundary() {
        assertThat(new DPLLSolver(Generators.waerden(3, 3, 8)).solve().isPresent(), is(true));
        assertThat(new DPLLSolver(Generators.waerden(3, 3, 9)).solve().isPresent(), is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void waerdenNeedsProgressions() {
        Generators.waerden(1, 3, 5);
    }

    @Test
    public void langfordShape() {
        // digit 1 has 4 placements, digit 2 has 3, digit 3 has 2
        CNFFormula l = Generators.langford(3);
        assertThat(l.nVariables(), is(9));
        assertThat(l.getClause(0), contains(1, 2, 3, 4));
    }

    @Test
    public void pigeonholeShape() {
        CNFFormula p = Generators.pigeonhole(4, 3);
        assertThat(p.nVariables(), is(12));
        assertThat(p.nClauses(), is(4 + 3 * 6));
        assertThat(p.getClause(3), contains(10, 11, 12));
        assertThat(p.getClause(4), contains(-1, -4));
    }
}
