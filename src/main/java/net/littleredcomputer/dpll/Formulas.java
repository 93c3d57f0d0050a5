package net.littleredcomputer.dpll;

import java.util.List;

public final class Formulas {
    private Formulas() {}

    /**
     * Decide whether two formulas are both satisfiable or both unsatisfiable.
     * <p>
     * This compares satisfiability outcomes only. It is <em>not</em> a test of logical
     * equivalence: {@code (x1)} and {@code (NOT x2)} are equisatisfiable but have different
     * models. Callers needing equivalence must compare models themselves.
     */
    public static boolean equisatisfiable(CNFFormula f, CNFFormula g) {
        return f.isSatisfiable() == g.isSatisfiable();
    }

    public static boolean equisatisfiable(List<? extends List<Integer>> f, List<? extends List<Integer>> g) {
        return equisatisfiable(CNFFormula.fromClauses(f), CNFFormula.fromClauses(g));
    }
}
