package net.littleredcomputer.dpll;

import java.util.Optional;

/**
 * Tries every point of the boolean cube until one satisfies the formula. Only usable for
 * small formulas, where it serves as a reference for the other solvers.
 */
public class ExhaustiveSolver extends AbstractSATSolver {
    static final int maxVariables = 30;

    public ExhaustiveSolver(CNFFormula formula) {
        super("exhaustive", formula);
        if (formula.nVariables() > maxVariables) {
            throw new IllegalArgumentException("exhaustive search is limited to " + maxVariables + " variables");
        }
    }

    @Override
    public Optional<boolean[]> solve() {
        start();
        final int n = formula.nVariables();
        boolean[] p = new boolean[n + 1];
        for (long i = 0; i < 1L << n; ++i) {
            ++stepCount;
            for (int b = 1; b <= n; ++b) p[b] = ((i >> (b - 1)) & 1) == 1;
            if (formula.evaluate(p)) {
                stop();
                return Optional.of(p);
            }
            final long point = i;
            if (stepCount % logCheckSteps == 0) maybeReportProgress(() -> Long.toBinaryString(point));
        }
        stop();
        return Optional.empty();
    }
}
