package net.littleredcomputer.dpll;

import java.util.ArrayList;
import java.util.List;

/**
 * Sources of test and benchmark formulas. Random formulas draw from a caller-supplied
 * {@link SGBRandom}, so a seed fully determines the result.
 */
public final class Generators {
    private Generators() {}

    /**
     * A random 3-CNF formula. Each literal independently picks a variable uniformly from
     * [1, nVariables] and a polarity uniformly, so a clause may repeat a variable. The
     * resulting formula's variable count is the largest variable actually drawn.
     */
    public static CNFFormula random3SAT(int nVariables, int nClauses, SGBRandom R) {
        if (nVariables <= 0) throw new IllegalArgumentException("nVariables must be positive!");
        if (nClauses < 0) throw new IllegalArgumentException("nClauses mustn't be negative!");
        CNFFormula f = new CNFFormula();
        for (int j = 0; j < nClauses; ++j) {
            int[] clause = new int[3];
            for (int i = 0; i < 3; ++i) {
                int v = 1 + R.uniform(nVariables);
                clause[i] = R.nextBoolean() ? v : -v;
            }
            f.addClause(clause);
        }
        return f;
    }

    /**
     * A random k-CNF formula whose clauses each mention k distinct variables, generated in
     * precisely the way Knuth's sat-rand-rep does, except that variables are 1-based.
     *
     * @param k          size of each clause
     * @param nVariables variables are drawn from [1, nVariables]
     * @param nClauses   number of clauses
     * @param R          source of randomness
     */
    public static CNFFormula randomKSAT(int k, int nVariables, int nClauses, SGBRandom R) {
        if (k <= 0) throw new IllegalArgumentException("k must be positive!");
        if (nClauses < 0) throw new IllegalArgumentException("nClauses mustn't be negative!");
        if (nVariables <= 0 || nVariables > 99999999) throw new IllegalArgumentException("nVariables must be between 1 and 99999999");
        if (k > nVariables) throw new IllegalArgumentException("k mustn't exceed nVariables!");
        CNFFormula f = new CNFFormula();
        int i, ii, t;
        for (int j = 0; j < nClauses; j++) {
            int[] clause = new int[k];
            int c = 0;
            for (int kk = k, nn = nVariables; kk != 0; kk--, nn = ii) {
                // Set ii to the largest in a random kk out of nn
                for (ii = i = 0; i < kk; i++) {
                    t = i + R.uniform(nn - i);
                    if (t > ii) ii = t;
                }
                clause[c++] = (R.nextInt() & 1) == 0 ? ii + 1 : -(ii + 1);
            }
            f.addClause(clause);
        }
        return f;
    }

    public static CNFFormula randomKSAT(int k, int nVariables, int nClauses, int seed) {
        return randomKSAT(k, nVariables, nClauses, new SGBRandom(seed));
    }

    /**
     * The problem waerden(j, k; n) of TAOCP 7.2.2.2 (10): a binary string of length n with
     * no j equally spaced 0s and no k equally spaced 1s. It is satisfiable iff n < W(j, k).
     */
    public static CNFFormula waerden(int j, int k, int n) {
        if (j < 2 || k < 2) throw new IllegalArgumentException("progression lengths must be at least 2");
        if (n <= 0) throw new IllegalArgumentException("n must be positive!");
        CNFFormula f = new CNFFormula();
        progressions(f, j, n, 1);
        progressions(f, k, n, -1);
        return f;
    }

    private static void progressions(CNFFormula f, int length, int n, int sign) {
        for (int d = 1; 1 + (length - 1) * d <= n; ++d) {
            for (int i = 1; i + (length - 1) * d <= n; ++i) {
                int[] clause = new int[length];
                for (int h = 0; h < length; ++h) clause[h] = sign * (i + d * h);
                f.addClause(clause);
            }
        }
    }

    /**
     * Langford pairings as the exact cover problem of TAOCP 7.2.2.2 (11): place two copies
     * of each digit 1..n in 2n slots so that the copies of digit i are i slots apart. Each
     * variable is one placement; each item must be covered exactly once. Satisfiable iff
     * n mod 4 is 0 or 3.
     */
    public static CNFFormula langford(int n) {
        if (n <= 0) throw new IllegalArgumentException("n must be positive!");
        // Items 0..n-1 are the digits, n..3n-1 the slots.
        List<List<Integer>> placements = new ArrayList<>(3 * n);
        for (int i = 0; i < 3 * n; ++i) placements.add(new ArrayList<>());
        int row = 0;
        for (int i = 0; i < n; ++i) {
            for (int j = 0; j + i + 2 < 2 * n; ++j) {
                ++row;
                placements.get(i).add(row);
                placements.get(n + j).add(row);
                placements.get(n + j + i + 2).add(row);
            }
        }
        CNFFormula f = new CNFFormula();
        placements.forEach(p -> exactlyOne(f, p));
        return f;
    }

    /**
     * Put the given number of pigeons into holes, at most one per hole. Variable
     * (p - 1) * holes + h means pigeon p sits in hole h. Unsatisfiable iff pigeons > holes.
     */
    public static CNFFormula pigeonhole(int pigeons, int holes) {
        if (pigeons <= 0 || holes <= 0) throw new IllegalArgumentException("need at least one pigeon and one hole");
        CNFFormula f = new CNFFormula();
        for (int p = 1; p <= pigeons; ++p) {
            int[] somewhere = new int[holes];
            for (int h = 1; h <= holes; ++h) somewhere[h - 1] = (p - 1) * holes + h;
            f.addClause(somewhere);
        }
        for (int h = 1; h <= holes; ++h) {
            for (int p = 1; p <= pigeons; ++p) {
                for (int q = p + 1; q <= pigeons; ++q) {
                    f.addClause(-((p - 1) * holes + h), -((q - 1) * holes + h));
                }
            }
        }
        return f;
    }

    // See eq. 7.2.2.2 (13): one clause requiring a true variable, then one forbidding each pair.
    private static void exactlyOne(CNFFormula f, List<Integer> variables) {
        f.addClause(variables);
        for (int i = 0; i < variables.size(); ++i) {
            for (int j = i + 1; j < variables.size(); ++j) {
                f.addClause(-variables.get(i), -variables.get(j));
            }
        }
    }
}
