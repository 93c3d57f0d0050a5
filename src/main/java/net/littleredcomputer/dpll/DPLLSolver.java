package net.littleredcomputer.dpll;

import com.google.common.collect.ImmutableList;
import gnu.trove.iterator.TIntIterator;
import gnu.trove.set.hash.TIntHashSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The Davis-Putnam-Logemann-Loveland procedure: unit propagation, pure literal
 * elimination and two-way branching on the smallest remaining variable.
 * <p>
 * Each branch works on its own copy of the clause list. Clauses themselves are immutable,
 * so simplification shares every clause it does not shorten. The partial assignment is a
 * single trail, rewound when a branch fails.
 */
public class DPLLSolver extends AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger();
    private long unitCount = 0;
    private long pureCount = 0;
    private long conflictCount = 0;

    public DPLLSolver(CNFFormula formula) {
        super("DPLL", formula);
    }

    @Override
    public Optional<boolean[]> solve() {
        start();
        Assignment a = new Assignment(formula.nVariables());
        boolean sat = search(new ArrayList<>(formula.clauses()), a);
        stop();
        log.debug("%s after %d nodes: %d units, %d pure, %d conflicts in %s",
                sat ? "SAT" : "UNSAT", nodeCount, unitCount, pureCount, conflictCount, stopwatch());
        return sat ? Optional.of(a.toArray()) : Optional.empty();
    }

    /**
     * Decide whether the clauses, which must already be simplified with respect to a, can be
     * satisfied by an extension of a. On success a holds the witness; on failure a may hold
     * assignments made below this node, which the caller is expected to rewind.
     */
    boolean search(List<List<Integer>> f, Assignment a) {
        ++nodeCount;
        if (nodeCount % logCheckSteps == 0) maybeReportProgress(a::toString);
        if (f.isEmpty()) return true;
        if (hasEmptyClause(f) || unitPropagate(f, a)) {
            ++conflictCount;
            return false;
        }
        while (eliminatePureLiteral(f, a)) {
            // keep going until no pure literal remains
        }
        if (f.isEmpty()) return true;
        final int v = chooseVariable(f);
        if (v == 0) return true;
        final int mark = a.mark();
        a.assign(v, true);
        if (search(simplify(f, a), a)) return true;
        a.undoTo(mark);
        a.assign(v, false);
        return search(simplify(f, a), a);
    }

    /**
     * Remove the clauses satisfied by a, and the literals falsified by a from the rest.
     *
     * @return a new clause list; f and a are unchanged
     */
    @CheckReturnValue
    List<List<Integer>> simplify(@Nonnull List<List<Integer>> f, @Nonnull Assignment a) {
        ++stepCount;
        List<List<Integer>> g = new ArrayList<>(f.size());
        CLAUSE:
        for (List<Integer> clause : f) {
            boolean shortened = false;
            for (int l : clause) {
                int value = a.valueOf(l);
                if (value == Assignment.TRUE) continue CLAUSE;
                if (value == Assignment.FALSE) shortened = true;
            }
            if (!shortened) {
                g.add(clause);
                continue;
            }
            ImmutableList.Builder<Integer> b = ImmutableList.builder();
            for (int l : clause) if (a.valueOf(l) == Assignment.UNASSIGNED) b.add(l);
            g.add(b.build());
        }
        return g;
    }

    /**
     * Repeatedly satisfy the first unit clause and simplify, until no unit clause remains.
     * Both f and a are updated in place.
     *
     * @return true if an empty clause resulted
     */
    boolean unitPropagate(List<List<Integer>> f, Assignment a) {
        SCAN:
        while (true) {
            for (List<Integer> clause : f) {
                if (clause.size() == 1) {
                    a.satisfy(clause.get(0));
                    ++unitCount;
                    replace(f, simplify(f, a));
                    continue SCAN;
                }
            }
            return hasEmptyClause(f);
        }
    }

    /**
     * Satisfy one pure literal, if there is one, and simplify. The smallest variable
     * occurring only positively is preferred; failing that, the smallest occurring only
     * negatively. Both f and a are updated in place.
     *
     * @return true if a pure literal was found
     */
    boolean eliminatePureLiteral(List<List<Integer>> f, Assignment a) {
        TIntHashSet positive = new TIntHashSet();
        TIntHashSet negative = new TIntHashSet();
        for (List<Integer> clause : f) {
            for (int l : clause) {
                if (l > 0) positive.add(l);
                else negative.add(-l);
            }
        }
        int pure = 0;
        for (TIntIterator it = positive.iterator(); it.hasNext(); ) {
            int v = it.next();
            if (!negative.contains(v) && (pure == 0 || v < pure)) pure = v;
        }
        if (pure == 0) {
            for (TIntIterator it = negative.iterator(); it.hasNext(); ) {
                int v = it.next();
                if (!positive.contains(v) && (pure == 0 || v < -pure)) pure = -v;
            }
        }
        if (pure == 0) return false;
        a.satisfy(pure);
        ++pureCount;
        replace(f, simplify(f, a));
        return true;
    }

    /**
     * @return the smallest variable mentioned in f, or 0 if f mentions none
     */
    int chooseVariable(List<List<Integer>> f) {
        int best = 0;
        for (List<Integer> clause : f) {
            for (int l : clause) {
                int v = Math.abs(l);
                if (best == 0 || v < best) best = v;
            }
        }
        return best;
    }

    static boolean hasEmptyClause(List<List<Integer>> f) {
        for (List<Integer> clause : f) if (clause.isEmpty()) return true;
        return false;
    }

    private static void replace(List<List<Integer>> f, List<List<Integer>> g) {
        f.clear();
        f.addAll(g);
    }

    long unitCount() { return unitCount; }
    long pureCount() { return pureCount; }
    long conflictCount() { return conflictCount; }
}
