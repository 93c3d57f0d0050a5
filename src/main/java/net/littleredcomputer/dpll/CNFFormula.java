package net.littleredcomputer.dpll;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * An accumulating store of CNF clauses. Literals are nonzero signed integers: the magnitude
 * names a (one-based) variable and the sign gives its polarity. The number of variables is
 * not declared up front; it is the largest magnitude of any literal ever added.
 * <p>
 * The store also remembers the last satisfying assignment found for it. Any mutation of
 * the store discards that assignment.
 */
public class CNFFormula {
    private final static Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private final static Splitter splitter = Splitter.on(' ').trimResults().omitEmptyStrings();
    private final static Joiner orJoiner = Joiner.on(" OR ");
    private final static Joiner andJoiner = Joiner.on(" AND ");
    private final List<List<Integer>> clauses = new ArrayList<>();
    private int nVariables = 0;
    private int nLiterals = 0;
    private int width = 0;
    private boolean[] satisfyingAssignment;  // null unless the last query succeeded

    public CNFFormula() {}

    /**
     * Build a store from literal arrays, one per clause.
     */
    public static CNFFormula of(int[]... clauses) {
        CNFFormula f = new CNFFormula();
        for (int[] c : clauses) f.addClause(c);
        return f;
    }

    public static CNFFormula fromClauses(Iterable<? extends Iterable<Integer>> clauses) {
        CNFFormula f = new CNFFormula();
        clauses.forEach(f::addClause);
        return f;
    }

    /**
     * Append a clause. An empty clause is allowed (and makes the formula unsatisfiable).
     *
     * @param literals the disjuncts of the clause
     * @throws IllegalArgumentException if any literal is zero or {@link Integer#MIN_VALUE}, whose
     *                                  magnitude is not an int; the store is then unchanged
     */
    public void addClause(Iterable<Integer> literals) {
        List<Integer> clause = ImmutableList.copyOf(literals);
        int maxVariable = 0;
        for (int l : clause) {
            if (l == 0) throw new IllegalArgumentException("0 is not a valid literal");
            if (l == Integer.MIN_VALUE) throw new IllegalArgumentException(l + " is not a valid literal");
            maxVariable = Math.max(maxVariable, Math.abs(l));
        }
        clauses.add(clause);
        nLiterals += clause.size();
        if (clause.size() > width) width = clause.size();
        if (maxVariable > nVariables) nVariables = maxVariable;
        satisfyingAssignment = null;
    }

    public void addClause(int... literals) {
        List<Integer> clause = new ArrayList<>(literals.length);
        for (int l : literals) clause.add(l);
        addClause(clause);
    }

    /**
     * Remove every clause, forgetting the variable count and any cached assignment.
     */
    public void clear() {
        clauses.clear();
        nVariables = 0;
        nLiterals = 0;
        width = 0;
        satisfyingAssignment = null;
    }

    public int nVariables() {
        return nVariables;
    }

    public int nClauses() {
        return clauses.size();
    }

    public int nLiterals() {
        return nLiterals;
    }

    /**
     * @return the length of the longest clause
     */
    public int width() {
        return width;
    }

    public List<Integer> getClause(int i) {
        return clauses.get(i);
    }

    public List<List<Integer>> clauses() {
        return Collections.unmodifiableList(clauses);
    }

    /**
     * @return true iff every clause has exactly three literals
     */
    public boolean is3SAT() {
        return clauses.stream().allMatch(c -> c.size() == 3);
    }

    /**
     * Evaluate the boolean function represented by the clauses at the specified point.
     *
     * @param p truth values indexed by variable number; p[0] is ignored
     * @return the truth value of this formula at p
     */
    public boolean evaluate(boolean[] p) {
        if (p.length <= nVariables) throw new IllegalArgumentException("point has too few variables");
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (p[Math.abs(literal)] == (literal > 0)) continue CLAUSE;
            }
            return false;  // Any false clause is enough to spoil satisfaction.
        }
        return true;
    }

    /**
     * Decide satisfiability with {@link DPLLSolver}. On success the witness is retained
     * and can be fetched with {@link #satisfyingAssignment()}; on failure any previous
     * witness is dropped.
     */
    public boolean isSatisfiable() {
        satisfyingAssignment = null;
        Optional<boolean[]> outcome = new DPLLSolver(this).solve();
        outcome.ifPresent(a -> satisfyingAssignment = a);
        return outcome.isPresent();
    }

    /**
     * @return a satisfying assignment (indexed by variable, slot 0 unused) if the formula
     * is satisfiable. The cached witness is used when the formula has not changed since it
     * was found.
     */
    public Optional<boolean[]> satisfyingAssignment() {
        if (satisfyingAssignment == null && !isSatisfiable()) return Optional.empty();
        return Optional.of(satisfyingAssignment.clone());
    }

    boolean hasCachedAssignment() {
        return satisfyingAssignment != null;
    }

    public static CNFFormula parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Read a formula in DIMACS CNF format. The resulting store's variable count is derived
     * from the literals actually present, which may be smaller than the count declared in
     * the p line.
     */
    public static CNFFormula parseFrom(Reader r) {
        List<Integer> literals = new ArrayList<>();
        Iterator<String> ls = new BufferedReader(r).lines()
                .filter(s -> !s.startsWith("c"))
                .filter(s -> !s.trim().isEmpty())
                .iterator();
        if (!ls.hasNext()) throw new IllegalArgumentException("Missing SAT instance data");
        Matcher m = pLineRe.matcher(ls.next());
        if (!m.matches()) throw new IllegalArgumentException("invalid p line");
        int nVar = Integer.parseInt(m.group(1));
        int nClause = Integer.parseInt(m.group(2));
        CNFFormula f = new CNFFormula();
        ls.forEachRemaining(line -> StreamSupport.stream(splitter.split(line).spliterator(), false)
                .mapToInt(Integer::parseInt)
                .forEach(l -> {
                    if (l == 0) {
                        if (literals.isEmpty())
                            throw new IllegalArgumentException("Empty clause, so problem is trivially unsatisfiable");
                        f.addClause(literals);
                        literals.clear();
                    } else {
                        if (l > nVar || l < -nVar) throw new IllegalArgumentException("literal out of declared bounds");
                        literals.add(l);
                    }
                }));
        if (!literals.isEmpty()) throw new IllegalArgumentException("Unterminated final clause");
        if (f.nClauses() != nClause) {
            throw new IllegalArgumentException("Observed clause count disagrees with DIMACS p header");
        }
        return f;
    }

    public void writeDimacs(Writer w) throws IOException {
        w.write("p cnf " + nVariables + ' ' + clauses.size() + '\n');
        for (List<Integer> clause : clauses) {
            for (int l : clause) w.write(l + " ");
            w.write("0\n");
        }
        w.flush();
    }

    public String toDimacs() {
        StringWriter sw = new StringWriter();
        try {
            writeDimacs(sw);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sw.toString();
    }

    /**
     * Render the formula as e.g. {@code (x1 OR NOT x2) AND (x3)}.
     */
    @Override
    public String toString() {
        return andJoiner.join(clauses.stream()
                .map(c -> "(" + orJoiner.join(c.stream().map(l -> l < 0 ? "NOT x" + -l : "x" + l).iterator()) + ")")
                .collect(Collectors.toList()));
    }
}
