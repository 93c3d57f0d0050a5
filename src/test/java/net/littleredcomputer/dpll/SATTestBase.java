package net.littleredcomputer.dpll;

import com.github.npathai.hamcrestopt.OptionalMatchers;
import org.hamcrest.CoreMatchers;
import org.junit.Assert;

import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toList;

public class SATTestBase {
    int waerden(int j, int k, Function<CNFFormula, AbstractSATSolver> solver) {
        // waerden(j, k, n) is satisfiable iff n < W(j, k). Compute W by finding the smallest
        // integer for which the associated problem is unsatisfiable.
        return IntStream.range(1, 1000)
                .filter(i -> !solver.apply(Generators.waerden(j, k, i)).solve().isPresent())
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("did not establish Waerden value"));
    }

    static final CNFFormula quinn = fromResource("quinn.cnf");
    static final CNFFormula hole3 = fromResource("hole3.cnf");
    static final CNFFormula ex6 = CNFFormula.parseFrom("p cnf 4 8\n1 2 -3 0 2 3 -4 0 3 4 1 0 4 -1 2 0 -1 -2 3 0 -2 -3 4 0 -3 -4 -1 0 -4 1 -2 0");
    static final CNFFormula ex7 = CNFFormula.parseFrom("p cnf 4 7\n1 2 -3 0 2 3 -4 0 3 4 1 0 4 -1 2 0 -1 -2 3 0 -2 -3 4 0 -3 -4 -1 0");

    static CNFFormula fromResource(String name) {
        return CNFFormula.parseFrom(new InputStreamReader(
                SATTestBase.class.getClassLoader().getResourceAsStream(name), StandardCharsets.UTF_8));
    }

    void testQuinnWith(Function<CNFFormula, AbstractSATSolver> a) { assertSAT(quinn, a); }
    void testHole3With(Function<CNFFormula, AbstractSATSolver> a) { assertUNSAT(hole3, a); }
    void testEx6With(Function<CNFFormula, AbstractSATSolver> a) { assertUNSAT(ex6, a); }
    void testEx7With(Function<CNFFormula, AbstractSATSolver> a) { assertSAT(ex7, a); }

    void assertSAT(CNFFormula f, Function<CNFFormula, AbstractSATSolver> a) {
        Assert.assertThat(a.apply(f).solve().map(f::evaluate), OptionalMatchers.isPresentAndIs(true));
    }

    void assertUNSAT(CNFFormula f, Function<CNFFormula, AbstractSATSolver> a) {
        Assert.assertThat(a.apply(f).solve(), OptionalMatchers.isEmpty());
    }

    void testLangfordWith(Function<CNFFormula, AbstractSATSolver> a) {
        Supplier<IntStream> range = () -> IntStream.range(2, 9);
        // The langford problem is solvable iff i mod 4 in {0, 3}. When it is solvable, the number of
        // true variables equals the problem size (each digit receives exactly one placement).
        List<Optional<Integer>> expected = range.get().mapToObj(i -> i % 4 == 0 || i % 4 == 3 ? Optional.of(i) : Optional.<Integer>empty()).collect(toList());
        Stream<Optional<Integer>> observed = range.get().mapToObj(i -> a.apply(Generators.langford(i)).solve()
                .map(bs -> {
                    int trues = 0;
                    for (int v = 1; v < bs.length; ++v) if (bs[v]) ++trues;
                    return trues;
                }));
        Assert.assertThat(observed.collect(toList()), CoreMatchers.is(expected));
    }
}
