package net.littleredcomputer.dpll;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class MainTest {

    private static String resource(String name) throws URISyntaxException {
        return new File(MainTest.class.getClassLoader().getResource(name).toURI()).getPath();
    }

    private static String run(String... args) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        Main.run(args, new PrintStream(bytes, true, "UTF-8"));
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void solvesSatisfiableFile() throws Exception {
        String out = run("-task", "sat", "-problem", resource("quinn.cnf"));
        assertThat(out, containsString("s SATISFIABLE"));
        String v = out.substring(out.indexOf("\nv ") + 3).trim();
        assertThat(v.endsWith(" 0"), is(true));
        assertThat(v.split(" ").length, is(17));
    }

    @Test
    public void reportsUnsatisfiableFile() throws Exception {
        assertThat(run("-task", "sat", "-algorithm", "exhaustive", "-problem", resource("hole3.cnf")),
                containsString("s UNSATISFIABLE"));
    }

    @Test
    public void randomOutputIsDimacs() throws Exception {
        String out = run("-task", "random", "-vars", "6", "-clauses", "9", "-seed", "3");
        CNFFormula f = CNFFormula.parseFrom(out);
        assertThat(f.nClauses(), is(9));
        assertThat(f.is3SAT(), is(true));
    }

    @Test
    public void render() throws Exception {
        assertThat(run("-task", "render", "-problem", resource("quinn.cnf")), containsString("(x1 OR x2) AND (NOT x2 OR NOT x4)"));
    }

    @Test
    public void equisat() throws Exception {
        assertThat(run("-task", "equisat", "-problem", resource("quinn.cnf"), "-other", resource("hole3.cnf")).trim(),
                is("not equisatisfiable"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownTask() throws Exception {
        run("-task", "tsp");
    }
}
