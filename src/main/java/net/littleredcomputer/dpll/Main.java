package net.littleredcomputer.dpll;

import com.google.common.base.Stopwatch;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger();

    private static Options options() {
        return new Options()
                .addOption("task", true, "one of sat, random, render, equisat")
                .addOption("problem", true, "filename of DIMACS problem, or - for stdin")
                .addOption("other", true, "filename of the second problem for equisat")
                .addOption("algorithm", true, "dpll (default) or exhaustive")
                .addOption("vars", true, "number of variables of a random formula")
                .addOption("clauses", true, "number of clauses of a random formula")
                .addOption("k", true, "clause width; when given, clauses use distinct variables")
                .addOption("seed", true, "random seed (default 0)")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader reader(String p) throws FileNotFoundException {
        return new BufferedReader(p.equals("-") ? new InputStreamReader(System.in) : new FileReader(p));
    }

    private static CNFFormula formula(CommandLine cmd, String option) throws IOException {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        try (Reader r = reader(cmd.getOptionValue(option))) {
            return CNFFormula.parseFrom(r);
        }
    }

    private static Function<CNFFormula, AbstractSATSolver> solver(CommandLine cmd) {
        String a = cmd.getOptionValue("algorithm", "dpll");
        switch (a) {
            case "dpll": return DPLLSolver::new;
            case "exhaustive": return ExhaustiveSolver::new;
            default: throw new IllegalArgumentException("Unknown algorithm: " + a);
        }
    }

    private static int intOption(CommandLine cmd, String option) {
        if (!cmd.hasOption(option)) throw new IllegalArgumentException("Must specify -" + option);
        return Integer.parseInt(cmd.getOptionValue(option));
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    public static void main(String[] args) throws ParseException, IOException {
        run(args, System.out);
    }

    static void run(String[] args, PrintStream out) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        switch (task) {
            case "sat": {
                CNFFormula f = formula(cmd, "problem");
                Stopwatch sw = Stopwatch.createStarted();
                AbstractSATSolver s = solver(cmd).apply(f);
                s.setLogInterval(logInterval(cmd));
                Optional<boolean[]> outcome = s.solve();
                sw.stop();
                log.info("%s solver: %d variables, %d clauses, %d nodes, %s", s.name(), f.nVariables(), f.nClauses(), s.nodeCount(), sw);
                out.println("c " + sw);
                if (outcome.isPresent()) {
                    out.println("s SATISFIABLE");
                    out.print("v ");
                    boolean[] bs = outcome.get();
                    for (int i = 1; i < bs.length; ++i) out.printf("%d ", bs[i] ? i : -i);
                    out.println("0");
                } else {
                    out.println("s UNSATISFIABLE");
                }
                break;
            }
            case "random": {
                int n = intOption(cmd, "vars");
                int m = intOption(cmd, "clauses");
                SGBRandom R = new SGBRandom(Integer.parseInt(cmd.getOptionValue("seed", "0")));
                CNFFormula f = cmd.hasOption("k")
                        ? Generators.randomKSAT(intOption(cmd, "k"), n, m, R)
                        : Generators.random3SAT(n, m, R);
                out.print(f.toDimacs());
                break;
            }
            case "render":
                out.println(formula(cmd, "problem"));
                break;
            case "equisat": {
                boolean same = Formulas.equisatisfiable(formula(cmd, "problem"), formula(cmd, "other"));
                out.println(same ? "equisatisfiable" : "not equisatisfiable");
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
        out.flush();
    }
}
