package net.littleredcomputer.dpll;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Common plumbing for the solvers: the formula being solved, step and node counters, and
 * rate-limited progress reporting through the log.
 */
public abstract class AbstractSATSolver {
    private static final Logger log = LogManager.getFormatterLogger(AbstractSATSolver.class);
    final int logCheckSteps = 10000;
    final CNFFormula formula;
    long stepCount;
    long nodeCount = 0;
    private long lastStepCount;
    private final String name;
    private Duration logInterval = Duration.ofMillis(1000);
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    public void setLogInterval(Duration interval) { logInterval = interval; }

    AbstractSATSolver(String name, CNFFormula formula) {
        this.name = name;
        this.formula = formula;
    }

    void start() {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
    }

    void stop() {
        if (stopwatch.isRunning()) stopwatch.stop();
    }

    Stopwatch stopwatch() { return stopwatch; }

    private final static int maxStateLength = 100;
    private final static int initialStateSegment = 81;
    private final static int finalStateSegment = 16;

    static String abbreviate(String state) {
        if (state.length() <= maxStateLength) return state;
        return state.substring(0, initialStateSegment) + "..." + state.substring(state.length() - finalStateSegment);
    }

    void maybeReportProgress(Supplier<String> s) {
        Instant now = Instant.now();

        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(logInterval) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %d nodes %s %.0f/sec %s",
                name, stepCount, nodeCount, stopwatch, perSec, abbreviate(s.get())));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    public String name() { return name; }

    public long nodeCount() { return nodeCount; }

    /**
     * @return a satisfying assignment indexed by variable (slot 0 unused), or empty if the
     * formula is unsatisfiable
     */
    public abstract Optional<boolean[]> solve();
}
