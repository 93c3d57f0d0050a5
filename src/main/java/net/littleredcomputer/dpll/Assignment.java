package net.littleredcomputer.dpll;

import gnu.trove.stack.TIntStack;
import gnu.trove.stack.array.TIntArrayStack;

/**
 * A partial assignment of truth values to the variables 1..n. Every assignment is
 * pushed on a trail so that a search can retract everything done since a given
 * {@link #mark()}.
 */
final class Assignment {
    static final int TRUE = 1;
    static final int FALSE = -1;
    static final int UNASSIGNED = 0;

    private final int[] value;  // indexed by variable; slot 0 unused
    private final TIntStack trail = new TIntArrayStack();

    Assignment(int nVariables) {
        if (nVariables < 0) throw new IllegalArgumentException("negative variable count");
        value = new int[nVariables + 1];
    }

    int nVariables() {
        return value.length - 1;
    }

    void assign(int variable, boolean truth) {
        if (value[variable] != UNASSIGNED) throw new IllegalStateException("variable " + variable + " is already assigned");
        value[variable] = truth ? TRUE : FALSE;
        trail.push(variable);
    }

    /**
     * Make the given literal true.
     */
    void satisfy(int literal) {
        assign(Math.abs(literal), literal > 0);
    }

    boolean isAssigned(int variable) {
        return value[variable] != UNASSIGNED;
    }

    /**
     * @return {@link #TRUE}, {@link #FALSE} or {@link #UNASSIGNED} according to the
     * current value of the literal
     */
    int valueOf(int literal) {
        int v = value[Math.abs(literal)];
        return literal > 0 ? v : -v;
    }

    int mark() {
        return trail.size();
    }

    void undoTo(int mark) {
        while (trail.size() > mark) value[trail.pop()] = UNASSIGNED;
    }

    /**
     * @return a total assignment indexed by variable (slot 0 unused), in which the
     * variables never assigned are false
     */
    boolean[] toArray() {
        boolean[] bs = new boolean[value.length];
        for (int i = 1; i < value.length; ++i) bs[i] = value[i] == TRUE;
        return bs;
    }

    /**
     * @return the trail as signed literals, oldest first
     */
    @Override
    public String toString() {
        int[] vs = trail.toArray();  // top of stack first
        StringBuilder sb = new StringBuilder();
        for (int i = vs.length - 1; i >= 0; --i) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(value[vs[i]] == TRUE ? vs[i] : -vs[i]);
        }
        return sb.toString();
    }
}
