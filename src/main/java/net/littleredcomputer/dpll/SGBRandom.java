package net.littleredcomputer.dpll;

import com.google.common.primitives.UnsignedInts;

/**
 * The subtractive random number generator of the Stanford GraphBase (gb_flip). Given the
 * same seed it yields the same sequence on every platform, which keeps generated test
 * formulas reproducible.
 */
public class SGBRandom {
    private static final int twoToThe31 = 0x80000000;
    private final int[] A = new int[56];
    private int next = 0;  // index of the next value to hand out; A[0] is a sentinel

    private static int modDiff(int x, int y) { return (x - y) & 0x7fffffff; }

    public SGBRandom(int seed) {
        A[0] = -1;
        int prev = modDiff(seed, 0);
        int s = prev;
        int n = 1;
        A[55] = prev;
        for (int i = 21; i != 0; i = (i + 21) % 55) {
            A[i] = n;
            n = modDiff(prev, n);
            s = (s & 1) != 0 ? 0x40000000 + (s >> 1) : s >> 1;
            n = modDiff(n, s);
            prev = A[i];
        }
        for (int i = 0; i < 5; ++i) cycle();
    }

    /**
     * @return a uniformly distributed 31-bit nonnegative integer
     */
    public int nextInt() {
        return A[next] >= 0 ? A[next--] : cycle();
    }

    /**
     * @return an integer uniformly distributed in [0, m)
     */
    public int uniform(int m) {
        if (m <= 0) throw new IllegalArgumentException("bound must be positive");
        int t = twoToThe31 - UnsignedInts.remainder(twoToThe31, m);
        int r;
        do r = nextInt(); while (UnsignedInts.compare(t, r) <= 0);
        return r % m;
    }

    public boolean nextBoolean() {
        return (nextInt() & 1) != 0;
    }

    private int cycle() {
        int i, j;
        for (i = 1, j = 32; j <= 55; i++, j++) A[i] = modDiff(A[i], A[j]);
        for (j = 1; i <= 55; i++, j++) A[i] = modDiff(A[i], A[j]);
        next = 54;
        return A[55];
    }
}
