package com.orderbook.domain;

/**
 * Arithmetic on non-negative quantities. Sums across orders can exceed a long even when
 * every single quantity fits, so totals saturate at Long.MAX_VALUE instead of wrapping.
 */
public final class Quantities {

    private Quantities() {
    }

    public static long saturatedAdd(long a, long b) {
        long sum = a + b;
        // overflow iff both operands have the sign opposite to the result
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return sum < 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return sum;
    }
}
