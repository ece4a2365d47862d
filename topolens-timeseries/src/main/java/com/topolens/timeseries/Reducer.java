package com.topolens.timeseries;

/** Left fold step {@code (t, accumulator, value) -> accumulator}. */
@FunctionalInterface
public interface Reducer {

    float apply(long t, float acc, float v);

    /** Prefers the first present operand. */
    Reducer ANY = (t, v1, v2) -> !Float.isNaN(v1) ? v1 : v2;

    /** Sums present operands; the result is missing only when both operands are. */
    Reducer NAN_SUM = (t, sum, v) -> {
        if (Float.isNaN(sum)) {
            return v;
        }
        if (Float.isNaN(v)) {
            return sum;
        }
        return sum + v;
    };

    Reducer MAX = (t, max, v) -> {
        if (Float.isNaN(max)) {
            return v;
        }
        if (Float.isNaN(v)) {
            return max;
        }
        return Math.max(max, v);
    };

    Reducer MIN = (t, min, v) -> {
        if (Float.isNaN(min)) {
            return v;
        }
        if (Float.isNaN(v)) {
            return min;
        }
        return Math.min(min, v);
    };
}
