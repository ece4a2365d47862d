package com.topolens.timeseries;

/**
 * Query window {@code [from, to]} sampled every {@code step} seconds.
 *
 * <p>Both bounds are truncated to the step; a series built from a context has
 * {@code (to - from) / step} points.
 */
public record TimeContext(long from, long to, long step) {

    public TimeContext {
        if (step <= 0) {
            throw new IllegalArgumentException("step must be positive: " + step);
        }
        from = Timestamps.truncate(from, step);
        to = Timestamps.truncate(to, step);
        if (to < from) {
            throw new IllegalArgumentException("window ends before it starts: from=" + from + " to=" + to);
        }
    }

    public int pointsCount() {
        return (int) ((to - from) / step);
    }
}
