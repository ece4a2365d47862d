package com.topolens.timeseries;

import java.time.Instant;

/** Epoch-second helpers shared by series, windows and callers that align to a step. */
public final class Timestamps {

    public static final long SECOND = 1;
    public static final long MINUTE = 60 * SECOND;
    public static final long HOUR = 60 * MINUTE;
    public static final long DAY = 24 * HOUR;

    private Timestamps() {}

    public static long truncate(long t, long step) {
        if (step <= 0) {
            return t;
        }
        return t - Math.floorMod(t, step);
    }

    public static Instant toInstant(long t) {
        return Instant.ofEpochSecond(t);
    }

    public static long fromInstant(Instant instant) {
        return instant == null ? 0 : instant.getEpochSecond();
    }
}
