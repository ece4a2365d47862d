package com.topolens.timeseries;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ReducerTest {

    private static TimeSeries series(float... values) {
        return TimeSeries.of(0, 15, values);
    }

    @Test
    void nanSumTreatsMissingAsZero() {
        assertThat(series(Float.NaN, 2, Float.NaN, 3).reduce(Reducer.NAN_SUM)).isEqualTo(5f);
    }

    @Test
    void nanSumOfAllMissingIsMissing() {
        assertThat(series(Float.NaN, Float.NaN).reduce(Reducer.NAN_SUM)).isNaN();
        assertThat(Reducer.NAN_SUM.apply(0, Float.NaN, Float.NaN)).isNaN();
    }

    @Test
    void anyPrefersFirstPresentOperand() {
        assertThat(Reducer.ANY.apply(0, 1, 2)).isEqualTo(1f);
        assertThat(Reducer.ANY.apply(0, Float.NaN, 2)).isEqualTo(2f);
        assertThat(series(Float.NaN, 7, 8).reduce(Reducer.ANY)).isEqualTo(7f);
    }

    @Test
    void maxAndMinIgnoreMissing() {
        TimeSeries ts = series(Float.NaN, 4, -1, Float.NaN, 9);

        assertThat(ts.reduce(Reducer.MAX)).isEqualTo(9f);
        assertThat(ts.reduce(Reducer.MIN)).isEqualTo(-1f);
        assertThat(series(Float.NaN).reduce(Reducer.MAX)).isNaN();
    }
}
