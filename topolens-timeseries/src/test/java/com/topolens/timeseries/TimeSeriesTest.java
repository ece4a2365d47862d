package com.topolens.timeseries;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TimeSeriesTest {

    private static final long FROM = 1_700_000_010L;
    private static final long STEP = 30;

    @Test
    void newSeriesIsAllMissing() {
        TimeSeries ts = TimeSeries.empty(FROM, 4, STEP);

        assertThat(ts.size()).isEqualTo(4);
        assertThat(ts.isAllMissing()).isTrue();
        assertThat(ts.to()).isEqualTo(FROM + 4 * STEP);
    }

    @Test
    void setThenGetTruncatesToStep() {
        TimeSeries ts = TimeSeries.empty(FROM, 4, STEP);

        ts.set(FROM + STEP + 17, 42f);

        assertThat(ts.get(FROM + STEP)).isEqualTo(42f);
        assertThat(ts.get(FROM + STEP + 29)).isEqualTo(42f);
        assertThat(ts.get(FROM)).isNaN();
    }

    @Test
    void setOutsideWindowIsNoop() {
        TimeSeries ts = TimeSeries.empty(FROM, 2, STEP);

        ts.set(FROM - STEP, 1f);
        ts.set(FROM + 2 * STEP, 1f);
        ts.set(FROM + 100 * STEP, 1f);

        assertThat(ts.isAllMissing()).isTrue();
        assertThat(ts.get(FROM + 2 * STEP)).isNaN();
    }

    @Test
    void fillMergesOnlyOverlap() {
        TimeSeries ts = TimeSeries.empty(FROM, 3, STEP);

        boolean changed = ts.fill(FROM - STEP, STEP, new float[] {1, 2, 3, 4, 5});

        assertThat(changed).isTrue();
        assertThat(ts.lastN(3)).containsExactly(2f, 3f, 4f);
    }

    @Test
    void fillReportsNoChangeForMissingOnlyInput() {
        TimeSeries ts = TimeSeries.empty(FROM, 3, STEP);

        boolean changed = ts.fill(FROM, STEP, new float[] {Float.NaN, Float.NaN});

        assertThat(changed).isFalse();
        assertThat(ts.isAllMissing()).isTrue();
    }

    @Test
    void fillNeverOverwritesPresentValueWithMissing() {
        TimeSeries ts = TimeSeries.empty(FROM, 3, STEP);
        ts.fill(FROM, STEP, new float[] {1, 2, 3});

        ts.fill(FROM, STEP, new float[] {Float.NaN, 7, Float.NaN});

        assertThat(ts.lastN(3)).containsExactly(1f, 7f, 3f);
    }

    @Test
    void fillWithFinerStepKeepsFirstPointPerSlot() {
        TimeSeries ts = TimeSeries.empty(FROM, 2, STEP);

        ts.fill(FROM, STEP / 2, new float[] {1, 2, 3, 4});

        assertThat(ts.lastN(2)).containsExactly(1f, 3f);
    }

    @Test
    void fillWithCoarserStepLandsOnMatchingSlots() {
        TimeSeries ts = TimeSeries.empty(FROM, 4, STEP);

        ts.fill(FROM, STEP * 2, new float[] {1, 2});

        assertThat(ts.get(FROM)).isEqualTo(1f);
        assertThat(ts.get(FROM + STEP)).isNaN();
        assertThat(ts.get(FROM + 2 * STEP)).isEqualTo(2f);
    }

    @Test
    void iteratorYieldsMissingPointsInOrder() {
        TimeSeries ts = TimeSeries.of(FROM, STEP, 1, Float.NaN, 3);

        TimeSeriesIterator iter = ts.iterator();
        assertThat(iter.next()).isTrue();
        assertThat(iter.time()).isEqualTo(FROM);
        assertThat(iter.value()).isEqualTo(1f);
        assertThat(iter.next()).isTrue();
        assertThat(iter.time()).isEqualTo(FROM + STEP);
        assertThat(iter.value()).isNaN();
        assertThat(iter.next()).isTrue();
        assertThat(iter.next()).isFalse();
        assertThat(iter.next()).isFalse();

        TimeSeriesIterator again = ts.iterator();
        assertThat(again.next()).isTrue();
        assertThat(again.value()).isEqualTo(1f);
    }

    @Test
    void lastNPadsShortSeries() {
        TimeSeries ts = TimeSeries.of(FROM, STEP, 5, 6);

        float[] last = ts.lastN(4);

        assertThat(last[0]).isNaN();
        assertThat(last[1]).isNaN();
        assertThat(last[2]).isEqualTo(5f);
        assertThat(last[3]).isEqualTo(6f);
    }

    @Test
    void lastNotNullSkipsTrailingGaps() {
        TimeSeries ts = TimeSeries.of(FROM, STEP, 5, 6, Float.NaN);

        TimeSeries.Point point = ts.lastNotNull();

        assertThat(point.time()).isEqualTo(FROM + STEP);
        assertThat(point.value()).isEqualTo(6f);
        assertThat(TimeSeries.empty(FROM, 3, STEP).lastNotNull()).isNull();
    }

    @Test
    void mapAppliesDefinedAndNanToZero() {
        TimeSeries ts = TimeSeries.of(FROM, STEP, Float.NaN, 0, 4);

        assertThat(ts.map(Mapper.DEFINED).lastN(3)).containsExactly(0f, 1f, 1f);
        assertThat(ts.map(Mapper.NAN_TO_ZERO).lastN(3)).containsExactly(0f, 0f, 4f);
    }

    @Test
    void toStringShowsMissingAsDots() {
        TimeSeries ts = TimeSeries.of(60, 30, 1, Float.NaN, 2.5f);

        assertThat(ts).hasToString("TimeSeries(60, 3, 30, [1 . 2.5])");
    }
}
