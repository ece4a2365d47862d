package com.topolens.core.model;

import com.topolens.timeseries.TimeSeries;

/** One labelled series: the unit the constructor consumes. */
public record MetricValues(LabelSet labels, TimeSeries values) {}
