package com.topolens.core.model;

import com.topolens.timeseries.TimeSeries;

/** Request rate and failed request rate of an application, per second. */
public record AvailabilitySli(TimeSeries totalRequests, TimeSeries failedRequests) {}
