package com.topolens.core.model;

import com.topolens.timeseries.TimeSeries;

/**
 * An outbound TCP connection of {@code source}. {@code serviceRemoteIp} is the address the client
 * dialled (a service cluster IP when going through a service), {@code actualRemoteIp} the pod it
 * ended up on.
 */
public record Connection(
        InstanceRef source, String serviceRemoteIp, String actualRemoteIp, TimeSeries active) {}
