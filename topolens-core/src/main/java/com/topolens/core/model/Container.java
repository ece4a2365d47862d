package com.topolens.core.model;

import com.topolens.timeseries.TimeSeries;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class Container {
    private final String name;
    private ContainerStatus status = ContainerStatus.UNKNOWN;
    private String reason = "";
    private String lastTerminatedReason = "";
    private boolean initContainer;
    private boolean ready;
    private String image = "";

    /** CPU seconds consumed per second. */
    private TimeSeries cpuUsage;

    private TimeSeries memoryRss;
    private TimeSeries restarts;
    private TimeSeries oomKills;

    public Container(String name) {
        this.name = name;
    }
}
