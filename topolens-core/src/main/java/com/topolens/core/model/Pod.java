package com.topolens.core.model;

import com.topolens.timeseries.TimeSeries;
import lombok.Getter;
import lombok.Setter;

/** Kubernetes metadata of an instance backed by a pod. */
@Getter
@Setter
public class Pod {
    private String replicaSet = "";
    private String phase = "";
    private boolean scheduled;

    /** Sum over phases of the pod phase indicators; positive while the pod exists. */
    private TimeSeries lifeSpan;

    private TimeSeries running;
    private TimeSeries ready;

    public boolean isRunning() {
        return running != null && running.last() > 0;
    }

    public boolean isReady() {
        return ready != null && ready.last() > 0;
    }
}
