package com.topolens.core.deployment;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeploymentWatcherScheduler {
    private final DeploymentWatcher watcher;

    @Value("${topolens.deployments.watcher.enabled:true}")
    private boolean enabled;

    @Scheduled(fixedRateString = "${topolens.deployments.watcher.rateMillis:60000}")
    public void sweep() {
        if (!enabled) {
            return;
        }
        watcher.runOnce();
    }
}
