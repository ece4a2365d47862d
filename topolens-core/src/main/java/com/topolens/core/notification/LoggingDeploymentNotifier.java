package com.topolens.core.notification;

import com.topolens.core.config.TopolensProperties;
import com.topolens.core.model.ApplicationDeployment;
import com.topolens.core.model.ApplicationDeploymentStatus;
import com.topolens.core.model.DeploymentSummary;
import com.topolens.core.model.Project;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingDeploymentNotifier implements DeploymentNotifier {
    public static final String CHANNEL = "log";

    private final TopolensProperties properties;

    @Override
    public String channel() {
        return CHANNEL;
    }

    @Override
    public boolean isEnabled(Project project) {
        return properties.getNotifications().isLoggingEnabled();
    }

    @Override
    public void send(Project project, ApplicationDeploymentStatus status) {
        ApplicationDeployment d = status.deployment();
        log.info(
                "[{}] deployment {} of {} is {} after {}: {}",
                project.id(),
                d.getName(),
                d.getApplicationId(),
                status.state(),
                status.lifetime(),
                status.message());
        for (DeploymentSummary item : status.summary()) {
            log.info("[{}]   {} {}: {}", project.id(), item.ok() ? "ok" : "!!", item.report(), item.message());
        }
    }
}
