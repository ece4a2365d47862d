package com.topolens.core.deployment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.topolens.core.config.TopolensProperties;
import com.topolens.core.model.Application;
import com.topolens.core.model.ApplicationDeployment;
import com.topolens.core.model.ApplicationDeploymentState;
import com.topolens.core.model.ApplicationDeploymentStatus;
import com.topolens.core.model.ApplicationId;
import com.topolens.core.model.ApplicationKind;
import com.topolens.core.model.DeploymentSummary;
import com.topolens.core.model.MetricsSnapshot;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DeploymentStatusCalculatorTest {
    private static final ApplicationId API = new ApplicationId("shop", ApplicationKind.DEPLOYMENT, "api");
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final DeploymentStatusCalculator calculator = new DeploymentStatusCalculator(new TopolensProperties());

    private static ApplicationDeployment deployment(String name, Instant startedAt, Instant finishedAt) {
        ApplicationDeployment d = new ApplicationDeployment(API, name, startedAt);
        d.setFinishedAt(finishedAt);
        return d;
    }

    private static MetricsSnapshot snapshot(long requests, long errors, Map<String, Long> latency, float cpu) {
        return new MetricsSnapshot(NOW, Duration.ofMinutes(30), requests, errors, latency, cpu, 0, 0, 0, 0, 0);
    }

    @Test
    void unfinishedRolloutsAreInProgressStuckOrCancelled() {
        Application app = new Application(API);
        app.addDeployment(deployment("rs-a", NOW.minusSeconds(7200), null));
        app.addDeployment(deployment("rs-b", NOW.minusSeconds(600), null));

        List<ApplicationDeploymentStatus> statuses = calculator.calculate(app, NOW);

        assertThat(statuses).extracting(ApplicationDeploymentStatus::state)
                .containsExactly(ApplicationDeploymentState.CANCELLED, ApplicationDeploymentState.IN_PROGRESS);
        assertThat(statuses.get(0).lifetime()).isEqualTo(Duration.ofSeconds(6600));
        assertThat(statuses.get(1).lifetime()).isEqualTo(Duration.ofMinutes(10));

        Application stuck = new Application(API);
        stuck.addDeployment(deployment("rs-c", NOW.minus(Duration.ofMinutes(45)), null));

        ApplicationDeploymentStatus status = calculator.calculate(stuck, NOW).get(0);
        assertThat(status.state()).isEqualTo(ApplicationDeploymentState.STUCK);
        assertThat(status.message()).isEqualTo("no progress for 45m");
    }

    @Test
    void finishedRolloutWaitsForItsSnapshot() {
        Application app = new Application(API);
        app.addDeployment(deployment("rs-a", NOW.minusSeconds(600), NOW.minusSeconds(300)));

        ApplicationDeploymentStatus status = calculator.calculate(app, NOW).get(0);

        assertThat(status.state()).isEqualTo(ApplicationDeploymentState.IN_PROGRESS);
        assertThat(status.lifetime()).isEqualTo(Duration.ofMinutes(5));
        assertThat(status.summary()).isEmpty();
    }

    @Test
    void summaryComparesAgainstThePreviousRollout() {
        Application app = new Application(API);
        ApplicationDeployment previous = deployment("rs-a", NOW.minusSeconds(86_000), NOW.minusSeconds(85_000));
        previous.setMetricsSnapshot(snapshot(1000, 10, Map.of("0.500", 990L, "+Inf", 1000L), 100f));
        ApplicationDeployment current = deployment("rs-b", NOW.minusSeconds(3600), NOW.minusSeconds(3000));
        current.setMetricsSnapshot(snapshot(1000, 50, Map.of("0.100", 500L, "0.500", 900L, "+Inf", 1000L), 120f));
        app.addDeployment(previous);
        app.addDeployment(current);

        ApplicationDeploymentStatus status = calculator.calculate(app, NOW).get(1);

        assertThat(status.state()).isEqualTo(ApplicationDeploymentState.SUMMARY);
        assertThat(status.message()).isEqualTo("deployed with 2 issue(s)");
        assertThat(status.summary())
                .extracting(DeploymentSummary::report, DeploymentSummary::ok)
                .containsExactly(
                        tuple("Errors", false),
                        tuple("Latency", false),
                        tuple("CPU usage", true),
                        tuple("Restarts", true),
                        tuple("Logs", true));
        assertThat(status.summary().get(0).message()).isEqualTo("5.0% of requests failed (was 1.0%)");
        assertThat(status.summary().get(2).message()).isEqualTo("+20%");
    }

    @Test
    void firstSummaryWithoutBaselineUsesAbsoluteFloors() {
        Application app = new Application(API);
        ApplicationDeployment d = deployment("rs-a", NOW.minusSeconds(3600), NOW.minusSeconds(3000));
        d.setMetricsSnapshot(snapshot(1000, 5, Map.of("0.250", 999L), 10f));
        app.addDeployment(d);

        ApplicationDeploymentStatus status = calculator.calculate(app, NOW).get(0);

        assertThat(status.message()).isEqualTo("deployed successfully");
        assertThat(status.summary()).extracting(DeploymentSummary::report).containsExactly("Errors", "Restarts", "Logs");
    }
}
