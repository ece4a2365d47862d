package com.topolens.core.deployment;

import static org.assertj.core.api.Assertions.assertThat;

import com.topolens.core.model.Application;
import com.topolens.core.model.ApplicationDeployment;
import com.topolens.core.model.ApplicationDeploymentState;
import com.topolens.core.model.ApplicationId;
import com.topolens.core.model.ApplicationKind;
import com.topolens.core.model.Instance;
import com.topolens.core.model.Pod;
import com.topolens.core.model.World;
import com.topolens.timeseries.TimeContext;
import com.topolens.timeseries.TimeSeries;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class DeploymentDiscoveryServiceTest {
    private static final long FROM = 1_700_000_040L;
    private static final long STEP = 60;
    private static final Instant NOW = Instant.ofEpochSecond(FROM + 4 * STEP);
    private static final ApplicationId API = new ApplicationId("shop", ApplicationKind.DEPLOYMENT, "api");
    private static final ApplicationId WEB = new ApplicationId("shop", ApplicationKind.DEPLOYMENT, "web");
    private static final ApplicationId DB = new ApplicationId("shop", ApplicationKind.STATEFUL_SET, "db");

    private final InMemoryDeploymentRepository repository = new InMemoryDeploymentRepository();
    private final DeploymentDiscoveryService service =
            new DeploymentDiscoveryService(new DeploymentDetector(), repository);
    private final World world = new World(new TimeContext(FROM, FROM + 4 * STEP, STEP));

    private static void pod(Application app, String name, String replicaSet, float... lifeSpan) {
        Instance instance = app.getOrCreateInstance(name, null);
        Pod pod = new Pod();
        pod.setReplicaSet(replicaSet);
        pod.setLifeSpan(TimeSeries.of(FROM, STEP, lifeSpan));
        instance.setPod(pod);
    }

    private static Instant at(int step) {
        return Instant.ofEpochSecond(FROM + step * STEP);
    }

    @Test
    void firstSightingSavesAnAnnouncedBaseline() {
        Application api = world.getOrCreateApplication(API);
        pod(api, "api-a-1", "rs-a", 1, 1, 1, 1);

        int checked = service.discover("p1", world, NOW);

        assertThat(checked).isEqualTo(1);
        assertThat(repository.saved()).hasSize(1);
        ApplicationDeployment initial = repository.saved().get(0);
        assertThat(initial.getName()).isEqualTo("rs-a");
        assertThat(initial.getStartedAt()).isEqualTo(NOW);
        assertThat(initial.getNotifications().getState()).isEqualTo(ApplicationDeploymentState.SUMMARY);
    }

    @Test
    void newRolloutIsSavedAndAttached() {
        Application api = world.getOrCreateApplication(API);
        pod(api, "api-a-1", "rs-a", 1, 1, 0, 0);
        pod(api, "api-b-1", "rs-b", 0, 0, 1, 1);

        service.discover("p1", world, NOW);

        assertThat(repository.saved()).extracting(ApplicationDeployment::getName).containsExactly("rs-b");
        assertThat(api.getDeployments()).extracting(ApplicationDeployment::getName).containsExactly("rs-b");
    }

    @Test
    void unchangedRolloutIsNotSavedAgain() {
        Application api = world.getOrCreateApplication(API);
        pod(api, "api-a-1", "rs-a", 1, 1, 0, 0);
        pod(api, "api-b-1", "rs-b", 0, 0, 1, 1);
        ApplicationDeployment known = new ApplicationDeployment(API, "rs-b", at(2));
        known.setFinishedAt(at(2));
        api.addDeployment(known);

        service.discover("p1", world, NOW);

        assertThat(repository.saved()).isEmpty();
    }

    @Test
    void finishingRolloutUpdatesTheKnownRecord() {
        Application api = world.getOrCreateApplication(API);
        pod(api, "api-a-1", "rs-a", 1, 1, 1, 0);
        pod(api, "api-b-1", "rs-b", 0, 1, 1, 1);
        ApplicationDeployment known = new ApplicationDeployment(API, "rs-b", at(1));
        api.addDeployment(known);

        service.discover("p1", world, NOW);

        assertThat(repository.saved()).hasSize(1);
        assertThat(known.getFinishedAt()).isEqualTo(at(3));
        assertThat(api.getDeployments()).hasSize(1);
    }

    @Test
    void saveFailureOnlyAffectsThatApplication() {
        Application api = world.getOrCreateApplication(API);
        pod(api, "api-a-1", "rs-a", 1, 1, 0, 0);
        pod(api, "api-b-1", "rs-b", 0, 0, 1, 1);
        Application web = world.getOrCreateApplication(WEB);
        pod(web, "web-a-1", "web-a", 1, 1, 0, 0);
        pod(web, "web-b-1", "web-b", 0, 0, 1, 1);
        repository.failSavesOf(API, new IllegalStateException("connection refused"));

        int checked = service.discover("p1", world, NOW);

        assertThat(checked).isEqualTo(2);
        assertThat(api.getDeployments()).isEmpty();
        assertThat(repository.saved()).extracting(ApplicationDeployment::getName).containsExactly("web-b");
    }

    @Test
    void onlyDeploymentsAreChecked() {
        Application db = world.getOrCreateApplication(DB);
        pod(db, "db-0", "", 1, 1, 1, 1);

        int checked = service.discover("p1", world, NOW);

        assertThat(checked).isZero();
        assertThat(repository.saved()).isEmpty();
    }
}
