package com.topolens.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.topolens.timeseries.TimeContext;
import com.topolens.timeseries.TimeSeries;
import org.junit.jupiter.api.Test;

class WorldTest {
    private static final TimeContext CTX = new TimeContext(1_700_000_040L, 1_700_000_040L + 240, 60);

    @Test
    void getOrCreateApplicationIsValueBased() {
        World world = new World(CTX);

        Application first = world.getOrCreateApplication(new ApplicationId("shop", ApplicationKind.DEPLOYMENT, "api"));
        Application second = world.getOrCreateApplication(new ApplicationId("shop", ApplicationKind.DEPLOYMENT, "api"));

        assertThat(second).isSameAs(first);
        assertThat(world.getApplications()).hasSize(1);
        assertThat(world.getApplication(new ApplicationId("shop", ApplicationKind.STATEFUL_SET, "api"))).isNull();
    }

    @Test
    void serviceIsFoundByClusterIpOrByAKnownActualDestination() {
        World world = new World(CTX);
        Service db = new Service("db", "shop", "10.96.0.10");
        world.getServices().add(db);
        InstanceRef api = new InstanceRef(new ApplicationId("shop", ApplicationKind.DEPLOYMENT, "api"), "api-1");
        TimeSeries active = TimeSeries.empty(CTX);
        db.getConnections().add(new Connection(api, "10.96.0.10", "10.0.0.9", active));

        assertThat(world.getServiceForConnection(new Connection(api, "10.96.0.10", "", active))).isSameAs(db);
        assertThat(world.getServiceForConnection(new Connection(api, "10.0.0.9", "10.0.0.9", active))).isSameAs(db);
        assertThat(world.getServiceForConnection(new Connection(api, "10.0.0.7", "", active))).isNull();
    }

    @Test
    void instancesAreFoundByListenAddress() {
        World world = new World(CTX);
        Instance instance = world.getOrCreateApplication(new ApplicationId("shop", ApplicationKind.DEPLOYMENT, "api"))
                .getOrCreateInstance("api-1", null);
        instance.getTcpListens().put(new Listen("10.0.0.5", "0", false), true);

        assertThat(world.findInstanceByIp("10.0.0.5")).isSameAs(instance);
        assertThat(world.findInstance(instance.ref())).isSameAs(instance);
        assertThat(world.findInstanceByIp("10.0.0.6")).isNull();
    }

    @Test
    void applicationIdRoundTripsThroughItsStringForm() {
        ApplicationId id = new ApplicationId("shop", ApplicationKind.STATEFUL_SET, "db");

        assertThat(id.toString()).isEqualTo("shop:StatefulSet:db");
        assertThat(ApplicationId.parse("shop:StatefulSet:db")).isEqualTo(id);
        assertThatThrownBy(() -> ApplicationId.parse("shop:Pod:db")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ApplicationId.parse("shop")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void notificationsOnlyMoveForward() {
        ApplicationDeploymentNotifications notifications = new ApplicationDeploymentNotifications();

        notifications.markSent("chat", ApplicationDeploymentState.STUCK);
        notifications.markSent("chat", ApplicationDeploymentState.IN_PROGRESS);
        notifications.markSent("mail", ApplicationDeploymentState.IN_PROGRESS);

        assertThat(notifications.getState()).isNull();
        assertThat(notifications.channelState("chat")).isEqualTo(ApplicationDeploymentState.STUCK);
        assertThat(notifications.reached("chat", ApplicationDeploymentState.STUCK)).isTrue();
        assertThat(notifications.reached("mail", ApplicationDeploymentState.STUCK)).isFalse();
        assertThat(notifications.reached("pager", ApplicationDeploymentState.IN_PROGRESS)).isFalse();

        notifications.advance(ApplicationDeploymentState.STUCK);
        notifications.advance(ApplicationDeploymentState.IN_PROGRESS);

        assertThat(notifications.getState()).isEqualTo(ApplicationDeploymentState.STUCK);
        assertThat(ApplicationDeploymentState.SUMMARY.isAfter(ApplicationDeploymentState.CANCELLED)).isTrue();
        assertThat(ApplicationDeploymentState.IN_PROGRESS.isAfter(null)).isTrue();
    }
}
