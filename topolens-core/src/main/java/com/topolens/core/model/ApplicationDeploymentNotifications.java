package com.topolens.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Highest state announced for a rollout, overall and per notification channel. */
@Getter
@Setter
@NoArgsConstructor
public class ApplicationDeploymentNotifications {
    private ApplicationDeploymentState state;
    private Map<String, ApplicationDeploymentState> channels = new LinkedHashMap<>();

    public ApplicationDeploymentNotifications(ApplicationDeploymentState state) {
        this.state = state;
    }

    public ApplicationDeploymentState channelState(String channel) {
        return channels.get(channel);
    }

    /** Records a delivery on one channel; the overall state is left to {@link #advance}. */
    public void markSent(String channel, ApplicationDeploymentState sent) {
        ApplicationDeploymentState current = channels.get(channel);
        if (sent.isAfter(current)) {
            channels.put(channel, sent);
        }
    }

    public boolean reached(String channel, ApplicationDeploymentState target) {
        return !target.isAfter(channels.get(channel));
    }

    /** Raises the overall state once every channel has delivered it. */
    public void advance(ApplicationDeploymentState reached) {
        if (reached.isAfter(state)) {
            state = reached;
        }
    }
}
