package io.scanhive.runtime.agent;

import io.scanhive.docker.ClusterService;

/**
 * Outcome of starting one agent.
 */
public sealed interface AgentStartResult permits AgentStartResult.Started, AgentStartResult.NotInstalled {

    record Started(ClusterService service) implements AgentStartResult {
    }

    /**
     * No image is available for the agent; nothing was created for it.
     */
    record NotInstalled(String agentKey) implements AgentStartResult {
    }
}
