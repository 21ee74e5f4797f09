package io.scanhive.runtime.agent;

/**
 * Makes an agent's image available locally.
 */
@FunctionalInterface
public interface AgentInstaller {

    void install(String agentKey);
}
