package io.scanhive.runtime.agent;

import java.util.Optional;

/**
 * Finds the locally available image for an agent key.
 */
@FunctionalInterface
public interface AgentImageResolver {

    Optional<String> resolve(String agentKey);
}
