package io.scanhive.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unordered group of agents supplied by the caller of a scan.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentGroupDefinition(String description, @Valid List<AgentSettings> agents) {
    public AgentGroupDefinition {
        description = description == null ? "" : description;
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    public AgentGroupDefinition(List<AgentSettings> agents) {
        this(null, agents);
    }

    /**
     * Agents collapsed to one entry per key. The first occurrence of a key wins.
     */
    public List<AgentSettings> distinctAgents() {
        Map<String, AgentSettings> byKey = new LinkedHashMap<>();
        for (AgentSettings agent : agents) {
            byKey.putIfAbsent(agent.key(), agent);
        }
        return new ArrayList<>(byKey.values());
    }
}
