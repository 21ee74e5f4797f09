package io.scanhive.runtime.api;

import io.scanhive.scan.model.AgentGroupDefinition;
import io.scanhive.scan.model.Asset;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record ScanRequest(String title, @NotNull @Valid AgentGroupDefinition agentGroup, @NotNull Asset asset) {
}
