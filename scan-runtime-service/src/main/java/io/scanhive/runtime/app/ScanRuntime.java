package io.scanhive.runtime.app;

import io.scanhive.runtime.domain.Scan;
import io.scanhive.runtime.domain.ScanOutcome;
import io.scanhive.scan.model.AgentGroupDefinition;
import io.scanhive.scan.model.Asset;
import java.util.List;

/**
 * A place scans run. Implementations are chosen by the caller and share no state.
 */
public interface ScanRuntime {

    String name();

    /**
     * Name of the private network of the scan.
     */
    String network(long scanId);

    boolean canRun(AgentGroupDefinition definition);

    ScanOutcome scan(String title, AgentGroupDefinition definition, Asset asset);

    /**
     * Removes every resource of the scan and marks it stopped. Safe to repeat.
     */
    void stop(long scanId);

    List<Scan> list(Integer page, Integer pageSize);

    /**
     * Installs the agents every scan of this runtime depends on.
     */
    void install();
}
