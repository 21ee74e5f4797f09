package io.scanhive.runtime.domain;

import java.util.List;

public interface VulnerabilityStore {

    /**
     * Vulnerabilities of the scan ordered by title.
     */
    List<Vulnerability> findByScanId(long scanId);
}
