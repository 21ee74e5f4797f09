package io.scanhive.runtime.domain;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of scan records. Every call commits on its own.
 */
public interface ScanRecordStore {

    /**
     * Persists a new scan in {@link ScanProgress#CREATED}; the store assigns the id.
     */
    Scan create(String title, String asset);

    Optional<Scan> findById(long id);

    /**
     * All scans ordered by creation.
     */
    List<Scan> listAll();

    void updateProgress(long id, ScanProgress progress);
}
