package io.scanhive.runtime.support;

import io.scanhive.runtime.domain.Scan;
import io.scanhive.runtime.domain.ScanProgress;
import io.scanhive.runtime.domain.ScanRecordStore;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryScanRecordStore implements ScanRecordStore {

    private final Map<Long, Scan> scans = new LinkedHashMap<>();
    private final List<String> transitions = new ArrayList<>();
    private long nextId;

    public InMemoryScanRecordStore() {
        this(1);
    }

    public InMemoryScanRecordStore(long firstId) {
        this.nextId = firstId;
    }

    @Override
    public Scan create(String title, String asset) {
        Scan scan = new Scan(nextId++, title, asset, ScanProgress.CREATED, Instant.parse("2024-01-01T00:00:00Z"));
        scans.put(scan.id(), scan);
        return scan;
    }

    @Override
    public Optional<Scan> findById(long id) {
        return Optional.ofNullable(scans.get(id));
    }

    @Override
    public List<Scan> listAll() {
        return List.copyOf(scans.values());
    }

    @Override
    public void updateProgress(long id, ScanProgress progress) {
        Scan scan = scans.get(id);
        if (scan == null) {
            return;
        }
        transitions.add(id + ":" + progress);
        scans.put(id, new Scan(id, scan.title(), scan.asset(), progress, scan.createdTime()));
    }

    public ScanProgress progressOf(long id) {
        return scans.get(id).progress();
    }

    public List<String> transitions() {
        return List.copyOf(transitions);
    }
}
