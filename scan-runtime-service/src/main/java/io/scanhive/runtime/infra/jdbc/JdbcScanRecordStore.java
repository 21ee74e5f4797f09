package io.scanhive.runtime.infra.jdbc;

import io.scanhive.runtime.domain.Scan;
import io.scanhive.runtime.domain.ScanProgress;
import io.scanhive.runtime.domain.ScanRecordStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;

/**
 * {@link ScanRecordStore} on table {@code scan_record}. Each call runs in its own auto-committed
 * statement.
 */
public class JdbcScanRecordStore implements ScanRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcScanRecordStore.class);

    private static final String SELECT = "SELECT id, title, asset, progress, created_time FROM scan_record";

    private final JdbcTemplate jdbc;
    private final SimpleJdbcInsert insert;
    private final Clock clock;

    public JdbcScanRecordStore(JdbcTemplate jdbc) {
        this(jdbc, Clock.systemUTC());
    }

    public JdbcScanRecordStore(JdbcTemplate jdbc, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.insert = new SimpleJdbcInsert(jdbc)
            .withTableName("scan_record")
            .usingColumns("title", "asset", "progress", "created_time")
            .usingGeneratedKeyColumns("id");
    }

    @Override
    public Scan create(String title, String asset) {
        Instant now = clock.instant();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("title", title);
        row.put("asset", asset);
        row.put("progress", ScanProgress.CREATED.name());
        row.put("created_time", OffsetDateTime.ofInstant(now, ZoneOffset.UTC));
        long id = insert.executeAndReturnKey(row).longValue();
        log.debug("created scan {} for asset {}", id, asset);
        return new Scan(id, title, asset, ScanProgress.CREATED, now);
    }

    @Override
    public Optional<Scan> findById(long id) {
        List<Scan> found = jdbc.query(SELECT + " WHERE id = ?", JdbcScanRecordStore::mapRow, id);
        return found.stream().findFirst();
    }

    @Override
    public List<Scan> listAll() {
        return jdbc.query(SELECT + " ORDER BY created_time, id", JdbcScanRecordStore::mapRow);
    }

    @Override
    public void updateProgress(long id, ScanProgress progress) {
        Objects.requireNonNull(progress, "progress");
        int updated = jdbc.update("UPDATE scan_record SET progress = ? WHERE id = ?", progress.name(), id);
        if (updated == 0) {
            log.warn("no scan {} to move to {}", id, progress);
        }
    }

    private static Scan mapRow(ResultSet rs, int rowNum) throws SQLException {
        OffsetDateTime created = rs.getObject("created_time", OffsetDateTime.class);
        return new Scan(
            rs.getLong("id"),
            rs.getString("title"),
            rs.getString("asset"),
            ScanProgress.valueOf(rs.getString("progress")),
            created == null ? null : created.toInstant());
    }
}
