package io.scanhive.runtime.infra.jdbc;

import io.scanhive.runtime.domain.Vulnerability;
import io.scanhive.runtime.domain.VulnerabilityStore;
import java.util.List;
import java.util.Objects;
import org.springframework.jdbc.core.JdbcTemplate;

public class JdbcVulnerabilityStore implements VulnerabilityStore {

    private final JdbcTemplate jdbc;

    public JdbcVulnerabilityStore(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    }

    @Override
    public List<Vulnerability> findByScanId(long scanId) {
        return jdbc.query(
            """
            SELECT id, scan_id, title, short_description, risk_rating, cvss_v3_vector
            FROM vulnerability
            WHERE scan_id = ?
            ORDER BY title, id
            """,
            (rs, rowNum) -> new Vulnerability(
                rs.getLong("id"),
                rs.getLong("scan_id"),
                rs.getString("title"),
                rs.getString("short_description"),
                rs.getString("risk_rating"),
                rs.getString("cvss_v3_vector")),
            scanId);
    }
}
