package io.scanhive.runtime.app;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scanhive.runtime.domain.ScanNotFoundException;
import io.scanhive.runtime.domain.ScanRecordStore;
import io.scanhive.runtime.domain.Vulnerability;
import io.scanhive.runtime.domain.VulnerabilityStore;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Writes the vulnerabilities of a scan, ordered by title, as JSON or CSV.
 */
public class VulnzDumper {

    static final String[] CSV_HEADER = {"id", "title", "risk_rating", "cvss_v3_vector", "short_description"};

    private final ScanRecordStore scans;
    private final VulnerabilityStore vulnerabilities;
    private final ObjectMapper objectMapper;

    public VulnzDumper(ScanRecordStore scans, VulnerabilityStore vulnerabilities, ObjectMapper objectMapper) {
        this.scans = Objects.requireNonNull(scans, "scans");
        this.vulnerabilities = Objects.requireNonNull(vulnerabilities, "vulnerabilities");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * @return number of vulnerabilities written
     * @throws ScanNotFoundException when no scan has that id
     */
    public int dump(long scanId, DumpFormat format, Writer out) throws IOException {
        if (scans.findById(scanId).isEmpty()) {
            throw new ScanNotFoundException(scanId);
        }
        List<Vulnerability> found = vulnerabilities.findByScanId(scanId);
        switch (format) {
            case JSON -> writeJson(found, out);
            case CSV -> writeCsv(found, out);
        }
        out.flush();
        return found.size();
    }

    private void writeJson(List<Vulnerability> found, Writer out) throws IOException {
        List<Map<String, Object>> entries = new ArrayList<>(found.size());
        for (Vulnerability vulnerability : found) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", vulnerability.id());
            entry.put("risk_rating", vulnerability.riskRating());
            entry.put("cvss_v3_vector", vulnerability.cvssV3Vector());
            entry.put("title", vulnerability.title());
            entry.put("short_description", vulnerability.shortDescription());
            entries.add(entry);
        }
        objectMapper.writerWithDefaultPrettyPrinter()
            .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .writeValue(out, Map.of("vulnerabilities", entries));
    }

    private void writeCsv(List<Vulnerability> found, Writer out) throws IOException {
        CSVFormat csvFormat = CSVFormat.DEFAULT
            .builder()
            .setHeader(CSV_HEADER)
            .build();
        CSVPrinter printer = new CSVPrinter(out, csvFormat);
        for (Vulnerability vulnerability : found) {
            printer.printRecord(
                vulnerability.id(),
                vulnerability.title(),
                vulnerability.riskRating(),
                vulnerability.cvssV3Vector(),
                vulnerability.shortDescription());
        }
        printer.flush();
    }
}
