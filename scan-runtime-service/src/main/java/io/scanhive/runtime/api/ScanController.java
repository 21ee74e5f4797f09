package io.scanhive.runtime.api;

import io.scanhive.runtime.app.DumpFormat;
import io.scanhive.runtime.app.ScanRuntime;
import io.scanhive.runtime.app.VulnzDumper;
import io.scanhive.runtime.domain.Scan;
import io.scanhive.runtime.domain.ScanOutcome;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scans")
public class ScanController {
    private static final Logger log = LoggerFactory.getLogger(ScanController.class);

    private final ScanRuntime runtime;
    private final VulnzDumper dumper;

    public ScanController(ScanRuntime runtime, VulnzDumper dumper) {
        this.runtime = runtime;
        this.dumper = dumper;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ScanOutcome scan(@Valid @RequestBody ScanRequest request) {
        log.info("[REST] POST /api/scans title={} asset={} agents={}",
            request.title(), request.asset().describe(), request.agentGroup().agents().size());
        ScanOutcome outcome = runtime.scan(request.title(), request.agentGroup(), request.asset());
        log.info("[REST] POST /api/scans -> scan={} progress={}", outcome.scanId(), outcome.progress());
        return outcome;
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> stop(@PathVariable("id") long id) {
        log.info("[REST] DELETE /api/scans/{}", id);
        runtime.stop(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Scan> list(@RequestParam(name = "page", required = false) Integer page,
                           @RequestParam(name = "size", required = false) Integer size) {
        log.info("[REST] GET /api/scans page={} size={}", page, size);
        List<Scan> scans = runtime.list(page, size);
        log.info("[REST] GET /api/scans -> {} items", scans.size());
        return scans;
    }

    @GetMapping("/{id}/vulnerabilities")
    public ResponseEntity<String> vulnerabilities(@PathVariable("id") long id,
                                                  @RequestParam(name = "format", defaultValue = "json") String format)
        throws IOException {
        DumpFormat dumpFormat = DumpFormat.fromValue(format);
        log.info("[REST] GET /api/scans/{}/vulnerabilities format={}", id, dumpFormat);
        StringWriter out = new StringWriter();
        int count = dumper.dump(id, dumpFormat, out);
        log.info("[REST] GET /api/scans/{}/vulnerabilities -> {} items", id, count);
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_TYPE, dumpFormat.mediaType())
            .body(out.toString());
    }
}
