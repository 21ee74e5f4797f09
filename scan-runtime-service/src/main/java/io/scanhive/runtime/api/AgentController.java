package io.scanhive.runtime.api;

import io.scanhive.runtime.app.ScanRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/agents")
public class AgentController {
    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private final ScanRuntime runtime;

    public AgentController(ScanRuntime runtime) {
        this.runtime = runtime;
    }

    @PostMapping("/install")
    public ResponseEntity<Void> install() {
        log.info("[REST] POST /api/agents/install");
        runtime.install();
        return ResponseEntity.noContent().build();
    }
}
