package com.netaudit.topology.discovery.api;

import com.netaudit.topology.discovery.model.CredentialPair;
import com.netaudit.topology.discovery.model.DiscoveryRunRequest;
import com.netaudit.topology.discovery.model.DiscoveryRunSummary;
import com.netaudit.topology.discovery.model.DiscoveryStatusResponse;
import com.netaudit.topology.discovery.service.TopologyDiscoveryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/discovery")
public class DiscoveryController {
    private final TopologyDiscoveryService topologyDiscoveryService;

    public DiscoveryController(TopologyDiscoveryService topologyDiscoveryService) {
        this.topologyDiscoveryService = topologyDiscoveryService;
    }

    @PostMapping("/run")
    public ResponseEntity<?> run(
        @RequestBody(required = false) DiscoveryApiRunRequest request,
        @RequestParam(name = "async", required = false, defaultValue = "false") boolean async
    ) {
        DiscoveryRunRequest runRequest = toRunRequest(request);
        if (async) {
            String runId = topologyDiscoveryService.startAsync(runRequest);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("runId", runId, "status", "STARTED"));
        }
        DiscoveryRunSummary summary = topologyDiscoveryService.run(runRequest);
        return ResponseEntity.ok(summary);
    }

    @GetMapping("/status")
    public DiscoveryStatusResponse status() {
        return new DiscoveryStatusResponse(topologyDiscoveryService.isRunning(), topologyDiscoveryService.lastSummary());
    }

    static DiscoveryRunRequest toRunRequest(DiscoveryApiRunRequest request) {
        if (request == null) {
            return DiscoveryRunRequest.ofSeeds(null, null);
        }
        CredentialPair credentials = request.username() == null
            ? null
            : new CredentialPair(request.username(), request.password());
        CredentialPair alternate = request.alternateUsername() == null
            ? null
            : new CredentialPair(request.alternateUsername(), request.alternatePassword());
        return new DiscoveryRunRequest(
            request.seeds(),
            request.siteName(),
            credentials,
            alternate,
            request.bastionHost(),
            request.writeReport()
        );
    }
}
