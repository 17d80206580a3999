package com.netaudit.topology.discovery.api;

import com.netaudit.topology.discovery.model.CredentialPair;
import com.netaudit.topology.discovery.model.DiscoveryRunRequest;
import com.netaudit.topology.discovery.model.DiscoveryRunSummary;
import com.netaudit.topology.discovery.service.TopologyDiscoveryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryControllerTest {

    @Mock
    private TopologyDiscoveryService topologyDiscoveryService;

    @Test
    void forwardsCredentialsAndBastionToTheRun() {
        when(topologyDiscoveryService.run(any())).thenReturn(new DiscoveryRunSummary(
            "run-1", "lab", Instant.now(), Instant.now(), "COMPLETED", 1, 0, 0, 0, Map.of(), false, List.of()
        ));
        DiscoveryController controller = new DiscoveryController(topologyDiscoveryService);

        ResponseEntity<?> response = controller.run(new DiscoveryApiRunRequest(
            List.of("10.0.0.1"),
            "lab",
            "netops",
            "secret",
            "backup",
            "other-secret",
            "jump.example.net",
            false
        ), false);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        ArgumentCaptor<DiscoveryRunRequest> captor = ArgumentCaptor.forClass(DiscoveryRunRequest.class);
        verify(topologyDiscoveryService).run(captor.capture());
        DiscoveryRunRequest forwarded = captor.getValue();
        assertEquals(List.of("10.0.0.1"), forwarded.seeds());
        assertEquals(new CredentialPair("netops", "secret"), forwarded.credentials());
        assertEquals(new CredentialPair("backup", "other-secret"), forwarded.alternateCredentials());
        assertEquals("jump.example.net", forwarded.bastionHost());
        assertEquals(Boolean.FALSE, forwarded.writeReport());
    }

    @Test
    void missingCredentialsFallBackToConfiguration() {
        DiscoveryRunRequest forwarded = DiscoveryController.toRunRequest(new DiscoveryApiRunRequest(
            List.of("10.0.0.1"), null, null, null, null, null, null, null
        ));

        assertNull(forwarded.credentials());
        assertNull(forwarded.alternateCredentials());
        assertNull(forwarded.writeReport());
    }

    @Test
    void asyncRunReturnsAccepted() {
        when(topologyDiscoveryService.startAsync(any())).thenReturn("run-2");
        DiscoveryController controller = new DiscoveryController(topologyDiscoveryService);

        ResponseEntity<?> response = controller.run(new DiscoveryApiRunRequest(
            List.of("10.0.0.1"), null, null, null, null, null, null, null
        ), true);

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertEquals(Map.of("runId", "run-2", "status", "STARTED"), response.getBody());
    }
}
