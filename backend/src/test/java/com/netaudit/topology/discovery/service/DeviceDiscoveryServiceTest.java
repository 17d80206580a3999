package com.netaudit.topology.discovery.service;

import com.netaudit.topology.config.AuditorProperties;
import com.netaudit.topology.discovery.model.CredentialPair;
import com.netaudit.topology.discovery.model.DeviceDiscoveryResult;
import com.netaudit.topology.discovery.model.ErrorRecordingPolicy;
import com.netaudit.topology.discovery.model.NeighborRecord;
import com.netaudit.topology.discovery.model.RunConfig;
import com.netaudit.topology.discovery.parse.TemplateOutputParser;
import com.netaudit.topology.discovery.session.AuthenticationFailedException;
import com.netaudit.topology.discovery.session.DeviceSession;
import com.netaudit.topology.discovery.session.SessionFactory;
import com.netaudit.topology.discovery.session.SessionPhase;
import com.netaudit.topology.discovery.session.SessionTimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeviceDiscoveryServiceTest {
    private static final CredentialPair CREDENTIALS = new CredentialPair("netops", "secret");
    private static final RunConfig CONFIG = new RunConfig(
        Duration.ofSeconds(1),
        3,
        1,
        Duration.ofMillis(20),
        Duration.ZERO,
        22,
        null,
        List.of(CREDENTIALS),
        ErrorRecordingPolicy.LAST_WRITE_WINS
    );

    @Mock
    private SessionFactory sessionFactory;
    @Mock
    private DeviceSession session;

    private AuditorProperties properties;
    private DeviceDiscoveryService service;

    @BeforeEach
    void setUp() {
        properties = new AuditorProperties();
        service = new DeviceDiscoveryService(properties, sessionFactory, new TemplateOutputParser(properties, new DefaultResourceLoader()));
    }

    @Test
    void buildsNeighborRowsAndTraversableAddresses() throws Exception {
        when(sessionFactory.open("10.20.0.10", CREDENTIALS, CONFIG)).thenReturn(session);
        when(session.execute("show cdp neighbors detail")).thenReturn(fixture("cdp_neighbors_detail.txt"));
        when(session.execute("show version")).thenReturn(fixture("show_version.txt"));

        DeviceDiscoveryResult result = service.discover("10.20.0.10", CREDENTIALS, CONFIG);

        assertThat(result.neighbors()).hasSize(4);
        assertThat(result.neighborAddresses()).containsExactly("10.20.0.2", "10.20.0.1");
        assertThat(result.version().hostname()).isEqualTo("access-sw1");

        NeighborRecord first = result.neighbors().get(0);
        assertThat(first.host()).isEqualTo("10.20.0.10");
        assertThat(first.hostname()).isEqualTo("access-sw1");
        assertThat(first.neighborDeviceId()).isEqualTo("dist-sw1.example.net");
        assertThat(first.capabilities()).containsExactly("Switch", "IGMP");
        assertThat(first.version().serial()).isEqualTo("FOC1234X0AB");
        verify(session).close();
    }

    @Test
    void excludedPlatformsAreRecordedButNotTraversed() throws Exception {
        properties.getNeighborFilter().setExcludedPlatformPrefixes(List.of("Cisco ISR"));
        when(sessionFactory.open(eq("10.20.0.10"), any(), any())).thenReturn(session);
        when(session.execute("show cdp neighbors detail")).thenReturn(fixture("cdp_neighbors_detail.txt"));
        when(session.execute("show version")).thenReturn(fixture("show_version.txt"));

        DeviceDiscoveryResult result = service.discover("10.20.0.10", CREDENTIALS, CONFIG);

        assertThat(result.neighbors()).hasSize(4);
        assertThat(result.neighborAddresses()).containsExactly("10.20.0.2");
    }

    @Test
    void emptyCapabilityFilterTraversesEveryAddressedNeighbor() throws Exception {
        properties.getNeighborFilter().setRequiredCapabilities(List.of());
        when(sessionFactory.open(eq("10.20.0.10"), any(), any())).thenReturn(session);
        when(session.execute("show cdp neighbors detail")).thenReturn(fixture("cdp_neighbors_detail.txt"));
        when(session.execute("show version")).thenReturn("");

        DeviceDiscoveryResult result = service.discover("10.20.0.10", CREDENTIALS, CONFIG);

        assertThat(result.neighborAddresses()).containsExactly("10.20.0.2", "10.30.1.15", "10.20.0.1");
        assertThat(result.version().hostname()).isNull();
    }

    @Test
    void sessionFailuresPropagate() throws Exception {
        when(sessionFactory.open(eq("10.20.0.10"), any(), any()))
            .thenThrow(new AuthenticationFailedException(SessionPhase.AUTHENTICATING, "denied", null));

        assertThatThrownBy(() -> service.discover("10.20.0.10", CREDENTIALS, CONFIG))
            .isInstanceOf(AuthenticationFailedException.class);
    }

    @Test
    void commandTimeoutClosesTheSession() throws Exception {
        when(sessionFactory.open(eq("10.20.0.10"), any(), any())).thenReturn(session);
        when(session.execute("show cdp neighbors detail"))
            .thenThrow(new SessionTimeoutException(SessionPhase.COMMAND_EXECUTING, "no output"));

        assertThatThrownBy(() -> service.discover("10.20.0.10", CREDENTIALS, CONFIG))
            .isInstanceOf(SessionTimeoutException.class);
        verify(session).close();
        verify(session, never()).execute("show version");
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = DeviceDiscoveryServiceTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
