package com.netaudit.topology.discovery.session;

import com.netaudit.topology.discovery.model.BastionHost;
import com.netaudit.topology.discovery.model.ConnectionErrorKind;
import com.netaudit.topology.discovery.model.CredentialPair;
import com.netaudit.topology.discovery.model.ErrorRecordingPolicy;
import com.netaudit.topology.discovery.model.RunConfig;
import org.apache.sshd.server.SshServer;
import org.apache.sshd.server.forward.AcceptAllForwardingFilter;
import org.apache.sshd.server.keyprovider.SimpleGeneratorHostKeyProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SshSessionFactoryBastionTest {
    private static final CredentialPair DEVICE = new CredentialPair("netops", "secret");
    private static final CredentialPair JUMP = new CredentialPair("jump", "jump-secret");
    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private final ExecutorService phaseExecutor = Executors.newCachedThreadPool();
    private final SshSessionFactory factory = new SshSessionFactory(new PhaseTimer(phaseExecutor));
    private final List<SshServer> servers = new ArrayList<>();
    private final List<Socket> accepted = Collections.synchronizedList(new ArrayList<>());

    private SshServer bastion;

    @BeforeEach
    void setUp() throws Exception {
        bastion = startServer(JUMP);
    }

    @AfterEach
    void tearDown() throws Exception {
        for (Socket socket : accepted) {
            socket.close();
        }
        for (SshServer server : servers) {
            server.stop(true);
        }
        phaseExecutor.shutdownNow();
    }

    @Test
    void opensDeviceSessionThroughTheBastion() throws Exception {
        SshServer device = startServer(DEVICE);

        DeviceSession session = factory.open("127.0.0.1", DEVICE, config(device.getPort(), JUMP));
        try {
            assertThat(session.phase()).isEqualTo(SessionPhase.READY);
            assertThat(session.host()).isEqualTo("127.0.0.1");
        } finally {
            session.close();
        }
        assertThat(session.phase()).isEqualTo(SessionPhase.CLOSED);
    }

    @Test
    void silentDeviceBehindBastionTimesOutWithinTheBound() throws Exception {
        try (ServerSocket silent = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            Thread acceptor = new Thread(() -> {
                try {
                    accepted.add(silent.accept());
                } catch (Exception ignored) {
                    // socket closed by the test
                }
            });
            acceptor.setDaemon(true);
            acceptor.start();

            long started = System.nanoTime();
            assertThatThrownBy(() -> factory.open("127.0.0.1", DEVICE, config(silent.getLocalPort(), JUMP)))
                .isInstanceOf(SessionTimeoutException.class)
                .satisfies(error -> assertThat(((SessionException) error).phase())
                    .isIn(SessionPhase.TUNNEL_OPENING, SessionPhase.BANNER_WAIT));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertThat(elapsedMs).isLessThan(3 * TIMEOUT.toMillis() + 1_000L);
        }
    }

    @Test
    void rejectedBastionCredentialsAreAnAuthenticationFailure() {
        CredentialPair wrong = new CredentialPair("jump", "not-the-password");

        assertThatThrownBy(() -> factory.open("127.0.0.1", DEVICE, config(22, wrong)))
            .isInstanceOf(AuthenticationFailedException.class)
            .satisfies(error -> {
                SessionException sessionError = (SessionException) error;
                assertThat(sessionError.kind()).isEqualTo(ConnectionErrorKind.AUTHENTICATION_ERROR);
                assertThat(sessionError.phase()).isEqualTo(SessionPhase.AUTHENTICATING);
            });
    }

    private SshServer startServer(CredentialPair credentials) throws Exception {
        SshServer server = SshServer.setUpDefaultServer();
        server.setHost("127.0.0.1");
        server.setPort(0);
        server.setKeyPairProvider(new SimpleGeneratorHostKeyProvider());
        server.setPasswordAuthenticator((username, password, session) ->
            credentials.username().equals(username) && credentials.password().equals(password));
        server.setForwardingFilter(AcceptAllForwardingFilter.INSTANCE);
        server.start();
        servers.add(server);
        return server;
    }

    private RunConfig config(int devicePort, CredentialPair bastionCredentials) {
        BastionHost jumpHost = new BastionHost("127.0.0.1", bastion.getPort(), bastionCredentials);
        return new RunConfig(TIMEOUT, 3, 1, Duration.ofMillis(20), Duration.ZERO, devicePort, jumpHost,
            List.of(DEVICE), ErrorRecordingPolicy.LAST_WRITE_WINS);
    }
}
