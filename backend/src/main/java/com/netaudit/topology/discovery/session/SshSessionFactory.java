package com.netaudit.topology.discovery.session;

import com.netaudit.topology.discovery.model.BastionHost;
import com.netaudit.topology.discovery.model.CredentialPair;
import com.netaudit.topology.discovery.model.RunConfig;
import net.schmizz.sshj.DefaultConfig;
import net.schmizz.sshj.SSHClient;
import net.schmizz.sshj.connection.channel.direct.DirectConnection;
import net.schmizz.sshj.transport.verification.PromiscuousVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.net.SocketFactory;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;

/**
 * Opens sshj sessions with one timeout applied to every phase: TCP connect, banner and key
 * exchange, authentication and, through a bastion, the {@code direct-tcpip} tunnel channel.
 * Each sshj timeout is set explicitly and each phase also runs under {@link PhaseTimer}.
 */
@Service
public class SshSessionFactory implements SessionFactory {
    private static final Logger log = LoggerFactory.getLogger(SshSessionFactory.class);

    private final PhaseTimer phaseTimer;

    public SshSessionFactory(PhaseTimer phaseTimer) {
        this.phaseTimer = phaseTimer;
    }

    @Override
    public DeviceSession open(String host, CredentialPair credentials, RunConfig config) throws SessionException {
        Duration timeout = config.timeout();
        SshDeviceSession session = new SshDeviceSession(host, timeout, phaseTimer);
        try {
            if (config.viaBastion()) {
                openViaBastion(session, host, credentials, config);
            } else {
                openDirect(session, host, credentials, config);
            }
            session.transition(SessionPhase.READY);
            log.debug("Session to {} ready{}", host, config.viaBastion() ? " via " + config.bastion().host() : "");
            return session;
        } catch (SessionException e) {
            session.close();
            throw e;
        } catch (RuntimeException e) {
            session.close();
            throw SessionErrorClassifier.classify(session.phase(), e);
        }
    }

    private void openDirect(SshDeviceSession session, String host, CredentialPair credentials, RunConfig config)
        throws SessionException {
        Duration timeout = config.timeout();
        SSHClient target = newClient(session, timeout);
        session.attachTarget(target);

        session.transition(SessionPhase.CONNECTING);
        phaseTimer.run(session, timeout, () -> {
            target.connect(host, config.sshPort());
            return null;
        });

        authenticate(session, target, credentials, timeout);
    }

    private void openViaBastion(SshDeviceSession session, String host, CredentialPair credentials, RunConfig config)
        throws SessionException {
        Duration timeout = config.timeout();
        BastionHost bastion = config.bastion();
        SSHClient jump = newClient(session, timeout);
        session.attachBastion(jump);

        session.transition(SessionPhase.CONNECTING);
        phaseTimer.run(session, timeout, () -> {
            jump.connect(bastion.host(), bastion.port());
            return null;
        });
        authenticate(session, jump, bastion.credentials(), timeout);

        // transport state may relax after authentication; re-assert before and at channel open
        applyTimeouts(jump, timeout);
        session.transition(SessionPhase.TUNNEL_OPENING);
        DirectConnection tunnel = phaseTimer.run(session, timeout, () -> {
            applyTimeouts(jump, timeout);
            return jump.newDirectConnection(host, config.sshPort());
        });
        session.attachTunnel(tunnel);

        SSHClient target = newClient(null, timeout);
        session.attachTarget(target);
        session.transition(SessionPhase.BANNER_WAIT);
        phaseTimer.run(session, timeout, () -> {
            target.connectVia(tunnel);
            return null;
        });

        authenticate(session, target, credentials, timeout);
    }

    private void authenticate(SshDeviceSession session, SSHClient client, CredentialPair credentials, Duration timeout)
        throws SessionException {
        session.transition(SessionPhase.AUTHENTICATING);
        phaseTimer.run(session, timeout, () -> {
            client.authPassword(credentials.username(), credentials.password());
            return null;
        });
    }

    private SSHClient newClient(SshDeviceSession session, Duration timeout) {
        SSHClient client = new SSHClient(new DefaultConfig());
        client.addHostKeyVerifier(new PromiscuousVerifier());
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        client.setConnectTimeout(timeoutMs);
        client.setTimeout(timeoutMs);
        applyTimeouts(client, timeout);
        if (session != null) {
            client.setSocketFactory(new PhaseReportingSocketFactory(session));
        }
        return client;
    }

    private static void applyTimeouts(SSHClient client, Duration timeout) {
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        client.getTransport().setTimeoutMs(timeoutMs);
        client.getConnection().setTimeoutMs(timeoutMs);
    }

    /**
     * Moves the session from {@code CONNECTING} to {@code BANNER_WAIT} as soon as the TCP
     * connection is up, so the handshake and the banner exchange each get their own deadline.
     */
    private static final class PhaseReportingSocketFactory extends SocketFactory {
        private final SshDeviceSession session;

        private PhaseReportingSocketFactory(SshDeviceSession session) {
            this.session = session;
        }

        @Override
        public Socket createSocket() {
            return new PhaseReportingSocket(session);
        }

        @Override
        public Socket createSocket(String host, int port) throws IOException {
            Socket socket = createSocket();
            socket.connect(new InetSocketAddress(host, port));
            return socket;
        }

        @Override
        public Socket createSocket(String host, int port, InetAddress localHost, int localPort) throws IOException {
            Socket socket = createSocket();
            socket.bind(new InetSocketAddress(localHost, localPort));
            socket.connect(new InetSocketAddress(host, port));
            return socket;
        }

        @Override
        public Socket createSocket(InetAddress host, int port) throws IOException {
            Socket socket = createSocket();
            socket.connect(new InetSocketAddress(host, port));
            return socket;
        }

        @Override
        public Socket createSocket(InetAddress address, int port, InetAddress localAddress, int localPort)
            throws IOException {
            Socket socket = createSocket();
            socket.bind(new InetSocketAddress(localAddress, localPort));
            socket.connect(new InetSocketAddress(address, port));
            return socket;
        }
    }

    private static final class PhaseReportingSocket extends Socket {
        private final SshDeviceSession session;

        private PhaseReportingSocket(SshDeviceSession session) {
            this.session = session;
        }

        @Override
        public void connect(SocketAddress endpoint, int timeout) throws IOException {
            super.connect(endpoint, timeout);
            if (session.phase() == SessionPhase.CONNECTING) {
                session.transition(SessionPhase.BANNER_WAIT);
            }
        }
    }
}
