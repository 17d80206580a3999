package com.netaudit.topology.discovery.session;

import net.schmizz.sshj.SSHClient;
import net.schmizz.sshj.common.IOUtils;
import net.schmizz.sshj.connection.channel.direct.DirectConnection;
import net.schmizz.sshj.connection.channel.direct.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * sshj-backed session. Holds the target client and, on the bastion path, the bastion client and
 * the tunnel channel; all three are released by {@link #close()}.
 */
public class SshDeviceSession implements DeviceSession, PhaseTracker {
    private static final Logger log = LoggerFactory.getLogger(SshDeviceSession.class);

    private final String host;
    private final Duration timeout;
    private final PhaseTimer phaseTimer;
    private final AtomicReference<PhaseMark> mark = new AtomicReference<>(new PhaseMark(SessionPhase.IDLE, System.nanoTime()));

    private SSHClient bastionClient;
    private DirectConnection tunnel;
    private SSHClient targetClient;

    SshDeviceSession(String host, Duration timeout, PhaseTimer phaseTimer) {
        this.host = host;
        this.timeout = timeout;
        this.phaseTimer = phaseTimer;
    }

    @Override
    public String host() {
        return host;
    }

    @Override
    public SessionPhase phase() {
        return mark.get().phase();
    }

    @Override
    public long phaseStartedNanos() {
        return mark.get().startedNanos();
    }

    void transition(SessionPhase next) {
        PhaseMark previous = mark.getAndSet(new PhaseMark(next, System.nanoTime()));
        if (previous.phase() != next) {
            log.debug("Session {}: {} -> {}", host, previous.phase(), next);
        }
    }

    void attachBastion(SSHClient client) {
        this.bastionClient = client;
    }

    void attachTunnel(DirectConnection connection) {
        this.tunnel = connection;
    }

    void attachTarget(SSHClient client) {
        this.targetClient = client;
    }

    @Override
    public String execute(String command) throws SessionException {
        SessionPhase current = phase();
        if (current != SessionPhase.READY || targetClient == null) {
            throw new UnexpectedSessionException(current, "session to " + host + " is not ready", null);
        }
        transition(SessionPhase.COMMAND_EXECUTING);
        try {
            return phaseTimer.run(this, timeout, () -> runCommand(command));
        } finally {
            if (phase() == SessionPhase.COMMAND_EXECUTING) {
                transition(SessionPhase.READY);
            }
        }
    }

    private String runCommand(String command) throws IOException {
        try (Session session = targetClient.startSession()) {
            Session.Command cmd = session.exec(command);
            String output = IOUtils.readFully(cmd.getInputStream()).toString(StandardCharsets.UTF_8);
            cmd.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return output;
        }
    }

    @Override
    public void close() {
        if (phase() == SessionPhase.CLOSED) {
            return;
        }
        transition(SessionPhase.CLOSED);
        disconnect(targetClient, "target");
        if (tunnel != null) {
            try {
                tunnel.close();
            } catch (IOException e) {
                log.debug("Error closing tunnel to {}", host, e);
            }
        }
        disconnect(bastionClient, "bastion");
    }

    private void disconnect(SSHClient client, String role) {
        if (client == null) {
            return;
        }
        try {
            if (client.isConnected()) {
                client.disconnect();
            }
        } catch (IOException e) {
            log.debug("Error disconnecting {} client for {}", role, host, e);
        }
    }

    private record PhaseMark(SessionPhase phase, long startedNanos) {
    }
}
