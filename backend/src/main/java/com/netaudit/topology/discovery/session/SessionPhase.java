package com.netaudit.topology.discovery.session;

/**
 * Lifecycle of one session attempt. On the bastion path the bastion goes through
 * {@code CONNECTING -> BANNER_WAIT -> AUTHENTICATING}, then {@code TUNNEL_OPENING}, then the
 * target goes through {@code BANNER_WAIT -> AUTHENTICATING} over the tunnel.
 */
public enum SessionPhase {
    IDLE,
    CONNECTING,
    BANNER_WAIT,
    AUTHENTICATING,
    TUNNEL_OPENING,
    READY,
    COMMAND_EXECUTING,
    CLOSED
}
