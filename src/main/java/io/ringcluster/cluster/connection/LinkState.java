package io.ringcluster.cluster.connection;

/**
 * Handshake progress of one connection.
 */
public enum LinkState {
    /** Accepted or dialled; the peer has not identified itself yet. */
    UNESTABLISHED,
    /** Peer identity received; this is the single authoritative link to that peer. */
    ESTABLISHED,
    CLOSED
}
