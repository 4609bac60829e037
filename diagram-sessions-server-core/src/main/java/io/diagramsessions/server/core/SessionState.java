package io.diagramsessions.server.core;

/**
 * Lifecycle state of a client session.
 */
public enum SessionState {
    /** No session exists for the client id. */
    UNINITIALIZED,
    /** Session opened; no model committed yet. */
    AWAITING_CAPABILITIES,
    /** A committed model exists and no bounds handshake is in flight. */
    READY,
    /** A candidate model waits for measured bounds. */
    AWAITING_BOUNDS,
    /** Terminal. */
    CLOSED
}
