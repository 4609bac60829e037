package io.diagramsessions.core;

/**
 * Base class for Diagram Sessions protocol errors.
 *
 * <p>None of these terminate a session or the process. The engine reports every subclass except
 * {@link StaleBoundsReply} back to the originating client as a {@code serverStatus} action.
 */
public abstract class DiagramSessionsException extends RuntimeException {

    protected DiagramSessionsException(String message) {
        super(message);
    }

    protected DiagramSessionsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when no handler is registered for an action kind.
     */
    public static class UnknownActionKind extends DiagramSessionsException {
        private final String kind;

        public UnknownActionKind(String kind) {
            super("unknown action kind: " + kind);
            this.kind = kind;
        }

        public String kind() {
            return kind;
        }
    }

    /**
     * Raised when an envelope addresses a client without an open session.
     */
    public static class UnknownSession extends DiagramSessionsException {
        private final String clientId;

        public UnknownSession(String clientId) {
            super("unknown session: " + clientId);
            this.clientId = clientId;
        }

        public String clientId() {
            return clientId;
        }
    }

    /**
     * Raised when an identifiable response matches no outstanding request.
     */
    public static class UnknownRequestId extends DiagramSessionsException {
        private final String requestId;

        public UnknownRequestId(String requestId) {
            super("unknown request id: " + requestId);
            this.requestId = requestId;
        }

        public String requestId() {
            return requestId;
        }
    }

    /**
     * Raised when a bounds result was measured against a superseded revision.
     */
    public static class StaleBoundsReply extends DiagramSessionsException {
        public StaleBoundsReply(long received, long current) {
            super("stale bounds reply for revision " + received + " (current " + current + ")");
        }
    }

    /**
     * Raised when a type hint forbids the requested change.
     */
    public static class OperationNotPermitted extends DiagramSessionsException {
        public OperationNotPermitted(String message) {
            super(message);
        }
    }

    /**
     * Raised when an operation targets a missing id or would corrupt the model tree.
     */
    public static class InvalidElementReference extends DiagramSessionsException {
        public InvalidElementReference(String message) {
            super(message);
        }
    }
}
