package io.diagramsessions.core;

import java.util.Objects;

/**
 * Wire envelope pairing the logical session with one action.
 */
public record ActionEnvelope(String clientId, Action action) {

    public ActionEnvelope {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(action, "action");
        if (clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be blank");
        }
    }
}
