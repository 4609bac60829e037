package io.diagramsessions.json.spi;

import io.diagramsessions.core.ActionEnvelope;

import java.util.Optional;

/**
 * Minimal codec translating {@link ActionEnvelope}s to and from their JSON wire form.
 * Implementations wrap specific JSON libraries (Jackson, Gson, etc.).
 *
 * <p>Wire shape: {@code {"clientId": "...", "action": {"kind": "...", ...}}}. A kind missing from
 * the codec's action table decodes to {@link io.diagramsessions.core.Action.Unrecognized} rather
 * than failing.
 */
public interface EnvelopeCodec {

    // ===== Serialization =====

    /**
     * Serializes an envelope to JSON bytes.
     * @throws JsonException if serialization fails
     */
    byte[] encode(ActionEnvelope envelope) throws JsonException;

    /**
     * Serializes an envelope to a JSON string.
     * @throws JsonException if serialization fails
     */
    String encodeString(ActionEnvelope envelope) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to an envelope.
     * @throws JsonException if the data is not a well-formed envelope
     */
    ActionEnvelope decode(byte[] data) throws JsonException;

    /**
     * Deserializes a JSON string to an envelope.
     * @throws JsonException if the data is not a well-formed envelope
     */
    ActionEnvelope decode(String json) throws JsonException;

    /**
     * Extracts the client id of a frame that could not be decoded, so the failure can be
     * reported to its sender.
     *
     * @return the client id, or empty if the frame is not JSON or has no client id
     */
    Optional<String> peekClientId(byte[] data);
}
