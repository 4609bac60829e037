package io.diagramsessions.core;

/**
 * Element-level diff record driving animated model transitions.
 *
 * <p>A match with only {@code leftId} is a removal, only {@code rightId} an addition, both a
 * retained element. The engine forwards matches without interpreting them.
 */
public record Match(String leftId, String rightId, String parentId) {
}
