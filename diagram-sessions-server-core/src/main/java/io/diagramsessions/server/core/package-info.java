/**
 * Transport-neutral Diagram Sessions engine.
 *
 * <p>{@link io.diagramsessions.server.core.DiagramSessionsEngine} owns the sessions and routes
 * envelopes through the {@link io.diagramsessions.server.core.ActionDispatcher} to the handlers in
 * {@code io.diagramsessions.server.core.handlers}.
 * {@link io.diagramsessions.server.core.DiagramSessionsEndpoint} adds byte-level framing for
 * transports that deal in encoded frames.
 */
package io.diagramsessions.server.core;
