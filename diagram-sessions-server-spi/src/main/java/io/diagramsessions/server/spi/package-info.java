/**
 * Server-side SPI for Diagram Sessions.
 *
 * <p>The engine consumes these collaborators through their input/output contracts only:
 * persistence, server-side layout, model diffing, capability declarations and the outbound
 * transport. Reference implementations suitable for tests and examples live here as well.
 */
package io.diagramsessions.server.spi;
