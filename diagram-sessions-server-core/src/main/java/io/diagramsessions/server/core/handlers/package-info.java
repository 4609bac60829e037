/**
 * Action handlers, one class per protocol concern. Each registers its kinds with an
 * {@link io.diagramsessions.server.core.ActionRegistry.Builder}.
 */
package io.diagramsessions.server.core.handlers;
