/**
 * Protocol-centric core for Diagram Sessions.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the closed set of {@link io.diagramsessions.core.Action} variants</li>
 *   <li>The {@link io.diagramsessions.core.ActionTypes} kind table shared by codecs and dispatchers</li>
 *   <li>Graphical model value types, type hints and capability descriptors</li>
 * </ul>
 *
 * <p>Transport bindings, JSON codecs and the server engine live in other modules.
 */
package io.diagramsessions.core;
