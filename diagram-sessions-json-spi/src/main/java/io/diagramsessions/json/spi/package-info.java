/**
 * Library-neutral JSON SPI for the Diagram Sessions wire format.
 */
package io.diagramsessions.json.spi;
