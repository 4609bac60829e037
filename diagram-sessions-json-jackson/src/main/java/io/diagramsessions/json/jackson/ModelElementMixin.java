package io.diagramsessions.json.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Keeps derived accessors of {@link io.diagramsessions.core.ModelElement} off the wire.
 */
abstract class ModelElementMixin {

    @JsonIgnore
    abstract boolean isEdge();
}
