package io.diagramsessions.core;

import java.util.Objects;

/**
 * Operation offered to the client.
 *
 * @param id stable identifier of the operation
 * @param elementTypeId element type the operation creates or targets, or null when not type bound
 * @param label human readable label
 * @param operationKind kind of structural edit
 * @param active whether the operation is applicable to the current model
 */
public record OperationDescriptor(String id, String elementTypeId, String label, OperationKind operationKind, boolean active) {

    public OperationDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(operationKind, "operationKind");
        if (label == null) label = id;
    }

    public OperationDescriptor withActive(boolean active) {
        return active == this.active ? this : new OperationDescriptor(id, elementTypeId, label, operationKind, active);
    }
}
