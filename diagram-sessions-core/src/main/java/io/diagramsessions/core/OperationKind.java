package io.diagramsessions.core;

/**
 * Fixed set of structural edit kinds an {@link OperationDescriptor} can offer.
 */
public enum OperationKind {
    CREATE_NODE,
    CREATE_CONNECTION,
    DELETE,
    CHANGE_BOUNDS,
    CHANGE_CONTAINER,
    GENERIC
}
