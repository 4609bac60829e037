package io.diagramsessions.core;

/**
 * Server-declared capability flags for one element type.
 *
 * <p>Hints are immutable; a session replaces its whole hint table on every {@code setTypeHints}
 * broadcast instead of patching individual entries.
 */
public sealed interface TypeHint permits ShapeTypeHint, EdgeTypeHint {

    String elementTypeId();

    boolean repositionable();

    boolean deletable();
}
