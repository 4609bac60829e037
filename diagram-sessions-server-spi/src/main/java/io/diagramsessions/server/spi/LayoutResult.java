package io.diagramsessions.server.spi;

import io.diagramsessions.core.ElementAndAlignment;
import io.diagramsessions.core.ElementAndBounds;

import java.util.List;

/**
 * Bounds and alignments computed for a candidate model, tagged with the revision they were
 * computed against.
 */
public record LayoutResult(long revision, List<ElementAndBounds> bounds, List<ElementAndAlignment> alignments) {

    public LayoutResult {
        if (revision < 0) throw new IllegalArgumentException("revision must be >= 0");
        bounds = bounds == null ? List.of() : List.copyOf(bounds);
        alignments = alignments == null ? List.of() : List.copyOf(alignments);
    }
}
