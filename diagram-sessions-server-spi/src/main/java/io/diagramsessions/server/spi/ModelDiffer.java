package io.diagramsessions.server.spi;

import io.diagramsessions.core.Match;
import io.diagramsessions.core.ModelElement;

import java.util.List;

/**
 * Produces element-level match records for animated transitions. The engine forwards them
 * opaquely in {@code updateModel}.
 */
@FunctionalInterface
public interface ModelDiffer {

    List<Match> diff(ModelElement oldRoot, ModelElement newRoot);

    /**
     * Differ that never reports matches.
     */
    static ModelDiffer none() {
        return (oldRoot, newRoot) -> List.of();
    }
}
