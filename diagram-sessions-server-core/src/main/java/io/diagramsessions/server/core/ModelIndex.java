package io.diagramsessions.server.core;

import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.ModelElement;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only id index over one model tree.
 *
 * <p>Building an index validates the structural invariants: ids are unique and every edge
 * endpoint names an element of the same tree. A violation raises
 * {@link DiagramSessionsException.InvalidElementReference}, so an index is also the gate every
 * mutated tree passes before it replaces the session model.
 */
public final class ModelIndex {

    private final ModelElement root;
    private final Map<String, ModelElement> byId;
    private final Map<String, String> parentOf;

    private ModelIndex(ModelElement root, Map<String, ModelElement> byId, Map<String, String> parentOf) {
        this.root = root;
        this.byId = byId;
        this.parentOf = parentOf;
    }

    public static ModelIndex of(ModelElement root) {
        Objects.requireNonNull(root, "root");
        Map<String, ModelElement> byId = new LinkedHashMap<>();
        Map<String, String> parentOf = new HashMap<>();
        Deque<ModelElement> todo = new ArrayDeque<>();
        todo.push(root);
        byId.put(root.id(), root);
        while (!todo.isEmpty()) {
            ModelElement current = todo.pop();
            for (ModelElement child : current.children()) {
                if (byId.putIfAbsent(child.id(), child) != null) {
                    throw new DiagramSessionsException.InvalidElementReference("duplicate element id: " + child.id());
                }
                parentOf.put(child.id(), current.id());
                todo.push(child);
            }
        }
        for (ModelElement element : byId.values()) {
            if (!element.isEdge()) continue;
            if (!byId.containsKey(element.sourceId()) || !byId.containsKey(element.targetId())) {
                throw new DiagramSessionsException.InvalidElementReference(
                        "edge " + element.id() + " has a dangling endpoint");
            }
        }
        return new ModelIndex(root, Collections.unmodifiableMap(byId), parentOf);
    }

    public ModelElement root() {
        return root;
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public Optional<ModelElement> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Returns the element with the given id.
     *
     * @throws DiagramSessionsException.InvalidElementReference if there is none
     */
    public ModelElement require(String id) {
        ModelElement element = id == null ? null : byId.get(id);
        if (element == null) {
            throw new DiagramSessionsException.InvalidElementReference("no element with id " + id);
        }
        return element;
    }

    public boolean isRoot(String id) {
        return root.id().equals(id);
    }

    public Optional<ModelElement> parent(String id) {
        String parentId = parentOf.get(id);
        return parentId == null ? Optional.empty() : Optional.of(byId.get(parentId));
    }

    /**
     * Returns whether {@code ancestorId} is {@code id} itself or one of its ancestors.
     */
    public boolean isSelfOrAncestor(String ancestorId, String id) {
        String current = id;
        while (current != null) {
            if (current.equals(ancestorId)) return true;
            current = parentOf.get(current);
        }
        return false;
    }

    /**
     * All elements in depth-first order, root first.
     */
    public Collection<ModelElement> elements() {
        return byId.values();
    }

    public Set<String> ids() {
        return byId.keySet();
    }
}
