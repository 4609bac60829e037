package io.diagramsessions.server.core;

import io.diagramsessions.core.ElementAndAlignment;
import io.diagramsessions.core.ElementAndBounds;
import io.diagramsessions.core.ModelElement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Structural edits on immutable model trees. Every method returns a new tree and leaves the
 * argument untouched; unchanged subtrees are shared.
 */
public final class ModelTrees {

    private ModelTrees() {}

    /**
     * Replace the element with the given id by {@code change.apply(element)}.
     */
    public static ModelElement replace(ModelElement root, String id, UnaryOperator<ModelElement> change) {
        if (root.id().equals(id)) {
            return change.apply(root);
        }
        List<ModelElement> children = root.children();
        List<ModelElement> next = null;
        for (int i = 0; i < children.size(); i++) {
            ModelElement child = children.get(i);
            ModelElement replaced = replace(child, id, change);
            if (replaced != child) {
                if (next == null) next = new ArrayList<>(children);
                next.set(i, replaced);
            }
        }
        return next == null ? root : root.withChildren(next);
    }

    /**
     * Append {@code child} to the children of {@code containerId}.
     */
    public static ModelElement insert(ModelElement root, String containerId, ModelElement child) {
        return replace(root, containerId, container -> container.withChild(child));
    }

    /**
     * Remove the subtrees rooted at the given ids. The root itself is never removed.
     */
    public static ModelElement removeAll(ModelElement root, Set<String> ids) {
        return prune(root, element -> !ids.contains(element.id()));
    }

    /**
     * Remove the subtree rooted at {@code id} without touching edges that point into it. Used
     * when the subtree is about to be inserted elsewhere.
     */
    public static ModelElement detach(ModelElement root, String id) {
        return filter(root, element -> !element.id().equals(id));
    }

    /**
     * Keep only elements accepted by {@code keep} (a rejected element takes its subtree with it),
     * then drop edges whose endpoints are gone.
     */
    public static ModelElement prune(ModelElement root, Predicate<ModelElement> keep) {
        return removeDanglingEdges(filter(root, keep));
    }

    /**
     * Drop edges referencing missing elements until none is left. Edges may connect to edges, so
     * one removal can orphan another.
     */
    public static ModelElement removeDanglingEdges(ModelElement root) {
        ModelElement current = root;
        while (true) {
            Set<String> ids = collectIds(current);
            ModelElement next = filter(current, element ->
                    !element.isEdge() || (ids.contains(element.sourceId()) && ids.contains(element.targetId())));
            if (next == current) return current;
            current = next;
        }
    }

    /**
     * Apply measured bounds and alignments. Entries naming unknown ids are ignored.
     */
    public static ModelElement mergeLayout(ModelElement root, List<ElementAndBounds> bounds, List<ElementAndAlignment> alignments) {
        Map<String, ElementAndBounds> boundsById = new HashMap<>();
        for (ElementAndBounds b : bounds) boundsById.put(b.elementId(), b);
        Map<String, ElementAndAlignment> alignmentById = new HashMap<>();
        for (ElementAndAlignment a : alignments) alignmentById.put(a.elementId(), a);
        if (boundsById.isEmpty() && alignmentById.isEmpty()) return root;
        return map(root, element -> {
            ModelElement result = element;
            ElementAndBounds b = boundsById.get(element.id());
            if (b != null) {
                if (b.newPosition() != null) result = result.withPosition(b.newPosition());
                if (b.newSize() != null) result = result.withSize(b.newSize());
            }
            ElementAndAlignment a = alignmentById.get(element.id());
            if (a != null) result = result.withAlignment(a.newAlignment());
            return result;
        });
    }

    public static Set<String> collectIds(ModelElement root) {
        Set<String> ids = new HashSet<>();
        collectIds(root, ids);
        return ids;
    }

    private static void collectIds(ModelElement element, Set<String> into) {
        into.add(element.id());
        for (ModelElement child : element.children()) collectIds(child, into);
    }

    private static ModelElement filter(ModelElement element, Predicate<ModelElement> keep) {
        List<ModelElement> children = element.children();
        List<ModelElement> next = null;
        for (int i = 0; i < children.size(); i++) {
            ModelElement child = children.get(i);
            if (!keep.test(child)) {
                if (next == null) next = new ArrayList<>(children.subList(0, i));
                continue;
            }
            ModelElement filtered = filter(child, keep);
            if (next == null && filtered != child) next = new ArrayList<>(children.subList(0, i));
            if (next != null) next.add(filtered);
        }
        return next == null ? element : element.withChildren(next);
    }

    private static ModelElement map(ModelElement element, UnaryOperator<ModelElement> f) {
        List<ModelElement> children = new ArrayList<>(element.children().size());
        for (ModelElement child : element.children()) children.add(map(child, f));
        return f.apply(element.withChildren(children));
    }
}
