package io.diagramsessions.server.core;

import io.diagramsessions.core.DiagramSessionsException;
import io.diagramsessions.core.EdgeTypeHint;
import io.diagramsessions.core.ModelElement;
import io.diagramsessions.core.ShapeTypeHint;
import io.diagramsessions.core.TypeHint;

import java.util.Map;
import java.util.Objects;

/**
 * Checks structural edits against a session's type hints.
 *
 * <p>Each edit kind is judged by one combined rule. An element type without a hint can be
 * neither created nor modified. The root of a model without its own shape hint accepts any
 * child type.
 *
 * <p>The {@code check*} methods throw {@link DiagramSessionsException.OperationNotPermitted};
 * the {@code allows*} variants answer the same question without throwing.
 */
public final class TypeHintGate {

    private final Map<String, TypeHint> hints;
    private final ModelIndex index;

    public TypeHintGate(Map<String, TypeHint> hints, ModelIndex index) {
        this.hints = Objects.requireNonNull(hints, "hints");
        this.index = Objects.requireNonNull(index, "index");
    }

    public boolean allowsCreateNode(String elementTypeId, ModelElement container) {
        return denyCreateNode(elementTypeId, container) == null;
    }

    public void checkCreateNode(String elementTypeId, ModelElement container) {
        check(denyCreateNode(elementTypeId, container));
    }

    public boolean allowsCreateConnection(String elementTypeId, ModelElement source, ModelElement target) {
        return denyConnection(elementTypeId, source, target) == null;
    }

    public void checkCreateConnection(String elementTypeId, ModelElement source, ModelElement target) {
        check(denyConnection(elementTypeId, source, target));
    }

    public boolean allowsDelete(ModelElement element) {
        return denyDelete(element) == null;
    }

    public void checkDelete(ModelElement element) {
        check(denyDelete(element));
    }

    public boolean allowsChangeBounds(ModelElement element, boolean move, boolean resize) {
        return denyChangeBounds(element, move, resize) == null;
    }

    public void checkChangeBounds(ModelElement element, boolean move, boolean resize) {
        check(denyChangeBounds(element, move, resize));
    }

    public boolean allowsChangeContainer(ModelElement element, ModelElement target) {
        return denyChangeContainer(element, target) == null;
    }

    public void checkChangeContainer(ModelElement element, ModelElement target) {
        check(denyChangeContainer(element, target));
    }

    public void checkReconnect(ModelElement edge, ModelElement source, ModelElement target) {
        check(denyConnection(edge.type(), source, target));
    }

    public void checkReroute(ModelElement edge) {
        TypeHint hint = hint(edge.type());
        if (!edge.isEdge()) check(edge.id() + " is not an edge");
        if (!(hint instanceof EdgeTypeHint edgeHint)) {
            check("no edge type hint for " + edge.type());
        } else if (!edgeHint.routable()) {
            check(edge.type() + " is not routable");
        }
    }

    /**
     * Whether {@code container} may hold a child of the given type.
     */
    public boolean accepts(ModelElement container, String childTypeId) {
        if (container.isEdge()) return false;
        TypeHint hint = hint(container.type());
        if (hint == null) return index.isRoot(container.id());
        return hint instanceof ShapeTypeHint shape && shape.canContain(childTypeId);
    }

    private String denyCreateNode(String elementTypeId, ModelElement container) {
        if (!(hint(elementTypeId) instanceof ShapeTypeHint)) {
            return "no shape type hint for " + elementTypeId;
        }
        if (!accepts(container, elementTypeId)) {
            return container.id() + " does not accept " + elementTypeId;
        }
        return null;
    }

    private String denyConnection(String elementTypeId, ModelElement source, ModelElement target) {
        if (!(hint(elementTypeId) instanceof EdgeTypeHint edge)) {
            return "no edge type hint for " + elementTypeId;
        }
        if (index.isRoot(source.id()) || index.isRoot(target.id())) {
            return "the root cannot be connected";
        }
        if (!edge.allowsSource(source.type())) return elementTypeId + " cannot start at " + source.type();
        if (!edge.allowsTarget(target.type())) return elementTypeId + " cannot end at " + target.type();
        return null;
    }

    private String denyDelete(ModelElement element) {
        if (index.isRoot(element.id())) return "the root cannot be deleted";
        TypeHint hint = hint(element.type());
        if (hint == null) return "no type hint for " + element.type();
        if (!hint.deletable()) return element.type() + " is not deletable";
        return null;
    }

    private String denyChangeBounds(ModelElement element, boolean move, boolean resize) {
        if (element.isEdge()) return element.id() + " is an edge";
        TypeHint hint = hint(element.type());
        if (!(hint instanceof ShapeTypeHint shape)) return "no shape type hint for " + element.type();
        if (move && !shape.repositionable()) return element.type() + " is not repositionable";
        if (resize && !shape.resizable()) return element.type() + " is not resizable";
        return null;
    }

    private String denyChangeContainer(ModelElement element, ModelElement target) {
        if (index.isRoot(element.id())) return "the root cannot be moved";
        if (!(hint(element.type()) instanceof ShapeTypeHint shape)) {
            return "no shape type hint for " + element.type();
        }
        if (!shape.reparentable()) return element.type() + " is not reparentable";
        if (index.isSelfOrAncestor(element.id(), target.id())) {
            return "moving " + element.id() + " into " + target.id() + " would create a cycle";
        }
        if (!accepts(target, element.type())) return target.id() + " does not accept " + element.type();
        return null;
    }

    private TypeHint hint(String elementTypeId) {
        return elementTypeId == null ? null : hints.get(elementTypeId);
    }

    private static void check(String denial) {
        if (denial != null) throw new DiagramSessionsException.OperationNotPermitted(denial);
    }
}
