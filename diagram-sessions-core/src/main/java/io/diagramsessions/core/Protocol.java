package io.diagramsessions.core;

/**
 * Diagram Sessions protocol constants (option keys, edit contexts, and well-known values).
 *
 * <p>Action kinds are declared on the action records themselves ({@code Action.SetModel.KIND} etc.).
 */
public final class Protocol {
    private Protocol() {}

    // requestModel options
    public static final String OPTION_NEEDS_CLIENT_LAYOUT = "needsClientLayout";
    public static final String OPTION_SOURCE_URI = "sourceUri";
    public static final String OPTION_ANIMATE = "animate";

    // requestEditValidation contexts
    public static final String EDIT_CONTEXT_CONTAINER = "container";
    public static final String EDIT_CONTEXT_POSITION = "position";

    // setDirtyState reasons
    public static final String DIRTY_REASON_OPERATION = "operation";
    public static final String DIRTY_REASON_SAVE = "save";

    /** Argument key a client may use to propose the id of a created element. */
    public static final String ARG_ELEMENT_ID = "id";

    /** Element property holding the text of a label. */
    public static final String PROPERTY_TEXT = "text";

    // Root created when the persistence collaborator has no model for a source
    public static final String DEFAULT_ROOT_TYPE = "graph";
    public static final String DEFAULT_ROOT_ID = "root";

    /** Canonical boolean textual value used by the protocol for true. */
    public static final String BOOL_TRUE = "true";
}
