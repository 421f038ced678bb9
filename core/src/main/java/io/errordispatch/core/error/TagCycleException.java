package io.errordispatch.core.error;

import io.errordispatch.core.model.Tag;

/** Thrown when deriving one tag from another would make the tag hierarchy cyclic. */
public final class TagCycleException extends ErrorDispatchException {

    private static final long serialVersionUID = 1L;

    private final transient Tag child;
    private final transient Tag parent;

    public TagCycleException(Tag child, Tag parent) {
        super("Cannot derive '" + child + "' from '" + parent + "': '" + parent + "' already derives from '" + child
                + "'", Phase.CONFIGURATION);
        this.child = child;
        this.parent = parent;
    }

    /** The tag that was to become the child. */
    public Tag child() {
        return child;
    }

    /** The tag that was to become the parent. */
    public Tag parent() {
        return parent;
    }
}
