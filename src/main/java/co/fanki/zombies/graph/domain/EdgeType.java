package co.fanki.zombies.graph.domain;

/**
 * Relationship carried by a {@link DependencyEdge}.
 *
 * <p>Every type propagates reachability: any relationship counts as use.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeType {

    /** Function or method call. */
    CALLS,

    /** Import, require or include. */
    IMPORTS,

    /** Interface implementation, also used for ORM method to statement. */
    IMPLEMENTS,

    /** Stored procedure invocation from a data-access call site. */
    INVOKES,

    /** A scheduler script running a procedure or touching a table. */
    TRIGGERS,

    /** SQL table access, qualified by an {@link AccessKind}. */
    ACCESSES,

    /** Class inheritance. */
    INHERITS,

    /** Any other type or value reference. */
    REFERENCES

}
