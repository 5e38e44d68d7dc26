package co.fanki.zombies.graph.domain;

/**
 * Sub-kind of an {@link EdgeType#ACCESSES} edge.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum AccessKind {

    READ,

    WRITE

}
