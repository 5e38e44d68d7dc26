package co.fanki.zombies.graph.domain;

/**
 * Category of a non-fatal finding recorded while building the graph.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum DiagnosticKind {

    /** A reference matched several symbols and was linked by tie-break. */
    AMBIGUOUS_REFERENCE,

    /** A method of a mapped namespace has no mapping statement. */
    UNMATCHED_MAPPER_METHOD,

    /** A mapping statement has no interface method. */
    UNMATCHED_MAPPER_STATEMENT,

    /** A fragment could not be parsed and was skipped. */
    MALFORMED_FRAGMENT,

    /** A referenced entity was never declared; a phantom node stands in. */
    PHANTOM_CREATED,

    /** A root designation matched no symbol. */
    UNMATCHED_ROOT

}
