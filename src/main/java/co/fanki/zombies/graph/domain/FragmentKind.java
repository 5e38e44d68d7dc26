package co.fanki.zombies.graph.domain;

/**
 * Kind of raw text fragment handed over by the parser for link inference.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum FragmentKind {

    /** An SQL string literal embedded in code. */
    SQL_LITERAL,

    /** A string-literal argument at a data-access call site. */
    CALL_ARGUMENT,

    /** The full content of an ORM mapping file. */
    MAPPER_XML,

    /** The full content of a scheduler or shell script. */
    SCRIPT

}
