package co.fanki.zombies.graph.domain;

/**
 * Declared visibility of a symbol.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Visibility {

    PUBLIC,

    PROTECTED,

    PRIVATE,

    /** Package-private or module-internal. */
    INTERNAL,

    /** Visible only inside its file. */
    FILE,

    UNKNOWN

}
