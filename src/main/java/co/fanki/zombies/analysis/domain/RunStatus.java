package co.fanki.zombies.analysis.domain;

/**
 * Outcome of a reachability run.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum RunStatus {

    /** The traversal visited every node reachable from the roots. */
    COMPLETE,

    /** A step or time budget ran out; the visited prefix is valid. */
    PARTIAL,

    /** The run was cancelled; the visited prefix is valid. */
    CANCELLED

}
