package co.fanki.zombies.analysis.domain;

/**
 * Why a symbol that no active root reaches is considered a zombie.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ZombieClassification {

    /** Completely isolated: neither used by nor using anything. */
    DEAD_CODE,

    /** Used only by other zombies. */
    ORPHANED,

    /** Any other unreached symbol, e.g. one that only uses live code. */
    UNREACHABLE

}
