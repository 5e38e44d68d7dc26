package co.fanki.zombies.graph.domain.link;

/**
 * Switches the built-in detector families on or off.
 *
 * @param ormMapping mapper XML statements and their methods
 * @param storedProcedures procedure calls at data-access call sites
 * @param schedulerScripts database clients run from scheduler scripts
 * @param sqlTableAccess table reads and writes in SQL text
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SemanticLinkConfig(
        boolean ormMapping,
        boolean storedProcedures,
        boolean schedulerScripts,
        boolean sqlTableAccess) {

    /** Every family enabled. */
    public static final SemanticLinkConfig ALL =
            new SemanticLinkConfig(true, true, true, true);

}
