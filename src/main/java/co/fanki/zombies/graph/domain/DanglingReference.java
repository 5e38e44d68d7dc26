package co.fanki.zombies.graph.domain;

/**
 * A parsed reference whose target could not be resolved to any symbol.
 *
 * @param sourceId the id of the referencing symbol
 * @param target the target text as written
 * @param type the relationship the reference expressed
 * @param fileKey the {@code repo::path} of the referencing file
 * @param line the source line
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DanglingReference(
        String sourceId,
        String target,
        EdgeType type,
        String fileKey,
        int line) {}
