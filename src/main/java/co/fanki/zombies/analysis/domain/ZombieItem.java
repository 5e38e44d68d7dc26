package co.fanki.zombies.analysis.domain;

import co.fanki.zombies.graph.domain.SymbolKind;

/**
 * One symbol no active root reaches, as exported to report consumers.
 *
 * @param symbolId the symbol id
 * @param name the simple name
 * @param qualifiedName the qualified name
 * @param kind the symbol kind
 * @param repository the repository
 * @param filePath the file path
 * @param line the declaration line, 0 if unknown
 * @param classification why it is a zombie
 * @param isolationDistance hops to the nearest root ignoring edge
 *        direction, -1 when no root is connected at all
 * @param confidence how sure the report is, 0.0 to 1.0
 * @param confidenceLevel the bucket of the confidence
 * @param phantom true for placeholders of undeclared entities
 * @param lastModified the last modification date, null if unknown
 * @param contributor the primary contributor, null if unknown
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ZombieItem(
        String symbolId,
        String name,
        String qualifiedName,
        SymbolKind kind,
        String repository,
        String filePath,
        int line,
        ZombieClassification classification,
        int isolationDistance,
        double confidence,
        ConfidenceLevel confidenceLevel,
        boolean phantom,
        String lastModified,
        String contributor) {}
