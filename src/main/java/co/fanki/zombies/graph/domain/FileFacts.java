package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;

import java.util.List;

/**
 * Everything the external parser extracted from one source file.
 *
 * <p>The unit of parallel ingestion and of incremental merge.</p>
 *
 * @param repository the repository name
 * @param filePath the file path relative to the repository root
 * @param language the language (e.g. {@code java}, {@code xml},
 *        {@code shell}), lower case
 * @param declarations the declared symbols
 * @param references the raw references
 * @param fragments the text fragments for link inference
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record FileFacts(
        String repository,
        String filePath,
        String language,
        List<SymbolDeclaration> declarations,
        List<ReferenceFact> references,
        List<TextFragment> fragments) {

    /** Validates and copies the lists. */
    public FileFacts {
        Preconditions.requireNonBlank(repository, "Repository is required");
        Preconditions.requireNonBlank(filePath, "File path is required");
        Preconditions.requireNonBlank(language, "Language is required");
        declarations = declarations == null
                ? List.of() : List.copyOf(declarations);
        references = references == null ? List.of() : List.copyOf(references);
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
    }

    /**
     * Returns the key identifying this file across repositories.
     *
     * @return {@code repository::filePath}
     */
    public String fileKey() {
        return SymbolId.fileKey(repository, filePath);
    }
}
