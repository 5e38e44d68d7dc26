package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;

import java.util.Comparator;
import java.util.Map;
import java.util.TreeMap;

/**
 * A canonical, globally unique node of the dependency graph.
 *
 * <p>Symbols are immutable. Root designation is applied once at build time
 * by replacing the instance with {@link #asRoot(RootType)}; reachability is
 * never stored here, it lives in the analysis overlay of each run.</p>
 *
 * @param id the global key, see {@link SymbolId}
 * @param name the simple name (e.g. {@code getUser})
 * @param qualifiedName the language-qualified name
 *        (e.g. {@code com.x.Mapper.getUser})
 * @param kind the symbol kind
 * @param repository the repository the symbol was declared in
 * @param filePath the file path relative to the repository root
 * @param language the source language, lower case
 * @param range the declaration range
 * @param visibility the declared visibility
 * @param rootType the root type, null when not an active root
 * @param phantom true for placeholders of undeclared entities
 * @param metadata free-form attributes (last-modified, contributor, ...)
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record CodeSymbol(
        String id,
        String name,
        String qualifiedName,
        SymbolKind kind,
        String repository,
        String filePath,
        String language,
        SourceRange range,
        Visibility visibility,
        RootType rootType,
        boolean phantom,
        Map<String, String> metadata) {

    /** Metadata key for the last modification date, set externally. */
    public static final String LAST_MODIFIED = "lastModified";

    /** Metadata key for the primary contributor, set externally. */
    public static final String CONTRIBUTOR = "contributor";

    /**
     * Earliest-declaration order: repository, file, start line, then id.
     * Independent of the order symbols were interned in.
     */
    public static final Comparator<CodeSymbol> DECLARATION_ORDER =
            Comparator.comparing(CodeSymbol::repository)
                    .thenComparing(CodeSymbol::filePath)
                    .thenComparingInt(s -> s.range().startLine())
                    .thenComparing(CodeSymbol::id);

    /** Validates and copies the metadata. */
    public CodeSymbol {
        Preconditions.requireNonBlank(id, "Symbol id is required");
        Preconditions.requireNonBlank(name, "Symbol name is required");
        Preconditions.requireNonBlank(qualifiedName,
                "Qualified name is required");
        Preconditions.requireNonNull(kind, "Symbol kind is required");
        Preconditions.requireNonBlank(repository, "Repository is required");
        Preconditions.requireNonBlank(filePath, "File path is required");
        language = language == null ? "unknown" : language;
        range = range == null ? SourceRange.UNKNOWN : range;
        visibility = visibility == null ? Visibility.UNKNOWN : visibility;
        metadata = metadata == null
                ? Map.of() : Map.copyOf(new TreeMap<>(metadata));
    }

    /**
     * Creates the placeholder node for an entity that is referenced but
     * never declared in the scanned repositories.
     *
     * @param kind the entity kind
     * @param name the referenced name
     * @return the phantom symbol
     */
    public static CodeSymbol phantomOf(final SymbolKind kind,
            final String name) {
        final SymbolId id = SymbolId.phantom(kind, name);
        return new CodeSymbol(id.value(), name, name, kind, id.repository(),
                id.path(), "sql", SourceRange.UNKNOWN, Visibility.UNKNOWN,
                null, true, Map.of());
    }

    /**
     * Creates the node standing for a whole file.
     *
     * @param repository the repository
     * @param filePath the file path
     * @param language the language
     * @param kind {@link SymbolKind#FILE} or
     *        {@link SymbolKind#SCHEDULER_SCRIPT}
     * @return the file symbol
     */
    public static CodeSymbol fileOf(final String repository,
            final String filePath, final String language,
            final SymbolKind kind) {
        final SymbolId id = SymbolId.file(repository, filePath);
        return new CodeSymbol(id.value(), id.symbol(), id.path(), kind,
                repository, id.path(), language, SourceRange.UNKNOWN,
                Visibility.FILE, null, false, Map.of());
    }

    /**
     * Checks if this symbol is a designated entry point.
     *
     * @return true if a root type was assigned
     */
    public boolean activeRoot() {
        return rootType != null;
    }

    /**
     * Returns a copy designated as active root.
     *
     * <p>The designation is immutable: if this symbol already is a root,
     * it is returned unchanged.</p>
     *
     * @param type the root type
     * @return the root symbol
     */
    public CodeSymbol asRoot(final RootType type) {
        Preconditions.requireNonNull(type, "Root type is required");
        if (activeRoot()) {
            return this;
        }
        return new CodeSymbol(id, name, qualifiedName, kind, repository,
                filePath, language, range, visibility, type, phantom,
                metadata);
    }

    /**
     * Returns the key of the file this symbol was declared in.
     *
     * @return {@code repository::filePath}
     */
    public String fileKey() {
        return SymbolId.fileKey(repository, filePath);
    }

}
