package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;
import co.fanki.zombies.shared.ValueObject;

import java.util.Locale;

/**
 * Value object for the global key of a symbol: {@code Repo::Path::Symbol}.
 *
 * <p>The key is unique across all scanned repositories. Placeholder
 * (phantom) nodes use the reserved repository {@code <phantom>} and the
 * lower-cased kind as path, e.g. {@code <phantom>::stored_procedure::sp_x}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SymbolId implements ValueObject {

    private static final long serialVersionUID = 1L;

    /** Separator between the three parts of the key. */
    public static final String SEPARATOR = "::";

    /** Repository name reserved for phantom nodes. */
    public static final String PHANTOM_REPOSITORY = "<phantom>";

    private final String repository;
    private final String path;
    private final String symbol;

    private SymbolId(final String theRepository, final String thePath,
            final String theSymbol) {
        this.repository = Preconditions.requireNonBlank(theRepository,
                "Repository is required");
        this.path = Preconditions.requireNonBlank(thePath,
                "Path is required");
        this.symbol = Preconditions.requireNonBlank(theSymbol,
                "Symbol is required");
    }

    /**
     * Creates the id of a declared symbol.
     *
     * @param repository the repository name
     * @param path the file path relative to the repository root
     * @param symbol the qualified symbol name
     * @return the symbol id
     */
    public static SymbolId of(final String repository, final String path,
            final String symbol) {
        return new SymbolId(repository, normalizePath(path), symbol);
    }

    /**
     * Creates the id of the node that stands for a whole file.
     *
     * @param repository the repository name
     * @param path the file path relative to the repository root
     * @return the file node id, whose symbol part is the file name
     */
    public static SymbolId file(final String repository, final String path) {
        final String normalized = normalizePath(path);
        final int slash = normalized.lastIndexOf('/');
        return new SymbolId(repository, normalized,
                normalized.substring(slash + 1));
    }

    /**
     * Creates the id of a phantom node.
     *
     * @param kind the kind of the referenced entity
     * @param name the referenced name
     * @return the phantom id
     */
    public static SymbolId phantom(final SymbolKind kind, final String name) {
        Preconditions.requireNonNull(kind, "Kind is required");
        final String key = kind.isDatabaseEntity()
                ? name.toLowerCase(Locale.ROOT) : name;
        return new SymbolId(PHANTOM_REPOSITORY,
                kind.name().toLowerCase(Locale.ROOT), key);
    }

    /**
     * Parses a key back into its parts.
     *
     * <p>The symbol part may itself contain the separator (e.g. C++ or Rust
     * qualified names), so only the first two separators split.</p>
     *
     * @param value the {@code Repo::Path::Symbol} key
     * @return the symbol id
     * @throws IllegalArgumentException if the key has fewer than three parts
     */
    public static SymbolId parse(final String value) {
        Preconditions.requireNonBlank(value, "Symbol id is required");
        final int first = value.indexOf(SEPARATOR);
        final int second = first < 0 ? -1
                : value.indexOf(SEPARATOR, first + SEPARATOR.length());
        Preconditions.require(first > 0 && second > first,
                "Malformed symbol id: " + value);
        return new SymbolId(value.substring(0, first),
                value.substring(first + SEPARATOR.length(), second),
                value.substring(second + SEPARATOR.length()));
    }

    /**
     * Builds the file key ({@code repo::path}) used to tag contributions.
     *
     * @param repository the repository name
     * @param path the file path
     * @return the file key
     */
    public static String fileKey(final String repository, final String path) {
        return repository + SEPARATOR + normalizePath(path);
    }

    private static String normalizePath(final String path) {
        Preconditions.requireNonBlank(path, "Path is required");
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    /** @return the repository part */
    public String repository() {
        return repository;
    }

    /** @return the path part */
    public String path() {
        return path;
    }

    /** @return the symbol part */
    public String symbol() {
        return symbol;
    }

    /**
     * Checks if this id denotes a phantom node.
     *
     * @return true if the repository is the phantom repository
     */
    public boolean isPhantom() {
        return PHANTOM_REPOSITORY.equals(repository);
    }

    /**
     * Returns the string form of the key.
     *
     * @return {@code repository::path::symbol}
     */
    public String value() {
        return repository + SEPARATOR + path + SEPARATOR + symbol;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final SymbolId that = (SymbolId) obj;
        return repository.equals(that.repository)
                && path.equals(that.path)
                && symbol.equals(that.symbol);
    }

    @Override
    public int hashCode() {
        return value().hashCode();
    }

    @Override
    public String toString() {
        return value();
    }

}
