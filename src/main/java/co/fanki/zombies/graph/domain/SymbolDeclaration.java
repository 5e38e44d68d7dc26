package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;

import java.util.Map;

/**
 * A declared-symbol fact as emitted by an external parser.
 *
 * <p>Qualification is left to the {@link SymbolQualifier} of the file's
 * language unless the parser already supplied a qualified name.</p>
 *
 * @param name the simple name
 * @param container the enclosing qualified name (package, class, module),
 *        null for top-level symbols
 * @param qualifiedName the qualified name if the parser computed it, or null
 * @param kind the symbol kind
 * @param range the declaration range
 * @param visibility the visibility, null if unknown
 * @param metadata free-form attributes, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SymbolDeclaration(
        String name,
        String container,
        String qualifiedName,
        SymbolKind kind,
        SourceRange range,
        Visibility visibility,
        Map<String, String> metadata) {

    /** Validates the fact. */
    public SymbolDeclaration {
        Preconditions.requireNonBlank(name, "Declaration name is required");
        Preconditions.requireNonNull(kind, "Declaration kind is required");
        range = range == null ? SourceRange.UNKNOWN : range;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /**
     * Creates a declaration without parser-side qualification.
     *
     * @param name the simple name
     * @param container the enclosing qualified name, may be null
     * @param kind the kind
     * @param line the declaration line
     * @return the declaration
     */
    public static SymbolDeclaration of(final String name,
            final String container, final SymbolKind kind, final int line) {
        return new SymbolDeclaration(name, container, null, kind,
                SourceRange.line(line), Visibility.PUBLIC, Map.of());
    }
}
