package co.fanki.zombies.graph.domain;

/**
 * Per-language adapter building the fully qualified name of a declaration.
 *
 * <p>Supplied by the external parser for each language it handles; the
 * symbol table only calls it when the parser left the qualified name
 * empty.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface SymbolQualifier {

    /**
     * Returns the language this adapter qualifies.
     *
     * @return the language name, lower case
     */
    String language();

    /**
     * Builds the qualified name of a declaration.
     *
     * @param declaration the declaration
     * @param file the file the declaration belongs to
     * @return the qualified name, never blank
     */
    String qualify(SymbolDeclaration declaration, FileFacts file);

    /**
     * Creates a qualifier that joins container and name with a separator.
     *
     * @param language the language
     * @param separator the separator ({@code .} for Java, {@code ::} for C++)
     * @return the qualifier
     */
    static SymbolQualifier joining(final String language,
            final String separator) {
        return new SymbolQualifier() {
            @Override
            public String language() {
                return language;
            }

            @Override
            public String qualify(final SymbolDeclaration declaration,
                    final FileFacts file) {
                final String container = declaration.container();
                if (container == null || container.isBlank()) {
                    return declaration.name();
                }
                return container + separator + declaration.name();
            }
        };
    }

}
