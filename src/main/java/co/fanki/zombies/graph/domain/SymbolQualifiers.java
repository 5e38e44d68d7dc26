package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Registry of {@link SymbolQualifier}s keyed by language.
 *
 * <p>Languages without a registered adapter are qualified with dots.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SymbolQualifiers {

    private static final SymbolQualifier DEFAULT =
            SymbolQualifier.joining("*", ".");

    private final Map<String, SymbolQualifier> byLanguage = new HashMap<>();

    /**
     * Creates a registry with the built-in adapters.
     *
     * @return the registry
     */
    public static SymbolQualifiers defaults() {
        final SymbolQualifiers qualifiers = new SymbolQualifiers();
        qualifiers.register(SymbolQualifier.joining("java", "."));
        qualifiers.register(SymbolQualifier.joining("kotlin", "."));
        qualifiers.register(SymbolQualifier.joining("python", "."));
        qualifiers.register(SymbolQualifier.joining("javascript", "."));
        qualifiers.register(SymbolQualifier.joining("typescript", "."));
        qualifiers.register(SymbolQualifier.joining("rust", "::"));
        qualifiers.register(SymbolQualifier.joining("cpp", "::"));
        return qualifiers;
    }

    /**
     * Registers (or replaces) the adapter of a language.
     *
     * @param qualifier the adapter
     * @return this registry
     */
    public SymbolQualifiers register(final SymbolQualifier qualifier) {
        Preconditions.requireNonNull(qualifier, "Qualifier is required");
        byLanguage.put(qualifier.language().toLowerCase(Locale.ROOT),
                qualifier);
        return this;
    }

    /**
     * Qualifies a declaration, honouring a parser-supplied name.
     *
     * @param declaration the declaration
     * @param file the owning file
     * @return the qualified name
     */
    public String qualify(final SymbolDeclaration declaration,
            final FileFacts file) {
        if (declaration.qualifiedName() != null
                && !declaration.qualifiedName().isBlank()) {
            return declaration.qualifiedName();
        }
        final SymbolQualifier qualifier = byLanguage.getOrDefault(
                file.language().toLowerCase(Locale.ROOT), DEFAULT);
        return Preconditions.requireNonBlank(
                qualifier.qualify(declaration, file),
                "Qualifier returned a blank name for " + declaration.name());
    }

}
