package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;

/**
 * An entry point designation from the root-node configuration.
 *
 * @param qualifiedSymbolName the qualified name or full id of the symbol
 * @param rootType why the symbol is a root
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RootDesignation(String qualifiedSymbolName, RootType rootType) {

    /** Validates the designation. */
    public RootDesignation {
        Preconditions.requireNonBlank(qualifiedSymbolName,
                "Root symbol name is required");
        Preconditions.requireNonNull(rootType, "Root type is required");
    }
}
