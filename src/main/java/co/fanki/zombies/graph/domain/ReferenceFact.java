package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;

/**
 * A raw reference as written in source: a call target, an import, a super
 * type.
 *
 * @param fromQualifiedName the qualified name of the enclosing symbol, or
 *        null when the reference sits at file level (imports)
 * @param target the target text as written (simple, qualified or id)
 * @param type the relationship the reference expresses
 * @param line the source line
 * @param context free-form context distinguishing otherwise equal edges
 *        (e.g. call-site signature), may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ReferenceFact(
        String fromQualifiedName,
        String target,
        EdgeType type,
        int line,
        String context) {

    /** Validates the fact. */
    public ReferenceFact {
        Preconditions.requireNonBlank(target, "Reference target is required");
        Preconditions.requireNonNull(type, "Reference type is required");
        context = context == null ? "" : context;
    }

    /**
     * Creates a reference without context.
     *
     * @param from the enclosing qualified name, may be null
     * @param target the target text
     * @param type the relationship
     * @param line the line
     * @return the reference
     */
    public static ReferenceFact of(final String from, final String target,
            final EdgeType type, final int line) {
        return new ReferenceFact(from, target, type, line, "");
    }
}
