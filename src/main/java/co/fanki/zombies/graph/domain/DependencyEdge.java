package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;

import java.util.Comparator;

/**
 * A directed relationship between two symbols of the graph.
 *
 * @param sourceId the dependent symbol id
 * @param targetId the dependency symbol id
 * @param type the relationship type
 * @param access the access sub-kind, only for {@link EdgeType#ACCESSES}
 * @param strength the confidence in the relationship, 0.0 to 1.0
 * @param lowConfidence true when the target was picked among several
 *        candidates by the tie-break policy
 * @param context free-form context that distinguishes otherwise equal edges
 * @param contributingFile the {@code repo::path} key of the file whose facts
 *        produced the edge
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DependencyEdge(
        String sourceId,
        String targetId,
        EdgeType type,
        AccessKind access,
        double strength,
        boolean lowConfidence,
        String context,
        String contributingFile) {

    /** Strength of an edge resolved to a single candidate. */
    public static final double FULL_STRENGTH = 1.0;

    /** Strength of an edge resolved through the tie-break policy. */
    public static final double AMBIGUOUS_STRENGTH = 0.5;

    /** Canonical edge order: source, target, type, access, context. */
    public static final Comparator<DependencyEdge> ORDER =
            Comparator.comparing(DependencyEdge::sourceId)
                    .thenComparing(DependencyEdge::targetId)
                    .thenComparing(DependencyEdge::type)
                    .thenComparing(e -> e.access() == null
                            ? "" : e.access().name())
                    .thenComparing(DependencyEdge::context);

    /** Validates the edge invariants. */
    public DependencyEdge {
        Preconditions.requireNonBlank(sourceId, "Source id is required");
        Preconditions.requireNonBlank(targetId, "Target id is required");
        Preconditions.requireNonNull(type, "Edge type is required");
        Preconditions.require(!sourceId.equals(targetId),
                "Self-loop edges are not allowed: " + sourceId);
        Preconditions.require((type == EdgeType.ACCESSES) == (access != null),
                "Access kind must be set exactly for ACCESSES edges");
        Preconditions.require(strength >= 0.0 && strength <= 1.0,
                "Strength must be between 0.0 and 1.0");
        Preconditions.requireNonBlank(contributingFile,
                "Contributing file is required");
        context = context == null ? "" : context;
    }

    /**
     * Creates a fully confident edge.
     *
     * @param sourceId the source
     * @param targetId the target
     * @param type the type, not ACCESSES
     * @param contributingFile the contributing file key
     * @return the edge
     */
    public static DependencyEdge of(final String sourceId,
            final String targetId, final EdgeType type,
            final String contributingFile) {
        return new DependencyEdge(sourceId, targetId, type, null,
                FULL_STRENGTH, false, "", contributingFile);
    }

    /**
     * Returns the deduplication key of this edge.
     *
     * @return the key
     */
    public Key key() {
        return new Key(sourceId, targetId, type, access, context);
    }

    /**
     * Picks which of two edges sharing a key survives.
     *
     * <p>The stronger edge wins; on equal strength the one contributed by
     * the lexicographically smaller file, so the outcome never depends on
     * the order edges were added in.</p>
     *
     * @param other an edge with the same key
     * @return the surviving edge
     */
    public DependencyEdge preferred(final DependencyEdge other) {
        if (strength != other.strength) {
            return strength > other.strength ? this : other;
        }
        return contributingFile.compareTo(other.contributingFile) <= 0
                ? this : other;
    }

    /**
     * Deduplication key: edges are unique by source, target, type (with
     * access sub-kind) and context.
     *
     * @param sourceId the source
     * @param targetId the target
     * @param type the type
     * @param access the access kind or null
     * @param context the context
     */
    public record Key(String sourceId, String targetId, EdgeType type,
            AccessKind access, String context) {}
}
