package co.fanki.zombies.analysis.domain;

import co.fanki.zombies.shared.Preconditions;

import java.util.EnumSet;
import java.util.Set;

/**
 * Narrows the items of a zombie report.
 *
 * <p>Every criterion is optional; an empty classification set, a null
 * minimum confidence or a null repository matches everything.</p>
 *
 * @param classifications the accepted classifications
 * @param minConfidence the lowest accepted confidence, 0.0 to 1.0
 * @param repository the accepted repository
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ZombieFilter(
        Set<ZombieClassification> classifications,
        Double minConfidence,
        String repository) {

    /** Matches every item. */
    public static final ZombieFilter NONE = new ZombieFilter(null, null, null);

    /** Validates the bounds and copies the classifications. */
    public ZombieFilter {
        classifications = classifications == null || classifications.isEmpty()
                ? Set.of() : Set.copyOf(EnumSet.copyOf(classifications));
        if (minConfidence != null) {
            Preconditions.require(minConfidence >= 0.0 && minConfidence <= 1.0,
                    "Minimum confidence must be between 0 and 1");
        }
        repository = repository == null || repository.isBlank()
                ? null : repository;
    }

    /**
     * Checks an item against every criterion.
     *
     * @param item the report item
     * @return true if the item is kept
     */
    public boolean matches(final ZombieItem item) {
        return (classifications.isEmpty()
                        || classifications.contains(item.classification()))
                && (minConfidence == null
                        || item.confidence() >= minConfidence)
                && (repository == null
                        || repository.equals(item.repository()));
    }

}
