package co.fanki.zombies.analysis.domain;

/**
 * Coarse bucket of a zombie confidence score.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ConfidenceLevel {

    HIGH,

    MEDIUM,

    LOW;

    /**
     * Buckets a score.
     *
     * @param score the score, 0.0 to 1.0
     * @return HIGH from 0.8, MEDIUM from 0.5, LOW below
     */
    public static ConfidenceLevel of(final double score) {
        if (score >= 0.8) {
            return HIGH;
        }
        return score >= 0.5 ? MEDIUM : LOW;
    }

}
