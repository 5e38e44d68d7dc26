package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.graph.domain.FileFacts;
import co.fanki.zombies.graph.domain.FragmentKind;
import co.fanki.zombies.graph.domain.TextFragment;

/**
 * Strategy inferring implicit edges from raw text fragments.
 *
 * <p>Detectors run in two phases separated by a barrier: {@link #index}
 * over every file first, then {@link #link}. State built during indexing
 * (e.g. the mapping statements known per namespace) is complete before the
 * first link call. Both phases may be called concurrently for different
 * files, so any index must be thread safe.</p>
 *
 * <p>A detector may throw on a fragment it cannot parse; the
 * {@link SemanticLinker} records it and moves on to the next fragment.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface LinkDetector {

    /**
     * Returns the detector name used in diagnostics and logs.
     *
     * @return the name, e.g. {@code orm-mapping}
     */
    String name();

    /**
     * Checks if this detector handles a fragment kind in a language.
     *
     * @param kind the fragment kind
     * @param language the file language, lower case
     * @return true if the fragment should be handed to this detector
     */
    boolean supports(FragmentKind kind, String language);

    /**
     * Indexes a fragment. Called for every supported fragment of every file
     * before any {@link #link} call.
     *
     * @param file the file the fragment belongs to
     * @param fragment the fragment
     * @param context the link context of the file
     */
    default void index(final FileFacts file, final TextFragment fragment,
            final LinkContext context) {
    }

    /**
     * Emits the edges inferred from a fragment.
     *
     * @param file the file the fragment belongs to
     * @param fragment the fragment
     * @param context the link context of the file
     */
    void link(FileFacts file, TextFragment fragment, LinkContext context);

    /**
     * Runs once per file in the link phase, after its fragments, for
     * detectors that infer links from declarations rather than fragments.
     *
     * @param file the file
     * @param context the link context of the file
     */
    default void linkFile(final FileFacts file, final LinkContext context) {
    }

    /**
     * Drops everything indexed from a file, before it is ingested again.
     *
     * @param fileKey the {@code repo::path} key of the file
     */
    default void forget(final String fileKey) {
    }

}
