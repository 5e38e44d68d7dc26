package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;

/**
 * A raw text fragment consumed by the semantic linker.
 *
 * @param kind the fragment kind
 * @param ownerQualifiedName the enclosing symbol, null for whole-file
 *        fragments
 * @param callee the data-access call the fragment is an argument of
 *        (e.g. {@code prepareCall}), null when not applicable
 * @param text the fragment text
 * @param line the line the fragment starts at
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TextFragment(
        FragmentKind kind,
        String ownerQualifiedName,
        String callee,
        String text,
        int line) {

    /** Validates the fragment. */
    public TextFragment {
        Preconditions.requireNonNull(kind, "Fragment kind is required");
        Preconditions.requireNonNull(text, "Fragment text is required");
    }

    /**
     * Creates a whole-file fragment (mapping file, script).
     *
     * @param kind the kind
     * @param text the file content
     * @return the fragment
     */
    public static TextFragment wholeFile(final FragmentKind kind,
            final String text) {
        return new TextFragment(kind, null, null, text, 1);
    }
}
