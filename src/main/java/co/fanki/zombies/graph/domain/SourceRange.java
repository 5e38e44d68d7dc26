package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;

/**
 * Line range of a declaration within its file (1-based, inclusive).
 *
 * @param startLine the first line
 * @param endLine the last line, never before {@code startLine}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceRange(int startLine, int endLine) {

    /** Range used for synthesized nodes that have no location. */
    public static final SourceRange UNKNOWN = new SourceRange(0, 0);

    /** Validates the range. */
    public SourceRange {
        Preconditions.requireNonNegative(startLine,
                "Start line must be non-negative");
        Preconditions.require(endLine >= startLine,
                "End line must not precede start line");
    }

    /**
     * Creates a single-line range.
     *
     * @param line the line
     * @return the range
     */
    public static SourceRange line(final int line) {
        return new SourceRange(line, line);
    }
}
