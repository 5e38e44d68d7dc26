package co.fanki.zombies.graph.domain;

/**
 * A non-fatal finding recorded while building or linking the graph.
 *
 * @param kind the category
 * @param detector the component that recorded it (e.g. {@code orm-mapping})
 * @param subject the symbol id or name the finding is about
 * @param message a human readable description
 * @param fileKey the {@code repo::path} of the file involved, or null when
 *        the finding is not tied to a file
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Diagnostic(
        DiagnosticKind kind,
        String detector,
        String subject,
        String message,
        String fileKey) {}
