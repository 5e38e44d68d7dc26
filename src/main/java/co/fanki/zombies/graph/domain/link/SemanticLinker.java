package co.fanki.zombies.graph.domain.link;

import co.fanki.zombies.graph.domain.DiagnosticKind;
import co.fanki.zombies.graph.domain.FileFacts;
import co.fanki.zombies.graph.domain.TextFragment;
import co.fanki.zombies.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs the registered {@link LinkDetector}s over the fragments of a file.
 *
 * <p>Fragments are processed one at a time. A detector failing on a
 * fragment is logged and recorded as a malformed-fragment diagnostic; the
 * remaining fragments and detectors still run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SemanticLinker {

    private static final Logger LOG = LoggerFactory.getLogger(
            SemanticLinker.class);

    private final List<LinkDetector> detectors;

    /**
     * Creates a linker.
     *
     * @param theDetectors the detectors, run in list order
     */
    public SemanticLinker(final List<LinkDetector> theDetectors) {
        Preconditions.requireNonNull(theDetectors, "Detectors are required");
        this.detectors = List.copyOf(theDetectors);
    }

    /**
     * Creates a linker with the built-in detectors.
     *
     * @return the linker
     */
    public static SemanticLinker defaults() {
        return of(SemanticLinkConfig.ALL);
    }

    /**
     * Creates a linker with the enabled built-in detector families.
     *
     * @param config the enabled families
     * @return the linker
     */
    public static SemanticLinker of(final SemanticLinkConfig config) {
        Preconditions.requireNonNull(config, "Link config is required");
        final List<LinkDetector> enabled = new ArrayList<>();
        if (config.ormMapping()) {
            enabled.add(new OrmMappingDetector());
        }
        if (config.storedProcedures()) {
            enabled.add(new StoredProcedureDetector());
        }
        if (config.schedulerScripts()) {
            enabled.add(new SchedulerScriptDetector());
        }
        if (config.sqlTableAccess()) {
            enabled.add(new SqlTableAccessDetector());
        }
        if (enabled.size() < 4) {
            LOG.info("Semantic link detectors enabled: {}", enabled.stream()
                    .map(LinkDetector::name).toList());
        }
        return new SemanticLinker(enabled);
    }

    /**
     * Runs the index phase of every detector over a file.
     *
     * @param file the file
     * @param context the link context of the file
     */
    public void index(final FileFacts file, final LinkContext context) {
        for (final TextFragment fragment : file.fragments()) {
            for (final LinkDetector detector : supporting(fragment, file)) {
                try {
                    detector.index(file, fragment, context);
                } catch (RuntimeException e) {
                    skip(detector, file, fragment, context, e);
                }
            }
        }
    }

    /**
     * Runs the link phase of every detector over a file.
     *
     * @param file the file
     * @param context the link context of the file
     */
    public void link(final FileFacts file, final LinkContext context) {
        for (final TextFragment fragment : file.fragments()) {
            for (final LinkDetector detector : supporting(fragment, file)) {
                try {
                    detector.link(file, fragment, context);
                } catch (RuntimeException e) {
                    skip(detector, file, fragment, context, e);
                }
            }
        }
        for (final LinkDetector detector : detectors) {
            try {
                detector.linkFile(file, context);
            } catch (RuntimeException e) {
                LOG.warn("Detector {} failed on file {}: {}",
                        detector.name(), file.fileKey(), e.getMessage());
                context.diagnose(DiagnosticKind.MALFORMED_FRAGMENT,
                        detector.name(), file.fileKey(),
                        String.valueOf(e.getMessage()));
            }
        }
    }

    /**
     * Drops the index state of a file from every detector.
     *
     * @param fileKey the file key
     */
    public void forget(final String fileKey) {
        for (final LinkDetector detector : detectors) {
            detector.forget(fileKey);
        }
    }

    /** @return the registered detectors */
    public List<LinkDetector> detectors() {
        return detectors;
    }

    private List<LinkDetector> supporting(final TextFragment fragment,
            final FileFacts file) {
        final String language = file.language().toLowerCase(Locale.ROOT);
        return detectors.stream()
                .filter(d -> d.supports(fragment.kind(), language))
                .toList();
    }

    private void skip(final LinkDetector detector, final FileFacts file,
            final TextFragment fragment, final LinkContext context,
            final RuntimeException e) {
        LOG.warn("Detector {} skipped {} fragment at {}:{}: {}",
                detector.name(), fragment.kind(), file.fileKey(),
                fragment.line(), e.getMessage());
        context.diagnose(DiagnosticKind.MALFORMED_FRAGMENT, detector.name(),
                file.fileKey() + ":" + fragment.line(),
                String.valueOf(e.getMessage()));
    }

}
