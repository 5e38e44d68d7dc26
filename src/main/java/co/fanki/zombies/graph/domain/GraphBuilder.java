package co.fanki.zombies.graph.domain;

import co.fanki.zombies.graph.domain.link.LinkContext;
import co.fanki.zombies.graph.domain.link.SemanticLinker;
import co.fanki.zombies.shared.DomainException;
import co.fanki.zombies.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Builds the dependency graph from per-file parse facts.
 *
 * <p>Ingestion runs in four phases separated by barriers, each parallel
 * across files: declare (intern every symbol), resolve (turn references
 * into edges), index and link (the semantic detectors). A reference can
 * therefore always see every declaration, whatever the file order.</p>
 *
 * <p>Edges, dangling references and diagnostics are kept per contributing
 * file. Re-ingesting a file replaces exactly what that file contributed;
 * nodes are never removed. {@link #freeze()} merges the contributions into
 * an immutable {@link DependencyGraph}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphBuilder.class);

    private final SymbolTable symbols;
    private final SemanticLinker linker;
    private final Map<String, Contribution> contributions =
            new ConcurrentHashMap<>();
    private final List<RootDesignation> designations =
            new CopyOnWriteArrayList<>();
    private final List<Diagnostic> rootDiagnostics =
            new CopyOnWriteArrayList<>();
    private final AtomicLong generation;

    /**
     * Creates a builder.
     *
     * @param theSymbols the symbol table to intern into
     * @param theLinker the semantic linker
     */
    public GraphBuilder(final SymbolTable theSymbols,
            final SemanticLinker theLinker) {
        this(theSymbols, theLinker, 0L);
    }

    /**
     * Creates a builder whose first frozen generation follows another.
     *
     * @param theSymbols the symbol table to intern into
     * @param theLinker the semantic linker
     * @param theGeneration the last generation already handed out
     */
    public GraphBuilder(final SymbolTable theSymbols,
            final SemanticLinker theLinker, final long theGeneration) {
        this.symbols = Preconditions.requireNonNull(theSymbols,
                "Symbol table is required");
        this.linker = Preconditions.requireNonNull(theLinker,
                "Semantic linker is required");
        this.generation = new AtomicLong(Preconditions.requireNonNegative(
                theGeneration, "Generation must not be negative"));
    }

    /**
     * Recreates a builder from a frozen graph, to continue incremental
     * merges on a loaded snapshot.
     *
     * @param graph the graph
     * @param theSymbols an empty symbol table
     * @param theLinker the semantic linker
     * @return the builder, holding the graph's nodes and contributions
     */
    public static GraphBuilder restore(final DependencyGraph graph,
            final SymbolTable theSymbols, final SemanticLinker theLinker) {
        Preconditions.requireNonNull(graph, "Graph is required");
        final GraphBuilder builder = new GraphBuilder(theSymbols, theLinker,
                graph.generation());

        graph.symbols().forEach(theSymbols::upsert);
        for (final DependencyEdge edge : graph.edges()) {
            builder.contribution(edge.contributingFile()).add(edge);
        }
        for (final DanglingReference dangling : graph.danglingReferences()) {
            builder.contribution(dangling.fileKey()).dangling(dangling);
        }
        for (final Diagnostic diagnostic : graph.diagnostics()) {
            if (diagnostic.fileKey() == null) {
                builder.rootDiagnostics.add(diagnostic);
            } else {
                builder.contribution(diagnostic.fileKey())
                        .diagnose(diagnostic);
            }
        }
        LOG.info("Restored builder at generation {} with {} files",
                graph.generation(), builder.contributions.size());
        return builder;
    }

    // -- Ingestion ---------------------------------------------------------

    /**
     * Ingests a batch of files on the calling thread.
     *
     * @param files the files
     */
    public void ingestAll(final Collection<FileFacts> files) {
        ingestAll(files, null);
    }

    /**
     * Ingests a batch of files, each phase in parallel on the executor.
     *
     * <p>Files already known are replaced, as with {@link #reingest}. When
     * the batch holds the same file twice, the later facts win.</p>
     *
     * @param files the files
     * @param executor the worker pool, or null to run on the caller
     * @throws DomainException with code {@code INGESTION_FAILED} if a worker
     *         fails or the calling thread is interrupted
     */
    public void ingestAll(final Collection<FileFacts> files,
            final ExecutorService executor) {
        Preconditions.requireNonNull(files, "Files are required");

        final Map<String, FileFacts> byKey = new LinkedHashMap<>();
        for (final FileFacts file : files) {
            byKey.put(file.fileKey(), file);
        }
        final List<FileFacts> batch = new ArrayList<>(byKey.values());

        final long start = System.currentTimeMillis();
        runPhase("declare", batch, executor, this::declare);
        runPhase("resolve", batch, executor, this::resolve);
        runPhase("index", batch, executor, this::index);
        runPhase("link", batch, executor, this::link);
        reapplyRoots();

        LOG.info("Ingested {} files in {} ms, {} symbols", batch.size(),
                System.currentTimeMillis() - start, symbols.size());
    }

    /**
     * Replaces everything a file contributed with its new facts.
     *
     * <p>The file's edges, dangling references and diagnostics are dropped,
     * its symbols declared again (existing nodes stay), its references
     * resolved and the detectors re-run for it.</p>
     *
     * @param file the new facts of the file
     */
    public void reingest(final FileFacts file) {
        Preconditions.requireNonNull(file, "File facts are required");
        declare(file);
        resolve(file);
        index(file);
        link(file);
        reapplyRoots();
        LOG.info("Re-ingested {}", file.fileKey());
    }

    /**
     * Declare phase for one file: resets its contribution and interns its
     * symbols.
     *
     * @param file the file
     */
    void declare(final FileFacts file) {
        contributions.put(file.fileKey(), new Contribution());
        linker.forget(file.fileKey());

        for (final SymbolDeclaration declaration : file.declarations()) {
            symbols.intern(declaration, file);
        }
        final boolean script = file.fragments().stream()
                .anyMatch(f -> f.kind() == FragmentKind.SCRIPT);
        if (script) {
            symbols.upsert(CodeSymbol.fileOf(file.repository(),
                    file.filePath(), file.language(),
                    SymbolKind.SCHEDULER_SCRIPT));
        }
    }

    /**
     * Resolve phase for one file: turns its references into edges.
     *
     * @param file the file
     */
    void resolve(final FileFacts file) {
        final Contribution contribution = contribution(file.fileKey());
        for (final ReferenceFact reference : file.references()) {
            final CodeSymbol source = sourceOf(reference, file);
            final List<CodeSymbol> candidates = symbols
                    .candidates(reference.target()).stream()
                    .filter(GraphBuilder::resolvable)
                    .filter(c -> !c.id().equals(source.id()))
                    .toList();

            if (candidates.isEmpty()) {
                if (isSelfReference(reference, source)) {
                    LOG.debug("Dropping self reference of {}", source.id());
                } else {
                    contribution.dangling(new DanglingReference(source.id(),
                            reference.target(), reference.type(),
                            file.fileKey(), reference.line()));
                }
                continue;
            }

            if (candidates.size() == 1) {
                contribution.add(new DependencyEdge(source.id(),
                        candidates.get(0).id(), reference.type(),
                        accessOf(reference),
                        DependencyEdge.FULL_STRENGTH, false,
                        reference.context(), file.fileKey()));
                continue;
            }

            final CodeSymbol chosen = tieBreak(candidates, file);
            contribution.add(new DependencyEdge(source.id(), chosen.id(),
                    reference.type(), accessOf(reference),
                    DependencyEdge.AMBIGUOUS_STRENGTH,
                    true, reference.context(), file.fileKey()));
            contribution.diagnose(new Diagnostic(
                    DiagnosticKind.AMBIGUOUS_REFERENCE, "resolver",
                    source.id(), "'" + reference.target() + "' matched "
                            + candidates.size() + " symbols, linked to "
                            + chosen.id(), file.fileKey()));
        }
    }

    /**
     * Detector index phase for one file.
     *
     * @param file the file
     */
    void index(final FileFacts file) {
        linker.index(file, linkContext(file));
    }

    /**
     * Detector link phase for one file.
     *
     * @param file the file
     */
    void link(final FileFacts file) {
        linker.link(file, linkContext(file));
    }

    // -- Roots -------------------------------------------------------------

    /**
     * Designates active roots.
     *
     * <p>Designations are remembered and applied again after every
     * ingestion, so a root declared by a later file is picked up.</p>
     *
     * @param roots the designations
     * @return the designations that matched no symbol
     */
    public List<RootDesignation> designateRoots(
            final Collection<RootDesignation> roots) {
        Preconditions.requireNonNull(roots, "Designations are required");
        designations.addAll(roots);
        return reapplyRoots();
    }

    private List<RootDesignation> reapplyRoots() {
        if (designations.isEmpty()) {
            return List.of();
        }
        final List<RootDesignation> unmatched =
                symbols.designateRoots(designations);
        rootDiagnostics.clear();
        for (final RootDesignation designation : unmatched) {
            rootDiagnostics.add(new Diagnostic(DiagnosticKind.UNMATCHED_ROOT,
                    "roots", designation.qualifiedSymbolName(),
                    "Root " + designation.rootType() + " "
                            + designation.qualifiedSymbolName()
                            + " matched no symbol", null));
        }
        return unmatched;
    }

    // -- Freeze ------------------------------------------------------------

    /**
     * Freezes the current state into a new graph generation.
     *
     * @return the graph
     */
    public DependencyGraph freeze() {
        final Map<DependencyEdge.Key, DependencyEdge> edges = new HashMap<>();
        final List<DanglingReference> dangling = new ArrayList<>();
        final Set<Diagnostic> diagnostics = new LinkedHashSet<>(
                rootDiagnostics);

        for (final Contribution contribution : contributions.values()) {
            synchronized (contribution) {
                for (final DependencyEdge edge
                        : contribution.edges.values()) {
                    edges.merge(edge.key(), edge, DependencyEdge::preferred);
                }
                dangling.addAll(contribution.dangling);
                diagnostics.addAll(contribution.diagnostics);
            }
        }

        final DependencyGraph graph = DependencyGraph.freeze(
                generation.incrementAndGet(), symbols.all(), edges.values(),
                dangling, diagnostics);
        LOG.info("Froze generation {}: {} nodes, {} edges, {} dangling",
                graph.generation(), graph.nodeCount(), graph.edgeCount(),
                dangling.size());
        return graph;
    }

    /** @return the symbol table */
    public SymbolTable symbols() {
        return symbols;
    }

    /** @return the number of files with contributions */
    public int fileCount() {
        return contributions.size();
    }

    // -- Internals ---------------------------------------------------------

    private CodeSymbol sourceOf(final ReferenceFact reference,
            final FileFacts file) {
        final String from = reference.fromQualifiedName();
        if (from != null && !from.isBlank()) {
            final Optional<CodeSymbol> declared = symbols.find(SymbolId.of(
                    file.repository(), file.filePath(), from).value());
            if (declared.isPresent()) {
                return declared.get();
            }
            LOG.debug("Enclosing symbol {} not declared in {}", from,
                    file.fileKey());
        }
        return symbols.upsert(CodeSymbol.fileOf(file.repository(),
                file.filePath(), file.language(), SymbolKind.FILE));
    }

    /** Parsers report table access without a direction; read is assumed. */
    private static AccessKind accessOf(final ReferenceFact reference) {
        return reference.type() == EdgeType.ACCESSES ? AccessKind.READ : null;
    }

    private static boolean isSelfReference(final ReferenceFact reference,
            final CodeSymbol source) {
        final String target = reference.target();
        return target.equals(source.id())
                || target.equals(source.qualifiedName())
                || target.equals(source.name());
    }

    /**
     * Reference targets are declared code symbols. Phantoms, file nodes and
     * mapping statements are created by the linker, after resolution.
     */
    private static boolean resolvable(final CodeSymbol symbol) {
        return !symbol.phantom()
                && symbol.kind() != SymbolKind.FILE
                && symbol.kind() != SymbolKind.SCHEDULER_SCRIPT
                && symbol.kind() != SymbolKind.XML_STATEMENT;
    }

    /**
     * Same repository first, then same file, then earliest declaration.
     */
    private static CodeSymbol tieBreak(final List<CodeSymbol> candidates,
            final FileFacts file) {
        final String fileKey = file.fileKey();
        final Comparator<CodeSymbol> order = Comparator
                .comparing((CodeSymbol c) ->
                        !c.repository().equals(file.repository()))
                .thenComparing(c -> !c.fileKey().equals(fileKey))
                .thenComparing(CodeSymbol.DECLARATION_ORDER);
        return candidates.stream().min(order).orElseThrow();
    }

    private LinkContext linkContext(final FileFacts file) {
        final Contribution contribution = contribution(file.fileKey());
        final Consumer<DependencyEdge> edges = contribution::add;
        final Consumer<Diagnostic> diagnostics = contribution::diagnose;
        return new LinkContext(symbols, file, edges, diagnostics);
    }

    private Contribution contribution(final String fileKey) {
        return contributions.computeIfAbsent(fileKey, k -> new Contribution());
    }

    private void runPhase(final String phase, final List<FileFacts> files,
            final ExecutorService executor, final Consumer<FileFacts> step) {
        if (executor == null) {
            files.forEach(step);
            return;
        }
        final List<Callable<Void>> tasks = new ArrayList<>(files.size());
        for (final FileFacts file : files) {
            tasks.add(() -> {
                step.accept(file);
                return null;
            });
        }
        try {
            for (final Future<Void> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DomainException("Ingestion interrupted during "
                    + phase, "INGESTION_FAILED", e);
        } catch (ExecutionException e) {
            throw new DomainException("Ingestion failed during " + phase
                    + ": " + e.getCause().getMessage(), "INGESTION_FAILED",
                    e.getCause());
        }
        LOG.debug("Phase {} done for {} files", phase, files.size());
    }

    /** What one file contributed to the graph. */
    private static final class Contribution {

        private final Map<DependencyEdge.Key, DependencyEdge> edges =
                new HashMap<>();

        private final List<DanglingReference> dangling = new ArrayList<>();

        private final Set<Diagnostic> diagnostics = new LinkedHashSet<>();

        private synchronized void add(final DependencyEdge edge) {
            edges.merge(edge.key(), edge, DependencyEdge::preferred);
        }

        private synchronized void dangling(final DanglingReference ref) {
            dangling.add(ref);
        }

        private synchronized void diagnose(final Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
        }
    }

}
