package co.fanki.zombies.graph.domain;

import co.fanki.zombies.graph.domain.link.SemanticLinker;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static co.fanki.zombies.graph.domain.GraphFixtures.id;
import static co.fanki.zombies.graph.domain.GraphFixtures.java;
import static co.fanki.zombies.graph.domain.GraphFixtures.letter;
import static co.fanki.zombies.graph.domain.GraphFixtures.lettersFile;
import static co.fanki.zombies.graph.domain.GraphFixtures.method;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphBuilder}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphBuilderTest {

    // -- Resolution --------------------------------------------------------

    @Test
    void whenResolving_givenUniqueQualifiedTarget_shouldLinkWithFullStrength() {
        final DependencyGraph graph = GraphFixtures.letters(
                List.of("A", "B"), List.of(), "A>B");

        assertEquals(1, graph.edgeCount());
        final DependencyEdge edge = graph.edge(0);
        assertEquals(letter("A"), edge.sourceId());
        assertEquals(letter("B"), edge.targetId());
        assertEquals(EdgeType.CALLS, edge.type());
        assertEquals(1.0, edge.strength());
        assertFalse(edge.lowConfidence());
        assertEquals("app::src/App.java", edge.contributingFile());
    }

    @Test
    void whenResolving_givenNameDeclaredInTwoRepositories_shouldPreferSameRepository() {
        final FileFacts shared = java("shared", "src/Text.java",
                List.of(method("shared.Text", "format", 3)), List.of());
        final FileFacts billingUtil = java("billing", "src/Util.java",
                List.of(method("billing.Util", "format", 9)), List.of());
        final FileFacts invoice = java("billing", "src/Invoice.java",
                List.of(method("billing.Invoice", "print", 1)),
                List.of(ReferenceFact.of("billing.Invoice.print", "format",
                        EdgeType.CALLS, 2)));

        final DependencyGraph graph = GraphFixtures.build(
                List.of(shared, billingUtil, invoice), List.of());

        assertEquals(1, graph.edgeCount());
        final DependencyEdge edge = graph.edge(0);
        assertEquals(id("billing", "src/Util.java", "billing.Util.format"),
                edge.targetId());
        assertEquals(DependencyEdge.AMBIGUOUS_STRENGTH, edge.strength());
        assertTrue(edge.lowConfidence());
        assertTrue(graph.diagnostics().stream().anyMatch(d ->
                d.kind() == DiagnosticKind.AMBIGUOUS_REFERENCE
                        && "billing::src/Invoice.java".equals(d.fileKey())));
    }

    @Test
    void whenResolving_givenNameDeclaredInReferencingFile_shouldPreferSameFile() {
        final FileFacts helpers = java("billing", "src/Aaa.java",
                List.of(method("billing.Aaa", "format", 1)), List.of());
        final FileFacts invoice = java("billing", "src/Invoice.java",
                List.of(method("billing.Invoice", "print", 1),
                        method("billing.Invoice.Fmt", "format", 20)),
                List.of(ReferenceFact.of("billing.Invoice.print", "format",
                        EdgeType.CALLS, 2)));

        final DependencyGraph graph = GraphFixtures.build(
                List.of(helpers, invoice), List.of());

        assertEquals(1, graph.edgeCount());
        final DependencyEdge edge = graph.edge(0);
        assertEquals(id("billing", "src/Invoice.java",
                "billing.Invoice.Fmt.format"), edge.targetId());
        assertEquals(DependencyEdge.AMBIGUOUS_STRENGTH, edge.strength());
        assertTrue(edge.lowConfidence());
    }

    @Test
    void whenResolving_givenCandidatesInOtherFiles_shouldPreferEarliestDeclaration() {
        final FileFacts zed = java("billing", "src/Zed.java",
                List.of(method("billing.Zed", "format", 1)), List.of());
        final FileFacts util = java("billing", "src/Util.java",
                List.of(method("billing.Util", "format", 9)), List.of());
        final FileFacts invoice = java("billing", "src/Invoice.java",
                List.of(method("billing.Invoice", "print", 1)),
                List.of(ReferenceFact.of("billing.Invoice.print", "format",
                        EdgeType.CALLS, 2)));

        final DependencyGraph graph = GraphFixtures.build(
                List.of(zed, invoice, util), List.of());

        assertEquals(1, graph.edgeCount());
        final DependencyEdge edge = graph.edge(0);
        assertEquals(id("billing", "src/Util.java", "billing.Util.format"),
                edge.targetId());
        assertTrue(edge.lowConfidence());
        assertEquals(1, graph.diagnostics().stream().filter(d ->
                d.kind() == DiagnosticKind.AMBIGUOUS_REFERENCE).count());
    }

    @Test
    void whenResolving_givenUnknownTarget_shouldRecordDanglingReference() {
        final FileFacts file = java("app", "src/Job.java",
                List.of(method("app.Job", "run", 1)),
                List.of(ReferenceFact.of("app.Job.run", "LegacyClient.send",
                        EdgeType.CALLS, 7)));

        final DependencyGraph graph = GraphFixtures.build(List.of(file),
                List.of());

        assertEquals(0, graph.edgeCount());
        assertEquals(1, graph.danglingReferences().size());
        final DanglingReference dangling = graph.danglingReferences().get(0);
        assertEquals(id("app", "src/Job.java", "app.Job.run"),
                dangling.sourceId());
        assertEquals("LegacyClient.send", dangling.target());
        assertEquals(7, dangling.line());
        assertEquals(1, graph.metrics().danglingReferences());
    }

    @Test
    void whenResolving_givenReferenceWithoutEnclosingSymbol_shouldStartFromFileNode() {
        final FileFacts util = java("app", "src/Util.java",
                List.of(new SymbolDeclaration("Util", "app", null,
                        SymbolKind.CLASS, SourceRange.line(1), null, null)),
                List.of());
        final FileFacts main = java("app", "src/Main.java", List.of(),
                List.of(ReferenceFact.of(null, "app.Util", EdgeType.IMPORTS,
                        1)));

        final DependencyGraph graph = GraphFixtures.build(
                List.of(util, main), List.of());

        final String fileNode = SymbolId.file("app", "src/Main.java").value();
        assertTrue(graph.contains(fileNode));
        assertEquals(SymbolKind.FILE,
                graph.symbol(fileNode).orElseThrow().kind());
        assertEquals(fileNode, graph.edge(0).sourceId());
        assertEquals(EdgeType.IMPORTS, graph.edge(0).type());
    }

    @Test
    void whenResolving_givenSelfReference_shouldDropIt() {
        final DependencyGraph graph = GraphFixtures.letters(List.of("A"),
                List.of(), "A>A");

        assertEquals(0, graph.edgeCount());
        assertTrue(graph.danglingReferences().isEmpty());
    }

    @Test
    void whenResolving_givenCycle_shouldKeepBothEdges() {
        final DependencyGraph graph = GraphFixtures.letters(
                List.of("A", "B"), List.of(), "A>B", "B>A");

        assertEquals(2, graph.edgeCount());
    }

    // -- Invariants --------------------------------------------------------

    @Test
    void whenFreezing_givenAnyGraph_shouldOnlyHoldEdgesBetweenKnownNodes() {
        final DependencyGraph graph = GraphFixtures.letters(
                List.of("A", "B", "C"), List.of("A"), "A>B", "B>C", "C>X");

        for (final DependencyEdge edge : graph.edges()) {
            assertTrue(graph.contains(edge.sourceId()));
            assertTrue(graph.contains(edge.targetId()));
        }
        assertEquals(1, graph.danglingReferences().size());
    }

    @Test
    void whenIngesting_givenSameFactsTwice_shouldProduceTheSameGraph() {
        final GraphBuilder builder = GraphFixtures.builder();
        final FileFacts file = lettersFile(List.of("A", "B", "C"),
                "A>B", "B>C");

        builder.ingestAll(List.of(file));
        final DependencyGraph first = builder.freeze();
        builder.ingestAll(List.of(file));
        final DependencyGraph second = builder.freeze();

        assertEquals(first.symbols(), second.symbols());
        assertEquals(first.edges(), second.edges());
        assertEquals(first.diagnostics(), second.diagnostics());
        assertEquals(first.generation() + 1, second.generation());
    }

    @Test
    void whenIngesting_givenDifferentWorkerCounts_shouldProduceIdenticalGraphs()
            throws Exception {
        final List<FileFacts> files = manyFiles(40);

        final DependencyGraph sequential = ingest(files, null);
        final ExecutorService one = Executors.newFixedThreadPool(1);
        final ExecutorService four = Executors.newFixedThreadPool(4);
        try {
            final DependencyGraph single = ingest(files, one);
            final DependencyGraph parallel = ingest(files, four);

            for (final DependencyGraph other : List.of(single, parallel)) {
                assertEquals(sequential.symbols(), other.symbols());
                assertEquals(sequential.edges(), other.edges());
                assertEquals(sequential.danglingReferences(),
                        other.danglingReferences());
                assertEquals(sequential.diagnostics(), other.diagnostics());
            }
        } finally {
            one.shutdownNow();
            four.shutdownNow();
        }
    }

    // -- Incremental merge -------------------------------------------------

    @Test
    void whenReingesting_givenChangedCalls_shouldReplaceTheFileEdges() {
        final GraphBuilder builder = GraphFixtures.builder();
        builder.ingestAll(List.of(lettersFile(List.of("A", "B", "C"),
                "A>B")));

        builder.reingest(lettersFile(List.of("A", "B", "C"), "A>C"));
        final DependencyGraph graph = builder.freeze();

        assertEquals(1, graph.edgeCount());
        assertEquals(letter("C"), graph.edge(0).targetId());
        assertEquals(3, graph.nodeCount());
    }

    @Test
    void whenReingesting_givenOtherFileUnchanged_shouldKeepItsEdges() {
        final GraphBuilder builder = GraphFixtures.builder();
        final FileFacts caller = java("app", "src/Caller.java",
                List.of(method("app.Caller", "go", 1)),
                List.of(ReferenceFact.of("app.Caller.go", "app.App.A",
                        EdgeType.CALLS, 2)));
        builder.ingestAll(List.of(lettersFile(List.of("A", "B"), "A>B"),
                caller));

        builder.reingest(lettersFile(List.of("A", "B")));
        final DependencyGraph graph = builder.freeze();

        assertEquals(1, graph.edgeCount());
        assertEquals(letter("A"), graph.edge(0).targetId());
    }

    @Test
    void whenRestoring_givenFrozenGraph_shouldContinueIncrementalMerges() {
        final DependencyGraph graph = GraphFixtures.letters(
                List.of("A", "B", "C"), List.of("A"), "A>B");

        final GraphBuilder restored = GraphBuilder.restore(graph,
                new SymbolTable(), SemanticLinker.defaults());
        restored.reingest(lettersFile(List.of("A", "B", "C"), "A>B", "B>C"));
        final DependencyGraph next = restored.freeze();

        assertEquals(graph.generation() + 1, next.generation());
        assertEquals(2, next.edgeCount());
        assertEquals(1, next.activeRoots().length);
        assertEquals(letter("A"), next.symbol(next.activeRoots()[0]).id());
    }

    // -- Roots -------------------------------------------------------------

    @Test
    void whenDesignatingRoots_givenUnknownName_shouldReportItAsDiagnostic() {
        final GraphBuilder builder = GraphFixtures.builder();
        builder.ingestAll(List.of(lettersFile(List.of("A"))));

        final List<RootDesignation> unmatched = builder.designateRoots(
                List.of(new RootDesignation("app.Gone.main", RootType.MAIN)));
        final DependencyGraph graph = builder.freeze();

        assertEquals(1, unmatched.size());
        final Diagnostic diagnostic = graph.diagnostics().get(0);
        assertEquals(DiagnosticKind.UNMATCHED_ROOT, diagnostic.kind());
        assertEquals("app.Gone.main", diagnostic.subject());
        assertNull(diagnostic.fileKey());
    }

    @Test
    void whenDesignatingRoots_givenRootDeclaredByLaterFile_shouldApplyItOnIngest() {
        final GraphBuilder builder = GraphFixtures.builder();
        builder.ingestAll(List.of(lettersFile(List.of("A"))));
        builder.designateRoots(List.of(new RootDesignation("app.Late.run",
                RootType.SCHEDULER)));

        builder.ingestAll(List.of(java("app", "src/Late.java",
                List.of(method("app.Late", "run", 1)), List.of())));
        final DependencyGraph graph = builder.freeze();

        assertEquals(1, graph.activeRoots().length);
        final CodeSymbol root = graph.symbol(graph.activeRoots()[0]);
        assertEquals(RootType.SCHEDULER, root.rootType());
        assertTrue(graph.diagnostics().isEmpty());
    }

    @Test
    void whenDesignatingRoots_givenSymbolAlreadyRoot_shouldKeepTheFirstType() {
        final GraphBuilder builder = GraphFixtures.builder();
        builder.ingestAll(List.of(lettersFile(List.of("A"))));

        builder.designateRoots(List.of(
                new RootDesignation("app.App.A", RootType.CONTROLLER),
                new RootDesignation("app.App.A", RootType.TEST)));
        final DependencyGraph graph = builder.freeze();

        assertEquals(RootType.CONTROLLER,
                graph.symbol(letter("A")).orElseThrow().rootType());
    }

    // -- Helpers -----------------------------------------------------------

    private static DependencyGraph ingest(final List<FileFacts> files,
            final ExecutorService executor) {
        final GraphBuilder builder = GraphFixtures.builder();
        builder.ingestAll(files, executor);
        builder.designateRoots(List.of(new RootDesignation("svc.C0.run",
                RootType.CONTROLLER)));
        return builder.freeze();
    }

    /** Files in two repositories calling each other, with ambiguity. */
    private static List<FileFacts> manyFiles(final int count) {
        final List<FileFacts> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            final String repo = i % 2 == 0 ? "svc" : "lib";
            final String container = repo + ".C" + i;
            final List<ReferenceFact> references = List.of(
                    ReferenceFact.of(container + ".run",
                            (i % 2 == 0 ? "lib" : "svc") + ".C"
                                    + ((i + 1) % count) + ".run",
                            EdgeType.CALLS, 2),
                    ReferenceFact.of(container + ".run", "helper",
                            EdgeType.CALLS, 3),
                    ReferenceFact.of(container + ".run", "missing" + i,
                            EdgeType.CALLS, 4));
            files.add(java(repo, "src/C" + i + ".java",
                    List.of(method(container, "run", 1),
                            method(container, "helper", 10)),
                    references,
                    List.of(new TextFragment(FragmentKind.SQL_LITERAL,
                            container + ".run", "executeQuery",
                            "SELECT * FROM t" + (i % 5), 5))));
        }
        return files;
    }

}
