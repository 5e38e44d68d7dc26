package co.fanki.zombies.analysis.domain;

import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DependencyEdge;
import co.fanki.zombies.graph.domain.DependencyGraph;
import co.fanki.zombies.graph.domain.EdgeType;
import co.fanki.zombies.graph.domain.RootType;
import co.fanki.zombies.graph.domain.SourceRange;
import co.fanki.zombies.graph.domain.SymbolKind;
import co.fanki.zombies.graph.domain.Visibility;
import co.fanki.zombies.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static co.fanki.zombies.graph.domain.GraphFixtures.letter;
import static co.fanki.zombies.graph.domain.GraphFixtures.letters;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ReachabilityAnalyzer}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ReachabilityAnalyzerTest {

    private final ReachabilityAnalyzer analyzer = new ReachabilityAnalyzer(
            1_000_000, Duration.ofSeconds(30));

    private static int at(final DependencyGraph graph, final String letter) {
        return graph.indexOf(letter(letter));
    }

    @Test
    void whenAnalyzing_givenIsolatedNode_shouldClassifyItAsDeadCode() {
        final DependencyGraph graph = letters(List.of("A", "B", "C", "D"),
                List.of("A"), "A>B", "B>C");

        final ReachabilityResult result = analyzer.analyze(graph);

        assertEquals(RunStatus.COMPLETE, result.status());
        assertEquals(3, result.reachableCount());
        assertEquals(1, result.zombieCount());
        assertTrue(result.isReachable(at(graph, "C")));
        assertFalse(result.isReachable(at(graph, "D")));
        assertEquals(ZombieClassification.DEAD_CODE,
                result.classification(at(graph, "D")));
        assertNull(result.classification(at(graph, "A")));
    }

    @Test
    void whenAnalyzing_givenCallerOfReachableNode_shouldBeUnreachable() {
        final DependencyGraph graph = letters(List.of("A", "B", "C"),
                List.of("A"), "A>B", "C>B");

        final ReachabilityResult result = analyzer.analyze(graph);

        assertEquals(2, result.reachableCount());
        assertTrue(result.isReachable(at(graph, "B")));
        assertEquals(ZombieClassification.UNREACHABLE,
                result.classification(at(graph, "C")));
    }

    @Test
    void whenAnalyzing_givenNodeOnlyUsedByZombies_shouldBeOrphaned() {
        final DependencyGraph graph = letters(List.of("A", "B", "C", "D"),
                List.of("A"), "A>B", "C>D");

        final ReachabilityResult result = analyzer.analyze(graph);

        assertEquals(ZombieClassification.UNREACHABLE,
                result.classification(at(graph, "C")));
        assertEquals(ZombieClassification.ORPHANED,
                result.classification(at(graph, "D")));
    }

    @Test
    void whenAnalyzing_givenCycles_shouldTerminate() {
        final DependencyGraph graph = letters(
                List.of("A", "B", "C", "D", "E", "F"), List.of("A"),
                "A>B", "B>C", "C>A", "C>D", "E>F", "F>E");

        final ReachabilityResult result = analyzer.analyze(graph);

        assertEquals(RunStatus.COMPLETE, result.status());
        assertEquals(4, result.reachableCount());
        assertEquals(ZombieClassification.ORPHANED,
                result.classification(at(graph, "E")));
        assertEquals(ZombieClassification.ORPHANED,
                result.classification(at(graph, "F")));
    }

    @Test
    void whenAnalyzing_givenAddedEdge_shouldNeverShrinkReachableSet() {
        final List<String> nodes = List.of("A", "B", "C", "D", "E");
        final ReachabilityResult before = analyzer.analyze(letters(nodes,
                List.of("A"), "A>B", "D>E"));
        final ReachabilityResult after = analyzer.analyze(letters(nodes,
                List.of("A"), "A>B", "D>E", "B>D"));

        final BitSet lost = before.reachable();
        lost.andNot(after.reachable());
        assertTrue(lost.isEmpty());
        assertEquals(4, after.reachableCount());
    }

    @Test
    void whenAnalyzing_givenStepBudget_shouldReturnValidPrefix() {
        final DependencyGraph graph = letters(
                List.of("A", "B", "C", "D", "E"), List.of("A"),
                "A>B", "B>C", "C>D", "D>E");

        final ReachabilityResult partial = new ReachabilityAnalyzer(2,
                Duration.ofSeconds(30)).analyze(graph);
        final ReachabilityResult full = analyzer.analyze(graph);

        assertEquals(RunStatus.PARTIAL, partial.status());
        assertTrue(partial.timedOut());
        assertEquals(2, partial.steps());
        assertEquals(3, partial.reachableCount());
        final BitSet extra = partial.reachable();
        extra.andNot(full.reachable());
        assertTrue(extra.isEmpty());
    }

    @Test
    void whenAnalyzing_givenExpiredTimeBudget_shouldStopBetweenLayers() {
        final AtomicLong clock = new AtomicLong();
        final ReachabilityAnalyzer slow = new ReachabilityAnalyzer(1_000,
                Duration.ofMillis(1_500),
                () -> clock.getAndAdd(1_000_000_000L));
        final DependencyGraph graph = letters(List.of("A", "B", "C", "D"),
                List.of("A"), "A>B", "B>C", "C>D");

        final ReachabilityResult result = slow.analyze(graph);

        assertEquals(RunStatus.PARTIAL, result.status());
        assertEquals(1, result.layers());
        assertTrue(result.isReachable(at(graph, "B")));
        assertFalse(result.isReachable(at(graph, "C")));
    }

    @Test
    void whenAnalyzing_givenCancellation_shouldReportCancelled() {
        final DependencyGraph graph = letters(List.of("A", "B"),
                List.of("A"), "A>B");

        final ReachabilityResult result = analyzer.analyze(graph,
                List.of(letter("A")), () -> true);

        assertEquals(RunStatus.CANCELLED, result.status());
        assertFalse(result.complete());
        assertEquals(1, result.reachableCount());
    }

    @Test
    void whenAnalyzing_givenAlternativeRoots_shouldStartFromThem() {
        final DependencyGraph graph = letters(List.of("A", "B", "C", "D"),
                List.of("A"), "A>B", "C>D");

        final ReachabilityResult result = analyzer.analyze(graph,
                List.of(letter("C")), () -> false);

        assertTrue(result.isReachable(at(graph, "D")));
        assertFalse(result.isReachable(at(graph, "A")));
        assertEquals(1, result.roots().length);
    }

    @Test
    void whenAnalyzing_givenUnknownRoot_shouldFail() {
        final DependencyGraph graph = letters(List.of("A"), List.of("A"));

        final DomainException error = assertThrows(DomainException.class,
                () -> analyzer.analyze(graph, List.of("nope"), () -> false));
        assertEquals("SYMBOL_NOT_FOUND", error.getErrorCode());
    }

    @Test
    void whenAnalyzing_givenNoRoots_shouldMarkEverythingAsZombie() {
        final DependencyGraph graph = letters(List.of("A", "B"), List.of(),
                "A>B");

        final ReachabilityResult result = analyzer.analyze(graph);

        assertEquals(RunStatus.COMPLETE, result.status());
        assertEquals(0, result.reachableCount());
        assertEquals(2, result.zombieCount());
    }

    @Test
    void whenAnalyzing_givenLongChain_shouldStayLinear() {
        final int length = 300_000;
        final List<CodeSymbol> nodes = new ArrayList<>(length);
        final List<DependencyEdge> edges = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            nodes.add(new CodeSymbol(chainId(i), "n" + i, "chain.n" + i,
                    SymbolKind.FUNCTION, "app", "src/Chain.java", "java",
                    SourceRange.line(i + 1), Visibility.PUBLIC,
                    i == 0 ? RootType.MAIN : null, false, Map.of()));
            if (i > 0) {
                edges.add(DependencyEdge.of(chainId(i - 1), chainId(i),
                        EdgeType.CALLS, "app::src/Chain.java"));
            }
        }
        final DependencyGraph graph = DependencyGraph.freeze(1, nodes, edges,
                List.of(), List.of());

        final ReachabilityResult result = assertTimeout(
                Duration.ofSeconds(2), () -> analyzer.analyze(graph));

        assertEquals(RunStatus.COMPLETE, result.status());
        assertEquals(length, result.reachableCount());
        assertEquals(length, result.layers());
    }

    private static String chainId(final int i) {
        return "app::src/Chain.java::chain.n" + i;
    }

}
