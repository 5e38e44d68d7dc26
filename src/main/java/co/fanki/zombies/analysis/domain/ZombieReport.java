package co.fanki.zombies.analysis.domain;

import co.fanki.zombies.graph.domain.Adjacency;
import co.fanki.zombies.graph.domain.CodeSymbol;
import co.fanki.zombies.graph.domain.DependencyGraph;
import co.fanki.zombies.shared.Preconditions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bulk export of every symbol an analysis run did not reach.
 *
 * <p>The counters always describe the whole run; a {@link ZombieFilter}
 * only narrows the items.</p>
 *
 * @param generation the graph generation
 * @param status the status of the run the report is built from
 * @param totalSymbols the node count
 * @param reachableSymbols the reached node count
 * @param zombieSymbols the unreached node count
 * @param zombiePercentage zombies over total, 0 to 100
 * @param durationMillis the run duration
 * @param byClassification zombie count per classification
 * @param items the zombies, sorted by symbol id
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ZombieReport(
        long generation,
        RunStatus status,
        int totalSymbols,
        int reachableSymbols,
        int zombieSymbols,
        double zombiePercentage,
        long durationMillis,
        Map<ZombieClassification, Integer> byClassification,
        List<ZombieItem> items) {

    private static final double TEST_PENALTY = 0.3;
    private static final double PHANTOM_PENALTY = 0.2;
    private static final double INCOMPLETE_PENALTY = 0.4;
    private static final double DEAD_CODE_BONUS = 0.2;

    /**
     * Builds the report of a run.
     *
     * @param graph the graph the run analysed
     * @param result the run result
     * @return the report
     */
    public static ZombieReport of(final DependencyGraph graph,
            final ReachabilityResult result) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(result, "Result is required");
        Preconditions.requireDomain(
                graph.generation() == result.generation(),
                "Result of generation " + result.generation()
                        + " does not belong to graph generation "
                        + graph.generation(), "GENERATION_MISMATCH");

        final int[] distances = isolationDistances(graph, result.roots());
        final Map<ZombieClassification, Integer> counts =
                new EnumMap<>(ZombieClassification.class);
        final List<ZombieItem> items = new ArrayList<>();

        for (int node = 0; node < graph.nodeCount(); node++) {
            final ZombieClassification classification =
                    result.classification(node);
            if (classification == null) {
                continue;
            }
            counts.merge(classification, 1, Integer::sum);
            final CodeSymbol symbol = graph.symbol(node);
            final double confidence = confidence(symbol, classification,
                    result.status());
            items.add(new ZombieItem(symbol.id(), symbol.name(),
                    symbol.qualifiedName(), symbol.kind(),
                    symbol.repository(), symbol.filePath(),
                    symbol.range().startLine(), classification,
                    distances[node], confidence,
                    ConfidenceLevel.of(confidence), symbol.phantom(),
                    symbol.metadata().get(CodeSymbol.LAST_MODIFIED),
                    symbol.metadata().get(CodeSymbol.CONTRIBUTOR)));
        }

        final int total = graph.nodeCount();
        final double percentage = total == 0
                ? 0.0 : 100.0 * items.size() / total;
        return new ZombieReport(graph.generation(), result.status(), total,
                result.reachableCount(), items.size(), percentage,
                result.duration().toMillis(),
                Collections.unmodifiableMap(counts),
                Collections.unmodifiableList(items));
    }

    /**
     * Returns a copy holding only the items the filter keeps.
     *
     * @param filter the filter
     * @return the filtered report
     */
    public ZombieReport filter(final ZombieFilter filter) {
        Preconditions.requireNonNull(filter, "Filter is required");
        return new ZombieReport(generation, status, totalSymbols,
                reachableSymbols, zombieSymbols, zombiePercentage,
                durationMillis, byClassification, items.stream()
                        .filter(filter::matches).toList());
    }

    /**
     * Hop count of every node to the nearest root, ignoring edge direction.
     *
     * @param graph the graph
     * @param roots the root indices
     * @return the distances, -1 where no root is connected
     */
    static int[] isolationDistances(final DependencyGraph graph,
            final int[] roots) {
        final int[] distance = new int[graph.nodeCount()];
        Arrays.fill(distance, -1);
        final int[] queue = new int[graph.nodeCount()];
        int head = 0;
        int tail = 0;
        for (final int root : roots) {
            if (distance[root] < 0) {
                distance[root] = 0;
                queue[tail++] = root;
            }
        }
        final Adjacency forward = graph.forward();
        final Adjacency reverse = graph.reverse();
        while (head < tail) {
            final int node = queue[head++];
            for (int p = forward.start(node); p < forward.end(node); p++) {
                final int next = graph.edgeTarget(forward.edgeAt(p));
                if (distance[next] < 0) {
                    distance[next] = distance[node] + 1;
                    queue[tail++] = next;
                }
            }
            for (int p = reverse.start(node); p < reverse.end(node); p++) {
                final int next = graph.edgeSource(reverse.edgeAt(p));
                if (distance[next] < 0) {
                    distance[next] = distance[node] + 1;
                    queue[tail++] = next;
                }
            }
        }
        return distance;
    }

    /**
     * Scores how likely a zombie really is unused.
     *
     * <p>Starts at 1.0. Test code, phantoms and results of incomplete runs
     * are penalised; isolated dead code gets a bonus. Clamped to 0..1.</p>
     */
    static double confidence(final CodeSymbol symbol,
            final ZombieClassification classification,
            final RunStatus status) {
        double score = 1.0;
        final String path = symbol.filePath().toLowerCase(Locale.ROOT);
        if (path.contains("test") || path.contains("spec")) {
            score -= TEST_PENALTY;
        }
        if (symbol.phantom()) {
            score -= PHANTOM_PENALTY;
        }
        if (status != RunStatus.COMPLETE) {
            score -= INCOMPLETE_PENALTY;
        }
        if (classification == ZombieClassification.DEAD_CODE) {
            score += DEAD_CODE_BONUS;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

}
