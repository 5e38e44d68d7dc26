package co.fanki.zombies.analysis.domain;

import co.fanki.zombies.graph.domain.Adjacency;
import co.fanki.zombies.graph.domain.DependencyGraph;
import co.fanki.zombies.shared.DomainException;
import co.fanki.zombies.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.function.BooleanSupplier;
import java.util.function.LongSupplier;

/**
 * Computes which symbols the active roots reach.
 *
 * <p>Layered multi-source breadth-first search over the forward adjacency
 * of a frozen graph; every edge type propagates reachability. Frontiers
 * are kept sorted by node index, so the visited set and its order depend
 * only on the graph and the roots.</p>
 *
 * <p>Between layers the run checks its cancellation flag and its time
 * budget; each expanded node counts against the step budget. When either
 * stops the run, the nodes visited so far are returned with a
 * {@link RunStatus#PARTIAL} or {@link RunStatus#CANCELLED} status.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ReachabilityAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReachabilityAnalyzer.class);

    private final long stepBudget;
    private final Duration timeBudget;
    private final LongSupplier nanoClock;

    /**
     * Creates an analyzer.
     *
     * @param theStepBudget the maximum number of expanded nodes
     * @param theTimeBudget the maximum wall-clock time
     */
    public ReachabilityAnalyzer(final long theStepBudget,
            final Duration theTimeBudget) {
        this(theStepBudget, theTimeBudget, System::nanoTime);
    }

    /**
     * Creates an analyzer with an explicit clock.
     *
     * @param theStepBudget the maximum number of expanded nodes
     * @param theTimeBudget the maximum wall-clock time
     * @param theNanoClock the monotonic clock, in nanoseconds
     */
    ReachabilityAnalyzer(final long theStepBudget,
            final Duration theTimeBudget, final LongSupplier theNanoClock) {
        this.stepBudget = Preconditions.requirePositive(theStepBudget,
                "Step budget must be positive");
        this.timeBudget = Preconditions.requireNonNull(theTimeBudget,
                "Time budget is required");
        this.nanoClock = Preconditions.requireNonNull(theNanoClock,
                "Clock is required");
    }

    /**
     * Analyses a graph from its active roots.
     *
     * @param graph the frozen graph
     * @return the result
     */
    public ReachabilityResult analyze(final DependencyGraph graph) {
        return analyze(graph, graph.activeRoots(), () -> false);
    }

    /**
     * Analyses a graph from an alternative root set, for what-if runs.
     *
     * @param graph the frozen graph
     * @param rootIds the root symbol ids
     * @param cancelled polled between layers
     * @return the result
     * @throws DomainException with code {@code SYMBOL_NOT_FOUND} if a root
     *         is not a node of the graph
     */
    public ReachabilityResult analyze(final DependencyGraph graph,
            final Collection<String> rootIds,
            final BooleanSupplier cancelled) {
        Preconditions.requireNonNull(rootIds, "Root ids are required");
        final int[] roots = new int[rootIds.size()];
        int i = 0;
        for (final String id : rootIds) {
            final int index = graph.indexOf(id);
            if (index < 0) {
                throw new DomainException("Root not found: " + id,
                        "SYMBOL_NOT_FOUND");
            }
            roots[i++] = index;
        }
        return analyze(graph, roots, cancelled);
    }

    /**
     * Analyses a graph from root node indices.
     *
     * @param graph the frozen graph
     * @param rootIndices the root node indices
     * @param cancelled polled between layers
     * @return the result
     */
    public ReachabilityResult analyze(final DependencyGraph graph,
            final int[] rootIndices, final BooleanSupplier cancelled) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(rootIndices, "Roots are required");
        Preconditions.requireNonNull(cancelled, "Cancellation is required");

        final long start = nanoClock.getAsLong();
        final long deadline = start + timeBudget.toNanos();
        final Adjacency forward = graph.forward();
        final BitSet visited = new BitSet(graph.nodeCount());

        // Every node enters the queue once; one layer is a slice of it.
        final int[] queue = new int[graph.nodeCount()];
        int layerStart = 0;
        int tail = 0;
        for (final int root : rootIndices) {
            Preconditions.require(root >= 0 && root < graph.nodeCount(),
                    "Root index out of range: " + root);
            if (!visited.get(root)) {
                visited.set(root);
                queue[tail++] = root;
            }
        }
        Arrays.sort(queue, 0, tail);

        RunStatus status = RunStatus.COMPLETE;
        int layers = 0;
        long steps = 0;

        traversal:
        while (layerStart < tail) {
            if (cancelled.getAsBoolean()) {
                status = RunStatus.CANCELLED;
                break;
            }
            if (nanoClock.getAsLong() > deadline) {
                status = RunStatus.PARTIAL;
                break;
            }

            final int layerEnd = tail;
            for (int i = layerStart; i < layerEnd; i++) {
                if (steps >= stepBudget) {
                    status = RunStatus.PARTIAL;
                    break traversal;
                }
                steps++;
                final int node = queue[i];
                for (int p = forward.start(node); p < forward.end(node); p++) {
                    final int target = graph.edgeTarget(forward.edgeAt(p));
                    if (!visited.get(target)) {
                        visited.set(target);
                        queue[tail++] = target;
                    }
                }
            }
            Arrays.sort(queue, layerEnd, tail);
            layerStart = layerEnd;
            layers++;
        }

        final ZombieClassification[] classes = classify(graph, visited);
        final Duration duration = Duration.ofNanos(
                nanoClock.getAsLong() - start);

        if (status == RunStatus.COMPLETE) {
            LOG.info("Generation {}: {} of {} nodes reachable from {} roots"
                    + " ({} layers, {} ms)", graph.generation(),
                    visited.cardinality(), graph.nodeCount(),
                    frontierSize(rootIndices), layers, duration.toMillis());
        } else {
            LOG.warn("Generation {}: run {} after {} layers and {} steps,"
                    + " {} nodes visited", graph.generation(), status, layers,
                    steps, visited.cardinality());
        }

        return new ReachabilityResult(graph.generation(), visited, classes,
                Arrays.stream(rootIndices).distinct().sorted().toArray(),
                status, layers, steps, duration);
    }

    /**
     * Classifies every node not in the visited set.
     *
     * <p>A node with no edges at all is dead code. A node with incoming
     * edges, all from unvisited nodes, is orphaned. Anything else is
     * unreachable.</p>
     */
    static ZombieClassification[] classify(final DependencyGraph graph,
            final BitSet visited) {
        final Adjacency forward = graph.forward();
        final Adjacency reverse = graph.reverse();
        final ZombieClassification[] classes =
                new ZombieClassification[graph.nodeCount()];

        for (int node = visited.nextClearBit(0); node < graph.nodeCount();
                node = visited.nextClearBit(node + 1)) {
            final int incoming = reverse.degree(node);
            if (incoming == 0 && forward.degree(node) == 0) {
                classes[node] = ZombieClassification.DEAD_CODE;
                continue;
            }
            boolean fromZombiesOnly = incoming > 0;
            for (int p = reverse.start(node); p < reverse.end(node); p++) {
                if (visited.get(graph.edgeSource(reverse.edgeAt(p)))) {
                    fromZombiesOnly = false;
                    break;
                }
            }
            classes[node] = fromZombiesOnly
                    ? ZombieClassification.ORPHANED
                    : ZombieClassification.UNREACHABLE;
        }
        return classes;
    }

    private static long frontierSize(final int[] roots) {
        return Arrays.stream(roots).distinct().count();
    }

}
