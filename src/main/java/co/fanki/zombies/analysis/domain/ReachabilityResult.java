package co.fanki.zombies.analysis.domain;

import co.fanki.zombies.shared.Preconditions;

import java.time.Duration;
import java.util.BitSet;

/**
 * Reachability overlay of one analysis run over one graph generation.
 *
 * <p>Node indices refer to the {@code DependencyGraph} of
 * {@link #generation()}. The overlay is authoritative only when
 * {@link #status()} is {@link RunStatus#COMPLETE}; a partial or cancelled
 * run still reports a valid prefix: every node marked reachable is
 * reachable.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ReachabilityResult {

    private final long generation;
    private final BitSet reachable;
    private final ZombieClassification[] classifications;
    private final int[] roots;
    private final RunStatus status;
    private final int layers;
    private final long steps;
    private final Duration duration;

    /**
     * Creates a result.
     *
     * @param theGeneration the graph generation analysed
     * @param theReachable the reached node indices
     * @param theClassifications per node index, null for reached nodes
     * @param theRoots the root indices the run started from
     * @param theStatus the run status
     * @param theLayers the completed BFS layers
     * @param theSteps the expanded nodes
     * @param theDuration the wall-clock time
     */
    public ReachabilityResult(final long theGeneration,
            final BitSet theReachable,
            final ZombieClassification[] theClassifications,
            final int[] theRoots, final RunStatus theStatus,
            final int theLayers, final long theSteps,
            final Duration theDuration) {
        Preconditions.requireNonNull(theReachable, "Reachable set is required");
        Preconditions.requireNonNull(theClassifications,
                "Classifications are required");
        Preconditions.requireNonNull(theStatus, "Status is required");
        this.generation = theGeneration;
        this.reachable = (BitSet) theReachable.clone();
        this.classifications = theClassifications.clone();
        this.roots = theRoots == null ? new int[0] : theRoots.clone();
        this.status = theStatus;
        this.layers = theLayers;
        this.steps = theSteps;
        this.duration = theDuration == null ? Duration.ZERO : theDuration;
    }

    /** @return the graph generation this overlay belongs to */
    public long generation() {
        return generation;
    }

    /**
     * Checks if a node was reached.
     *
     * @param index the node index
     * @return true if reached
     */
    public boolean isReachable(final int index) {
        return reachable.get(index);
    }

    /** @return a copy of the reached set */
    public BitSet reachable() {
        return (BitSet) reachable.clone();
    }

    /** @return the number of reached nodes */
    public int reachableCount() {
        return reachable.cardinality();
    }

    /** @return the number of nodes the overlay covers */
    public int nodeCount() {
        return classifications.length;
    }

    /** @return the number of nodes not reached */
    public int zombieCount() {
        return classifications.length - reachable.cardinality();
    }

    /**
     * Returns the classification of a node.
     *
     * @param index the node index
     * @return the classification, null if the node was reached
     */
    public ZombieClassification classification(final int index) {
        return classifications[index];
    }

    /** @return a copy of the root indices the run started from */
    public int[] roots() {
        return roots.clone();
    }

    /** @return the run status */
    public RunStatus status() {
        return status;
    }

    /** @return true if the run traversed the whole reachable region */
    public boolean complete() {
        return status == RunStatus.COMPLETE;
    }

    /** @return true if a budget ran out */
    public boolean timedOut() {
        return status == RunStatus.PARTIAL;
    }

    /** @return the completed BFS layers */
    public int layers() {
        return layers;
    }

    /** @return the expanded nodes */
    public long steps() {
        return steps;
    }

    /** @return the wall-clock time of the run */
    public Duration duration() {
        return duration;
    }

}
