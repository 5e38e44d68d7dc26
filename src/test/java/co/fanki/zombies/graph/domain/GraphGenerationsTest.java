package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphGenerations}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphGenerationsTest {

    @Test
    void whenRequiring_givenNothingPublished_shouldThrowGraphNotBuilt() {
        final GraphGenerations generations = new GraphGenerations();

        final DomainException e = assertThrows(DomainException.class,
                generations::require);

        assertEquals("GRAPH_NOT_BUILT", e.getErrorCode());
        assertTrue(generations.current().isEmpty());
    }

    @Test
    void whenPublishing_givenNewGeneration_shouldSwapAndReturnPrevious() {
        final GraphGenerations generations = new GraphGenerations();
        final DependencyGraph first = GraphFixtures.letters(List.of("A"),
                List.of());
        final DependencyGraph second = GraphFixtures.letters(List.of("A"),
                List.of());

        assertNull(generations.publish(first));
        final DependencyGraph pinned = generations.require();
        assertSame(first, generations.publish(second));

        assertSame(second, generations.require());
        assertSame(first, pinned);
    }

}
