package co.fanki.zombies.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "orders";

        assertEquals(value, Preconditions.requireNonNull(value, "message"));
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequire_givenFalseCondition_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));
    }

    @Test
    void whenRequireDomain_givenFalseCondition_shouldCarryErrorCode() {
        final DomainException e = assertThrows(DomainException.class,
                () -> Preconditions.requireDomain(false, "Stale result",
                        "GENERATION_MISMATCH"));

        assertEquals("GENERATION_MISMATCH", e.getErrorCode());
    }

    @Test
    void whenRequirePositive_givenZeroLong_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0L, "Not positive"));
    }

    @Test
    void whenRequireNonNegative_givenZero_shouldReturnZero() {
        assertEquals(0, Preconditions.requireNonNegative(0, "message"));
    }

    @Test
    void whenRequireNonNegative_givenNegative_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNegative(-1, "Negative"));
    }

}
