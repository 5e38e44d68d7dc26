package co.fanki.zombies.shared;

import java.io.Serializable;

/**
 * Marker interface for value objects in the domain model.
 *
 * <p>Value objects are immutable, compared by their attributes and
 * self-validating.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
