package co.fanki.reposync.shared;

import java.io.Serializable;

/**
 * Marker for immutable domain values compared by their attributes.
 *
 * <p>Repository references and watermarks are value objects: they are
 * validated on construction, never change afterwards and are safe to use
 * as map keys across threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
