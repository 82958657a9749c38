package org.waabox.protocache.normalize;

import org.waabox.protocache.model.Prototype;
import org.waabox.protocache.model.UpstreamPrototype;

/**
 * Converts a raw upstream record into the normalized {@link Prototype}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface PrototypeNormalizer {

  /**
   * Normalizes one upstream record.
   *
   * <p>Recoverable anomalies, such as an unparseable timestamp, are
   * expected to be logged and absorbed rather than thrown.
   *
   * @param upstream the upstream record, never null
   *
   * @return the normalized record, never null
   */
  Prototype normalize(UpstreamPrototype upstream);
}
