package org.waabox.protocache.fetch;

import java.util.List;
import java.util.Objects;

import org.waabox.protocache.model.UpstreamPrototype;

/**
 * A successful fetch.
 *
 * @param prototypes the fetched records, never null, unmodifiable
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FetchSuccess(List<UpstreamPrototype> prototypes)
    implements FetchResult {

  /**
   * Creates a new success.
   *
   * @throws NullPointerException if prototypes is null
   */
  public FetchSuccess {
    Objects.requireNonNull(prototypes, "prototypes must not be null");
    prototypes = List.copyOf(prototypes);
  }
}
