package org.waabox.protocache.fetch;

/**
 * The outcome of a {@link PrototypeFetcher} call.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public sealed interface FetchResult permits FetchSuccess, FetchFailure {

  /**
   * Tells whether the fetch succeeded.
   *
   * @return true for a {@link FetchSuccess}
   */
  default boolean isSuccess() {
    return this instanceof FetchSuccess;
  }
}
