package org.waabox.protocache.fetch;

import org.waabox.protocache.FetchParams;

/**
 * Retrieves one page of records from the upstream catalog API.
 *
 * <p>Implementations report expected failures as a {@link FetchFailure},
 * typically built with {@link ErrorClassifier#classify(Throwable)}. An
 * exception thrown from {@link #fetchPage(FetchParams)} is classified by
 * the repository the same way, so either style is safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface PrototypeFetcher {

  /**
   * Fetches one page of records.
   *
   * @param params the page parameters, all values set, never null
   *
   * @return the fetched records or the failure, never null
   */
  FetchResult fetchPage(FetchParams params);
}
