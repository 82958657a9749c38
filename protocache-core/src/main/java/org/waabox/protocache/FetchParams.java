package org.waabox.protocache;

import java.util.Objects;

/**
 * The parameters of one upstream page request.
 *
 * <p>Any value may be left unset; {@link #mergeOver(FetchParams)} fills the
 * unset values from another set of parameters, typically
 * {@link #defaults()}.
 *
 * @param offset      the number of records to skip, null when unset
 * @param limit       the maximum number of records, null when unset
 * @param prototypeId a single record id to fetch, null when unset
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FetchParams(Integer offset, Integer limit,
    Integer prototypeId) {

  /** The default offset. */
  public static final int DEFAULT_OFFSET = 0;

  /** The default page size. */
  public static final int DEFAULT_LIMIT = 10;

  /** The default parameters. */
  private static final FetchParams DEFAULTS = new FetchParams(
      DEFAULT_OFFSET, DEFAULT_LIMIT, null);

  /**
   * Returns the default parameters: offset 0, limit 10, no id.
   *
   * @return the default parameters, never null
   */
  public static FetchParams defaults() {
    return DEFAULTS;
  }

  /**
   * Creates parameters for the given page.
   *
   * @param offset the number of records to skip
   * @param limit  the maximum number of records
   *
   * @return the parameters, never null
   */
  public static FetchParams page(final int offset, final int limit) {
    return new FetchParams(offset, limit, null);
  }

  /**
   * Returns parameters with every value unset.
   *
   * @return the parameters, never null
   */
  public static FetchParams none() {
    return new FetchParams(null, null, null);
  }

  /**
   * Returns a copy of these parameters with the given record id.
   *
   * @param thePrototypeId the record id
   *
   * @return the new parameters, never null
   */
  public FetchParams withPrototypeId(final int thePrototypeId) {
    return new FetchParams(offset, limit, thePrototypeId);
  }

  /**
   * Fills every unset value of these parameters from the given ones.
   *
   * @param base the parameters providing the fallback values, never null
   *
   * @return the merged parameters, never null
   */
  public FetchParams mergeOver(final FetchParams base) {
    Objects.requireNonNull(base, "base must not be null");
    return new FetchParams(
        offset != null ? offset : base.offset,
        limit != null ? limit : base.limit,
        prototypeId != null ? prototypeId : base.prototypeId);
  }
}
