package org.waabox.protocache.store;

/**
 * Thrown when a candidate snapshot is estimated to be larger than the
 * configured maximum data size.
 *
 * <p>The previous snapshot is left untouched.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DataSizeExceededException extends StoreException {

  private static final long serialVersionUID = 1L;

  /** The estimated size of the rejected data, in bytes. */
  private final long dataSizeBytes;

  /** The configured limit, in bytes. */
  private final long maxDataSizeBytes;

  /** Creates a new exception.
   *
   * @param theDataSizeBytes the estimated size of the rejected data.
   * @param theMaxDataSizeBytes the configured limit.
   */
  public DataSizeExceededException(final long theDataSizeBytes,
      final long theMaxDataSizeBytes) {
    super("Snapshot data size (" + theDataSizeBytes
        + " bytes) exceeds maximum limit (" + theMaxDataSizeBytes
        + " bytes)", DataState.UNCHANGED);
    dataSizeBytes = theDataSizeBytes;
    maxDataSizeBytes = theMaxDataSizeBytes;
  }

  public long getDataSizeBytes() {
    return dataSizeBytes;
  }

  public long getMaxDataSizeBytes() {
    return maxDataSizeBytes;
  }
}
