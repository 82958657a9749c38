package org.waabox.protocache.store;

/**
 * The outcome of a successful {@link PrototypeStore#setAll} call.
 *
 * @param dataSizeBytes the estimated serialized size of the stored data
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SetAllResult(long dataSizeBytes) {
}
