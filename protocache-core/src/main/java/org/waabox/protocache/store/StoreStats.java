package org.waabox.protocache.store;

import java.time.Instant;

/**
 * A point-in-time view of the store state.
 *
 * @param size            the number of records in the snapshot
 * @param cachedAt        when the snapshot was stored, null when empty
 * @param expired         whether the snapshot is older than the ttl, true
 *                        when there is no snapshot
 * @param remainingTtlMs  milliseconds until expiry, 0 when expired
 * @param dataSizeBytes   the estimated size of the stored data
 * @param refreshInFlight whether an exclusive task is running
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StoreStats(int size, Instant cachedAt, boolean expired,
    long remainingTtlMs, long dataSizeBytes, boolean refreshInFlight) {
}
