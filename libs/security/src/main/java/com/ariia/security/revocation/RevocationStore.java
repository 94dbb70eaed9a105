package com.ariia.security.revocation;

import java.time.Duration;

/**
 * Key-value side-store holding revocation markers. Markers expire on their own; nothing ever
 * deletes them explicitly.
 * <p>
 * Implementations must be safe for concurrent use and should bound every call with a short
 * timeout so an unreachable store cannot stall request handling.
 */
public interface RevocationStore {

    /**
     * @throws RevocationStoreException when the store cannot be reached
     */
    boolean exists(String key);

    /**
     * Writes {@code key} with a time-to-live, overwriting any existing marker.
     *
     * @throws RevocationStoreException when the store cannot be reached
     */
    void setWithTtl(String key, Duration ttl);
}
