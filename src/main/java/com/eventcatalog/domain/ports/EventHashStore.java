package com.eventcatalog.domain.ports;

import com.eventcatalog.domain.model.CanonicalEvent;

/**
 * Port for remembering event hashes across batches.
 */
public interface EventHashStore {

    /**
     * Finds the event previously recorded under a hash.
     *
     * @param hash content hash
     * @return the recorded event, or null if the hash has not been seen
     */
    CanonicalEvent get(String hash);

    /**
     * Records an event under its hash, replacing any previous entry.
     *
     * @param event event to record; its {@code hash} is the key
     */
    void put(CanonicalEvent event);

    /**
     * Records an event only if its hash is not stored yet, atomically with respect
     * to other callers of this store.
     *
     * @param event event to record
     * @return the event already stored under the hash, or null if {@code event} was recorded
     */
    CanonicalEvent putIfAbsent(CanonicalEvent event);
}
