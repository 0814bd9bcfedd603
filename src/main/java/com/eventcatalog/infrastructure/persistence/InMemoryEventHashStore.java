package com.eventcatalog.infrastructure.persistence;

import com.eventcatalog.domain.model.CanonicalEvent;
import com.eventcatalog.domain.ports.EventHashStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link EventHashStore}, safe for concurrent batches.
 */
@Repository
public class InMemoryEventHashStore implements EventHashStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventHashStore.class);

    private final Map<String, CanonicalEvent> eventsByHash = new ConcurrentHashMap<>();

    @Override
    public CanonicalEvent get(String hash) {
        if (hash == null) {
            return null;
        }
        return eventsByHash.get(hash);
    }

    @Override
    public void put(CanonicalEvent event) {
        if (event == null || event.hash() == null) {
            logger.warn("Skipping event without hash");
            return;
        }
        eventsByHash.put(event.hash(), event);
    }

    @Override
    public CanonicalEvent putIfAbsent(CanonicalEvent event) {
        if (event == null || event.hash() == null) {
            logger.warn("Skipping event without hash");
            return null;
        }
        return eventsByHash.putIfAbsent(event.hash(), event);
    }

    public int size() {
        return eventsByHash.size();
    }
}
