package com.eventcatalog.domain.hashing;

import com.eventcatalog.domain.model.CanonicalEvent;
import com.eventcatalog.domain.model.HashGroup;
import com.eventcatalog.domain.model.NormalizedEvent;
import com.eventcatalog.domain.ports.EventHashStore;
import com.eventcatalog.domain.validation.EventValidator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups events by content hash.
 * Groups keep first-seen order; which member of a group is authoritative is
 * left to the caller.
 */
@Component
public class DuplicateGrouper {

    private final EventHasher hasher;

    public DuplicateGrouper(EventHasher hasher) {
        this.hasher = hasher;
    }

    /**
     * Maps each hash to the events sharing it. A null batch yields an empty map.
     */
    public Map<String, List<NormalizedEvent>> groupEventsByHash(List<NormalizedEvent> events) {
        Map<String, List<NormalizedEvent>> groups = new LinkedHashMap<>();
        if (events == null) {
            return groups;
        }
        for (NormalizedEvent event : events) {
            groups.computeIfAbsent(hasher.generateEventHash(event), hash -> new ArrayList<>()).add(event);
        }
        return groups;
    }

    /**
     * Returns only the groups with more than one member.
     */
    public List<HashGroup> findDuplicatesByHash(List<NormalizedEvent> events) {
        List<HashGroup> duplicates = new ArrayList<>();
        groupEventsByHash(events).forEach((hash, members) -> {
            if (members.size() > 1) {
                duplicates.add(HashGroup.of(hash, members));
            }
        });
        return duplicates;
    }

    /**
     * Splits a batch against hashes seen in earlier batches.
     * The first event of each unseen hash is recorded in the store and returned as new;
     * every other event is returned as already seen. Events are expected to have
     * passed validation and are stamped with the current schema version.
     */
    public StorePartition partitionAgainstStore(List<NormalizedEvent> events, EventHashStore store) {
        if (events == null) {
            return new StorePartition(List.of(), List.of());
        }
        List<CanonicalEvent> fresh = new ArrayList<>();
        List<CanonicalEvent> seen = new ArrayList<>();
        for (NormalizedEvent event : events) {
            CanonicalEvent canonical = new CanonicalEvent(
                hasher.generateEventHash(event), event, EventValidator.VALIDATION_SCHEMA_VERSION);
            if (store.putIfAbsent(canonical) == null) {
                fresh.add(canonical);
            } else {
                seen.add(canonical);
            }
        }
        return new StorePartition(List.copyOf(fresh), List.copyOf(seen));
    }

    /**
     * Events whose hash was new to the store, and events whose hash it already held.
     */
    public record StorePartition(List<CanonicalEvent> fresh, List<CanonicalEvent> seen) {}
}
