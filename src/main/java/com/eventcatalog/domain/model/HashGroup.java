package com.eventcatalog.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Events sharing one content hash. Only lives for the duration of a grouping call.
 * Members may include null entries, which all share the empty-event hash.
 */
public record HashGroup(String hash, List<NormalizedEvent> members, int count) {

    public static HashGroup of(String hash, List<NormalizedEvent> members) {
        return new HashGroup(hash, Collections.unmodifiableList(new ArrayList<>(members)), members.size());
    }
}
