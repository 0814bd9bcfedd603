package com.eventcatalog.domain.ports;

import com.eventcatalog.domain.model.LocationContext;
import com.eventcatalog.domain.model.RawEvent;

import java.util.List;

/**
 * Port for a discovery provider whose raw output feeds the pipeline.
 */
public interface DiscoveryProvider {

    /**
     * Gets the name of the provider, used to attribute counts and errors.
     *
     * @return Provider name (e.g., "gemini", "perplexity")
     */
    String getProviderName();

    /**
     * Returns the raw events the provider discovered for a location.
     *
     * @param context city/state being searched
     * @return raw provider records, in any shape the provider produced
     * @throws Exception if the provider fails
     */
    List<RawEvent> discoverEvents(LocationContext context) throws Exception;
}
