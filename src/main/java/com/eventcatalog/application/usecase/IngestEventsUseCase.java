package com.eventcatalog.application.usecase;

import com.eventcatalog.domain.hashing.DuplicateGrouper;
import com.eventcatalog.domain.model.CanonicalEvent;
import com.eventcatalog.domain.model.HashGroup;
import com.eventcatalog.domain.model.LocationContext;
import com.eventcatalog.domain.model.NormalizedEvent;
import com.eventcatalog.domain.model.RawEvent;
import com.eventcatalog.domain.model.ValidationReport;
import com.eventcatalog.domain.normalization.EventNormalizer;
import com.eventcatalog.domain.ports.DiscoveryProvider;
import com.eventcatalog.domain.ports.EventHashStore;
import com.eventcatalog.domain.validation.EventValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Use case for turning provider output into catalog-ready events.
 * Providers run in parallel; their events then go through normalize, validate,
 * hash and store-aware dedup in that order.
 */
@Service
public class IngestEventsUseCase implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(IngestEventsUseCase.class);

    private final List<DiscoveryProvider> providers;
    private final EventNormalizer normalizer;
    private final EventValidator validator;
    private final DuplicateGrouper grouper;
    private final EventHashStore hashStore;
    private final LocationContext defaultContext;
    private final ExecutorService executorService;

    public IngestEventsUseCase(
            List<DiscoveryProvider> providers,
            EventNormalizer normalizer,
            EventValidator validator,
            DuplicateGrouper grouper,
            EventHashStore hashStore,
            LocationContext defaultContext,
            @Value("${events.pipeline.thread-pool-size:4}") int threadPoolSize) {
        this.providers = List.copyOf(providers);
        this.normalizer = normalizer;
        this.validator = validator;
        this.grouper = grouper;
        this.hashStore = hashStore;
        this.defaultContext = defaultContext;
        this.executorService = Executors.newFixedThreadPool(Math.max(providers.size(), Math.max(threadPoolSize, 1)));
    }

    /**
     * Runs every provider for the configured default location.
     */
    public IngestSummary execute() {
        return execute(defaultContext);
    }

    /**
     * Runs every provider in parallel for a location and processes the combined output.
     *
     * @return Summary of the ingest run
     */
    public IngestSummary execute(LocationContext context) {
        logger.info("Starting event ingest with {} providers", providers.size());

        Map<String, Integer> eventsByProvider = new HashMap<>();
        Map<String, String> errorsByProvider = new HashMap<>();
        List<NormalizedEvent> allEvents = new ArrayList<>();

        List<CompletableFuture<ProviderResult>> futures = providers.stream()
            .map(provider -> CompletableFuture.supplyAsync(() -> executeProvider(provider, context), executorService))
            .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // Collected in provider order so repeated runs see the same first member per hash
        for (CompletableFuture<ProviderResult> future : futures) {
            ProviderResult result = future.join();
            if (result.events() != null) {
                allEvents.addAll(result.events());
                eventsByProvider.put(result.providerName(), result.events().size());
            } else {
                errorsByProvider.put(result.providerName(), result.error());
            }
        }

        return processNormalized(allEvents, eventsByProvider, errorsByProvider);
    }

    /**
     * Processes output already obtained from a provider, without calling any provider.
     */
    public IngestSummary process(String providerName, List<RawEvent> rawEvents, LocationContext context) {
        List<NormalizedEvent> normalized = normalizer.normalizeEvents(rawEvents, context);
        Map<String, Integer> eventsByProvider = new HashMap<>();
        eventsByProvider.put(providerName, normalized.size());
        return processNormalized(normalized, eventsByProvider, new HashMap<>());
    }

    private IngestSummary processNormalized(
            List<NormalizedEvent> events,
            Map<String, Integer> eventsByProvider,
            Map<String, String> errorsByProvider) {
        ValidationReport report = validator.validateEventsHard(events);
        List<HashGroup> duplicateGroups = grouper.findDuplicatesByHash(report.valid());
        DuplicateGrouper.StorePartition partition = grouper.partitionAgainstStore(report.valid(), hashStore);

        logger.info("Ingest finished: {} normalized, {} valid, {} duplicate groups, {} new, {} already known",
            events.size(), report.stats().valid(), duplicateGroups.size(),
            partition.fresh().size(), partition.seen().size());

        return new IngestSummary(
            eventsByProvider,
            errorsByProvider,
            report,
            duplicateGroups,
            partition.fresh(),
            partition.seen().size()
        );
    }

    private ProviderResult executeProvider(DiscoveryProvider provider, LocationContext context) {
        String providerName = provider.getProviderName();
        logger.info("Starting provider: {}", providerName);

        try {
            List<RawEvent> rawEvents = provider.discoverEvents(context);
            List<NormalizedEvent> events = normalizer.normalizeEvents(rawEvents, context);
            logger.info("Provider {} returned {} events", providerName, events.size());
            return new ProviderResult(providerName, events, null);
        } catch (Exception e) {
            logger.error("Provider {} failed", providerName, e);
            return new ProviderResult(providerName, null, String.valueOf(e.getMessage()));
        }
    }

    @Override
    public void close() {
        executorService.shutdown();
    }

    private record ProviderResult(String providerName, List<NormalizedEvent> events, String error) {}

    /**
     * Outcome of one ingest run.
     *
     * @param eventsByProvider normalized event count per provider that succeeded
     * @param errors           failure message per provider that threw
     * @param validation       valid/invalid partition with reasons and schema version
     * @param duplicateGroups  hash groups with more than one valid member in this run
     * @param newEvents        first valid event of every hash the store had not seen
     * @param alreadyKnown     valid events whose hash was already stored
     */
    public record IngestSummary(
        Map<String, Integer> eventsByProvider,
        Map<String, String> errors,
        ValidationReport validation,
        List<HashGroup> duplicateGroups,
        List<CanonicalEvent> newEvents,
        int alreadyKnown
    ) {}
}
