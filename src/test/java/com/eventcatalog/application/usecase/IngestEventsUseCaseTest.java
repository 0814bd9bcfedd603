package com.eventcatalog.application.usecase;

import com.eventcatalog.domain.hashing.DuplicateGrouper;
import com.eventcatalog.domain.hashing.EventHasher;
import com.eventcatalog.domain.model.EventCategory;
import com.eventcatalog.domain.model.LocationContext;
import com.eventcatalog.domain.model.RawEvent;
import com.eventcatalog.domain.model.RejectReason;
import com.eventcatalog.domain.normalization.EventNormalizer;
import com.eventcatalog.domain.ports.DiscoveryProvider;
import com.eventcatalog.domain.validation.EventValidator;
import com.eventcatalog.infrastructure.persistence.InMemoryEventHashStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for IngestEventsUseCase.
 */
class IngestEventsUseCaseTest {

    private static final LocationContext FRISCO = new LocationContext("Frisco", "TX");

    private IngestEventsUseCase useCase;
    private InMemoryEventHashStore hashStore;
    private List<DiscoveryProvider> providers;

    @BeforeEach
    void setUp() {
        hashStore = new InMemoryEventHashStore();
        providers = new ArrayList<>();

        providers.add(new TestProvider("gemini", List.of(
            rawEvent("Cirque du Soleil", "Cosm, 5776 Grandscape Blvd", "01/15/2026", "3:30 PM"),
            rawEvent("The Matrix in Shared Reality", "Cosm", "2026-01-15", "8:30 PM")
        )));
        providers.add(new TestProvider("perplexity", List.of(
            rawEvent("\"Cirque du Soleil at Cosm\"", "Cosm", "January 15, 2026", "15:30"),
            rawEvent("Stars vs. Blues", "American Airlines Center", "2026-01-15", "7 PM"),
            rawEvent("Headliner TBD", "Toyota Music Factory", "2026-01-15", "9 PM")
        )));

        useCase = newUseCase(providers);
    }

    @AfterEach
    void tearDown() {
        useCase.close();
    }

    private IngestEventsUseCase newUseCase(List<DiscoveryProvider> providers) {
        EventHasher hasher = new EventHasher();
        return new IngestEventsUseCase(
            providers,
            new EventNormalizer(),
            new EventValidator(false, EventValidator.DEFAULT_PHASE),
            new DuplicateGrouper(hasher),
            hashStore,
            FRISCO,
            2
        );
    }

    private static RawEvent rawEvent(String title, String venue, String date, String time) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("title", title);
        raw.put("venue", venue);
        raw.put("event_date", date);
        raw.put("event_time", time);
        raw.put("event_end_time", "11 PM");
        raw.put("category", "live entertainment");
        return RawEvent.of(raw);
    }

    @Test
    void testExecuteSuccess() {
        IngestEventsUseCase.IngestSummary summary = useCase.execute();

        assertNotNull(summary);
        assertEquals(2, summary.eventsByProvider().get("gemini"));
        assertEquals(3, summary.eventsByProvider().get("perplexity"));
        assertTrue(summary.errors().isEmpty());

        assertEquals(5, summary.validation().stats().total());
        assertEquals(4, summary.validation().stats().valid());
        assertEquals(RejectReason.TBD_IN_TITLE, summary.validation().invalid().get(0).reason());

        // Both Cirque listings collapse to one hash
        assertEquals(1, summary.duplicateGroups().size());
        assertEquals(2, summary.duplicateGroups().get(0).count());
        assertEquals(3, summary.newEvents().size());
        assertEquals(1, summary.alreadyKnown());
        assertEquals("Cirque du Soleil", summary.newEvents().get(0).event().title());
        assertEquals("Frisco", summary.newEvents().get(0).event().city());
        assertEquals(EventCategory.CONCERT, summary.newEvents().get(0).event().category());
    }

    @Test
    void testSecondRunFindsNothingNew() {
        useCase.execute(FRISCO);

        IngestEventsUseCase.IngestSummary second = useCase.execute(FRISCO);

        assertTrue(second.newEvents().isEmpty());
        assertEquals(4, second.alreadyKnown());
        assertEquals(3, hashStore.size());
    }

    @Test
    void testExecuteWithErrors() {
        providers.add(new FailingProvider("failing"));
        useCase.close();
        useCase = newUseCase(providers);

        IngestEventsUseCase.IngestSummary summary = useCase.execute();

        assertNotNull(summary);
        assertEquals(2, summary.eventsByProvider().get("gemini"));
        assertEquals(3, summary.eventsByProvider().get("perplexity"));
        assertTrue(summary.errors().containsKey("failing"));
        assertEquals("Test failure", summary.errors().get("failing"));
        assertEquals(3, summary.newEvents().size());
    }

    @Test
    void testProviderReturningNothing() {
        useCase.close();
        useCase = newUseCase(List.of(new TestProvider("empty", null)));

        IngestEventsUseCase.IngestSummary summary = useCase.execute();

        assertEquals(0, summary.eventsByProvider().get("empty"));
        assertEquals(0, summary.validation().stats().total());
        assertTrue(summary.newEvents().isEmpty());
    }

    @Test
    void testProcessProviderOutputDirectly() {
        List<RawEvent> output = List.of(
            rawEvent("Cirque du Soleil", "Cosm", "2026-01-15", "15:30"),
            RawEvent.empty()
        );

        IngestEventsUseCase.IngestSummary summary = useCase.process("manual", output, FRISCO);

        assertEquals(2, summary.eventsByProvider().get("manual"));
        assertEquals(1, summary.validation().stats().valid());
        assertEquals(RejectReason.MISSING_TITLE, summary.validation().invalid().get(0).reason());
        assertEquals(1, summary.newEvents().size());
        assertEquals(32, summary.newEvents().get(0).hash().length());
    }

    /**
     * Test provider that returns a fixed batch.
     */
    private static class TestProvider implements DiscoveryProvider {
        private final String name;
        private final List<RawEvent> events;

        public TestProvider(String name, List<RawEvent> events) {
            this.name = name;
            this.events = events;
        }

        @Override
        public String getProviderName() {
            return name;
        }

        @Override
        public List<RawEvent> discoverEvents(LocationContext context) {
            return events;
        }
    }

    /**
     * Test provider that always fails.
     */
    private static class FailingProvider implements DiscoveryProvider {
        private final String name;

        public FailingProvider(String name) {
            this.name = name;
        }

        @Override
        public String getProviderName() {
            return name;
        }

        @Override
        public List<RawEvent> discoverEvents(LocationContext context) throws Exception {
            throw new Exception("Test failure");
        }
    }
}
