package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.topiccorpus.core.config.EscalationConfig;
import de.bsommerfeld.topiccorpus.core.config.SearchConfig;
import de.bsommerfeld.topiccorpus.core.domain.Post;
import de.bsommerfeld.topiccorpus.core.domain.SearchTerm;
import de.bsommerfeld.topiccorpus.core.domain.Strategy;
import de.bsommerfeld.topiccorpus.core.event.AcquisitionEvents.AttemptCompletedEvent;
import de.bsommerfeld.topiccorpus.core.event.ApplicationEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static de.bsommerfeld.topiccorpus.reddit.RecordingSearchApi.items;
import static org.junit.jupiter.api.Assertions.*;

class EscalationControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
    private static final long DAY = 86_400L;

    private RecordingSearchApi api;
    private List<AttemptCompletedEvent> events;
    private EscalationController controller;

    @BeforeEach
    void setUp() {
        SearchConfig config = new SearchConfig();
        config.setPageDelayMillis(0);
        config.setRetryBackoffMillis(0);
        api = new RecordingSearchApi();
        events = new ArrayList<>();

        ApplicationEventBus eventBus = new ApplicationEventBus();
        eventBus.register(new Object() {
            @Subscribe
            public void on(AttemptCompletedEvent event) {
                events.add(event);
            }
        });

        Retriever retriever = new Retriever(api, config, millis -> { }, eventBus);
        controller = new EscalationController(retriever, new PostMapper(),
                new AttemptLadder(new EscalationConfig()), config, Clock.fixed(NOW, ZoneOffset.UTC), eventBus);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    // -- termination --

    @Test
    void acquire_shouldStopOnceTargetVolumeIsReached() {
        List<JsonNode> basePage = new ArrayList<>(items("a", 10, "haptics", 20));
        basePage.addAll(items("low", 2, "haptics", 3));
        api.thenPage(basePage).thenPage(List.of())
                .thenPage(items("b", 45, "haptics", 6)).thenPage(List.of())
                .thenPage(items("never", 10, "haptics", 100));

        List<Post> result = controller.acquire(List.of("r/haptics"), List.of(), 6, 10, 100, 50);

        assertEquals(55, result.size());
        assertEquals(4, api.requests().size());
        assertEquals(List.of(
                new AttemptCompletedEvent(AttemptLadder.BASE, 0, 10, 10),
                new AttemptCompletedEvent(AttemptLadder.LOWER_UPVOTES, 1, 45, 55)), events);
        assertTrue(result.stream().noneMatch(p -> p.id().startsWith("low")));
    }

    @Test
    void acquire_shouldRunWholeLadderWhenTargetIsNeverReached() {
        api.thenPage(items("a", 3, "haptics", 50));

        List<Post> result = controller.acquire(List.of("r/haptics"), List.of(), 6, 10, 100, 1000);

        assertEquals(3, result.size());
        assertEquals(4, events.size());
        assertEquals(AttemptLadder.BROAD, events.get(3).label());
        assertEquals(3, events.get(3).total());
    }

    @Test
    void acquire_shouldReturnEmptyCorpusWhenNothingIsFound() {
        List<Post> result = controller.acquire(List.of("r/haptics"), List.of(), 6, 0, 100, 10);

        assertTrue(result.isEmpty());
        assertEquals(3, events.size());
    }

    @Test
    void acquire_shouldKeepFirstOccurrenceAcrossAttempts() {
        api.thenPage(items("a", 10, "haptics", 20)).thenPage(List.of())
                .thenPage(items("a", 15, "haptics", 20)).thenPage(List.of());

        List<Post> result = controller.acquire(List.of("r/haptics"), List.of(), 6, 10, 100, 15);

        assertEquals(15, result.size());
        assertEquals("pullpush_sub:base", result.get(0).source());
        assertEquals("pullpush_sub:lower-upvotes", result.get(14).source());
        assertEquals(5, events.get(1).added());
    }

    @Test
    void acquire_shouldWidenTimeWindowPerAttempt() {
        controller.acquire(List.of("r/haptics"), List.of(), 6, 0, 100, 10);

        List<String> afters = api.requests().stream().map(r -> r.get(SearchParams.AFTER)).toList();
        assertEquals(List.of(
                Long.toString(NOW.getEpochSecond() - 180 * DAY),
                Long.toString(NOW.getEpochSecond() - 720 * DAY),
                Long.toString(NOW.getEpochSecond() - 1080 * DAY)), afters);
    }

    @Test
    void acquire_shouldStopWhenInterrupted() {
        api.thenPage(items("a", 10, "haptics", 20));
        Thread.currentThread().interrupt();

        assertTrue(controller.acquire(List.of("r/haptics"), List.of(), 6, 10, 100, 5).isEmpty());
        assertTrue(api.requests().isEmpty());
    }

    // -- passes --

    @Test
    void acquire_shouldRunCommunityPassesBeforeKeywordPasses() {
        Strategy glove = new Strategy("primary", List.of(new SearchTerm("glove"), new SearchTerm("haptic glove")));
        api.answering(params -> {
            if (params.containsKey(SearchParams.BEFORE)) {
                return FetchResult.ok("http://test", 200, List.of());
            }
            String prefix = params.containsKey(SearchParams.SUBREDDIT) ? "sub" : "kw";
            return FetchResult.ok("http://test", 200, items(prefix, 2, "haptics", 100));
        });

        List<Post> result = controller.acquire(List.of("r/haptics"), List.of(glove), 6, 0, 100, 4);

        assertEquals(List.of("sub0", "sub1", "kw0", "kw1"), result.stream().map(Post::id).toList());
        assertEquals("pullpush_sub:base", result.get(0).source());
        assertEquals("pullpush_kw:primary:base", result.get(2).source());
        assertEquals(NOW, result.get(2).fetchedAt());

        Map<String, String> communityRequest = api.requests().get(0);
        assertEquals("haptics", communityRequest.get(SearchParams.SUBREDDIT));
        assertEquals("glove OR \"haptic glove\"", api.requests().get(2).get(SearchParams.QUERY));
    }

    @Test
    void acquire_shouldSkipRemainingStrategiesOnceKeywordCapIsReached() {
        Strategy first = new Strategy("primary", List.of(new SearchTerm("glove")));
        Strategy second = new Strategy("basic", List.of(new SearchTerm("eldiven")));
        api.answering(params -> FetchResult.ok("http://test", 200, items("kw", 6, "haptics", 100)));

        controller.acquire(List.of(), List.of(first, second), 6, 0, 5, 1000);

        assertTrue(api.requests().stream().noneMatch(r -> second.query().equals(r.get(SearchParams.QUERY))));
        assertEquals(3, api.requests().size());
    }

    @Test
    void acquire_shouldDropItemsBelowAttemptThreshold() {
        List<JsonNode> page = new ArrayList<>(items("hi", 3, "haptics", 30));
        page.addAll(items("lo", 3, "haptics", 29));
        api.thenPage(page);

        List<Post> result = controller.acquire(List.of("r/haptics"), List.of(), 6, 30, 100, 3);

        assertEquals(List.of("hi0", "hi1", "hi2"), result.stream().map(Post::id).toList());
    }
}
