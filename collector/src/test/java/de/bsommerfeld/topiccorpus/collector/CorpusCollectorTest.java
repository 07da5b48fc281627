package de.bsommerfeld.topiccorpus.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.topiccorpus.core.config.ApplicationMode;
import de.bsommerfeld.topiccorpus.core.config.CorpusConfig;
import de.bsommerfeld.topiccorpus.core.config.RunConfig;
import de.bsommerfeld.topiccorpus.core.domain.MatchMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the whole pipeline against the synthetic search API.
 */
class CorpusCollectorTest {

    private static final Set<String> SYNTHETIC_COMMUNITIES = Set.of("r/haptics", "r/virtualreality",
            "r/cybersecurity", "r/privacy", "r/appdev", "r/MachineLearning");

    @TempDir
    Path tempDir;

    private CorpusConfig config;
    private RunConfig run;

    @BeforeEach
    void setUp() {
        config = new CorpusConfig();
        config.getSearch().setPageDelayMillis(0);
        config.getSearch().setRetryBackoffMillis(0);
        config.getSearch().setDiscoveryPages(2);

        run = config.getRun();
        run.setPrompt("haptic glove");
        run.setLimit(100);
        run.setTargetVolume(50);
        run.setMaxSubs(3);
        run.setOutput(tempDir.resolve("out/corpus.jsonl").toString());
    }

    @Test
    void run_shouldUseSeededCommunitiesAndWriteFilteredCorpus() throws Exception {
        Path seed = tempDir.resolve("seed.json");
        Files.writeString(seed, "{\"subreddits\": [\"haptics\", \"r/AskReddit\"],"
                + " \"keywords\": [\"haptic\"], \"filters\": {\"exclude\": [\"zzzz\"]}}");
        run.setSeedFile(seed.toString());
        run.setDiagnosticsOutput(tempDir.resolve("diag/api_health.json").toString());

        CollectionSummary summary = collector().run();

        assertEquals(List.of("r/haptics"), summary.communities());
        assertTrue(summary.finalCount() > 0);
        assertTrue(summary.finalCount() <= summary.rawCount());

        List<String> lines = Files.readAllLines(summary.output());
        assertEquals(summary.finalCount(), lines.size());
        ObjectMapper mapper = new ObjectMapper();
        for (String line : lines) {
            JsonNode post = mapper.readTree(line);
            String text = (post.get("title").asText() + " " + post.get("selftext").asText()).toLowerCase(Locale.ROOT);
            assertTrue(text.contains("haptic"), text);
            assertTrue(post.get("upvotes").asInt() >= run.getMinUpvotes());
        }
        assertTrue(Files.exists(tempDir.resolve("diag/api_health.json")));
    }

    @Test
    void run_shouldDiscoverCommunitiesWithoutSeed() throws Exception {
        CollectionSummary summary = collector().run();

        assertFalse(summary.communities().isEmpty());
        assertTrue(summary.communities().size() <= 3);
        assertTrue(SYNTHETIC_COMMUNITIES.containsAll(summary.communities()), summary.communities().toString());
        assertTrue(summary.strategies() > 0);
        assertTrue(Files.exists(summary.output()));
    }

    @Test
    void run_shouldApplySeedOverridesAndAllMode() throws Exception {
        Path seed = tempDir.resolve("seed.json");
        Files.writeString(seed, "{\"subreddits\": [\"privacy\"], \"min_upvotes\": 400, \"timeframe_months\": 1}");
        run.setSeedFile(seed.toString());
        run.setKeywords(List.of("\"Thoughts on\" privacy"));
        run.setMatchMode(MatchMode.ALL);

        CollectionSummary summary = collector().run();

        ObjectMapper mapper = new ObjectMapper();
        for (String line : Files.readAllLines(summary.output())) {
            JsonNode post = mapper.readTree(line);
            assertTrue(post.get("title").asText().startsWith("Thoughts on privacy"), line);
        }
    }

    @Test
    void run_shouldApplySeedAndRunExcludeTerms() throws Exception {
        Path seed = tempDir.resolve("seed.json");
        Files.writeString(seed, "{\"subreddits\": [\"haptics\"], \"filters\": {\"exclude\": [\"Thoughts on\"]}}");
        run.setSeedFile(seed.toString());
        run.setExcludeKeywords(List.of("anyone tried"));

        CollectionSummary summary = collector().run();

        assertTrue(summary.finalCount() <= summary.rawCount());
        ObjectMapper mapper = new ObjectMapper();
        for (String line : Files.readAllLines(summary.output())) {
            String title = mapper.readTree(line).get("title").asText().toLowerCase(Locale.ROOT);
            assertFalse(title.contains("thoughts on"), title);
            assertFalse(title.contains("anyone tried"), title);
        }
    }

    @Test
    void asInput_shouldQuotePhrasesAndStripQuotes() {
        assertEquals("\"haptic glove\" vr its", CorpusCollector.asInput(List.of("haptic glove", "vr", "it's", " ")));
    }

    private CorpusCollector collector() {
        Injector injector = Guice.createInjector(new CollectorModule(config, ApplicationMode.TEST));
        return injector.getInstance(CorpusCollector.class);
    }
}
