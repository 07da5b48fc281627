package de.bsommerfeld.topiccorpus.core.config;

import de.bsommerfeld.topiccorpus.core.domain.MatchMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReturnDefaultsForMissingFile() {
        CorpusConfig config = ConfigLoader.load(tempDir.resolve("missing.toml"));

        assertEquals(12, config.getRun().getMonths());
        assertEquals(20, config.getRun().getMinUpvotes());
        assertEquals(2000, config.getRun().getLimit());
        assertEquals(8, config.getRun().getMaxSubs());
        assertEquals(500, config.getRun().getTargetVolume());
        assertEquals(MatchMode.ANY, config.getRun().getMatchMode());
        assertEquals("data/corpus.jsonl", config.getRun().getOutput());
    }

    @Test
    void defaults_shouldMatchDocumentedSearchParameters() {
        var search = new SearchConfig();

        assertEquals("https://api.pullpush.io/reddit/search/submission/", search.getBaseUrl());
        assertEquals(100, search.getPageSize());
        assertEquals(3, search.getMaxRetries());
        assertEquals(600, search.getRetryBackoffMillis());
        assertEquals(300, search.getPageDelayMillis());
        assertEquals(8, search.getDiscoveryPages());
        assertEquals(16, search.getMaxTerms());
    }

    @Test
    void defaults_shouldMatchEscalationAndFilterConstants() {
        assertEquals(5, new EscalationConfig().getLowerUpvotesMinThreshold());
        assertEquals(24, new EscalationConfig().getOlderWindowFloorMonths());
        assertEquals(36, new EscalationConfig().getBroadWindowFloorMonths());
        assertEquals(15, new FilterConfig().getLeniencyThreshold());
    }

    @Test
    void load_shouldReadAllSections() throws IOException {
        Path file = tempDir.resolve("corpus.toml");
        Files.writeString(file, String.join("\n",
                "lexicon-file = \"custom.json\"",
                "",
                "[run]",
                "prompt = \"haptic gloves\"",
                "keywords = [\"glove\", \"\\\"force feedback\\\"\"]",
                "months = 6",
                "min-upvotes = 3",
                "match-mode = \"ALL\"",
                "exclude-keywords = [\"giveaway\"]",
                "",
                "[search]",
                "page-size = 50",
                "retry-backoff-millis = 10",
                "",
                "[escalation]",
                "older-window-floor-months = 18",
                "",
                "[filter]",
                "leniency-threshold = 3",
                "",
                "[unknown-section]",
                "ignored = true"));

        CorpusConfig config = ConfigLoader.load(file);

        assertEquals("custom.json", config.getLexiconFile());
        assertEquals("haptic gloves", config.getRun().getPrompt());
        assertEquals(List.of("glove", "\"force feedback\""), config.getRun().getKeywords());
        assertEquals(6, config.getRun().getMonths());
        assertEquals(3, config.getRun().getMinUpvotes());
        assertEquals(MatchMode.ALL, config.getRun().getMatchMode());
        assertEquals(List.of("giveaway"), config.getRun().getExcludeKeywords());
        assertEquals(50, config.getSearch().getPageSize());
        assertEquals(10, config.getSearch().getRetryBackoffMillis());
        assertEquals(3, config.getSearch().getMaxRetries());
        assertEquals(18, config.getEscalation().getOlderWindowFloorMonths());
        assertEquals(3, config.getFilter().getLeniencyThreshold());
    }

    @Test
    void load_shouldFailFastOnMalformedFile() throws IOException {
        Path file = tempDir.resolve("broken.toml");
        Files.writeString(file, "[run\nmonths = = 3");

        assertThrows(IllegalStateException.class, () -> ConfigLoader.load(file));
    }
}
