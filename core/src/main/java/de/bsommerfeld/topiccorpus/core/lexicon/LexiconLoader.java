package de.bsommerfeld.topiccorpus.core.lexicon;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a {@link Lexicon} from JSON, either the bundled
 * {@code lexicon/default-lexicon.json} or a substitute file.
 *
 * <p>
 * Stopword lists are keyed by language code and merged into one set.
 * Missing sections are treated as empty.
 */
public final class LexiconLoader {

    private static final Logger LOG = LoggerFactory.getLogger(LexiconLoader.class);

    static final String DEFAULT_RESOURCE = "lexicon/default-lexicon.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private LexiconLoader() {
    }

    /** Loads the lexicon bundled with the application. */
    public static Lexicon loadDefault() {
        try (InputStream in = LexiconLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Lexicon resource not found: " + DEFAULT_RESOURCE);
            }
            return build(MAPPER.readValue(in, Definition.class), DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read lexicon resource: " + DEFAULT_RESOURCE, e);
        }
    }

    /** Loads a substitute lexicon from disk. */
    public static Lexicon load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Lexicon file not found: " + path);
        }
        try {
            return build(MAPPER.readValue(path.toFile(), Definition.class), path.toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read lexicon file: " + path, e);
        }
    }

    /** Loads {@code path} when given, the bundled lexicon otherwise. */
    public static Lexicon loadOrDefault(String path) {
        if (path == null || path.isBlank()) {
            return loadDefault();
        }
        return load(Path.of(path));
    }

    private static Lexicon build(Definition def, String origin) {
        Set<String> stopwords = new LinkedHashSet<>();
        def.stopwords.values().forEach(stopwords::addAll);

        Lexicon lexicon = new Lexicon(stopwords, def.asciiFolding, def.suffixes, def.synonyms,
                def.fallbackTerms, def.curatedCommunities, new LinkedHashSet<>(def.genericCommunities));
        LOG.info("Lexicon loaded from {}: {} stopwords, {} suffix rules, {} synonym keys, {} curated topics",
                origin, lexicon.stopwords().size(), lexicon.suffixes().size(),
                lexicon.synonyms().size(), lexicon.curatedCommunities().size());
        return lexicon;
    }

    /** JSON shape of a lexicon file. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Definition {
        @JsonProperty("stopwords")
        Map<String, List<String>> stopwords = new LinkedHashMap<>();

        @JsonProperty("ascii_folding")
        Map<String, String> asciiFolding = new LinkedHashMap<>();

        @JsonProperty("suffixes")
        List<SuffixRule> suffixes = new ArrayList<>();

        @JsonProperty("synonyms")
        Map<String, List<String>> synonyms = new LinkedHashMap<>();

        @JsonProperty("fallback_terms")
        List<String> fallbackTerms = new ArrayList<>();

        @JsonProperty("curated_communities")
        Map<String, List<String>> curatedCommunities = new LinkedHashMap<>();

        @JsonProperty("generic_communities")
        List<String> genericCommunities = new ArrayList<>();
    }
}
