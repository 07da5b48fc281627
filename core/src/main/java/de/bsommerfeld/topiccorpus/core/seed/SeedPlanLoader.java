package de.bsommerfeld.topiccorpus.core.seed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.topiccorpus.core.text.ShellSplitter;
import de.bsommerfeld.topiccorpus.core.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Reads the seed JSON written by the seeding step and parses free-form
 * keyword input.
 *
 * <h3>Seed format</h3>
 * <pre>
 * {
 *   "subreddits": ["r/haptics", {"name": "vr"}, {"subreddit": "r/oculus"}],
 *   "keywords": ["haptic glove"],
 *   "filters": {"must_include": [], "should_include": [], "exclude": []},
 *   "timeframe_months": 12,
 *   "min_upvotes": 10
 * }
 * </pre>
 * Every field is optional. A file that exists but cannot be parsed is a
 * startup error.
 */
public final class SeedPlanLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SeedPlanLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SeedPlanLoader() {
    }

    public static SeedPlan load(Path path) {
        JsonNode root;
        try {
            root = MAPPER.readTree(Files.readString(path));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read seed plan " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Seed plan " + path + " is not a JSON object");
        }

        List<String> communities = communities(root.path("subreddits"));
        JsonNode filters = root.path("filters");
        List<String> must = strings(filters.path("must_include"));
        List<String> should = strings(filters.path("should_include"));
        List<String> exclude = TextUtils.dedupeIgnoreCase(strings(filters.path("exclude")));

        List<String> combined = new ArrayList<>(strings(root.path("keywords")));
        combined.addAll(must);
        combined.addAll(should);
        List<String> keywords = TextUtils.dedupeIgnoreCase(combined);

        Integer months = positiveOrNull(root.path("timeframe_months"));
        Integer minUpvotes = root.path("min_upvotes").isNumber()
                ? Math.max(0, root.path("min_upvotes").asInt())
                : null;

        SeedPlan plan = new SeedPlan(communities, keywords, must, should, exclude, months, minUpvotes);
        LOG.info("Loaded seed plan {}: {} communities, {} keywords, {} exclude terms",
                path, communities.size(), keywords.size(), exclude.size());
        return plan;
    }

    /**
     * Parses keyword input given as a JSON array string or as shell-style
     * words. Input that fails both falls back to splitting on commas and
     * whitespace. Duplicates are removed case-insensitively.
     */
    public static List<String> parseKeywordInput(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("[")) {
            try {
                JsonNode node = MAPPER.readTree(trimmed);
                if (node.isArray()) {
                    return TextUtils.dedupeIgnoreCase(strings(node));
                }
            } catch (IOException e) {
                LOG.debug("Keyword input is not valid JSON, splitting as words: {}", e.getMessage());
            }
        }
        try {
            return TextUtils.dedupeIgnoreCase(ShellSplitter.split(trimmed));
        } catch (IllegalArgumentException e) {
            return TextUtils.dedupeIgnoreCase(Arrays.asList(trimmed.replace(',', ' ').split("\\s+")));
        }
    }

    /** Canonical {@code r/<name>} form; the last path segment is the name. */
    public static String canonicalCommunity(String raw) {
        if (raw == null) {
            return null;
        }
        String name = raw.trim();
        if (name.isEmpty()) {
            return null;
        }
        if (name.toLowerCase(Locale.ROOT).startsWith("r/")) {
            return name;
        }
        String[] segments = name.split("/");
        String last = segments.length == 0 ? "" : segments[segments.length - 1].trim();
        return last.isEmpty() ? null : "r/" + last;
    }

    private static List<String> communities(JsonNode entries) {
        List<String> out = new ArrayList<>();
        if (!entries.isArray()) {
            return out;
        }
        for (JsonNode entry : entries) {
            String raw;
            if (entry.isObject()) {
                raw = entry.path("name").asText("");
                if (raw.isBlank()) {
                    raw = entry.path("subreddit").asText(null);
                }
            } else {
                raw = entry.isNull() ? null : entry.asText();
            }
            String canonical = canonicalCommunity(raw);
            if (canonical != null) {
                out.add(canonical);
            }
        }
        return TextUtils.dedupeIgnoreCase(out);
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (!array.isArray()) {
            return out;
        }
        for (JsonNode item : array) {
            if (item.isNull()) {
                continue;
            }
            String text = item.asText().trim();
            if (!text.isEmpty()) {
                out.add(text);
            }
        }
        return out;
    }

    private static Integer positiveOrNull(JsonNode node) {
        if (!node.isNumber() || node.asInt() <= 0) {
            return null;
        }
        return node.asInt();
    }
}
