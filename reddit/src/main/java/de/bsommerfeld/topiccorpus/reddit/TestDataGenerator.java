package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Generates search result items shaped like the mirror's for offline TEST
 * mode.
 *
 * <p>
 * Output is deterministic for a given request: the random source is seeded
 * from the query (or community) and the cursor, so paging the same query
 * twice yields the same ids and repeated attempts overlap the way real
 * archive queries do.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li>items one hour apart, newest first, starting just below the
 * {@code before} cursor</li>
 * <li>community queries stay in the requested community; keyword queries
 * spread over {@link #COMMUNITIES}</li>
 * <li>titles mention one of the query terms so keyword filters have
 * something to match</li>
 * <li>scores 0 to 499, comment counts 0 to 199</li>
 * </ul>
 * A query is exhausted after {@value #ITEMS_PER_QUERY} items or when the
 * window's {@code after} bound is reached.
 */
public final class TestDataGenerator {

    static final int ITEMS_PER_QUERY = 300;
    private static final long STEP_SECONDS = 3600;
    private static final Pattern OR_SPLIT = Pattern.compile("\\s+OR\\s+");

    static final String[] COMMUNITIES = { "haptics", "virtualreality", "cybersecurity", "privacy", "appdev",
            "MachineLearning" };

    private static final String[] TITLE_PREFIXES = { "Thoughts on", "Anyone tried", "Looking for advice about",
            "My experience with", "Is it worth building" };
    private static final String[] BODIES = {
            "Been reading a lot about this lately.",
            "Curious what the community thinks.",
            "Here is what I found after a month of testing.",
            "",
            "Links in the comments."
    };

    private TestDataGenerator() {
    }

    /**
     * @param params      request parameters as sent to the search API
     * @param nowEpochSec upper bound when no {@code before} cursor is set
     */
    public static List<JsonNode> generatePage(Map<String, String> params, long nowEpochSec) {
        String community = params.get(SearchParams.SUBREDDIT);
        String query = params.getOrDefault(SearchParams.QUERY, "");
        String key = community != null ? "sub:" + community : "q:" + query;

        long after = parseLong(params.get(SearchParams.AFTER), 0L);
        long before = parseLong(params.get(SearchParams.BEFORE), nowEpochSec);
        int size = (int) parseLong(params.get(SearchParams.SIZE), 100L);

        long newest = nowEpochSec - Math.floorMod(nowEpochSec, STEP_SECONDS);
        boolean firstPage = before >= nowEpochSec;
        long served = firstPage ? 0 : (newest - before) / STEP_SECONDS + 1;
        int remaining = (int) Math.max(0, ITEMS_PER_QUERY - served);
        long ts = firstPage ? newest : before - 1 - Math.floorMod(before - 1, STEP_SECONDS);

        List<String> terms = terms(query);
        Random rnd = new Random(key.hashCode() * 31L + before);
        List<JsonNode> items = new ArrayList<>();

        for (int i = 0; i < Math.min(size, remaining) && ts > after; i++, ts -= STEP_SECONDS) {
            String sub = community != null ? community : COMMUNITIES[rnd.nextInt(COMMUNITIES.length)];
            String term = terms.isEmpty() ? sub : terms.get(rnd.nextInt(terms.size()));
            items.add(item(id(key, ts), sub, ts,
                    TITLE_PREFIXES[rnd.nextInt(TITLE_PREFIXES.length)] + " " + term,
                    BODIES[rnd.nextInt(BODIES.length)],
                    rnd.nextInt(500), rnd.nextInt(200)));
        }
        return items;
    }

    static ObjectNode item(String id, String subreddit, long createdUtc, String title, String selftext,
            int score, int numComments) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("id", id);
        node.put("subreddit", subreddit);
        node.put("created_utc", createdUtc);
        node.put("title", title);
        node.put("selftext", selftext);
        node.put("score", score);
        node.put("num_comments", numComments);
        node.put("permalink", "/r/" + subreddit + "/comments/" + id + "/");
        return node;
    }

    private static String id(String key, long ts) {
        return Long.toString(Math.floorMod(key.hashCode(), 46656), 36) + Long.toString(ts, 36);
    }

    private static List<String> terms(String query) {
        if (query.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : Arrays.asList(OR_SPLIT.split(query))) {
            String term = part.replace("\"", "").trim();
            if (!term.isEmpty()) {
                out.add(term);
            }
        }
        return out;
    }

    private static long parseLong(String value, long fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
