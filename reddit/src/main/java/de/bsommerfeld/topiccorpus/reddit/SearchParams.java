package de.bsommerfeld.topiccorpus.reddit;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds parameter maps for the search endpoint. Results are always sorted
 * newest first so that the {@code before} cursor walks back in time.
 */
public final class SearchParams {

    public static final String QUERY = "q";
    public static final String SUBREDDIT = "subreddit";
    public static final String AFTER = "after";
    public static final String BEFORE = "before";
    public static final String SIZE = "size";

    /** A month is counted as 30 days. */
    private static final int DAYS_PER_MONTH = 30;

    private SearchParams() {
    }

    public static Map<String, String> forQuery(String query, long after, int size) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(QUERY, query);
        return withDefaults(params, after, size);
    }

    /**
     * @param community canonical {@code r/<name>} or a bare name
     */
    public static Map<String, String> forCommunity(String community, long after, int size) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(SUBREDDIT, bareName(community));
        return withDefaults(params, after, size);
    }

    /** Epoch seconds {@code months * 30} days before now. */
    public static long afterTimestamp(Clock clock, int months) {
        return clock.instant().minus(Duration.ofDays((long) DAYS_PER_MONTH * months)).getEpochSecond();
    }

    /** The last path segment, e.g. {@code r/privacy} becomes {@code privacy}. */
    public static String bareName(String community) {
        String trimmed = community == null ? "" : community.trim();
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static Map<String, String> withDefaults(Map<String, String> params, long after, int size) {
        params.put(AFTER, Long.toString(after));
        params.put(SIZE, Integer.toString(size));
        params.put("sort", "desc");
        params.put("sort_type", "created_utc");
        return params;
    }
}
