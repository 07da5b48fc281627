package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.domain.Post;
import de.bsommerfeld.topiccorpus.core.util.TextUtils;

import java.time.Instant;

/**
 * Turns raw search items into {@link Post} records.
 *
 * <p>
 * The URL is taken from {@code full_link} when present, otherwise from
 * {@code permalink} resolved against {@value #REDDIT_BASE}. Without either,
 * a canonical comments URL is synthesised from subreddit and id.
 */
@Singleton
public class PostMapper {

    static final String REDDIT_BASE = "https://www.reddit.com";

    /**
     * @param fallbackCommunity community used when the item has none, may be {@code null}
     * @param source            provenance tag stored on the post
     * @return the post, or {@code null} if the item has no id
     */
    public Post map(JsonNode item, String fallbackCommunity, String source, Instant fetchedAt) {
        String id = item.path("id").asText("").trim();
        if (id.isEmpty()) {
            return null;
        }

        String name = SearchParams.bareName(item.path("subreddit").asText(""));
        if (name.isEmpty() && fallbackCommunity != null) {
            name = SearchParams.bareName(fallbackCommunity);
        }
        Long created = Retriever.createdUtc(item);

        return new Post(
                id,
                name.isEmpty() ? "" : "r/" + name,
                created == null ? 0L : created,
                TextUtils.cleanText(item.path("title").asText("")),
                TextUtils.cleanText(item.path("selftext").asText("")),
                resolveUrl(item, name, id),
                item.path("score").asInt(0),
                item.path("num_comments").asInt(0),
                source,
                fetchedAt);
    }

    /** Score of a raw item, {@code 0} when absent. */
    public int score(JsonNode item) {
        return item.path("score").asInt(0);
    }

    private String resolveUrl(JsonNode item, String subreddit, String id) {
        String fullLink = item.path("full_link").asText("");
        if (!fullLink.isBlank()) {
            return fullLink;
        }
        String permalink = item.path("permalink").asText("");
        if (!permalink.isBlank()) {
            if (permalink.startsWith("http")) {
                return permalink;
            }
            return REDDIT_BASE + (permalink.startsWith("/") ? "" : "/") + permalink;
        }
        return canonicalUrl(subreddit, id);
    }

    static String canonicalUrl(String subreddit, String id) {
        if (subreddit == null || subreddit.isEmpty()) {
            return REDDIT_BASE + "/comments/" + id + "/";
        }
        return REDDIT_BASE + "/r/" + subreddit + "/comments/" + id + "/";
    }
}
