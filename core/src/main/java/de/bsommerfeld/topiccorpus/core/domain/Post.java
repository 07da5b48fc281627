package de.bsommerfeld.topiccorpus.core.domain;

import java.time.Instant;
import java.util.Locale;

/**
 * Immutable record of a single acquired submission. Timestamps are Unix epoch
 * seconds (UTC) except {@code fetchedAt}.
 *
 * @param id          platform identifier, the corpus-wide uniqueness key
 * @param subreddit   community in canonical {@code r/<name>} form
 * @param createdUtc  creation timestamp in epoch seconds
 * @param title       whitespace-collapsed title
 * @param selftext    whitespace-collapsed body, empty for link posts
 * @param url         canonical link to the post
 * @param upvotes     score at fetch time
 * @param numComments comment count at fetch time
 * @param source      provenance tag naming the pass that produced the post
 * @param fetchedAt   when the page containing the post was fetched
 */
public record Post(
        String id,
        String subreddit,
        long createdUtc,
        String title,
        String selftext,
        String url,
        int upvotes,
        int numComments,
        String source,
        Instant fetchedAt) {

    /**
     * Title and body joined and casefolded, the text all keyword filters look
     * at. The combining dot left behind by lower-casing {@code İ} is dropped.
     */
    public String searchableText() {
        return ((title == null ? "" : title) + " " + (selftext == null ? "" : selftext)).toLowerCase(Locale.ROOT)
                .replace("\u0307", "");
    }
}
