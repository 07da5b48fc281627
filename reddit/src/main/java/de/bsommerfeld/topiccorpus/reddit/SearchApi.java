package de.bsommerfeld.topiccorpus.reddit;

import java.util.Map;

/**
 * A single request against the submission search endpoint. Implementations
 * never throw for transport or protocol failures; those are reported through
 * {@link FetchResult#kind()}.
 *
 * @see PullPushSearchApi
 * @see TestSearchApi
 */
public interface SearchApi {

    /**
     * @param params query parameters in request order ({@code q} or
     *               {@code subreddit}, {@code after}, {@code before},
     *               {@code size}, {@code sort}, {@code sort_type})
     */
    FetchResult search(Map<String, String> params);
}
