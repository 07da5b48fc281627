package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One diagnostic request against the search endpoint.
 *
 * @param label         what was probed, e.g. {@code search_query_1} or {@code subreddit:privacy}
 * @param url           request URL, empty if no request was made
 * @param status        HTTP status, {@code null} without a response
 * @param ok            whether the request succeeded
 * @param elapsedMillis wall time of the request
 * @param items         size of the {@code data} array, {@code null} unless ok
 * @param bodyPreview   error detail or body excerpt for failures
 */
public record ProbeResult(
        @JsonProperty("label") String label,
        @JsonProperty("url") String url,
        @JsonProperty("status") Integer status,
        @JsonProperty("ok") boolean ok,
        @JsonProperty("elapsed_ms") long elapsedMillis,
        @JsonProperty("items") Integer items,
        @JsonProperty("body_preview") String bodyPreview) {
}
