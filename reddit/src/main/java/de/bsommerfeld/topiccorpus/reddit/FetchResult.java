package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Outcome of one search request.
 *
 * @param kind       what happened
 * @param url        the request URL as sent
 * @param statusCode HTTP status, {@code null} if no response arrived
 * @param items      entries of the response's {@code data} array, empty unless {@link Kind#OK}
 * @param detail     error message or the first characters of an error body, empty on success
 */
public record FetchResult(Kind kind, String url, Integer statusCode, List<JsonNode> items, String detail) {

    /** Maximum length of {@link #detail()} taken from a response body. */
    public static final int PREVIEW_LENGTH = 200;

    public enum Kind {
        OK,
        NETWORK_ERROR,
        HTTP_ERROR,
        MALFORMED
    }

    public FetchResult {
        items = items == null ? List.of() : List.copyOf(items);
        detail = detail == null ? "" : detail;
    }

    public static FetchResult ok(String url, int statusCode, List<JsonNode> items) {
        return new FetchResult(Kind.OK, url, statusCode, items, "");
    }

    public static FetchResult failure(Kind kind, String url, Integer statusCode, String detail) {
        return new FetchResult(kind, url, statusCode, List.of(), detail);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    /** Collapses line breaks and cuts the text to {@value #PREVIEW_LENGTH} characters. */
    static String preview(String body) {
        if (body == null) {
            return "";
        }
        String cut = body.length() > PREVIEW_LENGTH ? body.substring(0, PREVIEW_LENGTH) : body;
        return cut.replace('\n', ' ').replace('\r', ' ').trim();
    }
}
