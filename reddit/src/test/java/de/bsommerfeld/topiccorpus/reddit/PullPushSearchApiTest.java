package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import de.bsommerfeld.topiccorpus.core.config.SearchConfig;
import de.bsommerfeld.topiccorpus.core.event.ApplicationEventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PullPushSearchApiTest {

    private static final String URL = "https://api.pullpush.io/reddit/search/submission/?q=x";

    private PullPushSearchApi api;

    @BeforeEach
    void setUp() {
        api = new PullPushSearchApi(new SearchConfig());
    }

    // -- search --

    @Test
    void search_shouldReportBaseUrlWithoutSchemeAsNetworkError() {
        SearchConfig config = new SearchConfig();
        config.setBaseUrl("api.pullpush.io/reddit/search/submission/");

        FetchResult result = new PullPushSearchApi(config).search(Map.of("q", "haptic"));

        assertEquals(FetchResult.Kind.NETWORK_ERROR, result.kind());
        assertNull(result.statusCode());
    }

    @Test
    void search_shouldReportIllegalCharactersInBaseUrlAsNetworkError() {
        SearchConfig config = new SearchConfig();
        config.setBaseUrl("https://api pullpush io/search");

        FetchResult result = new PullPushSearchApi(config).search(Map.of("q", "haptic"));

        assertEquals(FetchResult.Kind.NETWORK_ERROR, result.kind());
    }

    @Test
    void fetch_shouldReturnEmptyPageForUnusableBaseUrl() {
        SearchConfig config = new SearchConfig();
        config.setBaseUrl("api.pullpush.io/reddit/search/submission/");
        Retriever retriever = new Retriever(new PullPushSearchApi(config), config, millis -> { },
                new ApplicationEventBus());

        List<JsonNode> items = assertDoesNotThrow(() -> retriever.fetch(Map.of("q", "haptic")));

        assertTrue(items.isEmpty());
    }

    // -- parse --

    @Test
    void parse_shouldReturnDataItems() {
        FetchResult result = api.parse(URL, 200, "{\"data\": [{\"id\": \"a\"}, {\"id\": \"b\"}]}");

        assertTrue(result.isOk());
        assertEquals(200, result.statusCode());
        assertEquals("b", result.items().get(1).get("id").asText());
    }

    @Test
    void parse_shouldTreatMissingDataAsEmptyPage() {
        FetchResult result = api.parse(URL, 200, "{\"metadata\": {}}");

        assertTrue(result.isOk());
        assertTrue(result.items().isEmpty());
    }

    @Test
    void parse_shouldTreatNullDataAsEmptyPage() {
        assertTrue(api.parse(URL, 200, "{\"data\": null}").items().isEmpty());
    }

    @Test
    void parse_shouldRejectInvalidJson() {
        FetchResult result = api.parse(URL, 200, "<html>Bad Gateway</html>");

        assertEquals(FetchResult.Kind.MALFORMED, result.kind());
        assertFalse(result.isOk());
        assertTrue(result.items().isEmpty());
    }

    @Test
    void parse_shouldRejectNonObjectRoot() {
        FetchResult result = api.parse(URL, 200, "[1, 2, 3]");

        assertEquals(FetchResult.Kind.MALFORMED, result.kind());
        assertEquals("[1, 2, 3]", result.detail());
    }

    @Test
    void parse_shouldRejectNonArrayData() {
        assertEquals(FetchResult.Kind.MALFORMED, api.parse(URL, 200, "{\"data\": {\"id\": \"a\"}}").kind());
    }

    @Test
    void parse_shouldRejectEmptyBody() {
        assertEquals(FetchResult.Kind.MALFORMED, api.parse(URL, 200, "").kind());
    }

    // -- buildUrl --

    @Test
    void buildUrl_shouldEncodeParametersInOrder() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", "\"haptic glove\" OR güvenlik");
        params.put("after", "1700000000");
        params.put("skipped", null);

        String url = PullPushSearchApi.buildUrl("https://example.org/search/", params);

        assertEquals("https://example.org/search/?q=%22haptic+glove%22+OR+g%C3%BCvenlik&after=1700000000", url);
    }

    @Test
    void buildUrl_shouldAppendToExistingQuery() {
        assertEquals("https://example.org/search?x=1&q=vr",
                PullPushSearchApi.buildUrl("https://example.org/search?x=1", Map.of("q", "vr")));
    }

    @Test
    void buildUrl_shouldReturnBaseForEmptyParams() {
        assertEquals("https://example.org/search", PullPushSearchApi.buildUrl("https://example.org/search", Map.of()));
    }

    // -- misc --

    @Test
    void userAgent_shouldIdentifyTheCollector() {
        assertTrue(api.userAgent().startsWith("java:de.bsommerfeld.topiccorpus:v"));
        assertTrue(api.userAgent().endsWith("(topic corpus collector)"));
    }

    @Test
    void preview_shouldCutAndFlattenBody() {
        String body = "line one\nline two\r\n" + "x".repeat(400);

        String preview = FetchResult.preview(body);

        assertFalse(preview.contains("\n"));
        assertTrue(preview.length() <= FetchResult.PREVIEW_LENGTH);
        assertTrue(preview.startsWith("line one line two"));
        assertEquals("", FetchResult.preview(null));
    }
}
