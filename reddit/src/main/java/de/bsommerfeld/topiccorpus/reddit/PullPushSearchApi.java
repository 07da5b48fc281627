package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.config.SearchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.StringJoiner;

/**
 * Queries the PullPush submission search mirror, which serves the historical
 * Reddit archive without authentication.
 *
 * <h3>Request</h3>
 * A plain GET against {@code search.base-url} with URL-encoded parameters and
 * a descriptive User-Agent. The version part of the agent is injected from
 * {@code topic-corpus-version.properties} at build time via Maven resource
 * filtering; {@code search.user-agent} replaces it entirely when set.
 *
 * <h3>Response</h3>
 * The body is a JSON object whose {@code data} array holds the submissions.
 * A missing {@code data} field counts as an empty page. Anything that is not
 * a JSON object, or a {@code data} field that is not an array, is reported as
 * {@link FetchResult.Kind#MALFORMED}.
 *
 * <p>
 * This class performs exactly one request per call. Retries and pagination
 * live in {@link Retriever}.
 */
@Singleton
public class PullPushSearchApi implements SearchApi {

    private static final Logger LOG = LoggerFactory.getLogger(PullPushSearchApi.class);

    private static final String DEFAULT_USER_AGENT = buildUserAgent();

    private final SearchConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String userAgent;

    @Inject
    public PullPushSearchApi(SearchConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.mapper = new ObjectMapper();
        String configured = config.getUserAgent();
        this.userAgent = configured == null || configured.isBlank() ? DEFAULT_USER_AGENT : configured;
    }

    @Override
    public FetchResult search(Map<String, String> params) {
        String url = buildUrl(config.getBaseUrl(), params);
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                    .header("User-Agent", userAgent)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IllegalArgumentException e) {
            // malformed search.base-url
            LOG.warn("Cannot build request for {}: {}", url, e.getMessage());
            return FetchResult.failure(FetchResult.Kind.NETWORK_ERROR, url, null, e.toString());
        } catch (IOException e) {
            LOG.debug("Request to {} failed: {}", url, e.toString());
            return FetchResult.failure(FetchResult.Kind.NETWORK_ERROR, url, null, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(FetchResult.Kind.NETWORK_ERROR, url, null, "interrupted");
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOG.debug("Request to {} returned HTTP {}", url, status);
            return FetchResult.failure(FetchResult.Kind.HTTP_ERROR, url, status,
                    FetchResult.preview(response.body()));
        }
        return parse(url, status, response.body());
    }

    FetchResult parse(String url, int status, String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            return FetchResult.failure(FetchResult.Kind.MALFORMED, url, status, e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return FetchResult.failure(FetchResult.Kind.MALFORMED, url, status, FetchResult.preview(body));
        }
        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            return FetchResult.ok(url, status, List.of());
        }
        if (!data.isArray()) {
            return FetchResult.failure(FetchResult.Kind.MALFORMED, url, status, "'data' is not an array");
        }
        List<JsonNode> items = new ArrayList<>(data.size());
        data.forEach(items::add);
        return FetchResult.ok(url, status, items);
    }

    /** {@code base?k=v&...} with keys and values URL-encoded as UTF-8. */
    public static String buildUrl(String baseUrl, Map<String, String> params) {
        StringJoiner query = new StringJoiner("&");
        params.forEach((key, value) -> {
            if (value != null) {
                query.add(URLEncoder.encode(key, StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(value, StandardCharsets.UTF_8));
            }
        });
        String joined = query.toString();
        if (joined.isEmpty()) {
            return baseUrl;
        }
        return baseUrl + (baseUrl.contains("?") ? "&" : "?") + joined;
    }

    String userAgent() {
        return userAgent;
    }

    private static String buildUserAgent() {
        String version = "unknown";
        try (InputStream in = PullPushSearchApi.class.getResourceAsStream("/topic-corpus-version.properties")) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                version = props.getProperty("app.version", "unknown");
            }
        } catch (IOException e) {
            LOG.debug("Could not read version properties: {}", e.getMessage());
        }
        return "java:de.bsommerfeld.topiccorpus:v" + version + " (topic corpus collector)";
    }
}
