package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.config.SearchConfig;
import de.bsommerfeld.topiccorpus.core.event.AcquisitionEvents.LogEvent;
import de.bsommerfeld.topiccorpus.core.event.ApplicationEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Executes search requests with bounded retries and walks result pages
 * backwards in time.
 *
 * <h3>Retries</h3>
 * Every failed request ({@link FetchResult.Kind} other than {@code OK}) is
 * retried until {@code search.max-retries} attempts were made. Before
 * attempt {@code n + 1} the retriever waits {@code retry-backoff-millis * n}.
 * Once the attempts are used up the last failure is logged and an empty page
 * is returned. Callers cannot distinguish this from the genuine end of the
 * results; the mirror is unreliable enough that this is accepted.
 *
 * <h3>Pagination</h3>
 * The {@code before} cursor is set to the integer {@code created_utc} of the
 * last item of the previous page. Paging stops when
 * <ul>
 * <li>a page comes back empty,</li>
 * <li>the limit of raw items or pages is reached,</li>
 * <li>the last item carries no usable timestamp, or</li>
 * <li>the thread is interrupted.</li>
 * </ul>
 * Consecutive page requests are separated by {@code page-delay-millis}.
 */
@Singleton
public class Retriever {

    private static final Logger LOG = LoggerFactory.getLogger(Retriever.class);

    private final SearchApi searchApi;
    private final SearchConfig config;
    private final Sleeper sleeper;
    private final ApplicationEventBus eventBus;

    @Inject
    public Retriever(SearchApi searchApi, SearchConfig config, Sleeper sleeper, ApplicationEventBus eventBus) {
        this.searchApi = searchApi;
        this.config = config;
        this.sleeper = sleeper;
        this.eventBus = eventBus;
    }

    // =====================================================================
    // Single page
    // =====================================================================

    /**
     * Fetches one page. Never throws; exhausted retries and interruption
     * both yield an empty list.
     */
    public List<JsonNode> fetch(Map<String, String> params) {
        int maxAttempts = Math.max(1, config.getMaxRetries());
        FetchResult last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return List.of();
            }
            FetchResult result = searchApi.search(params);
            if (result.isOk()) {
                return result.items();
            }
            last = result;
            LOG.debug("Attempt {}/{} failed ({} {}): {}", attempt, maxAttempts,
                    result.kind(), result.statusCode(), result.detail());

            if (attempt < maxAttempts && !pause(config.getRetryBackoffMillis() * attempt)) {
                return List.of();
            }
        }

        String message = "Search request failed after " + maxAttempts + " attempts: "
                + last.kind() + " " + (last.statusCode() == null ? "" : last.statusCode() + " ") + last.detail();
        LOG.warn("{} ({})", message, last.url());
        eventBus.post(new LogEvent(message, "WARN"));
        return List.of();
    }

    // =====================================================================
    // Pagination
    // =====================================================================

    /**
     * Walks pages until one of the stop conditions holds and hands every
     * non-empty page to {@code pageConsumer}. Pages are passed whole, so the
     * last page may push the total past {@code limit}.
     *
     * @param params initial parameters; not modified
     * @param limit  maximum number of raw items to request
     * @return number of raw items received
     */
    public int paginate(Map<String, String> params, int limit, Consumer<List<JsonNode>> pageConsumer) {
        return paginate(params, limit, Integer.MAX_VALUE, pageConsumer);
    }

    /**
     * Like {@link #paginate(Map, int, Consumer)}, but sends at most
     * {@code maxPages} page requests.
     */
    public int paginate(Map<String, String> params, int limit, int maxPages,
            Consumer<List<JsonNode>> pageConsumer) {
        Map<String, String> cursor = new LinkedHashMap<>(params);
        int fetched = 0;
        int page = 0;

        while (fetched < limit && page < maxPages) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.info("Pagination interrupted after {} items", fetched);
                break;
            }
            List<JsonNode> items = fetch(cursor);
            if (items.isEmpty()) {
                break;
            }
            page++;
            fetched += items.size();
            LOG.debug("[{}] page={} batch={} fetched={}", describe(params), page, items.size(), fetched);
            pageConsumer.accept(items);

            if (fetched >= limit || page >= maxPages) {
                break;
            }
            Long before = createdUtc(items.get(items.size() - 1));
            if (before == null) {
                LOG.debug("Last item has no timestamp, cannot advance cursor");
                break;
            }
            cursor.put(SearchParams.BEFORE, Long.toString(before));
            if (!pause(config.getPageDelayMillis())) {
                break;
            }
        }
        return fetched;
    }

    /** Collects all pages into one list. */
    public List<JsonNode> paginate(Map<String, String> params, int limit) {
        List<JsonNode> all = new ArrayList<>();
        paginate(params, limit, all::addAll);
        return all;
    }

    /**
     * The item's {@code created_utc} truncated to whole seconds. Accepts
     * integral, floating and numeric string values; {@code null} for
     * anything missing, zero or unparsable.
     */
    public static Long createdUtc(JsonNode item) {
        JsonNode node = item == null ? null : item.get("created_utc");
        if (node == null || node.isNull()) {
            return null;
        }
        long value;
        if (node.isNumber()) {
            value = node.asLong();
        } else if (node.isTextual()) {
            try {
                value = (long) Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return value == 0 ? null : value;
    }

    private boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(Map<String, String> params) {
        String subreddit = params.get(SearchParams.SUBREDDIT);
        if (subreddit != null) {
            return "r/" + subreddit;
        }
        String query = params.getOrDefault(SearchParams.QUERY, "");
        return query.length() > 80 ? query.substring(0, 80) : query;
    }
}
