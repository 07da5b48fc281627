package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.config.SearchConfig;
import de.bsommerfeld.topiccorpus.core.domain.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Health check for the search endpoint. Each probe is a single request
 * without retries, so the report reflects what the mirror actually does.
 *
 * <p>
 * Strategies are probed in order until one returns items. Communities are
 * probed individually, at most {@code max(maxSubs, 5)} of them.
 */
@Singleton
public class EndpointProbe {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointProbe.class);

    static final int PROBE_PAGE_SIZE = 25;
    private static final int MIN_COMMUNITY_PROBES = 5;

    private final SearchApi searchApi;
    private final SearchConfig config;
    private final Clock clock;
    private final ObjectMapper mapper;

    @Inject
    public EndpointProbe(SearchApi searchApi, SearchConfig config, Clock clock) {
        this.searchApi = searchApi;
        this.config = config;
        this.clock = clock;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Report probe(List<Strategy> strategies, List<String> communities, int months, int maxSubs) {
        long after = SearchParams.afterTimestamp(clock, months);
        List<ProbeResult> checks = new ArrayList<>();

        if (strategies.isEmpty()) {
            checks.add(new ProbeResult("search_query", "", null, false, 0, null,
                    "No keywords generated from prompt/keywords; cannot test search."));
        }
        for (int i = 0; i < strategies.size(); i++) {
            String label = strategies.size() == 1 ? "search_query" : "search_query_" + (i + 1);
            ProbeResult result = check(label, SearchParams.forQuery(strategies.get(i).query(), after, PROBE_PAGE_SIZE));
            checks.add(result);
            if (result.ok() && result.items() != null && result.items() > 0) {
                break;
            }
        }

        int communityProbes = Math.min(communities.size(), Math.max(maxSubs, MIN_COMMUNITY_PROBES));
        for (String community : communities.subList(0, communityProbes)) {
            String name = SearchParams.bareName(community);
            checks.add(check("subreddit:" + name, SearchParams.forCommunity(name, after, PROBE_PAGE_SIZE)));
        }

        Report report = new Report(checks.stream().allMatch(ProbeResult::ok) ? "healthy" : "degraded", checks);
        for (ProbeResult c : checks) {
            if (c.ok()) {
                LOG.info("[OK] {} status={} items={}", c.label(), c.status(), c.items());
            } else {
                LOG.warn("[FAIL] {} status={} detail={}", c.label(), c.status(), c.bodyPreview());
            }
        }
        LOG.info("Search API health: {}", report.status());
        return report;
    }

    public void write(Report report, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(target.toFile(), report);
        LOG.info("Wrote endpoint diagnostics to {}", target);
    }

    private ProbeResult check(String label, Map<String, String> params) {
        long started = System.nanoTime();
        FetchResult result = searchApi.search(params);
        long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        String url = result.url() != null ? result.url() : PullPushSearchApi.buildUrl(config.getBaseUrl(), params);
        return new ProbeResult(label, url, result.statusCode(), result.isOk(), elapsed,
                result.isOk() ? result.items().size() : null, result.detail());
    }

    /**
     * @param status {@code healthy} if every check passed, {@code degraded} otherwise
     */
    public record Report(@JsonProperty("status") String status, @JsonProperty("checks") List<ProbeResult> checks) {

        @JsonIgnore
        public boolean isHealthy() {
            return "healthy".equals(status);
        }
    }
}
