package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.config.SearchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Offline replacement for {@link PullPushSearchApi} when the application runs
 * in TEST mode. No HTTP requests are made; every call is answered by
 * {@link TestDataGenerator}, so the whole pipeline (discovery, escalation,
 * filtering, output) runs without network access.
 */
@Singleton
public class TestSearchApi implements SearchApi {

    private static final Logger LOG = LoggerFactory.getLogger(TestSearchApi.class);

    private final SearchConfig config;
    private final Clock clock;

    @Inject
    public TestSearchApi(SearchConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: search endpoint is NOT queried  #");
        LOG.warn("#  Using synthetic data generator for all requests    #");
        LOG.warn("#######################################################");
    }

    @Override
    public FetchResult search(Map<String, String> params) {
        String url = PullPushSearchApi.buildUrl(config.getBaseUrl(), params);
        List<JsonNode> items = TestDataGenerator.generatePage(params, clock.instant().getEpochSecond());
        LOG.debug("[TEST] {} -> {} items", url, items.size());
        return FetchResult.ok(url, 200, items);
    }
}
