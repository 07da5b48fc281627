package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.config.SearchConfig;
import de.bsommerfeld.topiccorpus.core.domain.Strategy;
import de.bsommerfeld.topiccorpus.core.event.AcquisitionEvents.DiscoveryCompletedEvent;
import de.bsommerfeld.topiccorpus.core.event.ApplicationEventBus;
import de.bsommerfeld.topiccorpus.core.lexicon.Lexicon;
import de.bsommerfeld.topiccorpus.core.text.KeywordNormalizer;
import de.bsommerfeld.topiccorpus.core.text.QueryStrategyBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finds the communities where a topic is discussed most.
 *
 * <h3>Search</h3>
 * Strategies are tried in order. For each one a newest-first OR-query is
 * paged through for at most {@code discovery-pages} requests and the
 * {@code subreddit} field of every item is counted. The first strategy that
 * produces any count wins; later strategies are not consulted.
 *
 * <h3>Ranking</h3>
 * Counts are keyed by the canonical, case-insensitive community name; the
 * first spelling seen is the one reported. Communities are ranked by
 * descending frequency and ties keep first-seen order. The ranked list then
 * goes through {@link CommunityValidator}.
 *
 * <h3>Curated fallback</h3>
 * When no strategy returns data (mirror down, or nothing matches) the
 * lexicon's curated table is consulted instead: an entry applies when any
 * normalized token contains its topic key.
 */
@Singleton
public class SubredditDiscoverer {

    private static final Logger LOG = LoggerFactory.getLogger(SubredditDiscoverer.class);

    private final QueryStrategyBuilder strategyBuilder;
    private final KeywordNormalizer normalizer;
    private final Retriever retriever;
    private final CommunityValidator validator;
    private final Lexicon lexicon;
    private final SearchConfig config;
    private final Clock clock;
    private final ApplicationEventBus eventBus;

    @Inject
    public SubredditDiscoverer(QueryStrategyBuilder strategyBuilder, KeywordNormalizer normalizer,
            Retriever retriever, CommunityValidator validator, Lexicon lexicon, SearchConfig config,
            Clock clock, ApplicationEventBus eventBus) {
        this.strategyBuilder = strategyBuilder;
        this.normalizer = normalizer;
        this.retriever = retriever;
        this.validator = validator;
        this.lexicon = lexicon;
        this.config = config;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    /**
     * @return up to {@code maxSubs} canonical community identifiers, possibly empty
     */
    public List<String> discover(String prompt, String rawKeywords, int months, int maxSubs) {
        List<Strategy> strategies = strategyBuilder.build(prompt, rawKeywords, config.getMaxTerms());
        if (strategies.isEmpty()) {
            LOG.warn("No search terms derivable from input, skipping community search");
        }

        long after = SearchParams.afterTimestamp(clock, months);
        int itemLimit = config.getDiscoveryPages() * config.getPageSize();
        int maxPages = config.getDiscoveryPages();

        for (Strategy strategy : strategies) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            Map<String, Integer> counts = countCommunities(strategy, after, itemLimit, maxPages);
            if (counts.isEmpty()) {
                LOG.info("Strategy '{}' returned no data", strategy.label());
                continue;
            }
            List<String> ranked = validator.clean(rank(counts), maxSubs);
            LOG.info("Discovered {} communities via '{}' strategy: {}", ranked.size(), strategy.label(), ranked);
            eventBus.post(new DiscoveryCompletedEvent(ranked, strategy.label(), false));
            return ranked;
        }

        List<String> curated = curatedFallback(prompt, rawKeywords, maxSubs);
        if (curated.isEmpty()) {
            LOG.warn("Community discovery found nothing and no curated entry matches");
        } else {
            LOG.warn("Community discovery returned no data, using curated fallback: {}", curated);
        }
        eventBus.post(new DiscoveryCompletedEvent(curated, null, true));
        return curated;
    }

    private Map<String, Integer> countCommunities(Strategy strategy, long after, int itemLimit, int maxPages) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, String> spellings = new HashMap<>();
        Map<String, String> params = SearchParams.forQuery(strategy.query(), after, config.getPageSize());
        retriever.paginate(params, itemLimit, maxPages, page -> {
            for (JsonNode item : page) {
                String community = CommunityValidator.canonical(item.path("subreddit").asText(""));
                if (community != null) {
                    String key = spellings.computeIfAbsent(community.toLowerCase(Locale.ROOT), k -> community);
                    counts.merge(key, 1, Integer::sum);
                }
            }
        });
        return counts;
    }

    /** Descending by count; the sort is stable, so ties stay in first-seen order. */
    static List<String> rank(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        List<String> out = new ArrayList<>(entries.size());
        for (Map.Entry<String, Integer> entry : entries) {
            out.add(entry.getKey());
        }
        return out;
    }

    List<String> curatedFallback(String prompt, String rawKeywords, int maxSubs) {
        Set<String> tokens = new LinkedHashSet<>();
        for (String token : normalizer.baseTokens(prompt, rawKeywords)) {
            tokens.add(lexicon.normalizeLookup(token));
        }
        for (String term : normalizer.normalize(prompt, rawKeywords)) {
            tokens.add(lexicon.normalizeLookup(term));
        }

        List<String> candidates = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : lexicon.curatedCommunities().entrySet()) {
            String topic = entry.getKey();
            if (tokens.stream().anyMatch(token -> token.contains(topic))) {
                candidates.addAll(entry.getValue());
            }
        }
        return validator.clean(candidates, maxSubs);
    }
}
