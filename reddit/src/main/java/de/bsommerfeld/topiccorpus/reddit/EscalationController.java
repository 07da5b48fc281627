package de.bsommerfeld.topiccorpus.reddit;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.config.SearchConfig;
import de.bsommerfeld.topiccorpus.core.corpus.Corpus;
import de.bsommerfeld.topiccorpus.core.domain.Attempt;
import de.bsommerfeld.topiccorpus.core.domain.Post;
import de.bsommerfeld.topiccorpus.core.domain.Strategy;
import de.bsommerfeld.topiccorpus.core.event.AcquisitionEvents.AttemptCompletedEvent;
import de.bsommerfeld.topiccorpus.core.event.ApplicationEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Acquires posts over a ladder of increasingly permissive attempts until the
 * target volume is reached.
 *
 * <h3>One attempt</h3>
 * <ol>
 * <li><strong>Community passes</strong>: one paginated query per community,
 * up to {@code perAttemptLimit} raw items each.</li>
 * <li><strong>Keyword passes</strong>: the search strategies in order, each
 * paginated up to {@code perAttemptLimit} raw items. Once the keyword passes
 * of this attempt kept {@code perAttemptLimit} posts, the remaining strategies
 * are skipped.</li>
 * </ol>
 * Items scoring below the attempt's threshold are dropped after fetching.
 * Each attempt's posts are merged into one {@link Corpus} keyed by id, so
 * community results always precede keyword results for the same post.
 *
 * <h3>Termination</h3>
 * The ladder stops as soon as the corpus holds {@code targetVolume} posts.
 * Otherwise it runs to the end and returns whatever was gathered, which may be
 * less than the target or nothing at all.
 *
 * @see AttemptLadder
 */
@Singleton
public class EscalationController {

    private static final Logger LOG = LoggerFactory.getLogger(EscalationController.class);

    static final String COMMUNITY_SOURCE = "pullpush_sub";
    static final String KEYWORD_SOURCE = "pullpush_kw";

    private final Retriever retriever;
    private final PostMapper mapper;
    private final AttemptLadder ladder;
    private final SearchConfig config;
    private final Clock clock;
    private final ApplicationEventBus eventBus;

    @Inject
    public EscalationController(Retriever retriever, PostMapper mapper, AttemptLadder ladder,
            SearchConfig config, Clock clock, ApplicationEventBus eventBus) {
        this.retriever = retriever;
        this.mapper = mapper;
        this.ladder = ladder;
        this.config = config;
        this.clock = clock;
        this.eventBus = eventBus;
    }

    /**
     * @return deduplicated posts in accumulation order
     */
    public List<Post> acquire(List<String> communities, List<Strategy> strategies, int baseMonths,
            int baseMinUpvotes, int perAttemptLimit, int targetVolume) {
        List<Attempt> attempts = ladder.build(baseMonths, baseMinUpvotes);
        Corpus corpus = new Corpus();

        for (int index = 0; index < attempts.size(); index++) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("Acquisition interrupted before attempt {}", attempts.get(index));
                break;
            }
            Attempt attempt = attempts.get(index);
            LOG.info("[escalation] attempt {}/{}: {}", index + 1, attempts.size(), attempt);

            List<Post> gathered = runAttempt(attempt, communities, strategies, perAttemptLimit);
            int added = corpus.merge(gathered);
            int total = corpus.size();
            LOG.info("[escalation] {} kept {} posts, {} new, corpus now {}",
                    attempt.label(), gathered.size(), added, total);
            eventBus.post(new AttemptCompletedEvent(attempt.label(), index, added, total));

            if (total >= targetVolume) {
                LOG.info("[escalation] target volume {} reached after '{}'", targetVolume, attempt.label());
                break;
            }
            if (index == attempts.size() - 1) {
                LOG.warn("[escalation] ladder exhausted with {} of {} targeted posts", total, targetVolume);
            }
        }
        return corpus.snapshot();
    }

    private List<Post> runAttempt(Attempt attempt, List<String> communities, List<Strategy> strategies,
            int perAttemptLimit) {
        long after = SearchParams.afterTimestamp(clock, attempt.months());
        List<Post> gathered = new ArrayList<>();

        for (String community : communities) {
            Map<String, String> params = SearchParams.forCommunity(community, after, config.getPageSize());
            String source = COMMUNITY_SOURCE + ":" + attempt.label();
            int before = gathered.size();
            int fetched = retriever.paginate(params, perAttemptLimit,
                    page -> collect(page, community, source, attempt.minUpvotes(), gathered));
            LOG.info("[subs:{}] fetched={} kept={}", community, fetched, gathered.size() - before);
        }

        int keywordKept = 0;
        for (Strategy strategy : strategies) {
            if (keywordKept >= perAttemptLimit) {
                LOG.debug("Keyword cap of {} reached, skipping remaining strategies", perAttemptLimit);
                break;
            }
            if (strategy.isEmpty()) {
                continue;
            }
            Map<String, String> params = SearchParams.forQuery(strategy.query(), after, config.getPageSize());
            String source = KEYWORD_SOURCE + ":" + strategy.label() + ":" + attempt.label();
            int before = gathered.size();
            int fetched = retriever.paginate(params, perAttemptLimit,
                    page -> collect(page, null, source, attempt.minUpvotes(), gathered));
            int kept = gathered.size() - before;
            keywordKept += kept;
            LOG.info("[kw:{}] fetched={} kept={}", strategy.label(), fetched, kept);
        }
        return gathered;
    }

    private void collect(List<JsonNode> page, String community, String source, int minUpvotes, List<Post> sink) {
        Instant fetchedAt = clock.instant();
        for (JsonNode item : page) {
            if (mapper.score(item) < minUpvotes) {
                continue;
            }
            Post post = mapper.map(item, community, source, fetchedAt);
            if (post != null) {
                sink.add(post);
            }
        }
    }
}
