package de.bsommerfeld.topiccorpus.collector;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.config.RunConfig;
import de.bsommerfeld.topiccorpus.core.config.SearchConfig;
import de.bsommerfeld.topiccorpus.core.corpus.CorpusFinalizer;
import de.bsommerfeld.topiccorpus.core.corpus.CorpusWriter;
import de.bsommerfeld.topiccorpus.core.domain.FilterSpec;
import de.bsommerfeld.topiccorpus.core.domain.Post;
import de.bsommerfeld.topiccorpus.core.domain.Strategy;
import de.bsommerfeld.topiccorpus.core.seed.SeedPlan;
import de.bsommerfeld.topiccorpus.core.seed.SeedPlanLoader;
import de.bsommerfeld.topiccorpus.core.text.QueryStrategyBuilder;
import de.bsommerfeld.topiccorpus.core.util.TextUtils;
import de.bsommerfeld.topiccorpus.reddit.CommunityValidator;
import de.bsommerfeld.topiccorpus.reddit.EndpointProbe;
import de.bsommerfeld.topiccorpus.reddit.EscalationController;
import de.bsommerfeld.topiccorpus.reddit.SubredditDiscoverer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Runs one acquisition end to end.
 *
 * <pre>
 * seed plan (optional)     → communities, keywords, filter terms, overrides
 * communities              → seeded and validated, or discovered
 * strategies               → built from prompt and keywords
 * endpoint probe (optional)→ diagnostics report
 * escalation ladder        → raw corpus
 * finalizer                → deduplicated, filtered corpus → JSONL
 * </pre>
 *
 * Keywords are the configured ones plus those of the seed plan. Multi-word
 * keywords are passed on as quoted phrases. When no keywords are given, the
 * include filter is skipped and only exclude terms apply.
 */
@Singleton
public class CorpusCollector {

    private static final Logger LOG = LoggerFactory.getLogger(CorpusCollector.class);

    private final RunConfig run;
    private final SearchConfig search;
    private final QueryStrategyBuilder strategyBuilder;
    private final CommunityValidator validator;
    private final SubredditDiscoverer discoverer;
    private final EscalationController escalation;
    private final CorpusFinalizer finalizer;
    private final CorpusWriter writer;
    private final EndpointProbe probe;

    @Inject
    public CorpusCollector(RunConfig run, SearchConfig search, QueryStrategyBuilder strategyBuilder,
            CommunityValidator validator, SubredditDiscoverer discoverer, EscalationController escalation,
            CorpusFinalizer finalizer, CorpusWriter writer, EndpointProbe probe) {
        this.run = run;
        this.search = search;
        this.strategyBuilder = strategyBuilder;
        this.validator = validator;
        this.discoverer = discoverer;
        this.escalation = escalation;
        this.finalizer = finalizer;
        this.writer = writer;
        this.probe = probe;
    }

    public CollectionSummary run() throws IOException {
        SeedPlan seed = isBlank(run.getSeedFile())
                ? SeedPlan.empty()
                : SeedPlanLoader.load(Path.of(run.getSeedFile()));

        int months = Math.max(1, seed.months() != null ? seed.months() : run.getMonths());
        int minUpvotes = Math.max(0, seed.minUpvotes() != null ? seed.minUpvotes() : run.getMinUpvotes());
        String prompt = run.getPrompt() == null ? "" : run.getPrompt();

        List<String> combined = new ArrayList<>();
        for (String entry : run.getKeywords()) {
            combined.addAll(SeedPlanLoader.parseKeywordInput(entry));
        }
        combined.addAll(seed.keywords());
        List<String> keywords = TextUtils.dedupeIgnoreCase(combined);
        String keywordInput = asInput(keywords);
        if (!keywords.isEmpty()) {
            LOG.info("Keywords: {}", String.join(", ", keywords));
        }

        List<String> communities;
        if (!seed.communities().isEmpty()) {
            communities = validator.clean(seed.communities(), run.getMaxSubs());
            LOG.info("Seeded communities: {}", communities);
        } else {
            communities = discoverer.discover(prompt, keywordInput, months, run.getMaxSubs());
        }

        List<Strategy> strategies = strategyBuilder.build(prompt, keywordInput, search.getMaxTerms());
        for (Strategy strategy : strategies) {
            LOG.info("Strategy '{}': {}", strategy.label(), strategy.query());
        }

        if (!isBlank(run.getDiagnosticsOutput())) {
            EndpointProbe.Report report = probe.probe(strategies, communities, months, run.getMaxSubs());
            probe.write(report, Path.of(run.getDiagnosticsOutput()));
            if (!report.isHealthy()) {
                LOG.warn("Search endpoint is degraded, the corpus may come out thin (see {})",
                        run.getDiagnosticsOutput());
            }
        }

        if (communities.isEmpty() && strategies.isEmpty()) {
            LOG.warn("Neither communities nor search terms available, nothing to acquire");
        }
        List<Post> raw = escalation.acquire(communities, strategies, months, minUpvotes,
                run.getLimit(), run.getTargetVolume());

        FilterSpec spec = seed.toFilterSpec(run.getMatchMode())
                .withLeadingTerms(keywords, run.getExcludeKeywords());
        List<Post> result = finalizer.apply(raw, spec);

        Path output = Path.of(run.getOutput());
        writer.write(result, output);

        CollectionSummary summary = new CollectionSummary(communities, strategies.size(), raw.size(),
                result.size(), output);
        LOG.info("Saved {} items to {} (from {} collected, {} communities, {} strategies)",
                summary.finalCount(), output, summary.rawCount(), communities.size(), summary.strategies());
        return summary;
    }

    /** Joins keywords into one input text, quoting multi-word entries. */
    static String asInput(List<String> keywords) {
        StringJoiner joiner = new StringJoiner(" ");
        for (String keyword : keywords) {
            String clean = keyword.replace("\"", "").replace("'", "").trim();
            if (clean.isEmpty()) {
                continue;
            }
            joiner.add(clean.contains(" ") ? "\"" + clean + "\"" : clean);
        }
        return joiner.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
