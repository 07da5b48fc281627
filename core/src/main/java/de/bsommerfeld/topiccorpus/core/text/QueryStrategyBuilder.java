package de.bsommerfeld.topiccorpus.core.text;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.domain.SearchTerm;
import de.bsommerfeld.topiccorpus.core.domain.Strategy;
import de.bsommerfeld.topiccorpus.core.lexicon.Lexicon;
import de.bsommerfeld.topiccorpus.core.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the prioritised list of OR-query strategies for a prompt.
 *
 * <ol>
 * <li><strong>primary</strong>: ASCII synonym expansions from
 * {@link KeywordNormalizer#normalize}</li>
 * <li><strong>basic</strong>: ASCII-folded base tokens, independent of synonym
 * coverage</li>
 * <li><strong>fallback</strong>: the lexicon's generic terms, only when both
 * of the above are empty</li>
 * </ol>
 *
 * Strategies with identical term lists are collapsed and empty ones dropped.
 * Any non-blank input yields at least one strategy; blank input yields none.
 */
@Singleton
public class QueryStrategyBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(QueryStrategyBuilder.class);

    public static final String PRIMARY = "primary";
    public static final String BASIC = "basic";
    public static final String FALLBACK = "fallback";

    private final KeywordNormalizer normalizer;
    private final Lexicon lexicon;

    @Inject
    public QueryStrategyBuilder(KeywordNormalizer normalizer, Lexicon lexicon) {
        this.normalizer = normalizer;
        this.lexicon = lexicon;
    }

    public List<Strategy> build(String prompt, String rawKeywords, int maxTerms) {
        boolean blankInput = (prompt == null || prompt.isBlank())
                && (rawKeywords == null || rawKeywords.isBlank());
        if (blankInput) {
            LOG.debug("No prompt or keywords given, no strategies built");
            return List.of();
        }

        Strategy primary = strategy(PRIMARY, normalizer.normalize(prompt, rawKeywords), maxTerms);
        Strategy basic = strategy(BASIC, normalizer.basicTerms(prompt, rawKeywords), maxTerms);

        List<Strategy> candidates = new ArrayList<>();
        candidates.add(primary);
        candidates.add(basic);
        if (primary.isEmpty() && basic.isEmpty()) {
            LOG.warn("Prompt '{}' produced no usable terms, using static fallback terms", prompt);
            candidates.add(strategy(FALLBACK, lexicon.fallbackTerms(), maxTerms));
        }

        List<Strategy> out = new ArrayList<>();
        Set<List<String>> seen = new HashSet<>();
        for (Strategy s : candidates) {
            if (!s.isEmpty() && seen.add(s.texts())) {
                out.add(s);
            }
        }
        LOG.debug("Built {} strategies: {}", out.size(), out);
        return out;
    }

    private Strategy strategy(String label, List<String> texts, int maxTerms) {
        List<SearchTerm> terms = new ArrayList<>();
        for (String text : texts) {
            if (terms.size() >= maxTerms) {
                break;
            }
            if (TextUtils.isAscii(text)) {
                terms.add(new SearchTerm(text));
            }
        }
        return new Strategy(label, terms);
    }
}
