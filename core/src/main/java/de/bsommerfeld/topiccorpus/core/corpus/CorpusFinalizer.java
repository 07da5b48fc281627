package de.bsommerfeld.topiccorpus.core.corpus;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.config.FilterConfig;
import de.bsommerfeld.topiccorpus.core.domain.FilterSpec;
import de.bsommerfeld.topiccorpus.core.domain.MatchMode;
import de.bsommerfeld.topiccorpus.core.domain.Post;
import de.bsommerfeld.topiccorpus.core.event.AcquisitionEvents.FilterAppliedEvent;
import de.bsommerfeld.topiccorpus.core.event.ApplicationEventBus;
import de.bsommerfeld.topiccorpus.core.lexicon.Lexicon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Deduplicates the accumulated posts and applies keyword containment filters.
 *
 * <h3>Stages</h3>
 * <ol>
 * <li><strong>dedup</strong>: by id, first occurrence wins</li>
 * <li><strong>exclude</strong>: any exclude term in title or body drops the
 * post</li>
 * <li><strong>include</strong>: must and should terms, matched per
 * {@link MatchMode}</li>
 * <li><strong>lenient include</strong>: runs when the strict pass keeps fewer
 * than {@code leniency-threshold} posts. Each term is split into words, and a
 * word also matches through its ASCII-folded form.</li>
 * </ol>
 *
 * <h3>Never empty</h3>
 * If the filters reduce a non-empty input to nothing, the deduplicated input
 * is returned unfiltered. An imprecise corpus is still usable downstream; an
 * empty one is not.
 */
@Singleton
public class CorpusFinalizer {

    private static final Logger LOG = LoggerFactory.getLogger(CorpusFinalizer.class);

    private final Lexicon lexicon;
    private final FilterConfig config;
    private final ApplicationEventBus eventBus;

    @Inject
    public CorpusFinalizer(Lexicon lexicon, FilterConfig config, ApplicationEventBus eventBus) {
        this.lexicon = lexicon;
        this.config = config;
        this.eventBus = eventBus;
    }

    public List<Post> apply(List<Post> posts, FilterSpec spec) {
        Corpus deduped = new Corpus();
        deduped.merge(posts);
        List<Post> unfiltered = deduped.snapshot();
        report("dedup", posts.size(), unfiltered.size());

        List<Post> current = excludePass(unfiltered, spec.exclude());
        current = includePass(current, spec);

        if (current.isEmpty() && !unfiltered.isEmpty()) {
            LOG.warn("[filter] filters removed all {} posts, returning the unfiltered corpus", unfiltered.size());
            report("abandoned", 0, unfiltered.size());
            return unfiltered;
        }
        LOG.info("[filter] final corpus: {} posts (from {} collected)", current.size(), unfiltered.size());
        return current;
    }

    private List<Post> excludePass(List<Post> posts, List<String> excludeTerms) {
        List<String> terms = new ArrayList<>();
        for (String term : excludeTerms) {
            if (term != null && !term.isBlank()) {
                terms.add(Lexicon.casefold(term.trim()));
            }
        }
        if (terms.isEmpty()) {
            return posts;
        }

        List<Post> kept = new ArrayList<>();
        for (Post post : posts) {
            String text = post.searchableText();
            if (terms.stream().noneMatch(text::contains)) {
                kept.add(post);
            }
        }
        int removed = posts.size() - kept.size();
        if (removed > 0) {
            LOG.info("[filter] removed {} posts based on exclude keywords", removed);
            report("exclude", posts.size(), kept.size());
        }
        return kept;
    }

    private List<Post> includePass(List<Post> posts, FilterSpec spec) {
        List<String> includeTerms = spec.includeTerms();
        if (includeTerms.isEmpty() || posts.isEmpty()) {
            return posts;
        }

        List<List<String>> strictGroups = new ArrayList<>();
        for (String term : includeTerms) {
            strictGroups.add(List.of(Lexicon.casefold(term)));
        }
        List<Post> strict = matching(posts, strictGroups, spec.mode());
        LOG.info("[filter] keyword pass ({}) kept {} of {} posts", spec.mode(), strict.size(), posts.size());
        report("include", posts.size(), strict.size());

        if (strict.size() >= config.getLeniencyThreshold()) {
            return strict;
        }

        List<Post> lenient = matching(posts, lenientGroups(includeTerms), spec.mode());
        LOG.warn("[filter] strict pass kept only {} posts (threshold {}), lenient pass kept {}",
                strict.size(), config.getLeniencyThreshold(), lenient.size());
        report("lenient-include", posts.size(), lenient.size());
        return lenient.size() > strict.size() ? lenient : strict;
    }

    /**
     * One group per distinct word of the include terms. A group matches when
     * the word or its ASCII-folded form occurs.
     */
    List<List<String>> lenientGroups(List<String> includeTerms) {
        Set<String> words = new LinkedHashSet<>();
        for (String term : includeTerms) {
            for (String word : Lexicon.casefold(term).split("\\s+")) {
                if (word.length() >= Lexicon.MIN_TOKEN_LENGTH) {
                    words.add(word);
                }
            }
        }
        List<List<String>> groups = new ArrayList<>();
        for (String word : words) {
            String folded = lexicon.fold(word);
            groups.add(folded.equals(word) ? List.of(word) : List.of(word, folded));
        }
        return groups;
    }

    private List<Post> matching(List<Post> posts, List<List<String>> groups, MatchMode mode) {
        if (groups.isEmpty()) {
            return List.of();
        }
        List<Post> kept = new ArrayList<>();
        for (Post post : posts) {
            String text = post.searchableText();
            boolean match = mode == MatchMode.ALL
                    ? groups.stream().allMatch(g -> g.stream().anyMatch(text::contains))
                    : groups.stream().anyMatch(g -> g.stream().anyMatch(text::contains));
            if (match) {
                kept.add(post);
            }
        }
        return kept;
    }

    private void report(String stage, int before, int after) {
        eventBus.post(new FilterAppliedEvent(stage, before, after));
    }
}
