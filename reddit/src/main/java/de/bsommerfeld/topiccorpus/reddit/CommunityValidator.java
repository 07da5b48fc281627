package de.bsommerfeld.topiccorpus.reddit;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.lexicon.Lexicon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cleans candidate community lists, whether seeded or discovered.
 * Candidates are brought into {@code r/<name>} form, generic communities from
 * the lexicon's deny-list are removed, duplicates are dropped
 * case-insensitively and the result is capped.
 */
@Singleton
public class CommunityValidator {

    private static final Logger LOG = LoggerFactory.getLogger(CommunityValidator.class);

    private final Lexicon lexicon;

    @Inject
    public CommunityValidator(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    public List<String> clean(Collection<String> candidates, int limit) {
        List<String> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String candidate : candidates) {
            if (out.size() >= limit) {
                break;
            }
            String canonical = canonical(candidate);
            if (canonical == null) {
                continue;
            }
            if (lexicon.isGenericCommunity(canonical)) {
                LOG.debug("Skipping generic community {}", canonical);
                continue;
            }
            if (seen.add(canonical.toLowerCase(Locale.ROOT))) {
                out.add(canonical);
            }
        }
        return out;
    }

    /** {@code r/<last path segment>}, or {@code null} for blank input. */
    public static String canonical(String candidate) {
        String name = SearchParams.bareName(candidate);
        return name.isEmpty() ? null : "r/" + name;
    }
}
