package de.bsommerfeld.topiccorpus.core.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword containment rules applied to the accumulated corpus.
 *
 * @param mustInclude   terms that define the topic
 * @param shouldInclude supporting terms, matched together with {@code mustInclude}
 * @param exclude       any occurrence drops the post
 * @param mode          how the combined include terms must match
 */
public record FilterSpec(
        List<String> mustInclude,
        List<String> shouldInclude,
        List<String> exclude,
        MatchMode mode) {

    public FilterSpec {
        mustInclude = mustInclude == null ? List.of() : List.copyOf(mustInclude);
        shouldInclude = shouldInclude == null ? List.of() : List.copyOf(shouldInclude);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
        mode = mode == null ? MatchMode.ANY : mode;
    }

    /**
     * This spec with {@code mustInclude} and {@code exclude} terms placed in
     * front of its own, duplicates (case-insensitive) collapsed.
     */
    public FilterSpec withLeadingTerms(List<String> mustInclude, List<String> exclude) {
        return new FilterSpec(concat(mustInclude, this.mustInclude), shouldInclude,
                concat(exclude, this.exclude), mode);
    }

    /**
     * Must and should terms combined, blank entries removed and duplicates
     * (case-insensitive) collapsed, in declaration order.
     */
    public List<String> includeTerms() {
        return concat(mustInclude, shouldInclude);
    }

    private static List<String> concat(List<String> first, List<String> second) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        List<String> all = new ArrayList<>(first == null ? List.of() : first);
        all.addAll(second == null ? List.of() : second);
        for (String term : all) {
            if (term == null || term.isBlank()) {
                continue;
            }
            String trimmed = term.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                out.add(trimmed);
            }
        }
        return out;
    }
}
