package de.bsommerfeld.topiccorpus.core.seed;

import de.bsommerfeld.topiccorpus.core.domain.FilterSpec;
import de.bsommerfeld.topiccorpus.core.domain.MatchMode;

import java.util.List;

/**
 * Communities, keywords and filter terms suggested by the seeding step.
 * {@code months} and {@code minUpvotes} are {@code null} when the seed does
 * not override the run configuration.
 *
 * @param communities   canonical {@code r/<name>} identifiers, deduplicated
 * @param keywords      keywords plus must and should terms, deduplicated
 * @param mustInclude   terms every on-topic post should mention
 * @param shouldInclude supporting terms
 * @param exclude       terms that mark a post as off-topic
 * @param months        suggested time window, or {@code null}
 * @param minUpvotes    suggested score threshold, or {@code null}
 */
public record SeedPlan(
        List<String> communities,
        List<String> keywords,
        List<String> mustInclude,
        List<String> shouldInclude,
        List<String> exclude,
        Integer months,
        Integer minUpvotes) {

    public SeedPlan {
        communities = communities == null ? List.of() : List.copyOf(communities);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        mustInclude = mustInclude == null ? List.of() : List.copyOf(mustInclude);
        shouldInclude = shouldInclude == null ? List.of() : List.copyOf(shouldInclude);
        exclude = exclude == null ? List.of() : List.copyOf(exclude);
    }

    public static SeedPlan empty() {
        return new SeedPlan(List.of(), List.of(), List.of(), List.of(), List.of(), null, null);
    }

    public FilterSpec toFilterSpec(MatchMode mode) {
        return new FilterSpec(mustInclude, shouldInclude, exclude, mode);
    }
}
