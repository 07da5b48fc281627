package de.bsommerfeld.topiccorpus.core.domain;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One OR-query. Strategies are tried in priority order until one returns data.
 *
 * @param label provenance name ({@code primary}, {@code basic}, {@code fallback})
 * @param terms ordered, non-empty list of terms
 */
public record Strategy(String label, List<SearchTerm> terms) {

    public Strategy {
        terms = List.copyOf(terms);
    }

    /** The {@code q} parameter: rendered terms joined by {@code OR}. */
    public String query() {
        return terms.stream().map(SearchTerm::render).collect(Collectors.joining(" OR "));
    }

    /** Raw term texts, used to compare strategies by content. */
    public List<String> texts() {
        return terms.stream().map(SearchTerm::text).collect(Collectors.toList());
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }
}
