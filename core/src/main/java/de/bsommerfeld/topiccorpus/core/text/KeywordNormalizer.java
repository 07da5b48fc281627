package de.bsommerfeld.topiccorpus.core.text;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.lexicon.Lexicon;
import de.bsommerfeld.topiccorpus.core.lexicon.SuffixRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a free-text prompt and optional keyword input into an ordered set of
 * search tokens.
 *
 * <h3>Pipeline</h3>
 * 
 * <pre>
 * text ─ shell split ─ allow-list clean ─ casefold
 *      └ drop stopwords and tokens shorter than 3 ─ dedupe      = base tokens
 *          └ lookup keys: token, folded token, one stem per form, bigrams
 *              └ synonym table hit  → mapped phrases (expansions)
 *              └ no hit             → token + folded token (literals)
 * </pre>
 *
 * <h3>Suffix stripping</h3>
 * Inflected forms are reduced by the first matching {@link SuffixRule}. A stem
 * is only ever used as an extra lookup key, never stripped again and never
 * emitted on its own, so a bad rule can widen a lookup but not corrupt the
 * output.
 *
 * <h3>Bigrams</h3>
 * Adjacent base tokens of the same input are also looked up as a phrase, so
 * an unquoted {@code yapay zeka} still hits a multi-word synonym entry. Both
 * tokens then count as covered and produce no literals.
 *
 * <p>
 * The result may legitimately be empty (e.g. a prompt made of stopwords).
 * {@link QueryStrategyBuilder} owns the fallback for that case.
 */
@Singleton
public class KeywordNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(KeywordNormalizer.class);

    private final Lexicon lexicon;

    @Inject
    public KeywordNormalizer(Lexicon lexicon) {
        this.lexicon = lexicon;
    }

    /**
     * Expanded, ordered, case-insensitively unique tokens for the given input.
     * Synonym-driven expansions come first in input order, literal fallbacks
     * after them.
     */
    public List<String> normalize(String prompt, String rawKeywords) {
        List<List<String>> perInput = List.of(filtered(tokens(prompt)), filtered(tokens(rawKeywords)));

        List<String> expansions = new ArrayList<>();
        Set<String> covered = new HashSet<>();

        for (List<String> input : perInput) {
            for (int i = 0; i < input.size(); i++) {
                String token = input.get(i);

                if (i + 1 < input.size()) {
                    String next = input.get(i + 1);
                    for (String key : bigramKeys(token, next)) {
                        List<String> hits = lexicon.synonymsFor(key);
                        if (!hits.isEmpty()) {
                            expansions.addAll(hits);
                            covered.add(token);
                            covered.add(next);
                        }
                    }
                }

                for (String key : lookupKeys(token)) {
                    List<String> hits = lexicon.synonymsFor(key);
                    if (!hits.isEmpty()) {
                        expansions.addAll(hits);
                        covered.add(token);
                    }
                }
            }
        }

        List<String> literals = new ArrayList<>();
        for (String token : baseTokens(perInput)) {
            if (!covered.contains(token)) {
                literals.add(token);
                literals.add(lexicon.fold(token));
            }
        }

        List<String> candidates = new ArrayList<>(expansions);
        candidates.addAll(literals);
        List<String> result = acceptable(candidates);
        LOG.debug("Normalized '{}' / '{}' into {} tokens ({} covered by synonyms)",
                prompt, rawKeywords, result.size(), covered.size());
        return result;
    }

    /**
     * ASCII-folded base tokens without synonym expansion. A token whose stem
     * is itself one of the base tokens is dropped, so {@code uygulamalar}
     * collapses into {@code uygulama} when both occur.
     */
    public List<String> basicTerms(String prompt, String rawKeywords) {
        List<String> base = baseTokens(List.of(filtered(tokens(prompt)), filtered(tokens(rawKeywords))));

        Set<String> foldedBase = new HashSet<>();
        for (String token : base) {
            foldedBase.add(lexicon.fold(token));
        }

        List<String> out = new ArrayList<>();
        for (String token : base) {
            String folded = lexicon.fold(token);
            boolean reducible = stems(token).stream()
                    .map(lexicon::fold)
                    .anyMatch(stem -> !stem.equals(folded) && foldedBase.contains(stem));
            if (!reducible) {
                out.add(folded);
            }
        }
        return acceptable(out);
    }

    /** Stopword- and length-filtered tokens of both inputs, first occurrence wins. */
    public List<String> baseTokens(String prompt, String rawKeywords) {
        return baseTokens(List.of(filtered(tokens(prompt)), filtered(tokens(rawKeywords))));
    }

    private List<String> baseTokens(List<List<String>> perInput) {
        Set<String> seen = new LinkedHashSet<>();
        perInput.forEach(seen::addAll);
        return new ArrayList<>(seen);
    }

    // =====================================================================
    // Tokenizing
    // =====================================================================

    /**
     * Splits {@code text} into casefolded tokens. Quoted input stays one
     * phrase token with single spaces; unquoted input is cleaned against the
     * allow-list and split on whitespace. Unbalanced quotes fall back to
     * plain whitespace splitting.
     */
    public List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }

        List<String> parts;
        try {
            parts = ShellSplitter.split(text);
        } catch (IllegalArgumentException e) {
            LOG.debug("Falling back to whitespace split for '{}': {}", text, e.getMessage());
            parts = Arrays.asList(text.trim().split("\\s+"));
        }

        for (String part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            String[] chunks = lexicon.clean(part).trim().split("\\s+");
            if (part.chars().anyMatch(Character::isWhitespace)) {
                String phrase = String.join(" ", Arrays.stream(chunks)
                        .filter(c -> !c.isEmpty())
                        .map(Lexicon::casefold)
                        .toArray(String[]::new));
                if (!phrase.isEmpty()) {
                    out.add(phrase);
                }
                continue;
            }
            for (String chunk : chunks) {
                if (!chunk.isEmpty()) {
                    out.add(Lexicon.casefold(chunk));
                }
            }
        }
        return out;
    }

    private List<String> filtered(List<String> tokens) {
        List<String> out = new ArrayList<>();
        for (String token : tokens) {
            if (token.length() < Lexicon.MIN_TOKEN_LENGTH || lexicon.isStopword(token)) {
                continue;
            }
            out.add(token);
        }
        return out;
    }

    // =====================================================================
    // Lookup keys
    // =====================================================================

    /**
     * Stems of {@code token}: at most one from the token as written and one
     * from its ASCII-folded form (matched against folded suffixes). Stems are
     * never stripped again.
     */
    public List<String> stems(String token) {
        Set<String> out = new LinkedHashSet<>();
        String raw = firstStem(token, false);
        if (raw != null) {
            out.add(raw);
        }
        String folded = firstStem(lexicon.fold(token), true);
        if (folded != null) {
            out.add(folded);
        }
        return new ArrayList<>(out);
    }

    private String firstStem(String token, boolean foldSuffixes) {
        for (SuffixRule rule : lexicon.suffixes()) {
            SuffixRule effective = foldSuffixes
                    ? new SuffixRule(lexicon.fold(rule.suffix()), rule.replacement())
                    : rule;
            String stem = effective.strip(token, Lexicon.MIN_TOKEN_LENGTH);
            if (stem != null) {
                return stem;
            }
        }
        return null;
    }

    private Set<String> lookupKeys(String token) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(lexicon.normalizeLookup(token));
        keys.add(lexicon.normalizeLookup(lexicon.fold(token)));
        for (String stem : stems(token)) {
            keys.add(lexicon.normalizeLookup(stem));
        }
        keys.remove("");
        return keys;
    }

    private Set<String> bigramKeys(String first, String second) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(lexicon.normalizeLookup(first + " " + second));
        for (String stem : stems(second)) {
            keys.add(lexicon.normalizeLookup(first + " " + stem));
        }
        keys.remove("");
        return keys;
    }

    /** Drops short and stopword candidates and case-insensitive duplicates. */
    private List<String> acceptable(List<String> candidates) {
        Set<String> seen = new HashSet<>();
        List<String> out = new ArrayList<>();
        for (String candidate : candidates) {
            String trimmed = candidate == null ? "" : candidate.trim();
            if (trimmed.length() < Lexicon.MIN_TOKEN_LENGTH || lexicon.isStopword(trimmed)) {
                continue;
            }
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                out.add(trimmed);
            }
        }
        return out;
    }
}
