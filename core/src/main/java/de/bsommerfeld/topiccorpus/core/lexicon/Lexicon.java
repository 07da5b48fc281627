package de.bsommerfeld.topiccorpus.core.lexicon;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable language tables used for keyword normalization, query expansion
 * and community discovery. Loaded once at startup by {@link LexiconLoader}
 * and shared by reference.
 *
 * <h3>Tables</h3>
 * <ul>
 * <li><strong>stopwords</strong>: union of all configured languages,
 * casefolded</li>
 * <li><strong>ascii folding</strong>: diacritic → ASCII mapping of the
 * minority-language alphabet. Its keys also extend the token allow-list.</li>
 * <li><strong>suffixes</strong>: ordered inflection rules, first match
 * wins</li>
 * <li><strong>synonyms</strong>: lookup key → English/canonical phrases.
 * Keys are stored in {@link #normalizeLookup lookup form}.</li>
 * <li><strong>fallback terms</strong>: generic query terms for when nothing
 * else can be derived</li>
 * <li><strong>curated communities</strong>: topic substring → hand-picked
 * communities, in priority order</li>
 * <li><strong>generic communities</strong>: catch-all communities never
 * worth scraping for a topic</li>
 * </ul>
 */
public final class Lexicon {

    /** Tokens shorter than this carry no topical signal. */
    public static final int MIN_TOKEN_LENGTH = 3;

    private static final String DOT_ABOVE = "\u0307";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Set<String> stopwords;
    private final Map<String, String> asciiFolding;
    private final List<SuffixRule> suffixes;
    private final Map<String, List<String>> synonyms;
    private final List<String> fallbackTerms;
    private final Map<String, List<String>> curatedCommunities;
    private final Set<String> genericCommunities;
    private final Pattern disallowedChars;

    Lexicon(Set<String> stopwords, Map<String, String> asciiFolding, List<SuffixRule> suffixes,
            Map<String, List<String>> synonyms, List<String> fallbackTerms,
            Map<String, List<String>> curatedCommunities, Set<String> genericCommunities) {
        this.asciiFolding = Collections.unmodifiableMap(new LinkedHashMap<>(asciiFolding));
        this.disallowedChars = buildDisallowedPattern(asciiFolding.keySet());

        Set<String> stops = new LinkedHashSet<>();
        for (String s : stopwords) {
            stops.add(casefold(s));
        }
        this.stopwords = Collections.unmodifiableSet(stops);

        this.suffixes = List.copyOf(suffixes);

        Map<String, List<String>> syn = new LinkedHashMap<>();
        synonyms.forEach((key, values) -> {
            String normalized = normalizeLookup(key);
            if (!normalized.isEmpty()) {
                syn.merge(normalized, List.copyOf(values), (a, b) -> {
                    Set<String> merged = new LinkedHashSet<>(a);
                    merged.addAll(b);
                    return List.copyOf(merged);
                });
            }
        });
        this.synonyms = Collections.unmodifiableMap(syn);

        this.fallbackTerms = List.copyOf(fallbackTerms);

        Map<String, List<String>> curated = new LinkedHashMap<>();
        curatedCommunities.forEach((topic, subs) -> curated.put(normalizeLookup(topic), List.copyOf(subs)));
        this.curatedCommunities = Collections.unmodifiableMap(curated);

        Set<String> generic = new LinkedHashSet<>();
        for (String g : genericCommunities) {
            generic.add(g.toLowerCase(Locale.ROOT));
        }
        this.genericCommunities = Collections.unmodifiableSet(generic);
    }

    /**
     * Builds the inverse of the token allow-list: ASCII alphanumerics, the
     * folding table's letters and {@code + # - / _ .}.
     */
    private static Pattern buildDisallowedPattern(Set<String> extraLetters) {
        StringBuilder cls = new StringBuilder("[^0-9A-Za-z");
        for (String letter : extraLetters) {
            for (char c : letter.toCharArray()) {
                if (!Character.isLetterOrDigit(c)) {
                    cls.append('\\');
                }
                cls.append(c);
            }
        }
        cls.append("+#\\-/_.]");
        return Pattern.compile(cls.toString());
    }

    // =====================================================================
    // Text helpers
    // =====================================================================

    /** Locale-independent lower-casing with the dangling dot of {@code İ} removed. */
    public static String casefold(String text) {
        return text.toLowerCase(Locale.ROOT).replace(DOT_ABOVE, "");
    }

    /** Replaces every character outside the allow-list with a space. */
    public String clean(String text) {
        return disallowedChars.matcher(text == null ? "" : text).replaceAll(" ");
    }

    /** Maps every diacritic in the folding table to its ASCII counterpart. */
    public String fold(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            String ch = new String(Character.toChars(cp));
            sb.append(asciiFolding.getOrDefault(ch, ch));
        });
        return sb.toString().replace(DOT_ABOVE, "");
    }

    /**
     * The canonical form used for synonym and curated-table lookups: cleaned,
     * whitespace-collapsed, casefolded and ASCII-folded.
     */
    public String normalizeLookup(String term) {
        String cleaned = WHITESPACE.matcher(clean(term).trim()).replaceAll(" ");
        return fold(casefold(cleaned));
    }

    public boolean isStopword(String token) {
        return token != null && stopwords.contains(casefold(token));
    }

    /** Synonyms for an already normalized lookup key, empty if none. */
    public List<String> synonymsFor(String lookupKey) {
        return synonyms.getOrDefault(lookupKey, List.of());
    }

    public boolean isGenericCommunity(String canonicalCommunity) {
        return canonicalCommunity != null
                && genericCommunities.contains(canonicalCommunity.toLowerCase(Locale.ROOT));
    }

    // =====================================================================
    // Accessors
    // =====================================================================

    public Set<String> stopwords() {
        return stopwords;
    }

    public List<SuffixRule> suffixes() {
        return suffixes;
    }

    public Map<String, List<String>> synonyms() {
        return synonyms;
    }

    public List<String> fallbackTerms() {
        return fallbackTerms;
    }

    public Map<String, List<String>> curatedCommunities() {
        return curatedCommunities;
    }

    public Set<String> genericCommunities() {
        return genericCommunities;
    }
}
