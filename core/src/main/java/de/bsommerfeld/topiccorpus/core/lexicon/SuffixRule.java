package de.bsommerfeld.topiccorpus.core.lexicon;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An inflectional ending and what replaces it when stripped. The replacement
 * covers consonant softening, e.g. {@code güvenliği} → {@code güvenlik}.
 *
 * @param suffix      casefolded ending to match at the end of a token
 * @param replacement text appended to the stem, usually empty
 */
public record SuffixRule(String suffix, String replacement) {

    @JsonCreator
    public SuffixRule(@JsonProperty("suffix") String suffix,
            @JsonProperty("replacement") String replacement) {
        this.suffix = suffix == null ? "" : suffix;
        this.replacement = replacement == null ? "" : replacement;
    }

    /**
     * Returns the stem of {@code token} or {@code null} if this rule does not
     * apply or would leave fewer than {@code minStemLength} characters.
     */
    public String strip(String token, int minStemLength) {
        if (suffix.isEmpty() || !token.endsWith(suffix)) {
            return null;
        }
        String stem = token.substring(0, token.length() - suffix.length());
        if (stem.length() < minStemLength) {
            return null;
        }
        return stem + replacement;
    }
}
