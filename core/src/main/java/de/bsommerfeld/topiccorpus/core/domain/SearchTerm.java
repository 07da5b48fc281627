package de.bsommerfeld.topiccorpus.core.domain;

/**
 * A normalized token promoted for querying.
 *
 * @param text casefolded word or phrase
 */
public record SearchTerm(String text) {

    /** Renders the term for an OR-query, quoting phrases. */
    public String render() {
        return isPhrase() ? "\"" + text + "\"" : text;
    }

    public boolean isPhrase() {
        return text.chars().anyMatch(Character::isWhitespace);
    }
}
