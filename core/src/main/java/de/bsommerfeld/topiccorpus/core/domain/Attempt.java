package de.bsommerfeld.topiccorpus.core.domain;

/**
 * One step of the escalation ladder.
 *
 * @param months     size of the time window, counted back from now
 * @param minUpvotes posts scoring below this are dropped
 * @param label      short name used in logs and provenance tags
 */
public record Attempt(int months, int minUpvotes, String label) {

    @Override
    public String toString() {
        return String.format("%s(months=%d, minUpvotes=%d)", label, months, minUpvotes);
    }
}
