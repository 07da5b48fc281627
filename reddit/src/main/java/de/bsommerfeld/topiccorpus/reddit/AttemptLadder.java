package de.bsommerfeld.topiccorpus.reddit;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.config.EscalationConfig;
import de.bsommerfeld.topiccorpus.core.domain.Attempt;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the escalation ladder from the run's base window and threshold.
 *
 * <pre>
 * base           months            minUpvotes
 * lower-upvotes  months            minUpvotes / 2        (only if minUpvotes &gt; threshold)
 * older-window   max(2m, floor)    minUpvotes / 4
 * broad          max(3m, floor)    0
 * </pre>
 */
@Singleton
public class AttemptLadder {

    public static final String BASE = "base";
    public static final String LOWER_UPVOTES = "lower-upvotes";
    public static final String OLDER_WINDOW = "older-window";
    public static final String BROAD = "broad";

    /** Upper bound on the number of attempts in any ladder. */
    public static final int MAX_ATTEMPTS = 4;

    private final EscalationConfig config;

    @Inject
    public AttemptLadder(EscalationConfig config) {
        this.config = config;
    }

    public List<Attempt> build(int baseMonths, int baseMinUpvotes) {
        int months = Math.max(1, baseMonths);
        int minUpvotes = Math.max(0, baseMinUpvotes);
        int halved = minUpvotes / 2;

        List<Attempt> ladder = new ArrayList<>(MAX_ATTEMPTS);
        ladder.add(new Attempt(months, minUpvotes, BASE));
        if (minUpvotes > config.getLowerUpvotesMinThreshold()) {
            ladder.add(new Attempt(months, halved, LOWER_UPVOTES));
        }
        ladder.add(new Attempt(Math.max(months * 2, config.getOlderWindowFloorMonths()), halved / 2, OLDER_WINDOW));
        ladder.add(new Attempt(Math.max(months * 3, config.getBroadWindowFloorMonths()), 0, BROAD));
        return List.copyOf(ladder);
    }
}
