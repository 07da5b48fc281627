package de.bsommerfeld.topiccorpus.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Constants shaping the escalation ladder. The base attempt always uses the
 * run's own window and threshold; these values only affect the widened steps.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EscalationConfig {

    /** The "lower upvotes" step only runs when the base threshold exceeds this. */
    @JsonProperty("lower-upvotes-min-threshold")
    private int lowerUpvotesMinThreshold = 5;

    @JsonProperty("older-window-floor-months")
    private int olderWindowFloorMonths = 24;

    @JsonProperty("broad-window-floor-months")
    private int broadWindowFloorMonths = 36;

    public int getLowerUpvotesMinThreshold() {
        return lowerUpvotesMinThreshold;
    }

    public void setLowerUpvotesMinThreshold(int lowerUpvotesMinThreshold) {
        this.lowerUpvotesMinThreshold = lowerUpvotesMinThreshold;
    }

    public int getOlderWindowFloorMonths() {
        return olderWindowFloorMonths;
    }

    public int getBroadWindowFloorMonths() {
        return broadWindowFloorMonths;
    }
}
