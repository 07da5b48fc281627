package de.bsommerfeld.topiccorpus.core.event;

import java.util.List;

/**
 * Progress events emitted during an acquisition run.
 */
public final class AcquisitionEvents {

    private AcquisitionEvents() {
    }

    /**
     * Community discovery finished.
     *
     * @param communities    ranked result
     * @param strategyLabel  strategy that produced data, {@code null} if none did
     * @param curatedFallback whether the curated table supplied the result
     */
    public record DiscoveryCompletedEvent(List<String> communities, String strategyLabel,
            boolean curatedFallback) {
    }

    /**
     * One escalation attempt finished.
     *
     * @param label   attempt label
     * @param index   zero-based position in the ladder
     * @param added   posts new to the corpus after dedup
     * @param total   corpus size after the attempt
     */
    public record AttemptCompletedEvent(String label, int index, int added, int total) {
    }

    /**
     * A filter stage changed the corpus size.
     *
     * @param stage  {@code dedup}, {@code exclude}, {@code include}, {@code lenient-include}
     *               or {@code abandoned}
     */
    public record FilterAppliedEvent(String stage, int before, int after) {
    }

    /** Free-form diagnostic message. */
    public record LogEvent(String message, String type) {
        public LogEvent(String message) {
            this(message, "INFO");
        }
    }
}
