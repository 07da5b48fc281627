package de.bsommerfeld.topiccorpus.collector;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.topiccorpus.core.event.AcquisitionEvents.AttemptCompletedEvent;
import de.bsommerfeld.topiccorpus.core.event.AcquisitionEvents.DiscoveryCompletedEvent;
import de.bsommerfeld.topiccorpus.core.event.AcquisitionEvents.FilterAppliedEvent;
import de.bsommerfeld.topiccorpus.core.event.AcquisitionEvents.LogEvent;
import de.bsommerfeld.topiccorpus.core.event.ApplicationEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Subscribes to acquisition events and keeps a short run log. Warnings
 * posted by the engine are collected so the summary can report every
 * degradation that happened during the run.
 */
@Singleton
public class AcquisitionProgressLogger {

    private static final Logger LOG = LoggerFactory.getLogger(AcquisitionProgressLogger.class);

    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());

    @Inject
    public AcquisitionProgressLogger(ApplicationEventBus eventBus) {
        eventBus.register(this);
    }

    @Subscribe
    public void onDiscoveryCompleted(DiscoveryCompletedEvent event) {
        if (event.curatedFallback()) {
            LOG.info("Communities (curated): {}", event.communities());
        } else {
            LOG.info("Communities (discovered via {}): {}", event.strategyLabel(), event.communities());
        }
    }

    @Subscribe
    public void onAttemptCompleted(AttemptCompletedEvent event) {
        LOG.info("Attempt #{} '{}' added {} posts, total {}", event.index() + 1, event.label(), event.added(),
                event.total());
    }

    @Subscribe
    public void onFilterApplied(FilterAppliedEvent event) {
        LOG.debug("Filter stage '{}': {} -> {}", event.stage(), event.before(), event.after());
        if ("abandoned".equals(event.stage())) {
            warnings.add("Keyword filters abandoned, corpus is unfiltered");
        }
    }

    @Subscribe
    public void onLog(LogEvent event) {
        if ("WARN".equals(event.type()) || "ERROR".equals(event.type())) {
            warnings.add(event.message());
        }
    }

    /** Snapshot of warnings seen so far. */
    public List<String> warnings() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }
}
