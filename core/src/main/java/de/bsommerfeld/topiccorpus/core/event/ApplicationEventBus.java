package de.bsommerfeld.topiccorpus.core.event;

import com.google.common.eventbus.EventBus;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus}. The acquisition engine posts
 * {@link AcquisitionEvents progress events} here; whoever drives a run
 * decides what to do with them (log, report, assert in tests).
 * Delivery is synchronous on the posting thread.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);

    private final EventBus eventBus = new EventBus("TopicCorpus-EventBus");

    public void post(Object event) {
        LOG.trace("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        eventBus.unregister(listener);
    }
}
