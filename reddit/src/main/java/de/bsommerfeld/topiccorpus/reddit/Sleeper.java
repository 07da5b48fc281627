package de.bsommerfeld.topiccorpus.reddit;

/**
 * Blocking pause used for politeness delays and retry backoff. Tests bind a
 * no-op implementation.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
