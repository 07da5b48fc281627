package de.bsommerfeld.topiccorpus.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects between the live search endpoint ({@link #PROD}) and the offline
 * synthetic search API ({@link #TEST}).
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Reads {@code corpus.mode} (system property) first, then the
     * {@code CORPUS_MODE} environment variable. Anything unset or
     * unrecognised resolves to {@link #PROD}.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty("corpus.mode"), System.getenv("CORPUS_MODE"));
    }

    static ApplicationMode resolve(String property, String environment) {
        String mode = property;
        if (mode == null || mode.isBlank()) {
            mode = environment;
        }
        if (mode == null || mode.isBlank()) {
            return PROD;
        }
        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown mode '{}', falling back to PROD", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
