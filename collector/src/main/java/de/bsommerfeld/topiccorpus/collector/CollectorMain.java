package de.bsommerfeld.topiccorpus.collector;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Process entry point. The only argument is the configuration file,
 * {@value #DEFAULT_CONFIG} by default.
 */
public final class CollectorMain {

    private static final Logger LOG = LoggerFactory.getLogger(CollectorMain.class);

    static final String DEFAULT_CONFIG = "corpus.toml";

    private CollectorMain() {
    }

    public static void main(String[] args) {
        Path configPath = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        Injector injector = Guice.createInjector(new CollectorModule(configPath));

        try {
            CollectionSummary summary = injector.getInstance(CorpusCollector.class).run();
            injector.getInstance(AcquisitionProgressLogger.class).warnings()
                    .forEach(w -> LOG.warn("Degraded: {}", w));
            LOG.info("Done. {} posts in {}", summary.finalCount(), summary.output());
        } catch (IOException e) {
            LOG.error("Failed to write corpus", e);
            System.exit(1);
        }
    }
}
