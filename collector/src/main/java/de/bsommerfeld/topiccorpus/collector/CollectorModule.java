package de.bsommerfeld.topiccorpus.collector;

import com.google.inject.AbstractModule;
import de.bsommerfeld.topiccorpus.core.config.ApplicationMode;
import de.bsommerfeld.topiccorpus.core.config.ConfigLoader;
import de.bsommerfeld.topiccorpus.core.config.CorpusConfig;
import de.bsommerfeld.topiccorpus.core.config.EscalationConfig;
import de.bsommerfeld.topiccorpus.core.config.FilterConfig;
import de.bsommerfeld.topiccorpus.core.config.RunConfig;
import de.bsommerfeld.topiccorpus.core.config.SearchConfig;
import de.bsommerfeld.topiccorpus.core.lexicon.Lexicon;
import de.bsommerfeld.topiccorpus.core.lexicon.LexiconLoader;
import de.bsommerfeld.topiccorpus.reddit.PullPushSearchApi;
import de.bsommerfeld.topiccorpus.reddit.SearchApi;
import de.bsommerfeld.topiccorpus.reddit.Sleeper;
import de.bsommerfeld.topiccorpus.reddit.TestSearchApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice module wiring configuration, lexicon and the search API.
 */
public class CollectorModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(CollectorModule.class);

    private final Path configPath;
    private final CorpusConfig preloaded;
    private final ApplicationMode mode;

    /** Loads {@code configPath} at injector creation; mode from the environment. */
    public CollectorModule(Path configPath) {
        this.configPath = configPath;
        this.preloaded = null;
        this.mode = ApplicationMode.get();
    }

    /** For programmatic runs with an already built configuration. */
    public CollectorModule(CorpusConfig config, ApplicationMode mode) {
        this.configPath = null;
        this.preloaded = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        CorpusConfig config = preloaded != null ? preloaded : ConfigLoader.load(configPath);

        // Bind configuration and its sections
        bind(CorpusConfig.class).toInstance(config);
        bind(RunConfig.class).toInstance(config.getRun());
        bind(SearchConfig.class).toInstance(config.getSearch());
        bind(EscalationConfig.class).toInstance(config.getEscalation());
        bind(FilterConfig.class).toInstance(config.getFilter());

        // Tables are loaded once and shared by reference
        bind(Lexicon.class).toInstance(LexiconLoader.loadOrDefault(config.getLexiconFile()));

        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(Sleeper.class).toInstance(Sleeper.SYSTEM);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode == ApplicationMode.TEST) {
            bind(SearchApi.class).to(TestSearchApi.class);
        } else {
            bind(SearchApi.class).to(PullPushSearchApi.class);
        }

        bind(AcquisitionProgressLogger.class).asEagerSingleton();
    }
}
