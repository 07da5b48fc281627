package de.bsommerfeld.topiccorpus.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link CorpusConfig} from a TOML file.
 *
 * <p>
 * A missing file is not an error: the run proceeds with defaults. A file that
 * exists but cannot be parsed aborts startup, since silently running with
 * defaults would scrape something the user did not ask for.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    public static CorpusConfig load(Path path) {
        if (path == null || !Files.exists(path)) {
            LOG.warn("Configuration {} not found. Using defaults.", path);
            return new CorpusConfig();
        }
        LOG.info("Loading Configuration from: {}", path.toAbsolutePath());
        try {
            CorpusConfig config = new TomlMapper().readValue(path.toFile(), CorpusConfig.class);
            return config != null ? config : new CorpusConfig();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration: " + path, e);
        }
    }
}
