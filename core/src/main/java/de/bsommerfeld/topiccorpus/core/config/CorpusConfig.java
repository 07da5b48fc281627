package de.bsommerfeld.topiccorpus.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of the {@code corpus.toml} configuration. Every section is
 * pre-populated with defaults, so an empty or missing file yields a
 * runnable configuration.
 *
 * @see ConfigLoader
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CorpusConfig {

    /** Path to a substitute lexicon JSON file. Empty means the bundled lexicon. */
    @JsonProperty("lexicon-file")
    private String lexiconFile = "";

    @JsonProperty("run")
    private RunConfig run = new RunConfig();

    @JsonProperty("search")
    private SearchConfig search = new SearchConfig();

    @JsonProperty("escalation")
    private EscalationConfig escalation = new EscalationConfig();

    @JsonProperty("filter")
    private FilterConfig filter = new FilterConfig();

    public String getLexiconFile() {
        return lexiconFile;
    }

    public RunConfig getRun() {
        return run;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public EscalationConfig getEscalation() {
        return escalation;
    }

    public FilterConfig getFilter() {
        return filter;
    }
}
