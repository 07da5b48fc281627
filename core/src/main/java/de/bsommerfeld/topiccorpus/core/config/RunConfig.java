package de.bsommerfeld.topiccorpus.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.topiccorpus.core.domain.MatchMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of a single acquisition run: what to look for and how much of it.
 * Setters exist for programmatic runs and tests.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunConfig {

    @JsonProperty("prompt")
    private String prompt = "";

    /** Explicit keywords. Entries may contain quoted phrases. */
    @JsonProperty("keywords")
    private List<String> keywords = new ArrayList<>();

    /** Seed plan JSON produced by the LLM seeding step. Empty = none. */
    @JsonProperty("seed-file")
    private String seedFile = "";

    @JsonProperty("months")
    private int months = 12;

    @JsonProperty("min-upvotes")
    private int minUpvotes = 20;

    /** Item cap per community and per attempt. */
    @JsonProperty("limit")
    private int limit = 2000;

    @JsonProperty("max-subs")
    private int maxSubs = 8;

    /** The escalation ladder stops once this many unique posts were gathered. */
    @JsonProperty("target-volume")
    private int targetVolume = 500;

    @JsonProperty("exclude-keywords")
    private List<String> excludeKeywords = new ArrayList<>();

    @JsonProperty("match-mode")
    private MatchMode matchMode = MatchMode.ANY;

    @JsonProperty("output")
    private String output = "data/corpus.jsonl";

    /** Endpoint probe report. Empty disables the probe. */
    @JsonProperty("diagnostics-output")
    private String diagnosticsOutput = "";

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }

    public String getSeedFile() {
        return seedFile;
    }

    public void setSeedFile(String seedFile) {
        this.seedFile = seedFile;
    }

    public int getMonths() {
        return months;
    }

    public void setMonths(int months) {
        this.months = months;
    }

    public int getMinUpvotes() {
        return minUpvotes;
    }

    public void setMinUpvotes(int minUpvotes) {
        this.minUpvotes = minUpvotes;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public int getMaxSubs() {
        return maxSubs;
    }

    public void setMaxSubs(int maxSubs) {
        this.maxSubs = maxSubs;
    }

    public int getTargetVolume() {
        return targetVolume;
    }

    public void setTargetVolume(int targetVolume) {
        this.targetVolume = targetVolume;
    }

    public List<String> getExcludeKeywords() {
        return excludeKeywords;
    }

    public void setExcludeKeywords(List<String> excludeKeywords) {
        this.excludeKeywords = excludeKeywords;
    }

    public MatchMode getMatchMode() {
        return matchMode;
    }

    public void setMatchMode(MatchMode matchMode) {
        this.matchMode = matchMode;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public String getDiagnosticsOutput() {
        return diagnosticsOutput;
    }

    public void setDiagnosticsOutput(String diagnosticsOutput) {
        this.diagnosticsOutput = diagnosticsOutput;
    }
}
