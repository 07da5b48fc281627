package de.bsommerfeld.topiccorpus.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class FilterConfig {

    /**
     * When the strict include pass keeps fewer posts than this, the pass is
     * retried with single words instead of phrases (default: 15).
     */
    @JsonProperty("leniency-threshold")
    private int leniencyThreshold = 15;

    public int getLeniencyThreshold() {
        return leniencyThreshold;
    }

    public void setLeniencyThreshold(int leniencyThreshold) {
        this.leniencyThreshold = leniencyThreshold;
    }
}
