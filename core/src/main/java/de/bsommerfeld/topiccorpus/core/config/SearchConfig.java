package de.bsommerfeld.topiccorpus.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Search endpoint and pagination parameters. Values are loaded from
 * {@code corpus.toml} at startup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchConfig {

    @JsonProperty("base-url")
    private String baseUrl = "https://api.pullpush.io/reddit/search/submission/";

    /** Items per page. Smaller pages are served more reliably by the mirror. */
    @JsonProperty("page-size")
    private int pageSize = 100;

    @JsonProperty("max-retries")
    private int maxRetries = 3;

    /** Backoff before retry {@code n} is {@code retry-backoff-millis * n}. */
    @JsonProperty("retry-backoff-millis")
    private long retryBackoffMillis = 600;

    /** Pause between successive page requests. */
    @JsonProperty("page-delay-millis")
    private long pageDelayMillis = 300;

    @JsonProperty("discovery-pages")
    private int discoveryPages = 8;

    @JsonProperty("max-terms")
    private int maxTerms = 16;

    @JsonProperty("request-timeout-seconds")
    private int requestTimeoutSeconds = 30;

    /** Overrides the generated User-Agent when non-empty. */
    @JsonProperty("user-agent")
    private String userAgent = "";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryBackoffMillis() {
        return retryBackoffMillis;
    }

    public void setRetryBackoffMillis(long retryBackoffMillis) {
        this.retryBackoffMillis = retryBackoffMillis;
    }

    public long getPageDelayMillis() {
        return pageDelayMillis;
    }

    public void setPageDelayMillis(long pageDelayMillis) {
        this.pageDelayMillis = pageDelayMillis;
    }

    public int getDiscoveryPages() {
        return discoveryPages;
    }

    public void setDiscoveryPages(int discoveryPages) {
        this.discoveryPages = discoveryPages;
    }

    public int getMaxTerms() {
        return maxTerms;
    }

    public void setMaxTerms(int maxTerms) {
        this.maxTerms = maxTerms;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public String getUserAgent() {
        return userAgent;
    }
}
