package org.example.storyprep.config;

import org.example.storyprep.service.extraction.ExtractionConfidence;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {

    private boolean agentEnabled = false;
    private ExtractionConfidence agentMinConfidence = ExtractionConfidence.MEDIUM;
    private int minAgentWords = 100;
    private int inlineMinChars = 500;
    private int minContentChars = 100;
    private int urlMinBlockChars = 500;
    private int fetchTimeoutSeconds = 30;
    private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";

    public boolean isAgentEnabled() {
        return agentEnabled;
    }

    public void setAgentEnabled(boolean agentEnabled) {
        this.agentEnabled = agentEnabled;
    }

    public ExtractionConfidence getAgentMinConfidence() {
        return agentMinConfidence;
    }

    public void setAgentMinConfidence(ExtractionConfidence agentMinConfidence) {
        this.agentMinConfidence = agentMinConfidence == null ? ExtractionConfidence.MEDIUM : agentMinConfidence;
    }

    public int getMinAgentWords() {
        return minAgentWords;
    }

    public void setMinAgentWords(int minAgentWords) {
        this.minAgentWords = minAgentWords;
    }

    public int getInlineMinChars() {
        return inlineMinChars;
    }

    public void setInlineMinChars(int inlineMinChars) {
        this.inlineMinChars = inlineMinChars;
    }

    public int getMinContentChars() {
        return minContentChars;
    }

    public void setMinContentChars(int minContentChars) {
        this.minContentChars = minContentChars;
    }

    public int getUrlMinBlockChars() {
        return urlMinBlockChars;
    }

    public void setUrlMinBlockChars(int urlMinBlockChars) {
        this.urlMinBlockChars = urlMinBlockChars;
    }

    public int getFetchTimeoutSeconds() {
        return fetchTimeoutSeconds;
    }

    public void setFetchTimeoutSeconds(int fetchTimeoutSeconds) {
        this.fetchTimeoutSeconds = fetchTimeoutSeconds;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
}
