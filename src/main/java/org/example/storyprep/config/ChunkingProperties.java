package org.example.storyprep.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "chunking")
public class ChunkingProperties {

    private boolean agentEnabled = false;
    private boolean llmEnabled = false;
    private int targetWords = 5000;
    /** Fraction of targetWords a chunk may deviate by; 0.15 means plus or minus 15%. */
    private double tolerance = 0.15;
    /** Proposed breaks this close (in words) to a scene-break marker are moved onto it. 0 means 15% of target. */
    private int sceneBreakSnapWords = 0;
    /** A proposed break that leaves fewer words than this after it is ignored. */
    private int minTrailingWords = 500;
    private int maxPromptChars = 100_000;
    private Recap recap = new Recap();

    public boolean isAgentEnabled() {
        return agentEnabled;
    }

    public void setAgentEnabled(boolean agentEnabled) {
        this.agentEnabled = agentEnabled;
    }

    public boolean isLlmEnabled() {
        return llmEnabled;
    }

    public void setLlmEnabled(boolean llmEnabled) {
        this.llmEnabled = llmEnabled;
    }

    public int getTargetWords() {
        return targetWords;
    }

    public void setTargetWords(int targetWords) {
        this.targetWords = targetWords;
    }

    public double getTolerance() {
        return tolerance;
    }

    public void setTolerance(double tolerance) {
        this.tolerance = tolerance;
    }

    public int getSceneBreakSnapWords() {
        return sceneBreakSnapWords;
    }

    public void setSceneBreakSnapWords(int sceneBreakSnapWords) {
        this.sceneBreakSnapWords = sceneBreakSnapWords;
    }

    public int resolveSceneBreakSnapWords(int targetWords) {
        return sceneBreakSnapWords > 0 ? sceneBreakSnapWords : (int) Math.round(targetWords * 0.15);
    }

    public int getMinTrailingWords() {
        return minTrailingWords;
    }

    public void setMinTrailingWords(int minTrailingWords) {
        this.minTrailingWords = minTrailingWords;
    }

    public int getMaxPromptChars() {
        return maxPromptChars;
    }

    public void setMaxPromptChars(int maxPromptChars) {
        this.maxPromptChars = maxPromptChars;
    }

    public Recap getRecap() {
        return recap;
    }

    public void setRecap(Recap recap) {
        this.recap = recap == null ? new Recap() : recap;
    }

    public static class Recap {

        private boolean llmEnabled = false;
        private int targetWords = 250;
        private int maxSentences = 10;
        private int maxContextChars = 12_000;

        public boolean isLlmEnabled() {
            return llmEnabled;
        }

        public void setLlmEnabled(boolean llmEnabled) {
            this.llmEnabled = llmEnabled;
        }

        public int getTargetWords() {
            return targetWords;
        }

        public void setTargetWords(int targetWords) {
            this.targetWords = targetWords;
        }

        public int getMaxSentences() {
            return maxSentences;
        }

        public void setMaxSentences(int maxSentences) {
            this.maxSentences = maxSentences;
        }

        public int getMaxContextChars() {
            return maxContextChars;
        }

        public void setMaxContextChars(int maxContextChars) {
            this.maxContextChars = maxContextChars;
        }
    }
}
