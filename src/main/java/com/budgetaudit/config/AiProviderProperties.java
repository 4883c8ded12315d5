package com.budgetaudit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Provider tiers bound from {@code budgetaudit.ai.providers.*}. A tier with a blank key, or a key
 * still set to a {@code your_...} placeholder, is left out of the chain.
 */
@ConfigurationProperties(prefix = "budgetaudit.ai.providers")
public class AiProviderProperties {

    private Tier primary = new Tier();
    private Tier backup = new Tier();
    private Tier disasterPrimary = new Tier();
    private Tier disasterBackup = new Tier();
    private int attemptTimeoutSeconds = 30;
    private int failureThreshold = 3;

    public Tier getPrimary() {
        return primary;
    }

    public void setPrimary(Tier primary) {
        this.primary = primary;
    }

    public Tier getBackup() {
        return backup;
    }

    public void setBackup(Tier backup) {
        this.backup = backup;
    }

    public Tier getDisasterPrimary() {
        return disasterPrimary;
    }

    public void setDisasterPrimary(Tier disasterPrimary) {
        this.disasterPrimary = disasterPrimary;
    }

    public Tier getDisasterBackup() {
        return disasterBackup;
    }

    public void setDisasterBackup(Tier disasterBackup) {
        this.disasterBackup = disasterBackup;
    }

    public int getAttemptTimeoutSeconds() {
        return attemptTimeoutSeconds;
    }

    public void setAttemptTimeoutSeconds(int attemptTimeoutSeconds) {
        this.attemptTimeoutSeconds = attemptTimeoutSeconds;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public static class Tier {
        private String name;
        private String baseUrl;
        private String apiKey;
        private String model;
        private int readTimeoutSeconds = 60;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getReadTimeoutSeconds() {
            return readTimeoutSeconds;
        }

        public void setReadTimeoutSeconds(int readTimeoutSeconds) {
            this.readTimeoutSeconds = readTimeoutSeconds;
        }

        public boolean isConfigured() {
            return baseUrl != null && !baseUrl.isBlank()
                    && model != null && !model.isBlank()
                    && apiKey != null && !apiKey.isBlank()
                    && !apiKey.startsWith("your_");
        }
    }
}
