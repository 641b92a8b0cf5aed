package com.skillmap.config;

import com.skillmap.domain.SkillModels.Difficulty;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "skillmap")
public class SkillMapProperties {
    private Table table = new Table();
    private Catalog catalog = new Catalog();
    private Scoring scoring = new Scoring();
    private Roadmap roadmap = new Roadmap();
    private Resources resources = new Resources();

    public Table getTable() {
        return table;
    }

    public void setTable(Table table) {
        this.table = table;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    public Roadmap getRoadmap() {
        return roadmap;
    }

    public void setRoadmap(Roadmap roadmap) {
        this.roadmap = roadmap;
    }

    public Resources getResources() {
        return resources;
    }

    public void setResources(Resources resources) {
        this.resources = resources;
    }

    public static class Table {
        private String location = "classpath:skill-table.json";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Catalog {
        private String location = "classpath:resources.json";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class Scoring {
        private int technicalWeight = 3;
        private int softWeight = 1;
        private int defaultWeight = 1;

        public int getTechnicalWeight() {
            return technicalWeight;
        }

        public void setTechnicalWeight(int technicalWeight) {
            this.technicalWeight = Math.max(1, technicalWeight);
        }

        public int getSoftWeight() {
            return softWeight;
        }

        public void setSoftWeight(int softWeight) {
            this.softWeight = Math.max(1, softWeight);
        }

        public int getDefaultWeight() {
            return defaultWeight;
        }

        public void setDefaultWeight(int defaultWeight) {
            this.defaultWeight = Math.max(1, defaultWeight);
        }
    }

    public static class Roadmap {
        private int defaultDurationWeeks = 4;
        private Difficulty defaultDifficulty = Difficulty.INTERMEDIATE;
        private int extraRounds = 5;

        public int getDefaultDurationWeeks() {
            return defaultDurationWeeks;
        }

        public void setDefaultDurationWeeks(int defaultDurationWeeks) {
            this.defaultDurationWeeks = Math.max(1, defaultDurationWeeks);
        }

        public Difficulty getDefaultDifficulty() {
            return defaultDifficulty;
        }

        public void setDefaultDifficulty(Difficulty defaultDifficulty) {
            this.defaultDifficulty = defaultDifficulty == null ? Difficulty.INTERMEDIATE : defaultDifficulty;
        }

        public int getExtraRounds() {
            return extraRounds;
        }

        public void setExtraRounds(int extraRounds) {
            this.extraRounds = Math.max(0, extraRounds);
        }
    }

    public static class Resources {
        private External external = new External();

        public External getExternal() {
            return external;
        }

        public void setExternal(External external) {
            this.external = external;
        }
    }

    public static class External {
        private boolean enabled = true;
        private String baseUrl = "https://www.googleapis.com/youtube/v3";
        private String apiKey;
        private int maxResults = 3;
        private long timeoutMs = 3000;
        private int concurrency = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
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

        /** True when an actual key is present, not blank and not a placeholder. */
        public boolean isConfigured() {
            return enabled && apiKey != null && !apiKey.isBlank() && !apiKey.startsWith("YOUR_");
        }

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = Math.max(0, maxResults);
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = Math.max(1, timeoutMs);
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = Math.max(1, concurrency);
        }
    }
}
