package com.rerag.runtime;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.rerag.index.DistanceMetric;
import com.rerag.search.SearchPolicy;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private SearchConfig search = new SearchConfig();
    private StorageConfig storage = new StorageConfig();
    private ServicesConfig services = new ServicesConfig();
    private PermissionsConfig permissions = new PermissionsConfig();

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public ServicesConfig getServices() {
        return services;
    }

    public void setServices(ServicesConfig services) {
        this.services = services == null ? new ServicesConfig() : services;
    }

    public PermissionsConfig getPermissions() {
        return permissions;
    }

    public void setPermissions(PermissionsConfig permissions) {
        this.permissions = permissions == null ? new PermissionsConfig() : permissions;
    }

    public void validate() {
        search.toPolicy();
        if (search.getDefaultTopK() <= 0) {
            throw new IllegalArgumentException("search.defaultTopK must be positive, got " + search.getDefaultTopK());
        }
        if (storage.getDistanceMetric() == null) {
            throw new IllegalArgumentException("storage.distanceMetric must be set");
        }
        if (permissions.getMode() == null) {
            throw new IllegalArgumentException("permissions.mode must be one of static, keto");
        }
        if (services.getOllama().getTimeoutMs() <= 0 || services.getKeto().getTimeoutMs() <= 0) {
            throw new IllegalArgumentException("service timeouts must be positive");
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int initialMultiplier = SearchPolicy.DEFAULT_INITIAL_MULTIPLIER;
        private double growthFactor = SearchPolicy.DEFAULT_GROWTH_FACTOR;
        private int maxAttempts = SearchPolicy.DEFAULT_MAX_ATTEMPTS;
        private int defaultTopK = 3;

        public int getInitialMultiplier() {
            return initialMultiplier;
        }

        public void setInitialMultiplier(int initialMultiplier) {
            this.initialMultiplier = initialMultiplier;
        }

        public double getGrowthFactor() {
            return growthFactor;
        }

        public void setGrowthFactor(double growthFactor) {
            this.growthFactor = growthFactor;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public SearchPolicy toPolicy() {
            return new SearchPolicy(initialMultiplier, growthFactor, maxAttempts);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String snapshotPath = "";
        private DistanceMetric distanceMetric = DistanceMetric.COSINE;

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath == null ? "" : snapshotPath;
        }

        public DistanceMetric getDistanceMetric() {
            return distanceMetric;
        }

        public void setDistanceMetric(DistanceMetric distanceMetric) {
            this.distanceMetric = distanceMetric;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServicesConfig {
        private OllamaConfig ollama = new OllamaConfig();
        private KetoConfig keto = new KetoConfig();

        public OllamaConfig getOllama() {
            return ollama;
        }

        public void setOllama(OllamaConfig ollama) {
            this.ollama = ollama == null ? new OllamaConfig() : ollama;
        }

        public KetoConfig getKeto() {
            return keto;
        }

        public void setKeto(KetoConfig keto) {
            this.keto = keto == null ? new KetoConfig() : keto;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OllamaConfig {
        private String baseUrl = "http://localhost:11434";
        private String embeddingModel = "nomic-embed-text";
        private String llmModel = "llama3";
        private int timeoutMs = 60000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getEmbeddingModel() {
            return embeddingModel;
        }

        public void setEmbeddingModel(String embeddingModel) {
            this.embeddingModel = embeddingModel;
        }

        public String getLlmModel() {
            return llmModel;
        }

        public void setLlmModel(String llmModel) {
            this.llmModel = llmModel;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KetoConfig {
        private String readUrl = "http://localhost:4466";
        private String namespace = "documents";
        private String relation = "viewer";
        private int timeoutMs = 10000;

        public String getReadUrl() {
            return readUrl;
        }

        public void setReadUrl(String readUrl) {
            this.readUrl = readUrl;
        }

        public String getNamespace() {
            return namespace;
        }

        public void setNamespace(String namespace) {
            this.namespace = namespace;
        }

        public String getRelation() {
            return relation;
        }

        public void setRelation(String relation) {
            this.relation = relation;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public enum PermissionsMode {
        STATIC,
        KETO
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PermissionsConfig {
        private PermissionsMode mode = PermissionsMode.STATIC;
        private Map<String, List<String>> grants = new HashMap<>();

        public PermissionsMode getMode() {
            return mode;
        }

        public void setMode(PermissionsMode mode) {
            this.mode = mode;
        }

        public Map<String, List<String>> getGrants() {
            return grants;
        }

        public void setGrants(Map<String, List<String>> grants) {
            this.grants = grants == null ? new HashMap<>() : grants;
        }
    }
}
