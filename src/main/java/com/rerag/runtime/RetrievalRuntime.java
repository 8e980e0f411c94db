package com.rerag.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rerag.Retrieval;
import com.rerag.authz.AuthorizationService;
import com.rerag.authz.KetoAuthorizationService;
import com.rerag.authz.PermissionTable;
import com.rerag.embedding.OllamaEmbeddingService;
import com.rerag.generation.OllamaAnswerGenerator;
import com.rerag.search.AdaptiveFilteredSearchEngine;
import com.rerag.store.DocumentStore;

import okhttp3.OkHttpClient;

public class RetrievalRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetrievalRuntime.class);

    private final OkHttpClient httpClient;
    private final DocumentStore store;
    private final Retrieval retrieval;

    private RetrievalRuntime(OkHttpClient httpClient, DocumentStore store, Retrieval retrieval) {
        this.httpClient = httpClient;
        this.store = store;
        this.retrieval = retrieval;
    }

    public static RetrievalRuntime fromConfig(AppConfig config) throws IOException {
        return fromConfig(config, new OkHttpClient());
    }

    public static RetrievalRuntime fromConfig(AppConfig config, OkHttpClient baseClient) throws IOException {
        config.validate();
        AppConfig.OllamaConfig ollama = config.getServices().getOllama();
        AppConfig.KetoConfig keto = config.getServices().getKeto();

        OkHttpClient ollamaClient = baseClient.newBuilder()
                .callTimeout(Duration.ofMillis(ollama.getTimeoutMs()))
                .readTimeout(Duration.ofMillis(ollama.getTimeoutMs()))
                .build();
        OkHttpClient ketoClient = baseClient.newBuilder()
                .callTimeout(Duration.ofMillis(keto.getTimeoutMs()))
                .build();

        String snapshotPath = config.getStorage().getSnapshotPath();
        DocumentStore store = snapshotPath.isBlank()
                ? DocumentStore.inMemory(config.getStorage().getDistanceMetric())
                : DocumentStore.open(Path.of(snapshotPath), config.getStorage().getDistanceMetric());

        AdaptiveFilteredSearchEngine engine = new AdaptiveFilteredSearchEngine(store, config.getSearch().toPolicy());
        Retrieval retrieval = new Retrieval(
                store,
                engine,
                new OllamaEmbeddingService(ollamaClient, ollama.getBaseUrl(), ollama.getEmbeddingModel()),
                authorizationService(config, ketoClient),
                new OllamaAnswerGenerator(ollamaClient, ollama.getBaseUrl(), ollama.getLlmModel()),
                config.getSearch().getDefaultTopK());

        log.info("Retrieval runtime ready permissions={} metric={} snapshot={} policy={}",
                config.getPermissions().getMode(),
                store.metric(),
                snapshotPath.isBlank() ? "none" : snapshotPath,
                engine.policy());
        return new RetrievalRuntime(baseClient, store, retrieval);
    }

    static AuthorizationService authorizationService(AppConfig config, OkHttpClient ketoClient) {
        AppConfig.KetoConfig keto = config.getServices().getKeto();
        return switch (config.getPermissions().getMode()) {
            case KETO -> new KetoAuthorizationService(ketoClient, keto.getReadUrl(), keto.getNamespace(), keto.getRelation());
            case STATIC -> new PermissionTable(config.getPermissions().getGrants());
        };
    }

    public Retrieval retrieval() {
        return retrieval;
    }

    public DocumentStore store() {
        return store;
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
