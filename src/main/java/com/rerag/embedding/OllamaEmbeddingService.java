package com.rerag.embedding;

import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class OllamaEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingService.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private volatile int dimension;

    public OllamaEmbeddingService(OkHttpClient httpClient, String baseUrl, String model) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = stripTrailingSlash(baseUrl) + "/api/embeddings";
        this.model = model;
    }

    @Override
    public float[] embed(String text) {
        try {
            String payload = mapper.writeValueAsString(Map.of("model", model, "prompt", text == null ? "" : text));
            Request request = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON))
                    .build();
            log.debug("Requesting embedding model={} chars={}", model, text == null ? 0 : text.length());
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new EmbeddingException("Embedding request to " + endpoint + " returned status " + response.code());
                }
                JsonNode vectorNode = mapper.readTree(response.body().string()).path("embedding");
                if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                    throw new EmbeddingException("No embedding returned by model " + model);
                }
                float[] out = new float[vectorNode.size()];
                for (int i = 0; i < vectorNode.size(); i++) {
                    out[i] = (float) vectorNode.get(i).asDouble();
                }
                dimension = out.length;
                return out;
            }
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request to " + endpoint + " failed", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "ollama-" + model;
    }

    public static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
