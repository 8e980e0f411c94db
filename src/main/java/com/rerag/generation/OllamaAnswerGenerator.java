package com.rerag.generation;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rerag.embedding.OllamaEmbeddingService;
import com.rerag.store.Document;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public class OllamaAnswerGenerator implements AnswerGenerator {
    private static final Logger log = LoggerFactory.getLogger(OllamaAnswerGenerator.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;

    public OllamaAnswerGenerator(OkHttpClient httpClient, String baseUrl, String model) {
        this.httpClient = httpClient;
        this.endpoint = OllamaEmbeddingService.stripTrailingSlash(baseUrl) + "/api/generate";
        this.model = model;
    }

    @Override
    public String generate(String question, List<Document> documents) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", PromptBuilder.build(question, documents));
        body.put("stream", false);
        try {
            Request request = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                    .build();
            log.debug("Requesting answer model={} sources={}", model, documents.size());
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new GenerationException("Generate request to " + endpoint + " returned status " + response.code());
                }
                JsonNode answer = mapper.readTree(response.body().string()).path("response");
                if (!answer.isTextual()) {
                    throw new GenerationException("Generate response from model " + model + " has no 'response' text");
                }
                return answer.asText();
            }
        } catch (IOException e) {
            throw new GenerationException("Generate request to " + endpoint + " failed", e);
        }
    }
}
