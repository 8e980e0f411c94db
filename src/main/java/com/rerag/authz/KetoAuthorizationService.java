package com.rerag.authz;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rerag.store.Document;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

public class KetoAuthorizationService implements AuthorizationService {
    private static final Logger log = LoggerFactory.getLogger(KetoAuthorizationService.class);
    private static final int FORBIDDEN = 403;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl readUrl;
    private final String namespace;
    private final String relation;

    public KetoAuthorizationService(OkHttpClient httpClient, String readUrl, String namespace, String relation) {
        this.httpClient = httpClient;
        HttpUrl parsed = HttpUrl.parse(readUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Keto read URL: " + readUrl);
        }
        this.readUrl = parsed;
        this.namespace = namespace;
        this.relation = relation;
    }

    @Override
    public boolean isAuthorized(String caller, Document document) {
        String object = objectFor(document);
        HttpUrl url = readUrl.newBuilder()
                .addPathSegments("relation-tuples/check/openapi")
                .addQueryParameter("namespace", namespace)
                .addQueryParameter("object", object)
                .addQueryParameter("relation", relation)
                .addQueryParameter("subject_id", caller)
                .build();
        log.debug("Keto check subject={} object={} relation={}", caller, object, relation);
        try (Response response = httpClient.newCall(new Request.Builder().url(url).get().build()).execute()) {
            if (response.code() == FORBIDDEN) {
                return false;
            }
            if (!response.isSuccessful() || response.body() == null) {
                throw new AuthorizationException("Keto check returned status " + response.code()
                        + " for subject " + caller + " on object " + object);
            }
            JsonNode allowed = mapper.readTree(response.body().string()).path("allowed");
            if (!allowed.isBoolean()) {
                throw new AuthorizationException("Keto check response for object " + object + " has no 'allowed' flag");
            }
            return allowed.booleanValue();
        } catch (IOException e) {
            throw new AuthorizationException("Keto check failed for subject " + caller + " on object " + object, e);
        }
    }

    @Override
    public List<String> permissionsOf(String caller) {
        HttpUrl url = readUrl.newBuilder()
                .addPathSegments("relation-tuples")
                .addQueryParameter("namespace", namespace)
                .addQueryParameter("subject_id", caller)
                .build();
        try (Response response = httpClient.newCall(new Request.Builder().url(url).get().build()).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new AuthorizationException("Keto list relation tuples returned status " + response.code()
                        + " for subject " + caller);
            }
            List<String> objects = new ArrayList<>();
            for (JsonNode tuple : mapper.readTree(response.body().string()).path("relation_tuples")) {
                String object = tuple.path("object").asText("");
                if (!object.isBlank()) {
                    objects.add(object);
                }
            }
            return objects;
        } catch (IOException e) {
            throw new AuthorizationException("Keto list relation tuples failed for subject " + caller, e);
        }
    }

    static String objectFor(Document document) {
        String taxpayer = document.metadataString(PermissionTable.TAXPAYER_KEY);
        if (taxpayer == null || taxpayer.isBlank()) {
            return document.id();
        }
        String taxpayerKey = taxpayer.trim().toLowerCase(Locale.ROOT).replace(' ', '-');
        return taxpayerKey + ":" + year(document.metadata().get("year"));
    }

    private static String year(Object value) {
        if (value instanceof Number number) {
            return Long.toString(number.longValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            return text.trim();
        }
        return "unknown";
    }
}
