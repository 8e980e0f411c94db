package com.rerag.store;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Document(
        String id,
        String title,
        String content,
        Map<String, Object> metadata,
        float[] embedding) {

    public Document {
        title = title == null ? "" : title;
        content = content == null ? "" : content;
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        embedding = embedding == null ? null : embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }

    public static Document of(String title, String content, float[] embedding) {
        return new Document(null, title, content, Map.of(), embedding);
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    public Document withId(String newId) {
        return new Document(newId, title, content, metadata, embedding);
    }

    public Document withEmbedding(float[] newEmbedding) {
        return new Document(id, title, content, metadata, newEmbedding);
    }

    public Document withoutEmbedding() {
        return embedding == null ? this : new Document(id, title, content, metadata, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Document other)) {
            return false;
        }
        return Objects.equals(id, other.id)
                && title.equals(other.title)
                && content.equals(other.content)
                && metadata.equals(other.metadata)
                && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, title, content, metadata) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Document[id=" + id + ", title=" + title + ", metadata=" + metadata
                + ", dimension=" + (embedding == null ? 0 : embedding.length) + "]";
    }

    public String metadataString(String key) {
        Object value = metadata.get(key);
        return value == null ? null : value.toString();
    }
}
