package com.rerag.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;

public class InMemoryMetadataStore implements DocumentMetadataStore {
    private final TreeMap<String, Document> documents = new TreeMap<>(Comparator.reverseOrder());

    @Override
    public void put(Document document) {
        String id = requireId(document);
        if (documents.containsKey(id)) {
            throw new IllegalStateException("Document with id " + id + " already exists");
        }
        documents.put(id, document.withoutEmbedding());
    }

    @Override
    public void upsert(Document document) {
        documents.put(requireId(document), document.withoutEmbedding());
    }

    @Override
    public Optional<Document> get(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public boolean remove(String id) {
        return documents.remove(id) != null;
    }

    @Override
    public List<Document> getAll() {
        return new ArrayList<>(documents.values());
    }

    @Override
    public List<Document> getFiltered(Predicate<Document> predicate) {
        if (predicate == null) {
            return getAll();
        }
        return documents.values().stream()
                .filter(predicate)
                .toList();
    }

    @Override
    public int size() {
        return documents.size();
    }

    private static String requireId(Document document) {
        Objects.requireNonNull(document, "document");
        if (!document.hasId()) {
            throw new IllegalArgumentException("Document id must be assigned before it is stored");
        }
        return document.id();
    }
}
