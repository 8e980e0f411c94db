package com.rerag.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

public interface DocumentMetadataStore {

    void put(Document document);

    void upsert(Document document);

    Optional<Document> get(String id);

    boolean remove(String id);

    List<Document> getAll();

    List<Document> getFiltered(Predicate<Document> predicate);

    int size();
}
