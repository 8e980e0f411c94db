package com.rerag;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rerag.authz.AuthorizationService;
import com.rerag.embedding.EmbeddingService;
import com.rerag.generation.AnswerGenerator;
import com.rerag.search.AdaptiveFilteredSearchEngine;
import com.rerag.search.AuthorizationPredicate;
import com.rerag.search.SearchOutcome;
import com.rerag.store.Document;
import com.rerag.store.DocumentStore;

public class Retrieval {
    private static final Logger log = LoggerFactory.getLogger(Retrieval.class);

    private final DocumentStore store;
    private final AdaptiveFilteredSearchEngine engine;
    private final EmbeddingService embeddingService;
    private final AuthorizationService authorizationService;
    private final AnswerGenerator answerGenerator;
    private final int defaultTopK;

    public Retrieval(
            DocumentStore store,
            AdaptiveFilteredSearchEngine engine,
            EmbeddingService embeddingService,
            AuthorizationService authorizationService,
            AnswerGenerator answerGenerator,
            int defaultTopK) {
        this.store = Objects.requireNonNull(store, "store");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.authorizationService = Objects.requireNonNull(authorizationService, "authorizationService");
        this.answerGenerator = Objects.requireNonNull(answerGenerator, "answerGenerator");
        this.defaultTopK = defaultTopK;
    }

    public List<Document> search(float[] queryEmbedding, int k, AuthorizationPredicate predicate) {
        return engine.search(queryEmbedding, k, predicate).documents();
    }

    public SearchOutcome search(String caller, String queryText, int k) {
        AuthorizationPredicate predicate = AuthorizationPredicate.forCaller(authorizationService, caller);
        return engine.search(embeddingService.embed(queryText), k, predicate);
    }

    public String upsert(Document document) {
        return store.upsert(document);
    }

    public String upsertText(String id, String title, String content, Map<String, Object> metadata) {
        float[] embedding = embeddingService.embed(content);
        String stored = store.upsert(new Document(id, title, content, metadata, embedding));
        log.info("Stored document id={} dimension={}", stored, embedding.length);
        return stored;
    }

    public void delete(String id) {
        store.delete(id);
    }

    public List<Document> listAll() {
        return store.listAll();
    }

    public List<Document> listFiltered(Predicate<Document> predicate) {
        return store.listFiltered(predicate);
    }

    public List<Document> listVisibleTo(String caller) {
        return store.listFiltered(AuthorizationPredicate.forCaller(authorizationService, caller));
    }

    public List<String> permissionsOf(String caller) {
        return authorizationService.permissionsOf(caller);
    }

    public Answer answer(String caller, String question, int k) {
        int topK = k > 0 ? k : defaultTopK;
        SearchOutcome outcome = search(caller, question, topK);
        log.info("Answering with {}/{} sources termination={} indexQueries={}",
                outcome.size(), topK, outcome.termination(), outcome.indexQueries());
        String text = answerGenerator.generate(question, outcome.documents());
        return new Answer(text, outcome.documents(), outcome.isPartial());
    }
}
