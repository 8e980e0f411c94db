package com.rerag.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.rerag.index.DimensionMismatchException;
import com.rerag.index.DistanceMetric;
import com.rerag.index.InMemorySimilarityIndex;

class DocumentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldKeepOneDocumentPerIdAcrossUpserts() {
        DocumentStore store = DocumentStore.inMemory();

        store.upsert(new Document("d1", "first", "v1", Map.of(), new float[] { 1f, 0f, 0f }));
        store.upsert(new Document("d1", "second", "v2", Map.of(), new float[] { 0f, 1f, 0f }));

        List<Document> all = store.listAll();
        assertEquals(1, all.size());
        assertEquals("d1", all.get(0).id());
        assertEquals("v2", all.get(0).content());
        assertEquals("second", all.get(0).title());
        assertEquals("d1", store.nearest(new float[] { 0f, 1f, 0f }, 1).get(0).document().id());
        assertEquals(0d, store.nearest(new float[] { 0f, 1f, 0f }, 1).get(0).distance(), 1e-9);
    }

    @Test
    void shouldRejectDocumentWithDifferentEmbeddingLength() {
        DocumentStore store = DocumentStore.inMemory();
        store.add(Document.of("one", "first", new float[] { 1f, 0f, 0f }));
        store.add(Document.of("two", "second", new float[] { 0f, 1f, 0f }));

        assertThrows(DimensionMismatchException.class,
                () -> store.add(Document.of("three", "third", new float[] { 0f, 0f, 1f, 0f })));
        assertThrows(DimensionMismatchException.class,
                () -> store.upsert(Document.of("three", "third", new float[] { 0f, 0f, 1f, 0f })));

        List<Document> all = store.listAll();
        assertEquals(2, all.size());
        assertTrue(all.stream().noneMatch(document -> document.title().equals("three")));
        assertEquals(2, store.size());
        assertEquals(3, store.dimension().getAsInt());
    }

    @Test
    void shouldKeepPriorVersionWhenUpsertHitsDimensionMismatch() {
        DocumentStore store = DocumentStore.inMemory();
        store.upsert(new Document("d1", "title", "original", Map.of(), new float[] { 1f, 0f }));
        store.upsert(new Document("d2", "title", "other", Map.of(), new float[] { 0f, 1f }));

        assertThrows(DimensionMismatchException.class,
                () -> store.upsert(new Document("d1", "title", "changed", Map.of(), new float[] { 1f, 0f, 0f })));

        assertEquals("original", store.get("d1").orElseThrow().content());
        assertEquals("d1", store.nearest(new float[] { 1f, 0f }, 1).get(0).document().id());
    }

    @Test
    void shouldAssignIdWhenAbsent() {
        DocumentStore store = DocumentStore.inMemory();

        String id = store.upsert(Document.of("title", "content", new float[] { 1f }));

        assertFalse(id.isBlank());
        assertEquals("content", store.get(id).orElseThrow().content());
    }

    @Test
    void shouldRefuseAddingAnExistingId() {
        DocumentStore store = DocumentStore.inMemory();
        store.add(new Document("d1", "title", "content", Map.of(), new float[] { 1f }));

        assertThrows(IllegalStateException.class,
                () -> store.add(new Document("d1", "title", "other", Map.of(), new float[] { 1f })));
        assertEquals("content", store.get("d1").orElseThrow().content());
    }

    @Test
    void shouldRejectDocumentsWithoutEmbedding() {
        DocumentStore store = DocumentStore.inMemory();

        assertThrows(IllegalArgumentException.class, () -> store.upsert(Document.of("title", "content", null)));
        assertThrows(IllegalArgumentException.class, () -> store.upsert(Document.of("title", "content", new float[0])));
        assertEquals(0, store.size());
    }

    @Test
    void shouldRollBackBothStoresWhenIndexWriteFails() {
        FailingIndex index = new FailingIndex();
        DocumentStore store = new DocumentStore(index, new InMemoryMetadataStore());
        store.upsert(new Document("d1", "title", "v1", Map.of(), new float[] { 1f, 0f }));

        index.failNextReplace = true;
        StorageException failure = assertThrows(StorageException.class,
                () -> store.upsert(new Document("d1", "title", "v2", Map.of(), new float[] { 0f, 1f })));

        assertEquals("disk full", failure.getCause().getMessage());
        assertEquals("v1", store.get("d1").orElseThrow().content());
        assertArrayEquals(new float[] { 1f, 0f }, index.vector("d1").orElseThrow());
        assertEquals(1, store.listAll().size());
    }

    @Test
    void shouldRollBackNewDocumentWhenIndexWriteFails() {
        FailingIndex index = new FailingIndex();
        DocumentStore store = new DocumentStore(index, new InMemoryMetadataStore());

        index.failNextReplace = true;
        assertThrows(StorageException.class,
                () -> store.upsert(new Document("d1", "title", "v1", Map.of(), new float[] { 1f, 0f })));

        assertTrue(store.listAll().isEmpty());
        assertEquals(0, store.size());
        assertTrue(store.dimension().isEmpty());
    }

    @Test
    void shouldRollBackWhenSnapshotCannotBeWritten() throws Exception {
        Path blocked = Files.createDirectories(tempDir.resolve("blocked"));
        Files.writeString(blocked.resolve("occupant.txt"), "x");
        DocumentStore store = new DocumentStore(new InMemorySimilarityIndex(), new InMemoryMetadataStore(),
                new DocumentSnapshot(blocked));

        assertThrows(StorageException.class,
                () -> store.upsert(new Document("d1", "title", "v1", Map.of(), new float[] { 1f, 0f })));

        assertTrue(store.listAll().isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void shouldDeleteFromBothStores() {
        DocumentStore store = DocumentStore.inMemory();
        store.upsert(new Document("d1", "title", "one", Map.of(), new float[] { 1f, 0f }));
        store.upsert(new Document("d2", "title", "two", Map.of(), new float[] { 0f, 1f }));

        store.delete("d1");

        assertTrue(store.get("d1").isEmpty());
        assertEquals(1, store.size());
        assertEquals(List.of("d2"), store.nearest(new float[] { 1f, 0f }, 5).stream()
                .map(candidate -> candidate.document().id())
                .toList());
        assertThrows(DocumentNotFoundException.class, () -> store.delete("d1"));
    }

    @Test
    void shouldListWithoutEmbeddingsOrderedByIdDescending() {
        DocumentStore store = DocumentStore.inMemory();
        store.upsert(new Document("a", "A", "alpha", Map.of(), new float[] { 1f }));
        store.upsert(new Document("c", "C", "gamma", Map.of(), new float[] { 1f }));
        store.upsert(new Document("b", "B", "beta", Map.of(), new float[] { 1f }));

        List<Document> all = store.listAll();

        assertEquals(List.of("c", "b", "a"), all.stream().map(Document::id).toList());
        assertTrue(all.stream().allMatch(document -> document.embedding() == null));
        assertEquals(List.of("b"), store.listFiltered(document -> document.title().equals("B")).stream()
                .map(Document::id)
                .toList());
        assertEquals(3, store.listFiltered(null).size());
    }

    @Test
    void shouldPersistAndReloadSnapshot() throws Exception {
        Path snapshotPath = tempDir.resolve("data/store.json");
        DocumentStore store = DocumentStore.open(snapshotPath, DistanceMetric.COSINE);
        store.upsert(new Document("d1", "Tax return", "2023 return", Map.of("taxpayer", "Acme Corp", "year", 2023),
                new float[] { 1f, 0f }));
        store.upsert(new Document("d2", "Invoice", "invoice text", Map.of(), new float[] { 0f, 1f }));
        store.delete("d2");

        DocumentStore reopened = DocumentStore.open(snapshotPath, DistanceMetric.COSINE);

        assertEquals(1, reopened.size());
        Document loaded = reopened.get("d1").orElseThrow();
        assertEquals("2023 return", loaded.content());
        assertEquals("Acme Corp", loaded.metadataString("taxpayer"));
        assertNull(loaded.embedding());
        assertEquals("d1", reopened.nearest(new float[] { 1f, 0f }, 1).get(0).document().id());
    }

    @Test
    void shouldSerializeUpsertsWhileReadersRun() throws Exception {
        DocumentStore store = DocumentStore.inMemory();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                int n = i;
                futures.add(executor.submit(() -> store.upsert(new Document("doc-" + (n % 50), "t", "v" + n, Map.of(),
                        new float[] { n, 1f }))));
                futures.add(executor.submit(() -> {
                    for (Candidate candidate : store.nearest(new float[] { 1f, 1f }, 50)) {
                        assertTrue(candidate.document().content().startsWith("v"));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(50, store.size());
        assertEquals(50, store.listAll().size());
        assertEquals(50, store.nearest(new float[] { 1f, 1f }, 100).size());
    }

    static class FailingIndex extends InMemorySimilarityIndex {
        boolean failNextReplace;

        @Override
        public void replace(String id, float[] embedding) {
            if (failNextReplace) {
                failNextReplace = false;
                throw new IllegalStateException("disk full");
            }
            super.replace(id, embedding);
        }
    }
}
