package com.rerag.store;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rerag.index.DimensionMismatchException;
import com.rerag.index.DistanceMetric;
import com.rerag.index.InMemorySimilarityIndex;
import com.rerag.index.Neighbor;
import com.rerag.index.SimilarityIndex;

/**
 * Keeps the similarity index and the metadata store in agreement.
 *
 * <p>Writes run under an exclusive lock and either apply to both sub-stores or to neither;
 * reads share the lock, so no reader sees metadata without its vector or the reverse.
 * Upserts to the same id serialise and the last one to commit wins.</p>
 */
public class DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    private final SimilarityIndex index;
    private final DocumentMetadataStore metadata;
    private final DocumentSnapshot snapshot;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public DocumentStore(SimilarityIndex index, DocumentMetadataStore metadata) {
        this(index, metadata, null);
    }

    public DocumentStore(SimilarityIndex index, DocumentMetadataStore metadata, DocumentSnapshot snapshot) {
        this.index = Objects.requireNonNull(index, "index");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.snapshot = snapshot;
    }

    public static DocumentStore inMemory() {
        return inMemory(DistanceMetric.COSINE);
    }

    public static DocumentStore inMemory(DistanceMetric metric) {
        return new DocumentStore(new InMemorySimilarityIndex(metric), new InMemoryMetadataStore());
    }

    public static DocumentStore open(Path snapshotPath, DistanceMetric metric) throws IOException {
        DocumentSnapshot snapshot = new DocumentSnapshot(snapshotPath);
        DocumentStore store = new DocumentStore(new InMemorySimilarityIndex(metric), new InMemoryMetadataStore(), snapshot);
        List<Document> loaded = snapshot.load();
        for (Document document : loaded) {
            store.index.insert(document.id(), requireEmbedding(document));
            store.metadata.put(document);
        }
        log.info("Opened document store snapshot={} documents={} dimension={}",
                snapshotPath,
                loaded.size(),
                store.index.dimension().isPresent() ? store.index.dimension().getAsInt() : "unset");
        return store;
    }

    public String add(Document document) {
        Document toStore = assignId(document);
        float[] embedding = requireEmbedding(toStore);
        lock.writeLock().lock();
        try {
            if (metadata.get(toStore.id()).isPresent() || index.contains(toStore.id())) {
                throw new IllegalStateException("Document with id " + toStore.id() + " already exists");
            }
            applyOrRollback(toStore.id(), () -> {
                metadata.put(toStore);
                index.insert(toStore.id(), embedding);
            });
            return toStore.id();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String upsert(Document document) {
        Document toStore = assignId(document);
        float[] embedding = requireEmbedding(toStore);
        lock.writeLock().lock();
        try {
            applyOrRollback(toStore.id(), () -> {
                metadata.upsert(toStore);
                index.replace(toStore.id(), embedding);
            });
            return toStore.id();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void delete(String id) {
        Objects.requireNonNull(id, "id");
        lock.writeLock().lock();
        try {
            if (metadata.get(id).isEmpty() && !index.contains(id)) {
                throw new DocumentNotFoundException(id);
            }
            applyOrRollback(id, () -> {
                metadata.remove(id);
                index.remove(id);
            });
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Document> get(String id) {
        lock.readLock().lock();
        try {
            return metadata.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Candidate> nearest(float[] query, int k) {
        lock.readLock().lock();
        try {
            List<Neighbor> neighbors = index.knn(query, k);
            List<Candidate> candidates = new ArrayList<>(neighbors.size());
            for (Neighbor neighbor : neighbors) {
                Optional<Document> document = metadata.get(neighbor.id());
                if (document.isEmpty()) {
                    log.warn("Indexed vector {} has no metadata, skipping", neighbor.id());
                    continue;
                }
                candidates.add(new Candidate(document.get(), neighbor.distance()));
            }
            return candidates;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Document> listAll() {
        lock.readLock().lock();
        try {
            return metadata.getAll();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Document> listFiltered(Predicate<Document> predicate) {
        lock.readLock().lock();
        try {
            return metadata.getFiltered(predicate);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return index.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public OptionalInt dimension() {
        lock.readLock().lock();
        try {
            return index.dimension();
        } finally {
            lock.readLock().unlock();
        }
    }

    public DistanceMetric metric() {
        return index.metric();
    }

    // caller holds the write lock
    private void applyOrRollback(String id, Runnable mutation) {
        Optional<Document> priorDocument = metadata.get(id);
        Optional<float[]> priorVector = index.vector(id);
        try {
            mutation.run();
            persist();
        } catch (RuntimeException e) {
            restore(id, priorDocument, priorVector);
            log.warn("Rolled back write for document {}: {}", id, e.getMessage());
            if (e instanceof DimensionMismatchException || e instanceof IllegalArgumentException) {
                throw e;
            }
            if (e instanceof StorageException storageException) {
                throw storageException;
            }
            throw new StorageException("Failed to write document " + id, e);
        }
    }

    private void restore(String id, Optional<Document> priorDocument, Optional<float[]> priorVector) {
        metadata.remove(id);
        priorDocument.ifPresent(metadata::upsert);
        index.remove(id);
        priorVector.ifPresent(vector -> index.insert(id, vector));
    }

    private void persist() {
        if (snapshot == null) {
            return;
        }
        List<Document> documents = new ArrayList<>(metadata.size());
        for (Document document : metadata.getAll()) {
            float[] vector = index.vector(document.id())
                    .orElseThrow(() -> new StorageException("No vector indexed for document " + document.id()));
            documents.add(document.withEmbedding(vector));
        }
        try {
            snapshot.save(documents);
        } catch (IOException e) {
            throw new StorageException("Failed to persist snapshot to " + snapshot.path(), e);
        }
    }

    private static Document assignId(Document document) {
        Objects.requireNonNull(document, "document");
        return document.hasId() ? document : document.withId(UUID.randomUUID().toString());
    }

    private static float[] requireEmbedding(Document document) {
        if (document.embedding() == null || document.embedding().length == 0) {
            throw new IllegalArgumentException("Document " + document.id() + " has no embedding");
        }
        return document.embedding();
    }
}
