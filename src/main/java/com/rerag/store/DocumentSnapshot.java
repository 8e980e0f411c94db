package com.rerag.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

public class DocumentSnapshot {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Path path;

    public DocumentSnapshot(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public List<Document> load() throws IOException {
        if (!Files.exists(path) || Files.size(path) == 0L) {
            return new ArrayList<>();
        }
        return objectMapper.readValue(path.toFile(), new TypeReference<List<Document>>() {
        });
    }

    public void save(Collection<Document> documents) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), documents);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
