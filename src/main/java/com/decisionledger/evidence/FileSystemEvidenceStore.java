package com.decisionledger.evidence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;

/**
 * Stores each evidence document as a JSON file below a root directory,
 * using the evidence key as the relative path.
 */
public class FileSystemEvidenceStore implements EvidenceStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemEvidenceStore.class);

    private final Path root;
    private final ObjectMapper mapper;

    public FileSystemEvidenceStore(Path root, ObjectMapper mapper) {
        this.root = root.toAbsolutePath().normalize();
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void put(String key, Map<String, Object> payload) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), ".evidence", ".tmp");
            mapper.writeValue(temp.toFile(), payload);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Stored evidence object {}", key);
        } catch (IOException ex) {
            throw new EvidenceStorageException("failed to store evidence object " + key, ex);
        }
    }

    @Override
    public Optional<Map<String, Object>> get(String key) {
        Path target = resolve(key);
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(target.toFile(), new TypeReference<Map<String, Object>>() {}));
        } catch (IOException ex) {
            throw new EvidenceStorageException("failed to read evidence object " + key, ex);
        }
    }

    private Path resolve(String key) {
        Path target = root.resolve(key).normalize();
        if (!target.startsWith(root)) {
            throw new EvidenceStorageException("evidence key escapes the store root: " + key);
        }
        return target;
    }
}
