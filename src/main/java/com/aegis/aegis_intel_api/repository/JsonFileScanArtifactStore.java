package com.aegis.aegis_intel_api.repository;

import com.aegis.aegis_intel_api.config.StorageProperties;
import com.aegis.aegis_intel_api.dto.analyst.ChatTurn;
import com.aegis.aegis_intel_api.dto.analyst.ScanArtifact;
import com.aegis.aegis_intel_api.exception.ArtifactStoreException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scan artifacts kept in a single JSON document keyed by scan id.
 * Every read-modify-write runs under one lock and replaces the file atomically.
 */
@Slf4j
@Repository
public class JsonFileScanArtifactStore implements ScanArtifactStore {

    private static final TypeReference<LinkedHashMap<String, ScanArtifact>> STORE_TYPE = new TypeReference<>() {};

    private final Path storePath;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public JsonFileScanArtifactStore(StorageProperties storageProperties, ObjectMapper objectMapper, Clock clock) {
        this(Paths.get(storageProperties.getScanArtifactPath()), objectMapper, clock);
    }

    public JsonFileScanArtifactStore(Path storePath, ObjectMapper objectMapper, Clock clock) {
        this.storePath = storePath.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean create(String scanId, String detectionContext, String sitrep, String model, int tokens) {
        lock.lock();
        try {
            Map<String, ScanArtifact> store = readForUpdate();
            if (store.containsKey(scanId)) {
                log.warn("Scan artifact {} already exists, keeping the original", scanId);
                return false;
            }
            LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
            store.put(scanId, new ScanArtifact(now, detectionContext, sitrep, model, tokens, List.of()));
            write(store);
            log.info("Saved SITREP for scan {}", scanId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<ScanArtifact> get(String scanId) {
        return Optional.ofNullable(readQuietly().get(scanId));
    }

    @Override
    public boolean appendChatTurns(String scanId, List<ChatTurn> turns) {
        lock.lock();
        try {
            Map<String, ScanArtifact> store = readForUpdate();
            ScanArtifact artifact = store.get(scanId);
            if (artifact == null) {
                log.warn("Scan {} not found, cannot add chat message", scanId);
                return false;
            }
            store.put(scanId, artifact.withChatTurns(turns));
            write(store);
            log.debug("Added {} chat turn(s) to scan {}", turns.size(), scanId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ChatTurn> chatHistory(String scanId) {
        return get(scanId).map(ScanArtifact::chatHistory).orElse(List.of());
    }

    @Override
    public int retainMostRecent(int keep) {
        lock.lock();
        try {
            Map<String, ScanArtifact> store = readForUpdate();
            if (store.size() <= keep) {
                return 0;
            }

            List<Map.Entry<String, ScanArtifact>> entries = new ArrayList<>(store.entrySet());
            entries.sort(Comparator.comparing((Map.Entry<String, ScanArtifact> e) -> e.getValue().timestamp(),
                    Comparator.nullsFirst(Comparator.naturalOrder())).reversed());

            Map<String, ScanArtifact> retained = new LinkedHashMap<>();
            entries.stream().limit(Math.max(keep, 0)).forEach(e -> retained.put(e.getKey(), e.getValue()));
            write(retained);

            int removed = store.size() - retained.size();
            log.info("Cleaned up {} old scans, kept {}", removed, retained.size());
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private Map<String, ScanArtifact> readQuietly() {
        lock.lock();
        try {
            return read();
        } catch (IOException e) {
            log.warn("Could not read scan artifact store {}: {}", storePath, e.getMessage());
            return new LinkedHashMap<>();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unlike reads, updates refuse to continue on an unreadable store so it is never overwritten.
     */
    private Map<String, ScanArtifact> readForUpdate() {
        try {
            return read();
        } catch (IOException e) {
            throw new ArtifactStoreException("Scan artifact store " + storePath + " is unreadable", e);
        }
    }

    private Map<String, ScanArtifact> read() throws IOException {
        if (!Files.exists(storePath) || Files.size(storePath) == 0) {
            return new LinkedHashMap<>();
        }
        LinkedHashMap<String, ScanArtifact> store = objectMapper.readValue(storePath.toFile(), STORE_TYPE);
        return store != null ? store : new LinkedHashMap<>();
    }

    private void write(Map<String, ScanArtifact> store) {
        try {
            Files.createDirectories(storePath.getParent());
            Path temp = storePath.resolveSibling(storePath.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), store);
            Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to write scan artifact store " + storePath, e);
        }
    }
}
