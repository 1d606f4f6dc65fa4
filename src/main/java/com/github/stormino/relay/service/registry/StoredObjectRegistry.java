package com.github.stormino.relay.service.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.stormino.relay.config.RelayProperties;
import com.github.stormino.relay.model.StoredObject;
import com.github.stormino.relay.model.TransferResult;
import com.github.stormino.relay.model.TransferTask;
import com.github.stormino.relay.service.scheduler.TransferCompletionListener;
import com.github.stormino.relay.service.sink.TransferSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which objects have been re-hosted and under which remote id.
 * <p>
 * A hit is confirmed against the sink before it is reported; entries the sink no longer knows
 * are evicted. When {@code relay.registry.file} is set the registry is loaded from and saved to
 * that JSON file.
 */
@Slf4j
@Service
public class StoredObjectRegistry implements DedupProbe, TransferCompletionListener {

    private final TransferSink sink;
    private final ObjectMapper objectMapper;
    private final Path snapshotFile;
    private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();

    public StoredObjectRegistry(TransferSink sink, ObjectMapper objectMapper, RelayProperties properties) {
        this.sink = sink;
        this.objectMapper = objectMapper;
        String file = properties.getRegistry().getFile();
        this.snapshotFile = file != null && !file.isBlank() ? Path.of(file) : null;
        load();
    }

    @Override
    public Optional<String> isDurablyStored(String id) {
        StoredObject stored = objects.get(id);
        if (stored == null) {
            return Optional.empty();
        }

        boolean present;
        try {
            present = sink.exists(stored.getRemoteId());
        } catch (UncheckedIOException e) {
            // Sink unreachable: trust the record rather than relay the object again
            log.warn("Could not verify {} ({}) on sink, assuming it is still stored: {}",
                    id, stored.getRemoteId(), e.getMessage());
            return Optional.of(stored.getRemoteId());
        }

        if (present) {
            return Optional.of(stored.getRemoteId());
        }

        log.warn("Stored copy of {} ({}) no longer exists on sink, evicting", id, stored.getRemoteId());
        objects.remove(id, stored);
        save();
        return Optional.empty();
    }

    @Override
    public void onTransferFinished(TransferTask task, int slotId, TransferResult result) {
        if (!result.isSuccess()) {
            return;
        }
        record(StoredObject.builder()
                .id(task.getId())
                .remoteId(result.getRemoteId())
                .displayName(task.getDisplayName())
                .sizeBytes(result.getBytesTransferred())
                .uploadedAt(Instant.now())
                .build());
    }

    private void record(StoredObject stored) {
        objects.put(stored.getId(), stored);
        log.debug("Recorded {} as {}", stored.getId(), stored.getRemoteId());
        save();
    }

    private List<StoredObject> newestFirst() {
        List<StoredObject> all = new ArrayList<>(objects.values());
        all.sort(Comparator.comparing(StoredObject::getUploadedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return all;
    }

    private void load() {
        if (snapshotFile == null || !Files.exists(snapshotFile)) {
            return;
        }
        try {
            List<StoredObject> loaded = objectMapper.readValue(snapshotFile.toFile(), new TypeReference<List<StoredObject>>() {
            });
            loaded.forEach(stored -> objects.put(stored.getId(), stored));
            log.info("Loaded {} stored object(s) from {}", objects.size(), snapshotFile);
        } catch (IOException e) {
            log.warn("Failed to load registry snapshot {}, starting empty: {}", snapshotFile, e.getMessage());
        }
    }

    private synchronized void save() {
        if (snapshotFile == null) {
            return;
        }
        try {
            Path parent = snapshotFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, "registry", ".json.tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), newestFirst());
            Files.move(temp, snapshotFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Failed to save registry snapshot {}: {}", snapshotFile, e.getMessage());
        }
    }
}
