package com.roapid.adapter.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Artifacts as pretty-printed JSON files under a data directory. Keys are written in sorted order.
 */
@Slf4j
public class FileArtifactStore implements ArtifactStore {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private final Path dataDir;
    private final Clock clock;
    private final JsonMapper jsonMapper = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    public FileArtifactStore(Path dataDir, Clock clock) {
        this.dataDir = dataDir.toAbsolutePath().normalize();
        this.clock = clock;
    }

    @Override
    public byte[] save(String relativePath, byte[] rawPayload) {
        Map<String, Object> payload;
        try {
            payload = jsonMapper.readValue(rawPayload, OBJECT_TYPE);
        } catch (IOException e) {
            throw new StorageException("Payload for " + relativePath + " is not a JSON object", e);
        }
        if (payload == null) {
            throw new StorageException("Payload for " + relativePath + " is not a JSON object");
        }
        payload.put(LAST_UPDATED_FIELD,
                DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS)));

        byte[] toWrite;
        try {
            toWrite = jsonMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize " + relativePath, e);
        }

        Path target = resolve(relativePath);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, toWrite);
        } catch (IOException e) {
            throw new StorageException("Cannot write " + target, e);
        }
        log.debug("Saved artifact {} ({} bytes)", relativePath, toWrite.length);
        return toWrite;
    }

    @Override
    public Optional<byte[]> readExisting(String relativePath) {
        Path target = resolve(relativePath);
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Cannot read " + target, e);
        }
    }

    @Override
    public List<String> listArtifactNames() {
        if (!Files.isDirectory(dataDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dataDir)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new StorageException("Cannot list data directory " + dataDir, e);
        }
    }

    private Path resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new StorageException("Artifact path must not be blank");
        }
        Path target = dataDir.resolve(relativePath).normalize();
        if (!target.startsWith(dataDir) || target.equals(dataDir)) {
            throw new StorageException("Artifact path escapes data directory: " + relativePath);
        }
        return target;
    }
}
