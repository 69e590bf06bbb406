package com.roapid.sync.detect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.roapid.adapter.storage.ArtifactStore;
import com.roapid.adapter.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a freshly fetched payload differs from the stored artifact in anything but
 * {@link ArtifactStore#LAST_UPDATED_FIELD}. Objects are compared in canonical form (keys sorted at every
 * level); when either side is not a JSON object the raw bytes are compared instead.
 */
@Component
@Slf4j
public class ChangeDetector {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private final ArtifactStore artifactStore;
    private final JsonMapper canonicalMapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    public ChangeDetector(ArtifactStore artifactStore) {
        this.artifactStore = artifactStore;
    }

    /**
     * @return true when nothing is stored at {@code path} or the content differs
     * @throws StorageException when the stored artifact cannot be read
     */
    public boolean hasChanged(String path, byte[] newPayload) {
        Optional<byte[]> stored = artifactStore.readExisting(path);
        if (stored.isEmpty()) {
            return true;
        }
        byte[] oldPayload = stored.get();

        Optional<Map<String, Object>> oldObject = parseObject(oldPayload);
        Optional<Map<String, Object>> newObject = parseObject(newPayload);
        if (oldObject.isEmpty() || newObject.isEmpty()) {
            log.debug("{}: not a JSON object on both sides, comparing raw bytes", path);
            return !Arrays.equals(oldPayload, newPayload);
        }

        oldObject.get().remove(ArtifactStore.LAST_UPDATED_FIELD);
        return !Arrays.equals(canonicalBytes(oldObject.get()), canonicalBytes(newObject.get()));
    }

    /**
     * Deterministic serialization: same content gives the same bytes regardless of key order.
     */
    public byte[] canonicalBytes(Map<String, Object> object) {
        try {
            return canonicalMapper.writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize payload for comparison", e);
        }
    }

    private Optional<Map<String, Object>> parseObject(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(canonicalMapper.readValue(payload, OBJECT_TYPE));
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
