package com.analyticshub.common.decision;

import com.analyticshub.common.json.JsonSupport;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Deterministic content hash of an invocation's input payload.
 *
 * <p>The payload is stringified with {@link JsonSupport#canonicalMapper()} (sorted
 * properties and map keys), hashed with SHA-256 and truncated to
 * {@value #HASH_LENGTH} hex characters. Equal payloads always hash equally.
 *
 * <p>An unserializable payload raises {@link IllegalArgumentException}; the calling agent
 * decides which error code it maps to.
 */
public final class InputsHasher {

    static final int HASH_LENGTH = 16;

    private InputsHasher() {}

    public static String hash(Object inputs) {
        try {
            byte[] canonical = JsonSupport.canonicalMapper().writeValueAsString(inputs)
                .getBytes(StandardCharsets.UTF_8);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical);
            return HexFormat.of().formatHex(digest).substring(0, HASH_LENGTH);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Input payload is not serializable: " + e.getOriginalMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
