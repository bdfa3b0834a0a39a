package com.span.tracing.instrument;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprints of traced values. Only hashes are recorded on spans,
 * never the values themselves.
 */
public final class Fingerprints {
    private static final Logger log = LoggerFactory.getLogger(Fingerprints.class);

    public static final int SHORT_HASH_LENGTH = 16;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private Fingerprints() {
        // Utility class
    }

    /**
     * @return the lowercase hex SHA-256 of the UTF-8 bytes of {@code value}
     */
    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * First 16 hex characters of the SHA-256 of the JSON form of {@code value}.
     * Map keys are sorted so equal maps hash equally. Values Jackson cannot
     * serialize are hashed through {@code String.valueOf}.
     */
    public static String shortHash(Object value) {
        return sha256Hex(toJson(value)).substring(0, SHORT_HASH_LENGTH);
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Value of type {} not serializable, hashing its string form: {}",
                    value.getClass().getName(), e.getMessage());
            return String.valueOf(value);
        }
    }
}
