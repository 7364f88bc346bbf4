package org.calista.culturerank.fingerprint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.culturerank.fingerprint.impl.Fnv1aParamHasher;
import org.calista.culturerank.fingerprint.impl.Sha256ParamHasher;

import java.nio.charset.StandardCharsets;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Fingerprint of the effective parameters: hash of their canonical JSON form
 * (properties and map keys sorted, compact, UTF-8).
 */
public final class ParamFingerprint {
    private static final Logger log = LogManager.getLogger(ParamFingerprint.class);

    private final ObjectMapper canonical;
    private final ParamHasher hasher;

    public ParamFingerprint(ParamHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.canonical = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }

    /** SHA-256 where available, FNV-1a otherwise. */
    public static ParamFingerprint createDefault() {
        return new ParamFingerprint(defaultHasher());
    }

    public static ParamHasher defaultHasher() {
        try {
            return new Sha256ParamHasher();
        } catch (NoSuchAlgorithmException e) {
            log.warn("SHA-256 unavailable ({}), falling back to FNV-1a fingerprints", e.toString());
            return new Fnv1aParamHasher();
        }
    }

    public ParamHasher hasher() {
        return hasher;
    }

    public String canonicalJson(Object params) {
        Objects.requireNonNull(params, "params");
        try {
            return canonical.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize parameters of type " + params.getClass().getName(), e);
        }
    }

    public String fingerprint(Object params) {
        return hasher.hash(canonicalJson(params).getBytes(StandardCharsets.UTF_8));
    }
}
