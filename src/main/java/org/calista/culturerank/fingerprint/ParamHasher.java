package org.calista.culturerank.fingerprint;

/**
 * Content hash over the canonical parameter bytes. Must be deterministic across runs.
 */
public interface ParamHasher {

    /** Short algorithm label, e.g. {@code sha256}. */
    String algorithm();

    /** Lowercase hex digest. */
    String hash(byte[] canonical);
}
