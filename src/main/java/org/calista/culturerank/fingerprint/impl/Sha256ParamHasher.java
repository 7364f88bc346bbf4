package org.calista.culturerank.fingerprint.impl;

import org.calista.culturerank.fingerprint.ParamHasher;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 through the platform {@link MessageDigest}.
 */
public final class Sha256ParamHasher implements ParamHasher {

    static final String DIGEST = "SHA-256";
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    /** Fails fast when the platform does not provide SHA-256. */
    public Sha256ParamHasher() throws NoSuchAlgorithmException {
        MessageDigest.getInstance(DIGEST);
    }

    @Override
    public String algorithm() {
        return "sha256";
    }

    @Override
    public String hash(byte[] canonical) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance(DIGEST);
        } catch (NoSuchAlgorithmException e) {
            // checked in the constructor
            throw new IllegalStateException(DIGEST + " disappeared after construction", e);
        }
        return hex(md.digest(canonical));
    }

    static String hex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }
}
