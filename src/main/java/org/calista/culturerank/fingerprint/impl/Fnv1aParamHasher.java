package org.calista.culturerank.fingerprint.impl;

import org.calista.culturerank.fingerprint.ParamHasher;
import org.calista.culturerank.random.Fnv1a;

/**
 * 64-bit FNV-1a, 16 hex chars. Used when no platform digest is available.
 */
public final class Fnv1aParamHasher implements ParamHasher {

    @Override
    public String algorithm() {
        return "fnv1a64";
    }

    @Override
    public String hash(byte[] canonical) {
        return Fnv1a.hex64(Fnv1a.hash64(canonical));
    }
}
