package com.eainde.nsgx.cache;

import org.apache.commons.codec.digest.DigestUtils;

/**
 * Cache key component derived from unit text: the first 16 hex characters of its
 * SHA-256 digest. Identical text maps to the same fingerprint regardless of the
 * unit's position, so re-segmentation keeps cache hits.
 */
public final class ContentFingerprint {

    static final int LENGTH = 16;

    private ContentFingerprint() {
    }

    public static String of(String unitText) {
        return DigestUtils.sha256Hex(unitText).substring(0, LENGTH);
    }
}
