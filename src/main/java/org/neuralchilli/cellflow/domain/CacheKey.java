package org.neuralchilli.cellflow.domain;

import javax.annotation.Nonnull;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 digest over the identity-bearing arguments of a task invocation.
 * Stored as lowercase hex so it can be written to cache sidecars as-is.
 */
public record CacheKey(String hex) {

    private static final int HEX_LENGTH = 64;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    /**
     * Key of an invocation whose arguments were all excluded from hashing.
     */
    public static final CacheKey EMPTY = new CacheKey("0".repeat(HEX_LENGTH));

    public CacheKey {
        Objects.requireNonNull(hex, "Cache key hex cannot be null");
        if (hex.length() != HEX_LENGTH) {
            throw new IllegalArgumentException(
                    "Cache key must be 64 hex characters (SHA-256), got: " + hex.length()
            );
        }
        try {
            HEX_FORMAT.parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cache key hex: " + hex, e);
        }
        hex = hex.toLowerCase();
    }

    public static CacheKey fromDigest(byte[] digest) {
        Objects.requireNonNull(digest, "Digest cannot be null");
        return new CacheKey(HEX_FORMAT.formatHex(digest));
    }

    public boolean isEmpty() {
        return EMPTY.equals(this);
    }

    /**
     * First 12 hex characters, enough to tell keys apart in logs.
     */
    public String shortForm() {
        return hex.substring(0, 12);
    }

    @Nonnull
    @Override
    public String toString() {
        return hex;
    }
}
