package com.gatekeeper.core.cache;

/**
 * Identity of a cached verdict: what was validated and which content version it saw.
 *
 * @param resource    resource identity, e.g. {@code standards:src/app.ts} or {@code tool:eslint:FULL}
 * @param fingerprint content fingerprint from {@link ContentFingerprinter}
 */
public record CacheKey(String resource, String fingerprint) {

    public CacheKey {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be blank");
        }
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint must not be blank");
        }
    }
}
