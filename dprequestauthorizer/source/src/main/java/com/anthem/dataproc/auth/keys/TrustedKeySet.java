package com.anthem.dataproc.auth.keys;

import java.security.Key;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the identity provider's signing keys, indexed by key id.
 * A new snapshot replaces the old one on rotation; a snapshot is never mutated.
 */
public final class TrustedKeySet {

    private final Map<String, Key> keysById;
    private final Instant loadedAt;

    private TrustedKeySet(Map<String, ? extends Key> keysById, Instant loadedAt) {
        this.keysById = Collections.unmodifiableMap(new LinkedHashMap<String, Key>(keysById));
        this.loadedAt = loadedAt;
    }

    public static TrustedKeySet of(Map<String, ? extends Key> keysById, Instant loadedAt) {
        return new TrustedKeySet(keysById, loadedAt);
    }

    public static TrustedKeySet empty(Instant loadedAt) {
        return new TrustedKeySet(Map.of(), loadedAt);
    }

    /**
     * Find the key for a JWS {@code kid}. A token without a key id is only matched when the set
     * holds exactly one key.
     */
    public Optional<Key> find(String keyId) {
        if (keyId == null) {
            return keysById.size() == 1 ? Optional.of(keysById.values().iterator().next()) : Optional.empty();
        }
        return Optional.ofNullable(keysById.get(keyId));
    }

    public Set<String> keyIds() {
        return keysById.keySet();
    }

    public int size() {
        return keysById.size();
    }

    public boolean isEmpty() {
        return keysById.isEmpty();
    }

    public Instant getLoadedAt() {
        return loadedAt;
    }

    @Override
    public String toString() {
        return "TrustedKeySet[kids=" + keysById.keySet() + ", loadedAt=" + loadedAt + "]";
    }
}
