package com.anthem.dataproc.auth.keys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Process-wide holder of the trusted signing keys.
 *
 * <p>Lifecycle:</p>
 * <ul>
 *   <li>{@link #load()} once at cold start</li>
 *   <li>{@link #current()} hands each verification one immutable snapshot</li>
 *   <li>{@link #rotate()} swaps in a freshly fetched snapshot; on failure the old one stays</li>
 *   <li>{@link #requestRotation()} is the rotation signal, rate limited by the minimum interval
 *       after a successful load and by a shorter back-off after a failed one</li>
 * </ul>
 * A verification in progress keeps the snapshot it started with.
 */
public class TrustedKeyStore {

    private static final Logger log = LoggerFactory.getLogger(TrustedKeyStore.class);

    static final Duration FAILED_LOAD_BACKOFF = Duration.ofSeconds(30);

    private final JwksSource source;
    private final JwksParser parser;
    private final Clock clock;
    private final Duration minRotationInterval;
    private final Duration failedLoadBackoff;

    private volatile TrustedKeySet snapshot;
    private volatile Instant lastSuccessfulLoad;
    private volatile Instant lastFailedLoad;

    public TrustedKeyStore(JwksSource source, Clock clock, Duration minRotationInterval) {
        this(source, new JwksParser(), clock, minRotationInterval);
    }

    public TrustedKeyStore(JwksSource source, JwksParser parser, Clock clock, Duration minRotationInterval) {
        this.source = source;
        this.parser = parser;
        this.clock = clock;
        this.minRotationInterval = minRotationInterval;
        this.failedLoadBackoff = minRotationInterval.compareTo(FAILED_LOAD_BACKOFF) < 0
                ? minRotationInterval
                : FAILED_LOAD_BACKOFF;
    }

    /**
     * Load the key set if it has not been loaded yet. If the identity provider cannot be reached
     * the store holds an empty set, so every token is denied until a rotation succeeds.
     */
    public synchronized TrustedKeySet load() {
        if (snapshot == null) {
            if (!refresh()) {
                snapshot = TrustedKeySet.empty(clock.instant());
            }
        }
        return snapshot;
    }

    public TrustedKeySet current() {
        TrustedKeySet keys = snapshot;
        return keys != null ? keys : load();
    }

    /**
     * Fetch a fresh key set and swap it in.
     *
     * @return true if the snapshot was replaced
     */
    public synchronized boolean rotate() {
        return refresh();
    }

    /**
     * Signal that a token referenced a key this process does not know. Rotates unless the last
     * successful load is more recent than the minimum rotation interval, or the last failed load
     * is more recent than the failure back-off.
     *
     * @return true if a rotation happened and succeeded
     */
    public synchronized boolean requestRotation() {
        Instant now = clock.instant();
        Instant lastSuccess = lastSuccessfulLoad;
        if (lastSuccess != null && now.isBefore(lastSuccess.plus(minRotationInterval))) {
            log.debug("Key rotation suppressed: lastLoad={}, minInterval={}", lastSuccess, minRotationInterval);
            return false;
        }
        Instant lastFailure = lastFailedLoad;
        if (lastFailure != null && now.isBefore(lastFailure.plus(failedLoadBackoff))) {
            log.debug("Key rotation suppressed: lastFailedLoad={}, backoff={}", lastFailure, failedLoadBackoff);
            return false;
        }
        log.info("Key rotation requested: source={}", source.describe());
        return refresh();
    }

    private boolean refresh() {
        Instant now = clock.instant();
        try {
            TrustedKeySet fresh = parser.parse(source.fetch(), now);
            snapshot = fresh;
            lastSuccessfulLoad = now;
            lastFailedLoad = null;
            log.info("Loaded signing keys: source={}, kids={}", source.describe(), fresh.keyIds());
            return true;
        } catch (JwksUnavailableException e) {
            lastFailedLoad = now;
            log.error("Failed to load signing keys: source={}, error={}", source.describe(), e.getMessage());
            return false;
        }
    }
}
