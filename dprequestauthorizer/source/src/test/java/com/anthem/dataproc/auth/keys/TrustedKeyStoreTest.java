package com.anthem.dataproc.auth.keys;

import com.anthem.dataproc.auth.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrustedKeyStoreTest {

    @Mock
    private JwksSource source;

    private MutableClock clock;
    private TrustedKeyStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestTokens.NOW);
        lenient().when(source.describe()).thenReturn("test-jwks");
        store = new TrustedKeyStore(source, clock, Duration.ofMinutes(5));
    }

    @Test
    void load_fetchesOnce() {
        when(source.fetch()).thenReturn(TestTokens.jwksJson());

        TrustedKeySet first = store.load();
        TrustedKeySet second = store.load();

        assertThat(first).isSameAs(second);
        assertThat(first.keyIds()).containsExactly(TestTokens.KEY_ID);
        verify(source, times(1)).fetch();
    }

    @Test
    void load_sourceUnavailable_holdsEmptySet() {
        when(source.fetch()).thenThrow(new JwksUnavailableException("connection refused"));

        TrustedKeySet keys = store.load();

        assertThat(keys.isEmpty()).isTrue();
        assertThat(store.current()).isSameAs(keys);
    }

    @Test
    void current_loadsLazilyWhenNotLoaded() {
        when(source.fetch()).thenReturn(TestTokens.jwksJson());

        assertThat(store.current().keyIds()).containsExactly(TestTokens.KEY_ID);
    }

    @Test
    void rotate_swapsInNewSnapshot() {
        when(source.fetch()).thenReturn(TestTokens.jwksJson("old-key"), TestTokens.jwksJson("new-key"));
        TrustedKeySet before = store.load();

        assertThat(store.rotate()).isTrue();

        assertThat(before.keyIds()).containsExactly("old-key");
        assertThat(store.current().keyIds()).containsExactly("new-key");
    }

    @Test
    void rotate_failure_keepsPreviousSnapshot() {
        when(source.fetch())
                .thenReturn(TestTokens.jwksJson())
                .thenThrow(new JwksUnavailableException("timeout"));
        TrustedKeySet before = store.load();

        assertThat(store.rotate()).isFalse();

        assertThat(store.current()).isSameAs(before);
    }

    @Test
    void requestRotation_withinMinimumInterval_isSuppressed() {
        when(source.fetch()).thenReturn(TestTokens.jwksJson());
        store.load();
        clock.advance(Duration.ofMinutes(1));

        assertThat(store.requestRotation()).isFalse();

        verify(source, times(1)).fetch();
    }

    @Test
    void requestRotation_afterMinimumInterval_refreshes() {
        when(source.fetch()).thenReturn(TestTokens.jwksJson("old-key"), TestTokens.jwksJson("new-key"));
        store.load();
        clock.advance(Duration.ofMinutes(6));

        assertThat(store.requestRotation()).isTrue();

        assertThat(store.current().keyIds()).containsExactly("new-key");
    }

    @Test
    void requestRotation_afterFailedInitialLoad_waitsForBackoff() {
        when(source.fetch())
                .thenThrow(new JwksUnavailableException("dns failure"))
                .thenReturn(TestTokens.jwksJson());
        store.load();

        assertThat(store.requestRotation()).isFalse();
        verify(source, times(1)).fetch();

        clock.advance(TrustedKeyStore.FAILED_LOAD_BACKOFF);
        assertThat(store.requestRotation()).isTrue();

        assertThat(store.current().keyIds()).containsExactly(TestTokens.KEY_ID);
    }

    @Test
    void requestRotation_providerDown_fetchesOncePerBackoff() {
        when(source.fetch())
                .thenReturn(TestTokens.jwksJson())
                .thenThrow(new JwksUnavailableException("timeout"));
        TrustedKeySet loaded = store.load();
        clock.advance(Duration.ofMinutes(6));

        assertThat(store.requestRotation()).isFalse();
        clock.advance(Duration.ofSeconds(10));
        assertThat(store.requestRotation()).isFalse();
        assertThat(store.requestRotation()).isFalse();

        verify(source, times(2)).fetch();
        assertThat(store.current()).isSameAs(loaded);

        clock.advance(TrustedKeyStore.FAILED_LOAD_BACKOFF);
        store.requestRotation();
        verify(source, times(3)).fetch();
    }

    @Test
    void requestRotation_backoffNeverExceedsMinimumInterval() {
        TrustedKeyStore eager = new TrustedKeyStore(source, clock, Duration.ofSeconds(5));
        when(source.fetch())
                .thenThrow(new JwksUnavailableException("timeout"))
                .thenReturn(TestTokens.jwksJson());
        eager.load();
        clock.advance(Duration.ofSeconds(5));

        assertThat(eager.requestRotation()).isTrue();
    }

    @Test
    void current_neverFetchesOnceLoaded() {
        when(source.fetch()).thenReturn(TestTokens.jwksJson());
        store.load();
        clock.advance(Duration.ofDays(1));

        store.current();

        verify(source, times(1)).fetch();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
