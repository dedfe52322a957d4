package org.operaton.nostrpub.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.operaton.nostrpub.TestFixtures;
import org.operaton.nostrpub.cache.BridgeCache;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.StoreUnavailableException;
import org.operaton.nostrpub.store.BridgeStore;
import org.operaton.nostrpub.store.InMemoryBridgeStore;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DedupIndexTest {

    private NostrPubProperties properties;
    private BridgeCache cache;
    private InMemoryBridgeStore store;
    private DedupIndex dedupIndex;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        cache = new BridgeCache(properties);
        store = new InMemoryBridgeStore();
        dedupIndex = new DedupIndex(cache, store, properties, TestFixtures.clock());
    }

    @Test
    void firstSeen_shouldBeTrueExactlyOnce() {
        assertThat(dedupIndex.firstSeen("abc")).isTrue();
        assertThat(dedupIndex.firstSeen("abc")).isFalse();
        assertThat(dedupIndex.firstSeen("def")).isTrue();
    }

    @Test
    void firstSeen_afterCacheEviction_shouldBeAnsweredByStore() {
        dedupIndex.firstSeen("abc");
        cache.forgetSeen("abc");

        assertThat(dedupIndex.firstSeen("abc")).isFalse();
    }

    @Test
    void firstSeen_withStoreUnavailable_shouldLeaveIdUnseen() {
        BridgeStore failing = mock(BridgeStore.class);
        when(failing.recordSeen(eq("abc"), any(Instant.class)))
            .thenThrow(new StoreUnavailableException("down", new RuntimeException()))
            .thenReturn(true);
        DedupIndex index = new DedupIndex(cache, failing, properties, TestFixtures.clock());

        assertThatThrownBy(() -> index.firstSeen("abc")).isInstanceOf(StoreUnavailableException.class);
        assertThat(cache.isSeen("abc")).isFalse();
        assertThat(index.firstSeen("abc")).isTrue();
    }

    @Test
    void purgeExpired_shouldDropEntriesOlderThanRetention() {
        store.recordSeen("old", TestFixtures.NOW.minus(Duration.ofHours(25)));
        store.recordSeen("recent", TestFixtures.NOW.minus(Duration.ofHours(2)));

        assertThat(dedupIndex.purgeExpired()).isEqualTo(1);
        assertThat(store.recordSeen("old", TestFixtures.NOW)).isTrue();
        assertThat(store.recordSeen("recent", TestFixtures.NOW)).isFalse();
    }
}
