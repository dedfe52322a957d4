package org.operaton.nostrpub.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.cache.BridgeCache;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.StoreUnavailableException;
import org.operaton.nostrpub.store.BridgeStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Remembers processed event and activity ids for the retention window.
 * The cache answers repeats without I/O; the store keeps the index across restarts and cache evictions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DedupIndex {

    private final BridgeCache cache;
    private final BridgeStore store;
    private final NostrPubProperties properties;
    private final Clock clock;

    /**
     * Records an id.
     *
     * @param id event or activity id
     * @return true exactly once per id within the retention window
     * @throws StoreUnavailableException if the store cannot record the id; the id counts as unseen afterwards
     */
    public boolean firstSeen(String id) {
        Instant now = clock.instant();
        if (!cache.markSeen(id, now)) {
            return false;
        }
        try {
            boolean fresh = store.recordSeen(id, now);
            if (!fresh) {
                log.debug("Id {} already recorded in store", id);
            }
            return fresh;
        } catch (StoreUnavailableException e) {
            cache.forgetSeen(id);
            throw e;
        }
    }

    /**
     * Drops store entries older than the retention window.
     *
     * @return number of removed entries
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(properties.getDedup().getRetention());
        return store.purgeSeenBefore(cutoff);
    }
}
