package org.operaton.nostrpub.relay;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.cache.BridgeCache;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.StoreUnavailableException;
import org.operaton.nostrpub.model.bridge.PublishResult;
import org.operaton.nostrpub.model.entity.RelayCursor;
import org.operaton.nostrpub.model.nostr.EventKind;
import org.operaton.nostrpub.model.nostr.Filter;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.operaton.nostrpub.security.NostrKeys;
import org.operaton.nostrpub.service.DedupIndex;
import org.operaton.nostrpub.store.BridgeStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * All configured relays as one source and sink of events.
 *
 * <p>Inbound events from every relay are verified, then checked against the shared dedup index; the first
 * copy goes to the event sink on the bridge executor, later copies are dropped. Publications go to every
 * connected relay independently.</p>
 */
@Service
@Slf4j
public class RelayPoolManager {

    static final String MAIN_SUBSCRIPTION = "nostrpub";
    private static final String QUERY_PREFIX = "q-";

    private final RelayTransport transport;
    private final RelayMessages messages;
    private final DedupIndex dedupIndex;
    private final BridgeStore store;
    private final BridgeCache cache;
    private final NostrPubProperties properties;
    private final Executor bridgeExecutor;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private final Map<String, RelayConnection> connections = new LinkedHashMap<>();
    private final Map<String, RelayConnection> metadataConnections = new LinkedHashMap<>();
    private final Map<String, PendingQuery> queries = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> newestSeen = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastCursorFlush = new ConcurrentHashMap<>();
    private final AtomicLong querySequence = new AtomicLong();
    private volatile Consumer<NostrEvent> sink = event -> { };

    public RelayPoolManager(RelayTransport transport,
                            RelayMessages messages,
                            DedupIndex dedupIndex,
                            BridgeStore store,
                            BridgeCache cache,
                            NostrPubProperties properties,
                            @Qualifier("bridgeExecutor") Executor bridgeExecutor,
                            @Qualifier("taskScheduler") TaskScheduler scheduler,
                            Clock clock) {
        this.transport = transport;
        this.messages = messages;
        this.dedupIndex = dedupIndex;
        this.store = store;
        this.cache = cache;
        this.properties = properties;
        this.bridgeExecutor = bridgeExecutor;
        this.scheduler = scheduler;
        this.clock = clock;
        for (String url : properties.getRelays()) {
            connections.put(url, new RelayConnection(url, transport, messages, scheduler,
                properties.getRelay(), clock, new PoolHandler()));
        }
        for (String url : properties.getMetadataRelays()) {
            if (!connections.containsKey(url)) {
                metadataConnections.put(url, new RelayConnection(url, transport, messages, scheduler,
                    properties.getRelay(), clock, new PoolHandler()));
            }
        }
    }

    /**
     * Registers the bridge's subscription on every relay and connects.
     *
     * @param filters the filter set, re-issued unchanged on every reconnect
     * @param eventSink receives each new verified event exactly once
     */
    public void start(List<Filter> filters, Consumer<NostrEvent> eventSink) {
        this.sink = eventSink;
        for (RelayConnection connection : connections.values()) {
            connection.subscribe(MAIN_SUBSCRIPTION, filters);
            connection.connect();
        }
        metadataConnections.values().forEach(RelayConnection::connect);
        log.info("Relay pool started with {} relays and {} metadata relays", connections.size(),
            metadataConnections.size());
    }

    /**
     * Adds or replaces a subscription on every relay.
     */
    public void subscribe(String subscriptionId, List<Filter> filters) {
        connections.values().forEach(connection -> connection.subscribe(subscriptionId, filters));
    }

    public void unsubscribe(String subscriptionId) {
        connections.values().forEach(connection -> connection.unsubscribe(subscriptionId));
    }

    /**
     * Broadcasts an event to every connected relay, kind 0 metadata also to the metadata relays.
     * One relay failing does not affect the others.
     *
     * @return one result per connected relay; empty if none is connected
     */
    public CompletableFuture<List<PublishResult>> publish(NostrEvent event) {
        List<RelayConnection> targets = new ArrayList<>(connected());
        if (event.getKind() == EventKind.METADATA.getCode()) {
            targets.addAll(connected(metadataConnections));
        }
        if (targets.isEmpty()) {
            log.warn("No relay connected, event {} not published", event.getId());
            return CompletableFuture.completedFuture(List.of());
        }
        // Own events come back through the subscription; they must not be bridged again
        try {
            dedupIndex.firstSeen(event.getId());
        } catch (StoreUnavailableException e) {
            log.warn("Cannot record own event {} as seen: {}", event.getId(), e.getMessage());
        }
        Duration timeout = properties.getRelay().getQueryTimeout();
        List<CompletableFuture<PublishResult>> results = targets.stream()
            .map(connection -> connection.publish(event, timeout))
            .collect(Collectors.toList());
        return CompletableFuture.allOf(results.toArray(new CompletableFuture[0]))
            .thenApply(ignored -> {
                List<PublishResult> collected = results.stream().map(CompletableFuture::join).collect(Collectors.toList());
                long accepted = collected.stream().filter(PublishResult::isAccepted).count();
                log.info("Published kind {} event {} to {}/{} relays", event.getKind(), event.getId(), accepted, collected.size());
                return collected;
            });
    }

    /**
     * Asks every connected relay for the first event matching a filter.
     *
     * @return the first verified match, or empty once all relays sent EOSE or the timeout passed
     */
    public CompletableFuture<Optional<NostrEvent>> query(Filter filter, Duration timeout) {
        List<RelayConnection> targets = connected();
        if (targets.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String subscriptionId = QUERY_PREFIX + querySequence.incrementAndGet();
        PendingQuery query = new PendingQuery(targets.size());
        queries.put(subscriptionId, query);
        query.timer = scheduler.schedule(() -> query.result.complete(Optional.empty()), clock.instant().plus(timeout));
        query.result.whenComplete((found, error) -> {
            queries.remove(subscriptionId);
            if (query.timer != null) {
                query.timer.cancel(false);
            }
            targets.forEach(connection -> connection.unsubscribe(subscriptionId));
        });
        List<Filter> filters = List.of(filter.toBuilder().limit(1).build());
        targets.forEach(connection -> connection.subscribe(subscriptionId, filters));
        return query.result;
    }

    /**
     * Relay states by URL.
     */
    public Map<String, RelayState> states() {
        Map<String, RelayState> states = new LinkedHashMap<>();
        connections.forEach((url, connection) -> states.put(url, connection.getState()));
        metadataConnections.forEach((url, connection) -> states.put(url, connection.getState()));
        return states;
    }

    /**
     * Lower bound for the subscription's {@code since}: the oldest stored cursor, limited to
     * {@code max-lookback}; {@code initial-lookback} when no cursor is stored.
     */
    public long initialSince() {
        long now = clock.instant().getEpochSecond();
        long floor = now - properties.getRelay().getMaxLookback().getSeconds();
        List<RelayCursor> cursors;
        try {
            cursors = store.findRelayCursors();
        } catch (StoreUnavailableException e) {
            log.warn("Relay cursors unavailable, using initial lookback", e);
            cursors = List.of();
        }
        Map<String, Long> byRelay = cursors.stream()
            .collect(Collectors.toMap(RelayCursor::getRelayUrl, RelayCursor::getNewestCreatedAt, Math::max));
        long initial = now - properties.getRelay().getInitialLookback().getSeconds();
        // A relay without cursor starts at the initial lookback
        long since = connections.keySet().stream()
            .mapToLong(url -> byRelay.getOrDefault(url, initial))
            .min()
            .orElse(initial);
        return Math.max(floor, since);
    }

    @PreDestroy
    public void shutdown() {
        connections.values().forEach(RelayConnection::close);
        metadataConnections.values().forEach(RelayConnection::close);
        queries.values().forEach(query -> query.result.complete(Optional.empty()));
        newestSeen.forEach((url, newest) -> flushCursor(url, newest.get()));
        log.info("Relay pool stopped");
    }

    private List<RelayConnection> connected() {
        return connected(connections);
    }

    private static List<RelayConnection> connected(Map<String, RelayConnection> pool) {
        return pool.values().stream()
            .filter(connection -> connection.getState() == RelayState.SUBSCRIBED
                || connection.getState() == RelayState.DEGRADED)
            .collect(Collectors.toList());
    }

    private void onEvent(RelayConnection relay, String subscriptionId, NostrEvent event) {
        if (event == null) {
            return;
        }
        if (!NostrKeys.verify(event)) {
            log.debug("Dropping event with invalid id or signature from {}", relay.getUrl());
            return;
        }
        if (subscriptionId != null && subscriptionId.startsWith(QUERY_PREFIX)) {
            PendingQuery query = queries.get(subscriptionId);
            if (query != null) {
                cache.putRecentEvent(event);
                query.result.complete(Optional.of(event));
            }
            return;
        }
        trackCursor(relay.getUrl(), event.getCreatedAt());
        boolean first;
        try {
            first = dedupIndex.firstSeen(event.getId());
        } catch (StoreUnavailableException e) {
            log.error("Dedup index unavailable, dropping event {} from {}", event.getId(), relay.getUrl(), e);
            return;
        }
        if (!first) {
            log.trace("Duplicate event {} from {}", event.getId(), relay.getUrl());
            return;
        }
        cache.putRecentEvent(event);
        Consumer<NostrEvent> target = sink;
        bridgeExecutor.execute(() -> {
            try {
                target.accept(event);
            } catch (RuntimeException e) {
                log.error("Failed to bridge event {}", event.getId(), e);
            }
        });
    }

    private void onEose(String subscriptionId) {
        PendingQuery query = subscriptionId == null ? null : queries.get(subscriptionId);
        if (query != null && query.remaining.decrementAndGet() <= 0) {
            query.result.complete(Optional.empty());
        }
    }

    private void trackCursor(String url, long createdAt) {
        long now = clock.instant().getEpochSecond();
        // Relays may serve events from the future; those must not move the cursor past now
        long bounded = Math.min(createdAt, now);
        AtomicLong newest = newestSeen.computeIfAbsent(url, u -> new AtomicLong());
        long updated = newest.accumulateAndGet(bounded, Math::max);
        Instant last = lastCursorFlush.get(url);
        Instant flushTime = clock.instant();
        if (last == null || !flushTime.isBefore(last.plus(properties.getRelay().getCursorFlushInterval()))) {
            lastCursorFlush.put(url, flushTime);
            bridgeExecutor.execute(() -> flushCursor(url, updated));
        }
    }

    private void flushCursor(String url, long newest) {
        try {
            store.saveRelayCursor(url, newest);
        } catch (StoreUnavailableException e) {
            log.warn("Cannot store cursor of relay {}: {}", url, e.getMessage());
        }
    }

    private static final class PendingQuery {
        private final CompletableFuture<Optional<NostrEvent>> result = new CompletableFuture<>();
        private final AtomicLong remaining;
        private volatile ScheduledFuture<?> timer;

        private PendingQuery(int relays) {
            this.remaining = new AtomicLong(relays);
        }
    }

    private final class PoolHandler implements RelayConnection.Handler {

        @Override
        public void onEvent(RelayConnection relay, String subscriptionId, NostrEvent event) {
            RelayPoolManager.this.onEvent(relay, subscriptionId, event);
        }

        @Override
        public void onEose(RelayConnection relay, String subscriptionId) {
            RelayPoolManager.this.onEose(subscriptionId);
        }

        @Override
        public void onStateChange(RelayConnection relay, RelayState state) {
            log.debug("Relay {} is now {}", relay.getUrl(), state);
        }
    }

    List<RelayConnection> connections() {
        return new ArrayList<>(connections.values());
    }
}
