package org.operaton.nostrpub.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.operaton.nostrpub.TestFixtures;
import org.operaton.nostrpub.cache.BridgeCache;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.model.bridge.PublishResult;
import org.operaton.nostrpub.model.nostr.Filter;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.operaton.nostrpub.security.NostrKeys;
import org.operaton.nostrpub.service.DedupIndex;
import org.operaton.nostrpub.store.InMemoryBridgeStore;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RelayPoolManagerTest {

    private static final String ONE = "wss://one.example";
    private static final String TWO = "wss://two.example";
    private static final String PROFILES = "wss://profiles.example";

    @Mock
    private TaskScheduler scheduler;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<NostrEvent> sink = new CopyOnWriteArrayList<>();
    private final List<Filter> filters = List.of(Filter.builder().kinds(List.of(0, 1, 3, 5, 6, 7)).since(1L).build());

    private NostrPubProperties properties;
    private FakeRelayTransport transport;
    private RelayMessages messages;
    private InMemoryBridgeStore store;
    private RelayPoolManager pool;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        properties.setRelays(List.of(ONE, TWO));
        transport = new FakeRelayTransport();
        messages = new RelayMessages(objectMapper);
        store = new InMemoryBridgeStore();
        pool = newPool();
    }

    // ==================== Subscription Tests ====================

    @Test
    void start_shouldSubscribeOnEveryRelay() {
        pool.start(filters, sink::add);

        String expected = messages.req(RelayPoolManager.MAIN_SUBSCRIPTION, filters);
        assertThat(transport.socket(ONE).sent()).containsExactly(expected);
        assertThat(transport.socket(TWO).sent()).containsExactly(expected);
        assertThat(pool.states()).containsEntry(ONE, RelayState.SUBSCRIBED).containsEntry(TWO, RelayState.SUBSCRIBED);
    }

    @Test
    void sameEventFromTwoRelays_shouldReachSinkOnce() throws Exception {
        pool.start(filters, sink::add);
        NostrEvent event = TestFixtures.note(TestFixtures.ALICE_KEY, "hello", List.of());

        transport.socket(ONE).receive(eventFrame(RelayPoolManager.MAIN_SUBSCRIPTION, event));
        transport.socket(TWO).receive(eventFrame(RelayPoolManager.MAIN_SUBSCRIPTION, event));
        transport.socket(ONE).receive(eventFrame(RelayPoolManager.MAIN_SUBSCRIPTION, event));

        assertThat(sink).extracting(NostrEvent::getId).containsExactly(event.getId());
    }

    @Test
    void eventWithBadSignature_shouldBeDropped() throws Exception {
        pool.start(filters, sink::add);
        NostrEvent forged = TestFixtures.note(TestFixtures.ALICE_KEY, "hello", List.of()).toBuilder()
            .content("changed")
            .build();

        transport.socket(ONE).receive(eventFrame(RelayPoolManager.MAIN_SUBSCRIPTION, forged));

        assertThat(sink).isEmpty();
        assertThat(store.isEmpty()).isTrue();
    }

    @Test
    void failingSink_shouldNotStopLaterEvents() throws Exception {
        pool.start(filters, event -> {
            if (event.getContent().equals("boom")) {
                throw new IllegalStateException("boom");
            }
            sink.add(event);
        });

        transport.socket(ONE).receive(eventFrame(RelayPoolManager.MAIN_SUBSCRIPTION,
            TestFixtures.note(TestFixtures.ALICE_KEY, "boom", List.of())));
        transport.socket(ONE).receive(eventFrame(RelayPoolManager.MAIN_SUBSCRIPTION,
            TestFixtures.note(TestFixtures.ALICE_KEY, "fine", List.of())));

        assertThat(sink).extracting(NostrEvent::getContent).containsExactly("fine");
    }

    @Test
    void receivedEvents_shouldAdvanceRelayCursor() throws Exception {
        pool.start(filters, sink::add);
        NostrEvent event = TestFixtures.note(TestFixtures.ALICE_KEY, "hello", List.of());

        transport.socket(ONE).receive(eventFrame(RelayPoolManager.MAIN_SUBSCRIPTION, event));

        assertThat(store.findRelayCursors()).singleElement().satisfies(cursor -> {
            assertThat(cursor.getRelayUrl()).isEqualTo(ONE);
            assertThat(cursor.getNewestCreatedAt()).isEqualTo(event.getCreatedAt());
        });
    }

    // ==================== Lookback Tests ====================

    @Test
    void initialSince_withoutCursors_shouldUseInitialLookback() {
        long now = TestFixtures.NOW.getEpochSecond();

        assertThat(pool.initialSince()).isEqualTo(now - Duration.ofMinutes(3).getSeconds());
    }

    @Test
    void initialSince_withCursors_shouldUseOldestCursorWithinMaxLookback() {
        long now = TestFixtures.NOW.getEpochSecond();
        store.saveRelayCursor(ONE, now - 600);
        store.saveRelayCursor(TWO, now - 60);

        assertThat(pool.initialSince()).isEqualTo(now - 600);

        store.saveRelayCursor(ONE, now - Duration.ofHours(5).getSeconds());
        assertThat(pool.initialSince()).isEqualTo(now - Duration.ofHours(1).getSeconds());
    }

    // ==================== Publication Tests ====================

    @Test
    void publish_shouldCollectOneResultPerRelay() {
        stubTimers();
        pool.start(filters, sink::add);
        NostrEvent event = TestFixtures.note(TestFixtures.ALICE_KEY, "out", List.of());

        CompletableFuture<List<PublishResult>> results = pool.publish(event);
        transport.socket(ONE).receive("[\"OK\",\"" + event.getId() + "\",true,\"\"]");
        transport.socket(TWO).receive("[\"OK\",\"" + event.getId() + "\",false,\"blocked\"]");

        assertThat(results.join()).extracting(PublishResult::getRelayUrl, PublishResult::isAccepted)
            .containsExactlyInAnyOrder(
                tuple(ONE, true),
                tuple(TWO, false));
        assertThat(pool.states()).containsEntry(TWO, RelayState.DEGRADED);
    }

    @Test
    void publishedEvent_comingBackFromRelay_shouldNotReachSink() throws Exception {
        stubTimers();
        pool.start(filters, sink::add);
        NostrEvent event = TestFixtures.note(TestFixtures.ALICE_KEY, "out", List.of());

        pool.publish(event);
        transport.socket(ONE).receive(eventFrame(RelayPoolManager.MAIN_SUBSCRIPTION, event));

        assertThat(sink).isEmpty();
    }

    @Test
    void publish_withoutConnectedRelay_shouldReturnNoResults() {
        NostrEvent event = TestFixtures.note(TestFixtures.ALICE_KEY, "out", List.of());

        assertThat(pool.publish(event).join()).isEmpty();
    }

    @Test
    void publish_withMetadataRelays_shouldSendOnlyProfilesThere() {
        stubTimers();
        properties.setMetadataRelays(List.of(TWO, PROFILES));
        pool = newPool();
        pool.start(filters, sink::add);
        NostrEvent note = TestFixtures.note(TestFixtures.ALICE_KEY, "out", List.of());
        NostrEvent profile = NostrKeys.sign(NostrEvent.builder()
            .kind(0)
            .createdAt(TestFixtures.NOW.getEpochSecond())
            .content("{\"name\":\"alice\"}")
            .tags(List.of())
            .build(), TestFixtures.ALICE_KEY);

        pool.publish(note);
        pool.publish(profile);

        assertThat(transport.connectCount(TWO)).isEqualTo(1);
        assertThat(transport.socket(PROFILES).sent()).containsExactly(messages.event(profile));
        assertThat(transport.socket(ONE).sent()).contains(messages.event(note), messages.event(profile));
        assertThat(pool.states()).containsKeys(ONE, TWO, PROFILES);
    }

    @Test
    void metadataRelay_shouldNotBeSubscribedOrQueried() {
        stubTimers();
        properties.setMetadataRelays(List.of(PROFILES));
        pool = newPool();
        pool.start(filters, sink::add);

        pool.query(Filter.byId("ff"), Duration.ofSeconds(5));

        assertThat(transport.socket(PROFILES).sent()).isEmpty();
    }

    // ==================== Query Tests ====================

    @Test
    void query_shouldCompleteWithFirstMatchAndCloseSubscription() throws Exception {
        stubTimers();
        pool.start(filters, sink::add);
        NostrEvent wanted = TestFixtures.note(TestFixtures.ALICE_KEY, "wanted", List.of());

        CompletableFuture<Optional<NostrEvent>> result = pool.query(Filter.byId(wanted.getId()), Duration.ofSeconds(5));
        String subscriptionId = "q-1";
        transport.socket(TWO).receive(eventFrame(subscriptionId, wanted));

        assertThat(result.join()).hasValueSatisfying(event -> assertThat(event.getId()).isEqualTo(wanted.getId()));
        assertThat(transport.socket(ONE).sent()).contains(messages.close(subscriptionId));
        assertThat(sink).isEmpty();
    }

    @Test
    void query_withEoseFromAllRelays_shouldCompleteEmpty() {
        stubTimers();
        pool.start(filters, sink::add);

        CompletableFuture<Optional<NostrEvent>> result = pool.query(Filter.byId("ff"), Duration.ofSeconds(5));
        transport.socket(ONE).receive("[\"EOSE\",\"q-1\"]");
        assertThat(result).isNotDone();
        transport.socket(TWO).receive("[\"EOSE\",\"q-1\"]");

        assertThat(result.join()).isEmpty();
    }

    // ==================== Helpers ====================

    private RelayPoolManager newPool() {
        BridgeCache cache = new BridgeCache(properties);
        DedupIndex dedupIndex = new DedupIndex(cache, store, properties, TestFixtures.clock());
        return new RelayPoolManager(transport, messages, dedupIndex, store, cache, properties,
            Runnable::run, scheduler, TestFixtures.clock());
    }

    private void stubTimers() {
        when(scheduler.schedule(any(Runnable.class), any(Instant.class)))
            .thenAnswer(invocation -> mock(ScheduledFuture.class));
    }

    private String eventFrame(String subscriptionId, NostrEvent event) throws JsonProcessingException {
        return objectMapper.writeValueAsString(List.of("EVENT", subscriptionId, event));
    }
}
