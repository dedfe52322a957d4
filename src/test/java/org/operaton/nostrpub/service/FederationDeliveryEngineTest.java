package org.operaton.nostrpub.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.operaton.nostrpub.TestFixtures;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.DeliveryExhaustedEvent;
import org.operaton.nostrpub.model.bridge.DeliveryOutcome;
import org.operaton.nostrpub.model.entity.VirtualActor;
import org.operaton.nostrpub.security.HttpSignatureValidator;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FederationDeliveryEngineTest {

    private static final String INBOX = "https://mastodon.example/users/alice/inbox";

    private static HttpSignatureValidator.PemKeyPair senderKeys;

    @Mock
    private RestTemplate restTemplate;

    @Mock
    private TaskScheduler scheduler;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private NostrPubProperties properties;
    private HttpSignatureValidator signatureValidator;
    private VirtualActor sender;
    private final List<Instant> retryTimes = new ArrayList<>();

    @BeforeAll
    static void generateKeys() {
        senderKeys = new HttpSignatureValidator(TestFixtures.properties(), TestFixtures.clock()).generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        properties.getDelivery().setMaxAttempts(4);
        signatureValidator = new HttpSignatureValidator(properties, TestFixtures.clock());
        sender = VirtualActor.builder()
            .pubkey("3bf0c63fcb93463407af97a5e5ee64fa883d107ef9e558472c4eb9aaaefa459d")
            .actorUri("https://bridge.example/users/npub180cvv07tjdrrgpa0j7j7tmnyl2yr6yr7l8j4s3evf6u64th6gkwsyjh6w6")
            .publicKey(senderKeys.publicKeyPem)
            .privateKey(senderKeys.privateKeyPem)
            .build();
    }

    // ==================== Retry Tests ====================

    @Test
    void deliver_withServerErrorsThenSuccess_shouldReportDelivered() {
        runRetriesImmediately();
        when(restTemplate.exchange(eq(INBOX), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
            .thenReturn(ResponseEntity.status(500).body("oops"))
            .thenReturn(ResponseEntity.status(500).body("oops"))
            .thenReturn(ResponseEntity.accepted().body(""));

        CompletableFuture<DeliveryOutcome> outcome = engine(Runnable::run).deliver(create("1"), sender, INBOX);

        assertThat(outcome).isCompletedWithValue(DeliveryOutcome.DELIVERED);
        verify(restTemplate, times(3)).exchange(eq(INBOX), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class));
        verifyNoInteractions(eventPublisher);
        assertThat(retryTimes).containsExactly(
            TestFixtures.NOW.plus(Duration.ofSeconds(30)),
            TestFixtures.NOW.plus(Duration.ofSeconds(60)));
    }

    @Test
    void deliver_withPersistentFailure_shouldGiveUpAfterMaxAttempts() {
        runRetriesImmediately();
        when(restTemplate.exchange(eq(INBOX), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
            .thenReturn(ResponseEntity.status(503).body(""));

        CompletableFuture<DeliveryOutcome> outcome = engine(Runnable::run).deliver(create("1"), sender, INBOX);

        assertThat(outcome).isCompletedWithValue(DeliveryOutcome.EXHAUSTED);
        verify(restTemplate, times(4)).exchange(eq(INBOX), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class));

        ArgumentCaptor<DeliveryExhaustedEvent> event = ArgumentCaptor.forClass(DeliveryExhaustedEvent.class);
        verify(eventPublisher, times(1)).publishEvent(event.capture());
        assertThat(event.getValue().getActivityId()).isEqualTo("https://bridge.example/activities/1");
        assertThat(event.getValue().getInbox()).isEqualTo(INBOX);
        assertThat(event.getValue().getAttempts()).isEqualTo(4);
        assertThat(event.getValue().getLastError()).contains("503");
    }

    @Test
    void deliver_withConnectionFailureThenSuccess_shouldRetry() {
        runRetriesImmediately();
        when(restTemplate.exchange(eq(INBOX), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
            .thenThrow(new ResourceAccessException("connection refused"))
            .thenReturn(ResponseEntity.ok(""));

        CompletableFuture<DeliveryOutcome> outcome = engine(Runnable::run).deliver(create("1"), sender, INBOX);

        assertThat(outcome).isCompletedWithValue(DeliveryOutcome.DELIVERED);
    }

    @Test
    void deliver_withRedirect_shouldCountAsFailure() {
        properties.getDelivery().setMaxAttempts(1);
        when(restTemplate.exchange(eq(INBOX), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
            .thenReturn(ResponseEntity.status(302).body(""));

        CompletableFuture<DeliveryOutcome> outcome = engine(Runnable::run).deliver(create("1"), sender, INBOX);

        assertThat(outcome).isCompletedWithValue(DeliveryOutcome.EXHAUSTED);
    }

    @Test
    void deliver_withUnusableSigningKey_shouldExhaustAndReleasePair() {
        properties.getDelivery().setMaxAttempts(2);
        runRetriesImmediately();
        VirtualActor broken = sender.toBuilder().privateKey("AAAA").build();
        FederationDeliveryEngine engine = engine(Runnable::run);

        CompletableFuture<DeliveryOutcome> outcome = engine.deliver(create("1"), broken, INBOX);

        assertThat(outcome).isCompletedWithValue(DeliveryOutcome.EXHAUSTED);
        assertThat(engine.pendingCount()).isZero();
        verify(restTemplate, never()).exchange(anyString(), any(HttpMethod.class), any(HttpEntity.class), eq(String.class));
        ArgumentCaptor<DeliveryExhaustedEvent> event = ArgumentCaptor.forClass(DeliveryExhaustedEvent.class);
        verify(eventPublisher, times(1)).publishEvent(event.capture());
        assertThat(event.getValue().getLastError()).contains("IllegalStateException");

        when(restTemplate.exchange(eq(INBOX), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
            .thenReturn(ResponseEntity.ok(""));
        CompletableFuture<DeliveryOutcome> retried = engine.deliver(create("1"), sender, INBOX);

        assertThat(retried).isNotSameAs(outcome).isCompletedWithValue(DeliveryOutcome.DELIVERED);
    }

    @Test
    void deliver_withRejectingExecutor_shouldExhaustInsteadOfHanging() {
        FederationDeliveryEngine engine = engine(task -> {
            throw new RejectedExecutionException("pool saturated");
        });

        CompletableFuture<DeliveryOutcome> outcome = engine.deliver(create("1"), sender, INBOX);

        assertThat(outcome).isCompletedWithValue(DeliveryOutcome.EXHAUSTED);
        assertThat(engine.pendingCount()).isZero();
        verify(eventPublisher, times(1)).publishEvent(any(DeliveryExhaustedEvent.class));
    }

    @Test
    void backoff_shouldDoubleUntilCapped() {
        FederationDeliveryEngine engine = engine(Runnable::run);

        assertThat(engine.backoff(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(engine.backoff(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(engine.backoff(3)).isEqualTo(Duration.ofSeconds(120));
        assertThat(engine.backoff(10)).isEqualTo(Duration.ofHours(2));
        assertThat(engine.backoff(100)).isEqualTo(Duration.ofHours(2));
    }

    // ==================== Request Tests ====================

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void deliver_shouldSendVerifiableSignedRequest() {
        when(restTemplate.exchange(eq(INBOX), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
            .thenReturn(ResponseEntity.ok(""));

        engine(Runnable::run).deliver(create("1"), sender, INBOX);

        ArgumentCaptor<HttpEntity> request = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).exchange(eq(INBOX), eq(HttpMethod.POST), request.capture(), eq(String.class));
        HttpHeaders headers = request.getValue().getHeaders();
        assertThat(headers.getFirst(HttpHeaders.CONTENT_TYPE)).isEqualTo("application/activity+json");
        assertThat(headers.getFirst("Signature")).contains("keyId=\"" + sender.getKeyId() + "\"");

        Map<String, String> signed = new HashMap<>();
        signed.put("(request-target)", "post /users/alice/inbox");
        signed.put("host", headers.getFirst(HttpHeaders.HOST));
        signed.put("date", headers.getFirst(HttpHeaders.DATE));
        signed.put("digest", headers.getFirst("Digest"));
        assertThat(signatureValidator.verify(
            signatureValidator.parse(headers.getFirst("Signature")), signed, senderKeys.publicKeyPem)).isTrue();
        assertThat(signatureValidator.digestMatches(headers.getFirst("Digest"),
            ((String) request.getValue().getBody()).getBytes(StandardCharsets.UTF_8))).isTrue();
    }

    @Test
    void deliverAll_withDuplicateInboxes_shouldPostOncePerInbox() {
        when(restTemplate.exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
            .thenReturn(ResponseEntity.ok(""));

        List<CompletableFuture<DeliveryOutcome>> outcomes = engine(Runnable::run).deliverAll(create("1"), sender,
            List.of(INBOX, "https://other.example/inbox", INBOX));

        assertThat(outcomes).hasSize(2);
        verify(restTemplate).exchange(eq(INBOX), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class));
        verify(restTemplate).exchange(eq("https://other.example/inbox"), eq(HttpMethod.POST),
            any(HttpEntity.class), eq(String.class));
    }

    // ==================== Concurrency Tests ====================

    @Test
    void deliver_toSaturatedDomain_shouldQueueInLane() {
        properties.getDelivery().setMaxConcurrencyPerDomain(1);
        when(restTemplate.exchange(anyString(), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
            .thenReturn(ResponseEntity.ok(""));
        List<Runnable> submitted = new ArrayList<>();
        FederationDeliveryEngine engine = engine(submitted::add);

        CompletableFuture<DeliveryOutcome> first = engine.deliver(create("1"), sender, INBOX);
        CompletableFuture<DeliveryOutcome> second = engine.deliver(create("2"), sender, "https://mastodon.example/inbox");

        assertThat(submitted).hasSize(1);
        assertThat(engine.pendingCount()).isEqualTo(2);

        submitted.get(0).run();

        assertThat(first).isCompletedWithValue(DeliveryOutcome.DELIVERED);
        assertThat(submitted).hasSize(2);
        submitted.get(1).run();
        assertThat(second).isCompletedWithValue(DeliveryOutcome.DELIVERED);
        assertThat(engine.pendingCount()).isZero();
    }

    @Test
    void deliver_whileSamePairInFlight_shouldShareDelivery() {
        List<Runnable> submitted = new ArrayList<>();
        FederationDeliveryEngine engine = engine(submitted::add);

        CompletableFuture<DeliveryOutcome> first = engine.deliver(create("1"), sender, INBOX);
        CompletableFuture<DeliveryOutcome> second = engine.deliver(create("1"), sender, INBOX);

        assertThat(second).isSameAs(first);
        assertThat(submitted).hasSize(1);
    }

    // ==================== Shutdown Tests ====================

    @Test
    void shutdown_withScheduledRetry_shouldCancelDelivery() {
        ScheduledFuture<?> timer = mock(ScheduledFuture.class);
        when(scheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> timer);
        when(restTemplate.exchange(eq(INBOX), eq(HttpMethod.POST), any(HttpEntity.class), eq(String.class)))
            .thenReturn(ResponseEntity.status(500).body(""));
        FederationDeliveryEngine engine = engine(Runnable::run);

        CompletableFuture<DeliveryOutcome> outcome = engine.deliver(create("1"), sender, INBOX);
        assertThat(outcome).isNotDone();

        engine.shutdown();

        assertThat(outcome).isCompletedWithValue(DeliveryOutcome.CANCELLED);
        assertThat(engine.pendingCount()).isZero();
        verify(timer).cancel(false);
    }

    @Test
    void deliver_afterShutdown_shouldBeCancelled() {
        FederationDeliveryEngine engine = engine(Runnable::run);
        engine.shutdown();

        assertThat(engine.deliver(create("1"), sender, INBOX)).isCompletedWithValue(DeliveryOutcome.CANCELLED);
    }

    // ==================== Helpers ====================

    private FederationDeliveryEngine engine(Executor executor) {
        return new FederationDeliveryEngine(restTemplate, signatureValidator, new ObjectMapper(), properties,
            executor, scheduler, eventPublisher, TestFixtures.clock());
    }

    private void runRetriesImmediately() {
        when(scheduler.schedule(any(Runnable.class), any(Instant.class))).thenAnswer(invocation -> {
            retryTimes.add(invocation.getArgument(1));
            ((Runnable) invocation.getArgument(0)).run();
            return null;
        });
    }

    private static Map<String, Object> create(String id) {
        Map<String, Object> activity = new LinkedHashMap<>();
        activity.put("@context", "https://www.w3.org/ns/activitystreams");
        activity.put("id", "https://bridge.example/activities/" + id);
        activity.put("type", "Create");
        activity.put("actor", "https://bridge.example/users/npub1");
        return activity;
    }
}
