package org.operaton.nostrpub.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.DeliveryExhaustedEvent;
import org.operaton.nostrpub.model.bridge.DeliveryOutcome;
import org.operaton.nostrpub.model.entity.VirtualActor;
import org.operaton.nostrpub.security.HttpSignatureValidator;
import org.operaton.nostrpub.util.ActivityJson;
import org.operaton.nostrpub.util.SingleFlight;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Delivers activities to remote inboxes with HTTP signatures, retries and per-domain concurrency limits.
 *
 * <p>Each (activity, inbox) pair is an independent delivery. Failed attempts are retried with exponential
 * backoff until {@code maxAttempts}; then the delivery is dropped and a {@link DeliveryExhaustedEvent}
 * is published. The queue lives in memory only.</p>
 *
 * <p>Deliveries to one domain run at most {@code maxConcurrencyPerDomain} at a time. Excess work waits in
 * the domain's lane instead of occupying a pool thread.</p>
 */
@Service
@Slf4j
public class FederationDeliveryEngine {

    private static final String ACTIVITY_JSON = "application/activity+json";

    private final RestTemplate restTemplate;
    private final HttpSignatureValidator signatureValidator;
    private final ObjectMapper objectMapper;
    private final NostrPubProperties.Delivery settings;
    private final Executor executor;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final SingleFlight<String, DeliveryOutcome> inFlight = new SingleFlight<>();
    private final Map<String, DomainLane> lanes = new ConcurrentHashMap<>();
    private final Set<Delivery> pending = ConcurrentHashMap.newKeySet();
    private volatile boolean shuttingDown;

    public FederationDeliveryEngine(RestTemplate restTemplate,
                                    HttpSignatureValidator signatureValidator,
                                    ObjectMapper objectMapper,
                                    NostrPubProperties properties,
                                    @Qualifier("deliveryExecutor") Executor executor,
                                    @Qualifier("taskScheduler") TaskScheduler scheduler,
                                    ApplicationEventPublisher eventPublisher,
                                    Clock clock) {
        this.restTemplate = restTemplate;
        this.signatureValidator = signatureValidator;
        this.objectMapper = objectMapper;
        this.settings = properties.getDelivery();
        this.executor = executor;
        this.scheduler = scheduler;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Delivers an activity on behalf of a virtual actor to every inbox, each one independently.
     * Duplicate inboxes are delivered once.
     */
    public List<CompletableFuture<DeliveryOutcome>> deliverAll(Map<String, Object> activity, VirtualActor sender,
                                                               Collection<String> inboxes) {
        List<CompletableFuture<DeliveryOutcome>> futures = new ArrayList<>();
        for (String inbox : new LinkedHashSet<>(inboxes)) {
            futures.add(deliver(activity, sender, inbox));
        }
        log.info("Queued {} for {} inboxes", ActivityJson.string(activity, "id"), futures.size());
        return futures;
    }

    /**
     * Delivers an activity to one inbox. A call for a pair already in flight joins that delivery.
     *
     * @return completes with {@link DeliveryOutcome#DELIVERED}, {@link DeliveryOutcome#EXHAUSTED}
     *         or {@link DeliveryOutcome#CANCELLED} on shutdown
     */
    public CompletableFuture<DeliveryOutcome> deliver(Map<String, Object> activity, VirtualActor sender, String inbox) {
        String activityId = ActivityJson.string(activity, "id");
        String body;
        try {
            body = objectMapper.writeValueAsString(activity);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize activity " + activityId, e);
        }
        String key = activityId + "|" + inbox;
        return inFlight.share(key, () -> start(new Delivery(activityId, inbox, body, sender.getPrivateKey(), sender.getKeyId())));
    }

    /**
     * Number of (activity, inbox) pairs not yet finished.
     */
    public int pendingCount() {
        return pending.size();
    }

    /**
     * Cancels retry timers and queued attempts; their futures complete with {@link DeliveryOutcome#CANCELLED}.
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        int cancelled = 0;
        for (Delivery delivery : new ArrayList<>(pending)) {
            ScheduledFuture<?> timer = delivery.retryTimer;
            if (timer != null) {
                timer.cancel(false);
            }
            if (finish(delivery, DeliveryOutcome.CANCELLED)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} pending deliveries on shutdown", cancelled);
        }
    }

    private CompletableFuture<DeliveryOutcome> start(Delivery delivery) {
        if (shuttingDown) {
            return CompletableFuture.completedFuture(DeliveryOutcome.CANCELLED);
        }
        pending.add(delivery);
        laneFor(delivery.inbox).submit(delivery);
        return delivery.future;
    }

    private void attempt(Delivery delivery) {
        if (delivery.future.isDone()) {
            return;
        }
        delivery.attempts++;
        String error = post(delivery);
        if (error == null) {
            log.info("Delivered {} to {} (attempt {})", delivery.activityId, delivery.inbox, delivery.attempts);
            finish(delivery, DeliveryOutcome.DELIVERED);
            return;
        }
        delivery.lastError = error;
        if (delivery.attempts >= settings.getMaxAttempts()) {
            giveUp(delivery, error);
            return;
        }
        scheduleRetry(delivery);
    }

    /**
     * Drops a delivery for good. Only the first call for a delivery publishes a {@link DeliveryExhaustedEvent}.
     */
    private void giveUp(Delivery delivery, String error) {
        if (delivery.future.isDone()) {
            pending.remove(delivery);
            return;
        }
        log.error("Giving up on {} to {} after {} attempts: {}",
            delivery.activityId, delivery.inbox, delivery.attempts, error);
        if (finish(delivery, DeliveryOutcome.EXHAUSTED)) {
            eventPublisher.publishEvent(new DeliveryExhaustedEvent(
                this, delivery.activityId, delivery.inbox, delivery.attempts, error));
        }
    }

    private void scheduleRetry(Delivery delivery) {
        if (shuttingDown) {
            finish(delivery, DeliveryOutcome.CANCELLED);
            return;
        }
        Duration delay = backoff(delivery.attempts);
        log.warn("Delivery of {} to {} failed ({}), retry {} in {}",
            delivery.activityId, delivery.inbox, delivery.lastError, delivery.attempts + 1, delay);
        delivery.retryTimer = scheduler.schedule(() -> laneFor(delivery.inbox).submit(delivery),
            clock.instant().plus(delay));
    }

    /**
     * Delay before the attempt following {@code attempts} failures: {@code initial * 2^(attempts-1)}, capped.
     */
    Duration backoff(int attempts) {
        Duration initial = settings.getInitialBackoff();
        Duration max = settings.getMaxBackoff();
        int exponent = Math.min(Math.max(attempts - 1, 0), 30);
        Duration delay = initial.multipliedBy(1L << exponent);
        return delay.compareTo(max) > 0 || delay.isNegative() ? max : delay;
    }

    /**
     * Performs one signed POST.
     *
     * @return null on a 2xx answer, otherwise a description of the failure
     */
    private String post(Delivery delivery) {
        try {
            HttpSignatureValidator.SignatureHeaders signatureHeaders = signatureValidator.signRequest(
                HttpMethod.POST.name(),
                delivery.inbox,
                delivery.body,
                delivery.privateKeyPem,
                delivery.keyId
            );

            HttpHeaders headers = new HttpHeaders();
            headers.set(HttpHeaders.CONTENT_TYPE, ACTIVITY_JSON);
            headers.set(HttpHeaders.ACCEPT, ACTIVITY_JSON);
            // Host must be exactly what was signed
            headers.set(HttpHeaders.HOST, signatureHeaders.host);
            headers.set(HttpHeaders.DATE, signatureHeaders.date);
            headers.set("Digest", signatureHeaders.digest);
            headers.set("Signature", signatureHeaders.signature);

            ResponseEntity<String> response = restTemplate.exchange(
                delivery.inbox, HttpMethod.POST, new HttpEntity<>(delivery.body, headers), String.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                return null;
            }
            return "HTTP " + response.getStatusCode().value();
        } catch (RestClientException e) {
            log.debug("Delivery of {} to {} failed", delivery.activityId, delivery.inbox, e);
            return e.getClass().getSimpleName() + ": " + e.getMessage();
        } catch (RuntimeException e) {
            // signing failures and malformed inbox URLs count as failed attempts
            log.warn("Cannot send {} to {}", delivery.activityId, delivery.inbox, e);
            return e.getClass().getSimpleName() + ": " + e.getMessage();
        }
    }

    private boolean finish(Delivery delivery, DeliveryOutcome outcome) {
        pending.remove(delivery);
        return delivery.future.complete(outcome);
    }

    private DomainLane laneFor(String inbox) {
        String domain = ActivityJson.host(inbox);
        return lanes.computeIfAbsent(domain == null ? "" : domain, d -> new DomainLane(d, settings.getMaxConcurrencyPerDomain()));
    }

    /**
     * One (activity, inbox) pair moving through its attempts. Attempts of one delivery never overlap,
     * so the mutable fields need no locking beyond the happens-before of task submission.
     */
    private static final class Delivery {
        private final String activityId;
        private final String inbox;
        private final String body;
        private final String privateKeyPem;
        private final String keyId;
        private final CompletableFuture<DeliveryOutcome> future = new CompletableFuture<>();
        private volatile int attempts;
        private volatile String lastError;
        private volatile ScheduledFuture<?> retryTimer;

        private Delivery(String activityId, String inbox, String body, String privateKeyPem, String keyId) {
            this.activityId = activityId;
            this.inbox = inbox;
            this.body = body;
            this.privateKeyPem = privateKeyPem;
            this.keyId = keyId;
        }
    }

    /**
     * Bounded concurrency for one domain without blocking pool threads.
     * Every delivery that enters a lane ends with an attempt or is given up.
     */
    private final class DomainLane {
        private final String domain;
        private final int limit;
        private final Queue<Delivery> waiting = new ArrayDeque<>();
        private int running;

        private DomainLane(String domain, int limit) {
            this.domain = domain;
            this.limit = limit;
        }

        void submit(Delivery delivery) {
            synchronized (this) {
                if (running >= limit) {
                    waiting.add(delivery);
                    log.debug("Lane {} saturated, {} waiting", domain, waiting.size());
                    return;
                }
                running++;
            }
            execute(delivery);
        }

        private void execute(Delivery delivery) {
            try {
                executor.execute(() -> {
                    try {
                        attempt(delivery);
                    } catch (RuntimeException e) {
                        log.error("Unexpected failure in delivery lane {}", domain, e);
                        giveUp(delivery, e.getClass().getSimpleName() + ": " + e.getMessage());
                    } finally {
                        next();
                    }
                });
            } catch (RejectedExecutionException e) {
                giveUp(delivery, "Delivery executor rejected attempt: " + e.getMessage());
                next();
            }
        }

        private void next() {
            Delivery delivery;
            synchronized (this) {
                delivery = waiting.poll();
                if (delivery == null) {
                    running--;
                    return;
                }
            }
            execute(delivery);
        }
    }
}
