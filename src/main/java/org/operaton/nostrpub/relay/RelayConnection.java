package org.operaton.nostrpub.relay;

import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.BridgeException;
import org.operaton.nostrpub.model.bridge.PublishResult;
import org.operaton.nostrpub.model.nostr.Filter;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One relay: connection state machine, registered subscriptions and pending publications.
 *
 * <p>Subscriptions are kept across reconnects; every successful connect re-issues all of them
 * with exactly the filters they were registered with.</p>
 */
@Slf4j
public class RelayConnection {

    /**
     * Receives what the relay sends. Called on the socket's listener thread.
     */
    public interface Handler {

        void onEvent(RelayConnection relay, String subscriptionId, NostrEvent event);

        void onEose(RelayConnection relay, String subscriptionId);

        default void onStateChange(RelayConnection relay, RelayState state) {
        }
    }

    private final String url;
    private final RelayTransport transport;
    private final RelayMessages messages;
    private final TaskScheduler scheduler;
    private final NostrPubProperties.Relay settings;
    private final Clock clock;
    private final Handler handler;

    private final Map<String, List<Filter>> subscriptions = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<PublishResult>> pendingPublications = new ConcurrentHashMap<>();

    private volatile RelayState state = RelayState.DISCONNECTED;
    private RelaySocket socket;
    private ScheduledFuture<?> reconnectTimer;
    private int failedAttempts;
    private boolean closed;

    public RelayConnection(String url, RelayTransport transport, RelayMessages messages, TaskScheduler scheduler,
                           NostrPubProperties.Relay settings, Clock clock, Handler handler) {
        this.url = url;
        this.transport = transport;
        this.messages = messages;
        this.scheduler = scheduler;
        this.settings = settings;
        this.clock = clock;
        this.handler = handler;
    }

    public String getUrl() {
        return url;
    }

    public RelayState getState() {
        return state;
    }

    /**
     * Starts connecting unless a connection is open or pending.
     */
    public void connect() {
        synchronized (this) {
            if (closed || state != RelayState.DISCONNECTED) {
                return;
            }
            reconnectTimer = null;
            changeState(RelayState.CONNECTING);
        }
        log.info("Connecting to relay {}", url);
        CompletableFuture<RelaySocket> connecting;
        try {
            connecting = transport.connect(url, new SocketListener());
        } catch (RuntimeException e) {
            connecting = CompletableFuture.failedFuture(e);
        }
        connecting.whenComplete((opened, error) -> {
            if (error != null) {
                log.warn("Connection to relay {} failed: {}", url, error.getMessage());
                onDisconnected();
            } else {
                onConnected(opened);
            }
        });
    }

    /**
     * Registers a subscription and issues it right away if connected. Re-registering an id replaces its filters.
     */
    public void subscribe(String subscriptionId, List<Filter> filters) {
        RelaySocket current;
        synchronized (this) {
            subscriptions.put(subscriptionId, List.copyOf(filters));
            current = isOpen() ? socket : null;
        }
        if (current != null) {
            send(current, messages.req(subscriptionId, filters));
        }
    }

    public void unsubscribe(String subscriptionId) {
        RelaySocket current;
        synchronized (this) {
            if (subscriptions.remove(subscriptionId) == null) {
                return;
            }
            current = isOpen() ? socket : null;
        }
        if (current != null) {
            send(current, messages.close(subscriptionId));
        }
    }

    /**
     * Current subscriptions, in registration order.
     */
    public synchronized Map<String, List<Filter>> subscriptions() {
        return new LinkedHashMap<>(subscriptions);
    }

    /**
     * Sends an event and completes with the relay's {@code OK} answer.
     * Completes with a rejection if the relay is not connected, does not answer in time or the send fails.
     */
    public CompletableFuture<PublishResult> publish(NostrEvent event, Duration timeout) {
        RelaySocket current;
        synchronized (this) {
            current = isOpen() ? socket : null;
        }
        if (current == null) {
            return CompletableFuture.completedFuture(PublishResult.rejected(url, "not connected"));
        }
        CompletableFuture<PublishResult> result = new CompletableFuture<>();
        CompletableFuture<PublishResult> previous = pendingPublications.putIfAbsent(event.getId(), result);
        if (previous != null) {
            return previous;
        }
        ScheduledFuture<?> timer = scheduler.schedule(
            () -> completePublication(event.getId(), PublishResult.rejected(url, "timeout")),
            clock.instant().plus(timeout));
        result.whenComplete((r, e) -> timer.cancel(false));
        current.send(messages.event(event)).whenComplete((ignored, error) -> {
            if (error != null) {
                completePublication(event.getId(), PublishResult.rejected(url, "send failed: " + error.getMessage()));
            }
        });
        return result;
    }

    /**
     * Closes the socket for good and cancels a pending reconnect.
     */
    public void close() {
        RelaySocket current;
        synchronized (this) {
            closed = true;
            if (reconnectTimer != null) {
                reconnectTimer.cancel(false);
                reconnectTimer = null;
            }
            current = socket;
            socket = null;
            changeState(RelayState.DISCONNECTED);
        }
        if (current != null) {
            current.close();
        }
        failPendingPublications("closed");
    }

    /**
     * Delay before reconnect attempt number {@code attempt} (1-based): {@code initial * 2^(attempt-1)}, capped.
     */
    Duration reconnectDelay(int attempt) {
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        Duration delay = settings.getInitialBackoff().multipliedBy(1L << exponent);
        return delay.compareTo(settings.getMaxBackoff()) > 0 || delay.isNegative() ? settings.getMaxBackoff() : delay;
    }

    private void onConnected(RelaySocket opened) {
        Map<String, List<Filter>> toIssue;
        synchronized (this) {
            if (closed) {
                opened.close();
                return;
            }
            socket = opened;
            failedAttempts = 0;
            toIssue = new LinkedHashMap<>(subscriptions);
            changeState(RelayState.SUBSCRIBED);
        }
        log.info("Connected to relay {}, issuing {} subscriptions", url, toIssue.size());
        toIssue.forEach((id, filters) -> send(opened, messages.req(id, filters)));
    }

    private void onDisconnected() {
        Duration delay;
        synchronized (this) {
            socket = null;
            if (state == RelayState.DISCONNECTED && reconnectTimer != null) {
                return;
            }
            changeState(RelayState.DISCONNECTED);
            if (closed) {
                return;
            }
            failedAttempts++;
            delay = reconnectDelay(failedAttempts);
            reconnectTimer = scheduler.schedule(this::connect, clock.instant().plus(delay));
        }
        failPendingPublications("disconnected");
        log.info("Relay {} disconnected, reconnecting in {}", url, delay);
    }

    private void handleMessage(String text) {
        RelayMessages.Inbound message;
        try {
            message = messages.parse(text);
        } catch (BridgeException e) {
            log.debug("Ignoring message from {}: {}", url, e.getMessage());
            return;
        }
        switch (message.getType()) {
            case EVENT -> {
                recover();
                handler.onEvent(this, message.getSubscriptionId(), message.getEvent());
            }
            case EOSE -> {
                recover();
                handler.onEose(this, message.getSubscriptionId());
            }
            case OK -> {
                if (!message.isAccepted()) {
                    degrade("rejected " + message.getEventId() + ": " + message.getMessage());
                }
                completePublication(message.getEventId(), message.isAccepted()
                    ? PublishResult.accepted(url, message.getMessage())
                    : PublishResult.rejected(url, message.getMessage()));
            }
            case NOTICE -> {
                log.info("Notice from relay {}: {}", url, message.getMessage());
                degrade("notice: " + message.getMessage());
            }
            case CLOSED -> {
                log.warn("Relay {} closed subscription {}: {}", url, message.getSubscriptionId(), message.getMessage());
                degrade("closed " + message.getSubscriptionId());
                handler.onEose(this, message.getSubscriptionId());
            }
            case AUTH -> log.debug("Relay {} requests authentication, not supported", url);
        }
    }

    private synchronized void degrade(String reason) {
        if (state == RelayState.SUBSCRIBED) {
            log.warn("Relay {} degraded: {}", url, reason);
            changeState(RelayState.DEGRADED);
        }
    }

    private synchronized void recover() {
        if (state == RelayState.DEGRADED) {
            log.info("Relay {} recovered", url);
            changeState(RelayState.SUBSCRIBED);
        }
    }

    private boolean isOpen() {
        return socket != null && (state == RelayState.SUBSCRIBED || state == RelayState.DEGRADED);
    }

    private void changeState(RelayState next) {
        if (state != next) {
            state = next;
            handler.onStateChange(this, next);
        }
    }

    private void send(RelaySocket target, String text) {
        target.send(text).whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Send to relay {} failed: {}", url, error.getMessage());
            }
        });
    }

    private void completePublication(String eventId, PublishResult result) {
        CompletableFuture<PublishResult> pending = eventId == null ? null : pendingPublications.remove(eventId);
        if (pending != null) {
            pending.complete(result);
        }
    }

    private void failPendingPublications(String reason) {
        for (String eventId : new ArrayList<>(pendingPublications.keySet())) {
            completePublication(eventId, PublishResult.rejected(url, reason));
        }
    }

    private final class SocketListener implements RelayListener {

        @Override
        public void onMessage(String text) {
            handleMessage(text);
        }

        @Override
        public void onClosed(int statusCode, String reason) {
            log.info("Relay {} closed the connection: {} {}", url, statusCode, reason);
            onDisconnected();
        }

        @Override
        public void onError(Throwable error) {
            log.warn("Relay {} connection error: {}", url, error.getMessage());
            onDisconnected();
        }
    }

    @Override
    public String toString() {
        return "RelayConnection[" + url + ", " + state + "]";
    }
}
