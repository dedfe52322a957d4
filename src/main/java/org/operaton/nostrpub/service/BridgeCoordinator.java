package org.operaton.nostrpub.service;

import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.exception.StoreUnavailableException;
import org.operaton.nostrpub.model.bridge.InboundRequest;
import org.operaton.nostrpub.model.nostr.EventKind;
import org.operaton.nostrpub.model.nostr.NativeIdentity;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.operaton.nostrpub.store.BridgeStore;
import org.operaton.nostrpub.util.SingleFlight;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The two ways into the bridge: events arriving from relays and activities arriving at an inbox.
 *
 * <p>Relay events have already been verified and deduplicated by the relay pool. Inbox requests are
 * authenticated and deduplicated here, synchronously, so the caller can answer with the right status;
 * the bridging itself runs on the bridge executor.</p>
 */
@Service
@Slf4j
public class BridgeCoordinator {

    private final InboxProcessor inboxProcessor;
    private final DedupIndex dedupIndex;
    private final NativeToFederationBridge outbound;
    private final FederationToNativeBridge inbound;
    private final BridgeStore store;
    private final Executor bridgeExecutor;

    private final SingleFlight<String, Boolean> nativeEvents = new SingleFlight<>();

    public BridgeCoordinator(InboxProcessor inboxProcessor,
                             DedupIndex dedupIndex,
                             NativeToFederationBridge outbound,
                             FederationToNativeBridge inbound,
                             BridgeStore store,
                             @Qualifier("bridgeExecutor") Executor bridgeExecutor) {
        this.inboxProcessor = inboxProcessor;
        this.dedupIndex = dedupIndex;
        this.outbound = outbound;
        this.inbound = inbound;
        this.store = store;
        this.bridgeExecutor = bridgeExecutor;
    }

    /**
     * Bridges a verified, first-seen native event to the fediverse.
     * Concurrent calls for the same event id share one run.
     */
    public void ingestNativeEvent(NostrEvent event) {
        nativeEvents.run(event.getId(), () -> {
            bridgeNative(event);
            return Boolean.TRUE;
        });
    }

    /**
     * Authenticates an inbox request and schedules it for bridging.
     *
     * @return completes when the activity has been bridged; already complete for ignored or repeated activities
     * @throws org.operaton.nostrpub.exception.SignatureInvalidException if the sender cannot be authenticated
     * @throws org.operaton.nostrpub.exception.BridgeException if the request is malformed or cannot be bridged
     * @throws StoreUnavailableException if the dedup index cannot be reached
     */
    public CompletableFuture<Void> ingestFederationActivity(InboundRequest request) {
        Optional<InboxProcessor.VerifiedActivity> verified = inboxProcessor.verify(request);
        if (verified.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        InboxProcessor.VerifiedActivity activity = verified.get();
        inbound.validate(activity);

        String activityId = activity.getId();
        if (activityId != null && !dedupIndex.firstSeen(activityId)) {
            log.debug("Activity {} already processed", activityId);
            return CompletableFuture.completedFuture(null);
        }
        log.info("Received {} from {}", activity.getActivity().get("type"), activity.getActor().getActorUri());
        return CompletableFuture.runAsync(() -> {
            try {
                inbound.bridge(activity);
            } catch (RuntimeException e) {
                log.error("Failed to bridge activity {}", activityId, e);
                throw e;
            }
        }, bridgeExecutor);
    }

    private void bridgeNative(NostrEvent event) {
        if (event.isProxiedFromActivityPub()) {
            log.trace("Event {} came from the fediverse", event.getId());
            return;
        }
        Optional<EventKind> kind = event.getEventKind();
        if (kind.isEmpty()) {
            return;
        }
        // Derived keys only ever publish what the bridge signed for them
        if (store.findRemoteIdentityByPubkey(NativeIdentity.fromHex(event.getPubkey()).hex()).isPresent()) {
            log.trace("Event {} is authored by a bridged fediverse actor", event.getId());
            return;
        }
        log.debug("Bridging kind {} event {}", event.getKind(), event.getId());
        switch (kind.get()) {
            case METADATA -> outbound.bridgeMetadata(event);
            case NOTE -> outbound.bridgeNote(event);
            case FOLLOW_LIST -> outbound.bridgeFollowList(event);
            case DELETION -> outbound.bridgeDeletion(event);
            case REPOST -> outbound.bridgeRepost(event);
            case REACTION -> outbound.bridgeReaction(event);
        }
    }
}
