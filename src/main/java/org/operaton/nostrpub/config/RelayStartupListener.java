package org.operaton.nostrpub.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.model.nostr.EventKind;
import org.operaton.nostrpub.model.nostr.Filter;
import org.operaton.nostrpub.relay.RelayPoolManager;
import org.operaton.nostrpub.service.BridgeCoordinator;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Subscribes to the relays once the application is ready to accept inbox requests.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RelayStartupListener {

    private final RelayPoolManager relayPool;
    private final BridgeCoordinator coordinator;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        long since = relayPool.initialSince();
        List<Integer> kinds = Arrays.stream(EventKind.values())
            .map(EventKind::getCode)
            .collect(Collectors.toList());
        Filter filter = Filter.builder()
            .kinds(kinds)
            .since(since)
            .build();
        log.info("Subscribing to kinds {} since {}", kinds, Instant.ofEpochSecond(since));
        relayPool.start(List.of(filter), coordinator::ingestNativeEvent);
    }
}
