package org.operaton.nostrpub.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.model.activitypub.Actor;
import org.operaton.nostrpub.model.activitypub.OrderedCollection;
import org.operaton.nostrpub.model.bridge.InboundRequest;
import org.operaton.nostrpub.service.ActorDirectory;
import org.operaton.nostrpub.service.BridgeCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * ActivityPub protocol controller.
 * Serves the documents of virtual actors and hands inbox deliveries to the bridge.
 *
 * Spec: https://www.w3.org/TR/activitypub/
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class ActivityPubController {

    private final ActorDirectory actorDirectory;
    private final BridgeCoordinator coordinator;

    private static final String ACTIVITY_JSON = "application/activity+json";
    private static final String LD_JSON = "application/ld+json; profile=\"https://www.w3.org/ns/activitystreams\"";

    /**
     * Actor profile endpoint.
     *
     * @param npub the bridged key
     * @return Actor object in JSON-LD format
     */
    @GetMapping(
        value = "/users/{npub}",
        produces = {ACTIVITY_JSON, LD_JSON, MediaType.APPLICATION_JSON_VALUE}
    )
    public ResponseEntity<Actor> getActor(@PathVariable String npub) {
        log.debug("ActivityPub actor request for {}", npub);
        return actorDirectory.actor(npub)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Followers collection endpoint. Only the number of fediverse followers is published.
     */
    @GetMapping(
        value = "/users/{npub}/followers",
        produces = {ACTIVITY_JSON, LD_JSON, MediaType.APPLICATION_JSON_VALUE}
    )
    public ResponseEntity<OrderedCollection> followers(@PathVariable String npub) {
        return actorDirectory.followers(npub)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Outbox endpoint. Always empty, the posts of a key live on relays.
     */
    @GetMapping(
        value = "/users/{npub}/outbox",
        produces = {ACTIVITY_JSON, LD_JSON, MediaType.APPLICATION_JSON_VALUE}
    )
    public ResponseEntity<OrderedCollection> outbox(@PathVariable String npub) {
        return actorDirectory.outbox(npub)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(
        value = "/notes/{noteId}",
        produces = {ACTIVITY_JSON, LD_JSON, MediaType.APPLICATION_JSON_VALUE}
    )
    public ResponseEntity<Map<String, Object>> note(@PathVariable String noteId) {
        return actorDirectory.note(noteId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Shared inbox.
     */
    @PostMapping("/inbox")
    public ResponseEntity<Void> sharedInbox(@RequestBody byte[] body, HttpServletRequest request) {
        return receive(body, request);
    }

    /**
     * Personal inbox of a virtual actor. Handled exactly like the shared inbox.
     */
    @PostMapping("/users/{npub}/inbox")
    public ResponseEntity<Void> inbox(@PathVariable String npub, @RequestBody byte[] body, HttpServletRequest request) {
        return receive(body, request);
    }

    private ResponseEntity<Void> receive(byte[] body, HttpServletRequest request) {
        String path = request.getRequestURI();
        if (request.getQueryString() != null) {
            path = path + "?" + request.getQueryString();
        }
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name.toLowerCase(Locale.ROOT), request.getHeader(name));
        }
        coordinator.ingestFederationActivity(InboundRequest.builder()
            .method(request.getMethod())
            .path(path)
            .headers(headers)
            .body(body)
            .build());
        return ResponseEntity.status(HttpStatus.ACCEPTED).build();
    }
}
