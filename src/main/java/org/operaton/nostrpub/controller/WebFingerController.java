package org.operaton.nostrpub.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.model.activitypub.WebFingerResponse;
import org.operaton.nostrpub.service.ActorDirectory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * WebFinger controller for actor discovery.
 * Implements RFC 7033 WebFinger protocol.
 *
 * Example: /.well-known/webfinger?resource=acct:npub1...@bridge.example
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class WebFingerController {

    private static final String JRD_JSON = "application/jrd+json";

    private final ActorDirectory actorDirectory;

    /**
     * WebFinger endpoint for actor discovery.
     *
     * @param resource the resource identifier (acct:npub@domain)
     * @return WebFinger response
     */
    @GetMapping(value = "/.well-known/webfinger", produces = {JRD_JSON, "application/json"})
    public ResponseEntity<WebFingerResponse> webfinger(@RequestParam("resource") String resource) {
        log.debug("WebFinger request for resource: {}", resource);
        if (!resource.startsWith("acct:")) {
            log.warn("Invalid WebFinger resource format: {}", resource);
            return ResponseEntity.badRequest().build();
        }
        return actorDirectory.webFinger(resource)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
