package org.operaton.nostrpub.controller;

import lombok.RequiredArgsConstructor;
import org.operaton.nostrpub.service.BridgeUris;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * NodeInfo discovery, so fediverse servers can tell they are talking to a bridge.
 *
 * Spec: https://nodeinfo.diaspora.software/protocol
 */
@RestController
@RequiredArgsConstructor
public class NodeInfoController {

    private static final String SCHEMA_2_0 = "http://nodeinfo.diaspora.software/ns/schema/2.0";

    private final BridgeUris uris;

    @GetMapping(value = "/.well-known/nodeinfo", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> discovery() {
        return Map.of("links", List.of(Map.of(
            "rel", SCHEMA_2_0,
            "href", uris.baseUrl() + "/nodeinfo/2.0")));
    }

    @GetMapping(value = "/nodeinfo/2.0", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> nodeInfo() {
        Map<String, Object> nodeInfo = new LinkedHashMap<>();
        nodeInfo.put("version", "2.0");
        nodeInfo.put("software", Map.of("name", "nostrpub", "version", "0.1.0"));
        nodeInfo.put("protocols", List.of("activitypub"));
        nodeInfo.put("services", Map.of("inbound", List.of(), "outbound", List.of()));
        nodeInfo.put("openRegistrations", false);
        nodeInfo.put("usage", Map.of("users", Map.of()));
        nodeInfo.put("metadata", Map.of("bridgedProtocol", "nostr"));
        return nodeInfo;
    }
}
