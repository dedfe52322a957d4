package org.operaton.nostrpub.controller;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.operaton.nostrpub.exception.BridgeException;
import org.operaton.nostrpub.exception.SignatureInvalidException;
import org.operaton.nostrpub.exception.StoreUnavailableException;
import org.operaton.nostrpub.model.activitypub.Actor;
import org.operaton.nostrpub.model.activitypub.WebFingerResponse;
import org.operaton.nostrpub.model.bridge.InboundRequest;
import org.operaton.nostrpub.service.ActorDirectory;
import org.operaton.nostrpub.service.BridgeCoordinator;
import org.operaton.nostrpub.service.BridgeUris;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP surface of the bridge: actor documents, WebFinger and the status codes of inbox deliveries.
 */
@WebMvcTest(controllers = {ActivityPubController.class, WebFingerController.class, NodeInfoController.class})
class ActivityPubControllerTest {

    private static final String NPUB = "npub180cvv07tjdrrgpa0j7j7tmnyl2yr6yr7l8j4s3evf6u64th6gkwsyjh6w6";
    private static final String ACTIVITY_JSON = "application/activity+json";
    private static final String BODY = "{\"type\":\"Follow\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ActorDirectory actorDirectory;

    @MockBean
    private BridgeCoordinator coordinator;

    @MockBean
    private BridgeUris uris;

    // ==================== Actor Tests ====================

    @Test
    void getActor_withKnownKey_shouldReturnActorDocument() throws Exception {
        when(actorDirectory.actor(NPUB)).thenReturn(Optional.of(Actor.builder()
            .type("Person")
            .id("https://bridge.example/users/" + NPUB)
            .preferredUsername(NPUB)
            .inbox("https://bridge.example/users/" + NPUB + "/inbox")
            .build()));

        mockMvc.perform(get("/users/{npub}", NPUB).accept(ACTIVITY_JSON))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.type", is("Person")))
            .andExpect(jsonPath("$.id", is("https://bridge.example/users/" + NPUB)));
    }

    @Test
    void getActor_withUndecodableKey_shouldReturn404() throws Exception {
        when(actorDirectory.actor("bogus")).thenReturn(Optional.empty());

        mockMvc.perform(get("/users/{npub}", "bogus").accept(ACTIVITY_JSON))
            .andExpect(status().isNotFound());
    }

    // ==================== WebFinger Tests ====================

    @Test
    void webfinger_withAcctResource_shouldReturnLinks() throws Exception {
        String resource = "acct:" + NPUB + "@bridge.example";
        when(actorDirectory.webFinger(resource)).thenReturn(Optional.of(WebFingerResponse.builder()
            .subject(resource)
            .links(List.of(WebFingerResponse.Link.builder()
                .rel("self")
                .type(ACTIVITY_JSON)
                .href("https://bridge.example/users/" + NPUB)
                .build()))
            .build()));

        mockMvc.perform(get("/.well-known/webfinger").param("resource", resource))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.subject", is(resource)))
            .andExpect(jsonPath("$.links[0].rel", is("self")));
    }

    @Test
    void webfinger_withoutAcctScheme_shouldReturn400() throws Exception {
        mockMvc.perform(get("/.well-known/webfinger").param("resource", "https://bridge.example/users/x"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(actorDirectory);
    }

    // ==================== NodeInfo Tests ====================

    @Test
    void nodeInfoDiscovery_shouldLinkSchema20Document() throws Exception {
        when(uris.baseUrl()).thenReturn("https://bridge.example");

        mockMvc.perform(get("/.well-known/nodeinfo"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.links[0].rel", is("http://nodeinfo.diaspora.software/ns/schema/2.0")))
            .andExpect(jsonPath("$.links[0].href", is("https://bridge.example/nodeinfo/2.0")));
    }

    @Test
    void nodeInfo_shouldAdvertiseActivityPubWithClosedRegistrations() throws Exception {
        mockMvc.perform(get("/nodeinfo/2.0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.software.name", is("nostrpub")))
            .andExpect(jsonPath("$.protocols[0]", is("activitypub")))
            .andExpect(jsonPath("$.openRegistrations", is(false)));
    }

    // ==================== Inbox Tests ====================

    @Test
    void inbox_withAcceptedActivity_shouldReturn202AndPassRawRequest() throws Exception {
        when(coordinator.ingestFederationActivity(any())).thenReturn(CompletableFuture.completedFuture(null));

        mockMvc.perform(post("/users/{npub}/inbox", NPUB)
                .contentType(ACTIVITY_JSON)
                .header("Signature", "keyId=\"k\",signature=\"s\"")
                .content(BODY))
            .andExpect(status().isAccepted());

        ArgumentCaptor<InboundRequest> captor = ArgumentCaptor.forClass(InboundRequest.class);
        verify(coordinator).ingestFederationActivity(captor.capture());
        InboundRequest request = captor.getValue();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/users/" + NPUB + "/inbox");
        assertThat(request.header("signature")).isEqualTo("keyId=\"k\",signature=\"s\"");
        assertThat(new String(request.getBody(), StandardCharsets.UTF_8)).isEqualTo(BODY);
    }

    @Test
    void sharedInbox_withInvalidSignature_shouldReturn401() throws Exception {
        when(coordinator.ingestFederationActivity(any())).thenThrow(new SignatureInvalidException("Invalid signature"));

        mockMvc.perform(post("/inbox").contentType(ACTIVITY_JSON).content(BODY))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error", is("Invalid signature")));
    }

    @Test
    void sharedInbox_withMalformedActivity_shouldReturn400() throws Exception {
        when(coordinator.ingestFederationActivity(any())).thenThrow(new BridgeException("Activity has no actor"));

        mockMvc.perform(post("/inbox").contentType(ACTIVITY_JSON).content(BODY))
            .andExpect(status().isBadRequest());
    }

    @Test
    void sharedInbox_withStoreDown_shouldReturn503() throws Exception {
        when(coordinator.ingestFederationActivity(any()))
            .thenThrow(new StoreUnavailableException("down", new RuntimeException()));

        mockMvc.perform(post("/inbox").contentType(ACTIVITY_JSON).content(BODY))
            .andExpect(status().isServiceUnavailable());
    }
}
