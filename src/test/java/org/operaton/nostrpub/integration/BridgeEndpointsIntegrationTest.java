package org.operaton.nostrpub.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.nostrpub.config.TestcontainersConfiguration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Full stack from HTTP request to database for the public endpoints of the bridge.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
class BridgeEndpointsIntegrationTest {

    private static final String NPUB = "npub180cvv07tjdrrgpa0j7j7tmnyl2yr6yr7l8j4s3evf6u64th6gkwsyjh6w6";
    private static final String ACTOR_URI = "https://bridge.example/users/" + NPUB;
    private static final String ACTIVITY_JSON = "application/activity+json";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Any valid key gets an actor with a stable key pair")
    void getActor_shouldMaterializeActorOnce() throws Exception {
        String first = mockMvc.perform(get("/users/{npub}", NPUB).accept(ACTIVITY_JSON))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id", is(ACTOR_URI)))
            .andExpect(jsonPath("$.type", is("Person")))
            .andExpect(jsonPath("$.inbox", is(ACTOR_URI + "/inbox")))
            .andExpect(jsonPath("$.publicKey.publicKeyPem", startsWith("-----BEGIN PUBLIC KEY-----")))
            .andReturn().getResponse().getContentAsString();

        String second = mockMvc.perform(get("/users/{npub}", NPUB).accept(ACTIVITY_JSON))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();

        JsonNode firstKey = objectMapper.readTree(first).path("publicKey").path("publicKeyPem");
        JsonNode secondKey = objectMapper.readTree(second).path("publicKey").path("publicKeyPem");
        assertThat(secondKey).isEqualTo(firstKey);
    }

    @Test
    void getActor_withInvalidKey_shouldReturn404() throws Exception {
        mockMvc.perform(get("/users/{npub}", "npub1notakey").accept(ACTIVITY_JSON))
            .andExpect(status().isNotFound());
    }

    @Test
    void followers_shouldOnlyPublishCount() throws Exception {
        mockMvc.perform(get("/users/{npub}/followers", NPUB).accept(ACTIVITY_JSON))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalItems", is(0)));
    }

    @Test
    void webfinger_shouldPointToActor() throws Exception {
        mockMvc.perform(get("/.well-known/webfinger").param("resource", "acct:" + NPUB + "@bridge.example"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.subject", is("acct:" + NPUB + "@bridge.example")))
            .andExpect(jsonPath("$.links[?(@.rel == 'self')].href").value(ACTOR_URI));
    }

    @Test
    void webfinger_forOtherDomain_shouldReturn404() throws Exception {
        mockMvc.perform(get("/.well-known/webfinger").param("resource", "acct:" + NPUB + "@other.example"))
            .andExpect(status().isNotFound());
    }

    @Test
    void inbox_withoutSignature_shouldReturn401() throws Exception {
        String follow = "{\"id\":\"https://remote.example/activities/1\",\"type\":\"Follow\","
            + "\"actor\":\"https://remote.example/users/bob\",\"object\":\"" + ACTOR_URI + "\"}";

        mockMvc.perform(post("/users/{npub}/inbox", NPUB).contentType(ACTIVITY_JSON).content(follow))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void inbox_withMalformedBody_shouldReturn400() throws Exception {
        mockMvc.perform(post("/inbox").contentType(ACTIVITY_JSON).content("{not json"))
            .andExpect(status().isBadRequest());
    }
}
