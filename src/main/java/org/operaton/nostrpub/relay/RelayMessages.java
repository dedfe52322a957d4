package org.operaton.nostrpub.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.Builder;
import lombok.Value;
import org.operaton.nostrpub.exception.BridgeException;
import org.operaton.nostrpub.model.nostr.Filter;
import org.operaton.nostrpub.model.nostr.NostrEvent;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * NIP-01 message framing between client and relay.
 *
 * Spec: https://github.com/nostr-protocol/nips/blob/master/01.md
 */
@Component
public class RelayMessages {

    private final ObjectMapper objectMapper;

    public RelayMessages(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Message received from a relay.
     */
    @Value
    @Builder
    public static class Inbound {
        Type type;
        String subscriptionId;
        NostrEvent event;
        String eventId;
        boolean accepted;
        String message;

        public enum Type {
            EVENT,
            EOSE,
            OK,
            NOTICE,
            CLOSED,
            AUTH
        }
    }

    public String req(String subscriptionId, List<Filter> filters) {
        ArrayNode array = objectMapper.createArrayNode();
        array.add("REQ");
        array.add(subscriptionId);
        for (Filter filter : filters) {
            array.add(objectMapper.valueToTree(filter));
        }
        return write(array);
    }

    public String close(String subscriptionId) {
        ArrayNode array = objectMapper.createArrayNode();
        array.add("CLOSE");
        array.add(subscriptionId);
        return write(array);
    }

    public String event(NostrEvent event) {
        ArrayNode array = objectMapper.createArrayNode();
        array.add("EVENT");
        array.add(objectMapper.valueToTree(event));
        return write(array);
    }

    /**
     * Parses a relay message.
     *
     * @throws BridgeException if the message is malformed or of an unknown type
     */
    public Inbound parse(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new BridgeException("Malformed relay message", e);
        }
        if (root == null || !root.isArray() || root.size() < 2 || !root.get(0).isTextual()) {
            throw new BridgeException("Relay message is not a typed array");
        }
        String type = root.get(0).asText();
        try {
            switch (type) {
                case "EVENT":
                    return Inbound.builder()
                        .type(Inbound.Type.EVENT)
                        .subscriptionId(root.get(1).asText())
                        .event(objectMapper.treeToValue(required(root, 2), NostrEvent.class))
                        .build();
                case "EOSE":
                    return Inbound.builder().type(Inbound.Type.EOSE).subscriptionId(root.get(1).asText()).build();
                case "OK":
                    return Inbound.builder()
                        .type(Inbound.Type.OK)
                        .eventId(root.get(1).asText())
                        .accepted(required(root, 2).asBoolean())
                        .message(root.size() > 3 ? root.get(3).asText() : "")
                        .build();
                case "NOTICE":
                    return Inbound.builder().type(Inbound.Type.NOTICE).message(root.get(1).asText()).build();
                case "CLOSED":
                    return Inbound.builder()
                        .type(Inbound.Type.CLOSED)
                        .subscriptionId(root.get(1).asText())
                        .message(root.size() > 2 ? root.get(2).asText() : "")
                        .build();
                case "AUTH":
                    return Inbound.builder().type(Inbound.Type.AUTH).message(root.get(1).asText()).build();
                default:
                    throw new BridgeException("Unknown relay message type: " + type);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new BridgeException("Malformed " + type + " message", e);
        }
    }

    private static JsonNode required(JsonNode array, int index) {
        if (array.size() <= index) {
            throw new BridgeException("Relay message too short");
        }
        return array.get(index);
    }

    private String write(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize relay message", e);
        }
    }
}
