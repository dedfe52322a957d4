package org.operaton.nostrpub.model.activitypub;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * ActivityPub OrderedCollection.
 * The bridge only publishes counts: followers are not enumerated and the outbox lives on relays.
 *
 * Spec: https://www.w3.org/TR/activitystreams-core/#collections
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderedCollection {

    @JsonProperty("@context")
    private String context;

    private String type;
    private String id;
    private Long totalItems;
    private List<Object> orderedItems;

    /**
     * Creates an empty OrderedCollection.
     */
    public static OrderedCollection empty(String id) {
        return OrderedCollection.builder()
            .context("https://www.w3.org/ns/activitystreams")
            .type("OrderedCollection")
            .id(id)
            .totalItems(0L)
            .orderedItems(List.of())
            .build();
    }

    /**
     * Creates a collection that only exposes its size.
     */
    public static OrderedCollection countOnly(String id, long totalItems) {
        return OrderedCollection.builder()
            .context("https://www.w3.org/ns/activitystreams")
            .type("OrderedCollection")
            .id(id)
            .totalItems(totalItems)
            .build();
    }
}
