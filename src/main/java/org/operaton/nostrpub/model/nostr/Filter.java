package org.operaton.nostrpub.model.nostr;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A NIP-01 subscription filter.
 * Tag filters such as {@code #e} or {@code #p} are kept in {@link #tagFilters} keyed by the tag letter.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Filter {

    private List<String> ids;
    private List<String> authors;
    private List<Integer> kinds;
    private Long since;
    private Long until;
    private Integer limit;

    @Builder.Default
    @JsonIgnore
    private Map<String, List<String>> tagFilters = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, List<String>> tagFilterProperties() {
        Map<String, List<String>> properties = new LinkedHashMap<>();
        if (tagFilters == null) {
            return properties;
        }
        tagFilters.forEach((letter, values) -> properties.put("#" + letter, values));
        return properties;
    }

    @JsonAnySetter
    @SuppressWarnings("unchecked")
    public void setTagFilterProperty(String name, Object value) {
        if (name.startsWith("#") && value instanceof List) {
            if (tagFilters == null) {
                tagFilters = new LinkedHashMap<>();
            }
            tagFilters.put(name.substring(1), (List<String>) value);
        }
    }

    /**
     * Filter matching a single event id.
     */
    public static Filter byId(String eventId) {
        return Filter.builder().ids(List.of(eventId)).build();
    }
}
