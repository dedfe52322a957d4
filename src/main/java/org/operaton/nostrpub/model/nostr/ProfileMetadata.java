package org.operaton.nostrpub.model.nostr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Content of a kind 0 metadata event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProfileMetadata {

    private String name;

    @JsonProperty("display_name")
    private String displayName;

    private String about;
    private String picture;
    private String banner;
    private String website;
    private String nip05;

    /**
     * Preferred human readable name, falling back from display name to name.
     */
    public String bestName() {
        if (displayName != null && !displayName.isBlank()) {
            return displayName;
        }
        return name;
    }
}
