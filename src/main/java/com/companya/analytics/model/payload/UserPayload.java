package com.companya.analytics.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;

/**
 * Full user snapshot carried by {@code user.created} and {@code user.updated}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserPayload {

    @JsonProperty("contact_info")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private ContactInfo contactInfo = new ContactInfo();

    @JsonProperty("profile")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Profile profile = new Profile();

    @JsonProperty("version")
    private Integer version;

    @JsonProperty("deleted_at")
    private String deletedAt;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContactInfo {
        @JsonProperty("primary_email")
        private String primaryEmail;

        @JsonProperty("phone")
        private String phone;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Profile {
        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("avatar")
        private String avatar;

        @JsonProperty("bio")
        private String bio;
    }
}
