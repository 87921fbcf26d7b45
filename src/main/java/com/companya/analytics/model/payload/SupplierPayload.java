package com.companya.analytics.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;

/**
 * Full supplier snapshot. Address and social links sit two levels deep.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SupplierPayload {

    @JsonProperty("contact_info")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private ContactInfo contactInfo = new ContactInfo();

    @JsonProperty("company_info")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private CompanyInfo companyInfo = new CompanyInfo();

    @JsonProperty("business_info")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private BusinessInfo businessInfo = new BusinessInfo();

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ContactInfo {
        @JsonProperty("primary_email")
        private String primaryEmail;

        @JsonProperty("primary_phone")
        private String primaryPhone;

        @JsonProperty("contact_person_name")
        private String contactPersonName;

        @JsonProperty("contact_person_title")
        private String contactPersonTitle;

        @JsonProperty("contact_person_email")
        private String contactPersonEmail;

        @JsonProperty("contact_person_phone")
        private String contactPersonPhone;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CompanyInfo {
        @JsonProperty("legal_name")
        private String legalName;

        @JsonProperty("dba_name")
        private String dbaName;

        @JsonProperty("business_address")
        @JsonSetter(nulls = Nulls.AS_EMPTY)
        private Address businessAddress = new Address();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Address {
        @JsonProperty("street_address_1")
        private String streetAddress1;

        @JsonProperty("street_address_2")
        private String streetAddress2;

        @JsonProperty("city")
        private String city;

        @JsonProperty("state")
        private String state;

        @JsonProperty("zip_code")
        private String zipCode;

        @JsonProperty("country")
        private String country;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BusinessInfo {
        @JsonProperty("support_email")
        private String supportEmail;

        @JsonProperty("support_phone")
        private String supportPhone;

        @JsonProperty("timezone")
        private String timezone;

        @JsonProperty("social_media")
        @JsonSetter(nulls = Nulls.AS_EMPTY)
        private SocialMedia socialMedia = new SocialMedia();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SocialMedia {
        @JsonProperty("facebook_url")
        private String facebookUrl;

        @JsonProperty("instagram_handle")
        private String instagramHandle;

        @JsonProperty("twitter_handle")
        private String twitterHandle;

        @JsonProperty("linkedin_url")
        private String linkedinUrl;
    }
}
