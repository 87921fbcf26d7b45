package com.companya.analytics.model.row;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
public class SupplierRow {

    String supplierId;
    String email;
    String primaryPhone;
    String contactPersonName;
    String contactPersonTitle;
    String contactPersonEmail;
    String contactPersonPhone;
    String legalName;
    String dbaName;
    String streetAddress1;
    String streetAddress2;
    String city;
    String state;
    String zipCode;
    String country;
    String supportEmail;
    String supportPhone;
    String facebookUrl;
    String instagramHandle;
    String twitterHandle;
    String linkedinUrl;
    String timezone;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
    String eventId;
    LocalDateTime eventTimestamp;
}
