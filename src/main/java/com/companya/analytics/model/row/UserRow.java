package com.companya.analytics.model.row;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/** One row of {@code users}: contact info and profile flattened onto the user. */
@Value
@Builder(toBuilder = true)
public class UserRow {

    String userId;
    String email;
    String phone;
    String displayName;
    String avatar;
    String bio;
    Integer version;
    LocalDateTime deletedAt;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
    String eventId;
    LocalDateTime eventTimestamp;
}
