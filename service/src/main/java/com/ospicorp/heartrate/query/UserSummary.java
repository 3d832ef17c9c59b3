package com.ospicorp.heartrate.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;

public record UserSummary(
    @JsonProperty("user_id") String userId,
    @JsonProperty("record_count") long recordCount,
    @JsonProperty("first_timestamp") OffsetDateTime firstTimestamp,
    @JsonProperty("last_timestamp") OffsetDateTime lastTimestamp
) {}
