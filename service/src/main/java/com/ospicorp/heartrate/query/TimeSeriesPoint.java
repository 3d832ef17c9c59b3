package com.ospicorp.heartrate.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.OffsetDateTime;

@JsonPropertyOrder({"timestamp", "value", "user_id"})
public record TimeSeriesPoint(
    OffsetDateTime timestamp,
    Double value,
    @JsonProperty("user_id") String userId
) {}
