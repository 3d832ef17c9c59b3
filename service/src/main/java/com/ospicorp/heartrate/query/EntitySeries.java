package com.ospicorp.heartrate.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record EntitySeries(
    @JsonProperty("user_id") String userId,
    List<TimeSeriesPoint> data,
    int count
) {

  public static EntitySeries of(String userId, List<TimeSeriesPoint> data) {
    return new EntitySeries(userId, data, data.size());
  }

  public static EntitySeries empty(String userId) {
    return new EntitySeries(userId, List.of(), 0);
  }
}
