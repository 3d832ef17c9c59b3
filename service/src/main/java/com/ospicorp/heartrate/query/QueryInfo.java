package com.ospicorp.heartrate.query;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QueryInfo(
    @JsonProperty("table_used") String tableUsed,
    @JsonProperty("table_description") String tableDescription,
    String interval
) {

  public static QueryInfo of(QueryResolution resolution) {
    return new QueryInfo(resolution.table(), resolution.description(), resolution.interval());
  }
}
