package com.ospicorp.heartrate.query;

import java.util.List;

public record TimeSeriesQuery(String sql, List<Object> args) {

  public TimeSeriesQuery {
    args = List.copyOf(args);
  }
}
