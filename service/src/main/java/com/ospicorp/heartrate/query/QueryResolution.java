package com.ospicorp.heartrate.query;

/** Which stored granularity serves a request and at what interval the result is reported. */
public record QueryResolution(Granularity granularity, OutputInterval outputInterval) {

  public String table() {
    return granularity.table();
  }

  public String timeColumn() {
    return granularity.timeColumn();
  }

  public String valueColumn() {
    return granularity.valueColumn();
  }

  public String description() {
    return granularity.description();
  }

  public boolean rebucketed() {
    return outputInterval != null;
  }

  public String interval() {
    return outputInterval != null ? outputInterval.token() : granularity.token();
  }
}
