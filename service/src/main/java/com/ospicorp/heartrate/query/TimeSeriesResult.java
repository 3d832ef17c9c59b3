package com.ospicorp.heartrate.query;

import java.util.List;

public record TimeSeriesResult(List<TimeSeriesPoint> points, QueryInfo queryInfo) {}
