package com.ospicorp.heartrate.web;

import com.ospicorp.heartrate.query.TimeSeriesPoint;
import java.util.List;

public record TimeSeriesResponse(List<TimeSeriesPoint> data, ResponseMetadata metadata) {}
