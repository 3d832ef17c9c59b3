package com.ospicorp.heartrate.query;

import java.util.List;

public record MultiEntityResult(List<EntitySeries> series, QueryInfo queryInfo) {}
