package com.ospicorp.heartrate.web;

import com.ospicorp.heartrate.query.EntitySeries;
import java.util.List;

public record MultiUserResponse(List<EntitySeries> data, ResponseMetadata metadata) {}
