package com.ospicorp.heartrate.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.heartrate.query.QueryInfo;

public record ResponseMetadata(@JsonProperty("query_info") QueryInfo queryInfo) {}
