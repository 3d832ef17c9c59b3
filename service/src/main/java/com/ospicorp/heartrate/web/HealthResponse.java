package com.ospicorp.heartrate.web;

import java.time.OffsetDateTime;

public record HealthResponse(String status, String database, OffsetDateTime timestamp) {}
