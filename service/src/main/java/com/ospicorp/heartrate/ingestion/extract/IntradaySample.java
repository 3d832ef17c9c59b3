package com.ospicorp.heartrate.ingestion.extract;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;

public record IntradaySample(LocalDate date, String time, JsonNode value, String entityId)
    implements CandidateRecord {}
