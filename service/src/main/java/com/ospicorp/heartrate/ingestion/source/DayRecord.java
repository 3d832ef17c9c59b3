package com.ospicorp.heartrate.ingestion.source;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;

/** One calendar day of upstream payload, read at {@code shift} from the replay cache. */
public record DayRecord(LocalDate date, int shift, JsonNode payload) {}
