package com.analyticshub.common.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Inclusive time bounds of an analysis. Accepts both {@code start/end} and {@code startTime/endTime} on input. */
public record TimeWindow(
    @JsonProperty("startTime") @JsonAlias("start") Instant startTime,
    @JsonProperty("endTime")   @JsonAlias("end")   Instant endTime
) {
    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(startTime) && !instant.isAfter(endTime);
    }
}
