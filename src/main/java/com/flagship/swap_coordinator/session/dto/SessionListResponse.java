package com.flagship.swap_coordinator.session.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class SessionListResponse {

    @JsonProperty("sessions")
    List<SessionStatusResponse> sessions;

    @JsonProperty("total")
    int total;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("offset")
    int offset;
}
