package com.agentledger.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/** A full free-text reasoning block from the process log. May span several lines. */
@Data
@Builder
public class ReasoningEntry {

    private Instant timestamp;
    private String text;
}
