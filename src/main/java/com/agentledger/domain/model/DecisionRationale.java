package com.agentledger.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/** Single-line rationale the agent logged for one asset's decision. */
@Data
@Builder
public class DecisionRationale {

    private Instant timestamp;
    private String asset;
    private String text;
}
