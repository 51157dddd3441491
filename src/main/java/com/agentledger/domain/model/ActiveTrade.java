package com.agentledger.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A trade the agent believes is still open, as tracked in its own memory. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActiveTrade {

    private String asset;

    @JsonProperty("is_long")
    private Boolean longSide;

    private BigDecimal amount;
    private BigDecimal entryPrice;
    private String tpOid;
    private String slOid;
    private String exitPlan;
    private String openedAt;
}
