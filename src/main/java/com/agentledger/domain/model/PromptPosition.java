package com.agentledger.domain.model;

import com.agentledger.mapper.LeverageDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Exchange position as the agent echoed it into the prompt log. Quantity is signed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptPosition {

    private String symbol;
    private BigDecimal quantity;
    private BigDecimal entryPrice;
    private BigDecimal currentPrice;
    private BigDecimal liquidationPrice;
    private BigDecimal unrealizedPnl;

    @JsonDeserialize(using = LeverageDeserializer.class)
    private Integer leverage;
}
