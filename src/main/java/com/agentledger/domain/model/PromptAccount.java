package com.agentledger.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptAccount {

    private BigDecimal balance;
    private BigDecimal accountValue;
    private BigDecimal totalReturnPct;

    @Builder.Default
    private List<PromptPosition> positions = new ArrayList<>();

    @Builder.Default
    private List<ActiveTrade> activeTrades = new ArrayList<>();
}
