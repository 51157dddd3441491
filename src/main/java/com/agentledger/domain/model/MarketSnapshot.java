package com.agentledger.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One "ALL ASSETS" block from the agent's prompt log: the account summary and the
 * per-asset market context the agent saw in a decision cycle.
 *
 * <p>Bound from the block's snake_case JSON body; {@link #timestamp} comes from the
 * block header, not the body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketSnapshot {

    private Instant timestamp;
    private PromptAccount account;

    @Builder.Default
    private List<AssetMarketData> marketData = new ArrayList<>();
}
