package com.agentledger.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Market context for one asset. Indicator values are doubles because the agent
 * writes NaN when an upstream data source fails; any field may be null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssetMarketData {

    private String asset;
    private Double currentPrice;
    private Intraday intraday;
    private LongTerm longTerm;
    private Double fundingRate;
    private Double fundingAnnualizedPct;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Intraday {
        private Double ema20;
        private Double macd;
        private Double rsi7;
        private Double rsi14;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LongTerm {
        private Double ema20;
        private Double ema50;
        private Double atr14;

        @Builder.Default
        private List<Double> rsiSeries = new ArrayList<>();
    }
}
