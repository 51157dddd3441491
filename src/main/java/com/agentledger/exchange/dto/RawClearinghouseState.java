package com.agentledger.exchange.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code clearinghouseState} response. The exchange sends every number as a decimal
 * string; conversion to BigDecimal happens in the mapper.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawClearinghouseState {

    private MarginSummary marginSummary;

    @Builder.Default
    private List<AssetPosition> assetPositions = new ArrayList<>();

    private String withdrawable;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MarginSummary {
        private String accountValue;
        private String totalNtlPos;
        private String totalRawUsd;
        private String totalMarginUsed;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AssetPosition {
        private String type;
        private PositionData position;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PositionData {
        private String coin;

        /** Signed size: positive long, negative short. */
        private String szi;

        private String entryPx;
        private String positionValue;
        private String unrealizedPnl;
        private String liquidationPx;
        private String marginUsed;
        private Leverage leverage;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Leverage {
        private String type;
        private Integer value;
    }
}
