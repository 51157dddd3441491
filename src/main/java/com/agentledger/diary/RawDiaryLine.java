package com.agentledger.diary;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One diary line exactly as the agent wrote it. Names bind through the snake_case
 * mapper in {@link com.agentledger.mapper.JsonHelper}; only the abbreviated price
 * keys need explicit names.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class RawDiaryLine {

    private String timestamp;
    private String asset;
    private String action;
    private String rationale;
    private BigDecimal allocationUsd;
    private BigDecimal amount;
    private BigDecimal entryPrice;

    @JsonProperty("tp_price")
    private BigDecimal takeProfitPrice;

    @JsonProperty("sl_price")
    private BigDecimal stopLossPrice;

    private String exitPlan;

    /** Usually the repr string of the broker response, occasionally a JSON object. */
    private JsonNode orderResult;

    private String reason;
    private String openedAt;
    private Boolean filled;
}
