package com.agentledger.exchange.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the {@code userNonFundingLedgerUpdates} response: a deposit,
 * withdrawal or transfer that moved USDC into or out of the account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawLedgerUpdate {

    private Long time;
    private String hash;
    private Delta delta;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Delta {

        /** {@code deposit}, {@code withdraw}, {@code internalTransfer}, {@code subAccountTransfer}, ... */
        private String type;

        private String usdc;
        private String usdcValue;
        private String user;
        private String destination;
        private Boolean toPerp;
    }
}
