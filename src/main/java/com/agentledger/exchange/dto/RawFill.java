package com.agentledger.exchange.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One entry of the {@code userFills} response. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawFill {

    private String coin;
    private String px;
    private String sz;

    /** {@code B} (bid) or {@code A} (ask). */
    private String side;

    private Long time;

    /** Human-readable direction, e.g. {@code Open Long}, {@code Close Short}, {@code Long > Short}. */
    private String dir;

    private String closedPnl;
    private String fee;
    private String hash;
    private Long oid;
    private Long tid;
}
