package com.agentledger.exchange.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One entry of the {@code frontendOpenOrders} response. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawOpenOrder {

    private String coin;
    private Long oid;
    private String side;
    private String sz;
    private String limitPx;
    private String triggerPx;
    private String orderType;
    private Boolean reduceOnly;
    private Long timestamp;
}
