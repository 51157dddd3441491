package com.agentledger.domain.enums;

public enum OrderSide {
    BUY,
    SELL
}
