package com.agentledger.domain.enums;

public enum FeedEntryKind {
    REASONING,
    DECISION,
    TRADE,
    MARKET_INFO,
    ACCOUNT_INFO
}
