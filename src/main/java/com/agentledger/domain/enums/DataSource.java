package com.agentledger.domain.enums;

/** Where a position or account state was read from, most authoritative first. */
public enum DataSource {
    EXCHANGE,
    PROMPT_LOG,
    DIARY
}
