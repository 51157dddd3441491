package com.agentledger.exception;

/**
 * Raised when the live exchange snapshot cannot be fetched or is unusable.
 *
 * <p>The reconciliation service catches this and degrades to diary/prompt-log
 * fallbacks, so it only reaches the API layer if thrown outside a poll.
 */
public class ExchangeException extends BaseException {

    public ExchangeException(String message) {
        super(ErrorCode.EXCHANGE_ERROR, message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(ErrorCode.EXCHANGE_ERROR, message, cause);
    }
}
