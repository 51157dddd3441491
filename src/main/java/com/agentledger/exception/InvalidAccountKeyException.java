package com.agentledger.exception;

import java.util.Map;

/**
 * Account keys become file names under the diary and log directories, so anything
 * that could escape those directories is rejected before a read is attempted.
 */
public class InvalidAccountKeyException extends BaseException {

    public InvalidAccountKeyException(String accountKey) {
        super(ErrorCode.BAD_REQUEST, "Invalid account key", Map.of("accountKey", String.valueOf(accountKey)));
    }
}
