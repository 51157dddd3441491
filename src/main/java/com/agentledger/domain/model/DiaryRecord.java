package com.agentledger.domain.model;

import com.agentledger.domain.enums.DiaryAction;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * One decision the agent appended to its diary.
 *
 * <p>Records are immutable once written by the agent; this service only reads them.
 * An OPEN_* record is an attempted entry and counts as executed only when
 * {@link #isExecuted()} holds.
 */
@Data
@Builder
public class DiaryRecord {

    /** Zero-based position of the record in the diary file. Identity for sequential matching. */
    private long sequence;

    private Instant timestamp;
    private String asset;
    private DiaryAction action;

    private String rationale;
    private BigDecimal allocationUsd;
    private BigDecimal amount;
    private BigDecimal entryPrice;
    private BigDecimal takeProfitPrice;
    private BigDecimal stopLossPrice;
    private String exitPlan;

    /** Raw broker response text, stored by the agent as the repr of the order result. */
    private String orderResult;

    private String reason;

    /** Correlation id shared by an open and the reconcile-close that retires it. */
    private String openedAt;

    private Boolean filled;

    /**
     * True when the broker response reports a fill and no error. The agent writes
     * Python reprs (single quotes) but JSON-quoted keys are accepted as well.
     */
    public boolean isExecuted() {
        if (orderResult == null) {
            return false;
        }
        boolean hasFill = orderResult.contains("'filled':") || orderResult.contains("\"filled\":");
        boolean hasError = orderResult.contains("'error':") || orderResult.contains("\"error\":");
        return hasFill && !hasError;
    }
}
