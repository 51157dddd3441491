package com.agentledger.event;

import com.agentledger.domain.model.ReconciliationResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every account reconciliation, whether or not the exchange was
 * reachable. Listened to by {@link com.agentledger.observability.ReconciliationMetrics}.
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationResult result;

    public ReconciliationEvent(Object source, ReconciliationResult result) {
        super(source);
        this.result = result;
    }

    public ReconciliationResult getResult() {
        return result;
    }
}
