package com.agentledger.observability;

import com.agentledger.domain.model.ReconciliationResult;
import com.agentledger.event.ReconciliationEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for reconciliation polls:
 * <ul>
 *   <li><b>agentledger.reconciliation</b> (timer): duration of each poll</li>
 *   <li><b>agentledger.exchange.unavailable</b> (counter): polls served from fallbacks</li>
 * </ul>
 *
 * <p>Malformed diary lines are counted by the diary reader as they are first read.
 */
@Service
public class ReconciliationMetrics {

    private final Timer reconciliationTimer;
    private final Counter exchangeUnavailableCounter;

    public ReconciliationMetrics(MeterRegistry meterRegistry) {
        this.reconciliationTimer = Timer.builder("agentledger.reconciliation")
                .description("Duration of one account reconciliation poll")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(10))
                .register(meterRegistry);

        this.exchangeUnavailableCounter = Counter.builder("agentledger.exchange.unavailable")
                .description("Reconciliations that fell back to diary and prompt-log data")
                .register(meterRegistry);
    }

    @EventListener
    public void onReconciliation(ReconciliationEvent event) {
        ReconciliationResult result = event.getResult();
        reconciliationTimer.record(result.getDurationMs(), TimeUnit.MILLISECONDS);
        if (!result.isExchangeAvailable()) {
            exchangeUnavailableCounter.increment();
        }
    }
}
