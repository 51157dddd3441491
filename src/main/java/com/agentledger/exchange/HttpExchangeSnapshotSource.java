package com.agentledger.exchange;

import com.agentledger.exception.ExchangeException;
import com.agentledger.exchange.dto.RawClearinghouseState;
import com.agentledger.exchange.dto.RawExchangeSnapshot;
import com.agentledger.exchange.dto.RawFill;
import com.agentledger.exchange.dto.RawLedgerUpdate;
import com.agentledger.exchange.dto.RawOpenOrder;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Reads an account from the exchange's public {@code /info} endpoint.
 *
 * <p>Every query is a POST of {@code {"type": ..., "user": <accountKey>}}. The
 * account state is mandatory: if it fails the whole fetch fails with
 * {@link ExchangeException}, which the circuit breaker and retry count. Fills, open
 * orders and ledger updates are best effort; each failure is logged and leaves its
 * part null so the rest of the snapshot is still usable.
 */
@Service
public class HttpExchangeSnapshotSource implements ExchangeSnapshotSource {

    private static final Logger log = LoggerFactory.getLogger(HttpExchangeSnapshotSource.class);

    static final String INFO_PATH = "/info";

    private final RestClient exchangeRestClient;

    public HttpExchangeSnapshotSource(RestClient exchangeRestClient) {
        this.exchangeRestClient = exchangeRestClient;
    }

    @Override
    @CircuitBreaker(name = "exchangeApi")
    @Retry(name = "exchangeApi")
    public RawExchangeSnapshot fetch(String accountKey) {
        RawClearinghouseState state;
        try {
            state = query("clearinghouseState", accountKey, new ParameterizedTypeReference<RawClearinghouseState>() {});
        } catch (RestClientException e) {
            log.error("Failed to fetch clearinghouse state for {}: {}", accountKey, e.getMessage());
            throw new ExchangeException("Failed to fetch clearinghouse state: " + e.getMessage(), e);
        }
        if (state == null) {
            throw new ExchangeException("Empty clearinghouse state for " + accountKey);
        }

        return RawExchangeSnapshot.builder()
                .state(state)
                .fills(queryOptional("userFills", accountKey, new ParameterizedTypeReference<List<RawFill>>() {}))
                .openOrders(queryOptional(
                        "frontendOpenOrders", accountKey, new ParameterizedTypeReference<List<RawOpenOrder>>() {}))
                .ledgerUpdates(queryOptional(
                        "userNonFundingLedgerUpdates",
                        accountKey,
                        new ParameterizedTypeReference<List<RawLedgerUpdate>>() {}))
                .build();
    }

    private <T> T queryOptional(String type, String accountKey, ParameterizedTypeReference<T> responseType) {
        try {
            return query(type, accountKey, responseType);
        } catch (RestClientException e) {
            log.warn("Exchange {} query failed for {}, continuing without it: {}", type, accountKey, e.getMessage());
            return null;
        }
    }

    private <T> T query(String type, String accountKey, ParameterizedTypeReference<T> responseType) {
        return exchangeRestClient
                .post()
                .uri(INFO_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("type", type, "user", accountKey))
                .retrieve()
                .body(responseType);
    }
}
