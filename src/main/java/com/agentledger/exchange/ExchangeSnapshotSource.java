package com.agentledger.exchange;

import com.agentledger.exception.ExchangeException;
import com.agentledger.exchange.dto.RawExchangeSnapshot;

/**
 * Fetches the live exchange payloads for one account.
 *
 * <p>Reconciliation depends only on this interface. {@link HttpExchangeSnapshotSource}
 * is the production implementation; tests substitute mocks.
 */
public interface ExchangeSnapshotSource {

    /**
     * Fetches state, fills, open orders and ledger updates.
     *
     * @throws ExchangeException if the account state cannot be fetched. Fills, orders
     *     and ledger failures are reported as null parts instead.
     */
    RawExchangeSnapshot fetch(String accountKey);
}
