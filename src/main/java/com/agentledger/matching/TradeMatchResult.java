package com.agentledger.matching;

import com.agentledger.domain.enums.TradeSource;
import com.agentledger.domain.model.CompletedTrade;
import com.agentledger.domain.model.DiaryRecord;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Output of {@link TradeMatcher#match}: the published trade set, which pass it came
 * from, and the executed diary opens no later record closed.
 */
@Data
@Builder
public class TradeMatchResult {

    @Builder.Default
    private List<CompletedTrade> trades = List.of();

    private TradeSource source;

    /** Executed OPEN_* diary records left unpaired by sequential matching, oldest first. */
    @Builder.Default
    private List<DiaryRecord> unmatchedOpens = List.of();

    public boolean isExchangeSourced() {
        return source == TradeSource.EXCHANGE_FILL;
    }
}
