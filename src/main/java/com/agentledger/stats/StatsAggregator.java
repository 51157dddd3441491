package com.agentledger.stats;

import com.agentledger.domain.enums.PositionSide;
import com.agentledger.domain.model.AgentStats;
import com.agentledger.domain.model.CompletedTrade;
import com.agentledger.matching.HoldingDurationFormatter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Computes performance stats over the published completed-trade set.
 *
 * <p>Total P&L is the exchange's live figure, passed in by the caller. Without it
 * there is no update: the aggregator returns empty and {@link StatsPublisher} keeps
 * the last published stats instead of showing zeros.
 */
@Service
public class StatsAggregator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public Optional<AgentStats> aggregate(
            List<CompletedTrade> trades,
            BigDecimal liveTotalPnl,
            int holdDecisions,
            int longCount,
            int shortCount) {
        if (liveTotalPnl == null) {
            return Optional.empty();
        }
        List<CompletedTrade> published = trades != null ? trades : List.of();

        return Optional.of(AgentStats.builder()
                .totalTrades(published.size())
                .winRate(winRate(published))
                .totalPnl(liveTotalPnl)
                .avgHoldingDuration(averageHolding(published))
                .holdDecisions(holdDecisions)
                .longCount(longCount)
                .shortCount(shortCount)
                .longVolume(volume(published, PositionSide.LONG))
                .shortVolume(volume(published, PositionSide.SHORT))
                .build());
    }

    BigDecimal winRate(List<CompletedTrade> trades) {
        long closable = trades.stream().filter(t -> t.getRealizedPnl() != null).count();
        if (closable == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        long wins = trades.stream()
                .filter(t -> t.getRealizedPnl() != null && t.getRealizedPnl().signum() > 0)
                .count();
        return BigDecimal.valueOf(wins)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(closable), 2, RoundingMode.HALF_UP);
    }

    /** Trades with an unknown holding time count as zero minutes. */
    String averageHolding(List<CompletedTrade> trades) {
        if (trades.isEmpty()) {
            return HoldingDurationFormatter.UNKNOWN;
        }
        long totalMinutes = trades.stream()
                .mapToLong(t -> HoldingDurationFormatter.parseMinutes(t.getHoldingDuration()))
                .sum();
        return HoldingDurationFormatter.renderAverage(totalMinutes / trades.size());
    }

    private BigDecimal volume(List<CompletedTrade> trades, PositionSide side) {
        return trades.stream()
                .filter(t -> t.getDirection() == side && t.getEntryNotional() != null)
                .map(CompletedTrade::getEntryNotional)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
