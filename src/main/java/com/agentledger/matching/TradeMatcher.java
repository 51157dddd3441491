package com.agentledger.matching;

import com.agentledger.domain.enums.DiaryAction;
import com.agentledger.domain.enums.PositionSide;
import com.agentledger.domain.enums.TradeSource;
import com.agentledger.domain.model.CompletedTrade;
import com.agentledger.domain.model.DiaryRecord;
import com.agentledger.domain.model.Fill;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconstructs completed round trips from the diary and from exchange fills.
 *
 * <p>Three passes run on every call:
 * <ul>
 *   <li><b>Diary correlation</b>: each RECONCILE_CLOSE is paired with the first open
 *       on the same asset carrying the same {@code openedAt} id. No exit price is
 *       logged on this path, so entry = exit and P&L is 0.</li>
 *   <li><b>Diary sequence</b>: executed opens in time order, each paired with the next
 *       executed opposite-side open on the same asset. P&L is recomputed from the
 *       logged prices.</li>
 *   <li><b>Exchange fills</b>: per-asset FIFO of opening fills, popped by each closing
 *       fill. P&L is the exchange-reported value.</li>
 * </ul>
 *
 * <p>Executed opens left unpaired by the sequence pass are reported as unmatched
 * unless a RECONCILE_CLOSE already retired them.
 *
 * <p>Exchange fills are ground truth: when they produce anything, the diary passes
 * are not published. The diary passes never invent a price; only the fill pass emits
 * a trade without a known opening, using the close price as entry.
 */
@Component
public class TradeMatcher {

    private static final Logger log = LoggerFactory.getLogger(TradeMatcher.class);

    private static final Comparator<CompletedTrade> NEWEST_FIRST = Comparator.comparing(
                    CompletedTrade::getClosedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(CompletedTrade::getId);

    public TradeMatchResult match(List<DiaryRecord> diaryRecords, List<Fill> fills) {
        List<DiaryRecord> records = diaryRecords != null ? diaryRecords : List.of();

        List<CompletedTrade> correlated = matchCorrelated(records);
        SequenceMatch sequenced = matchSequential(records);
        List<DiaryRecord> unmatchedOpens = stillOpen(sequenced.unmatchedOpens(), records);
        List<CompletedTrade> fromFills = matchFills(fills != null ? fills : List.of());

        log.debug(
                "Matched {} correlated, {} sequential, {} fill trades",
                correlated.size(),
                sequenced.trades().size(),
                fromFills.size());

        if (!fromFills.isEmpty()) {
            return TradeMatchResult.builder()
                    .trades(fromFills)
                    .source(TradeSource.EXCHANGE_FILL)
                    .unmatchedOpens(unmatchedOpens)
                    .build();
        }

        Map<String, CompletedTrade> union = new LinkedHashMap<>();
        correlated.forEach(t -> union.putIfAbsent(t.getId(), t));
        sequenced.trades().forEach(t -> union.putIfAbsent(t.getId(), t));
        List<CompletedTrade> diaryTrades = new ArrayList<>(union.values());
        diaryTrades.sort(NEWEST_FIRST);

        return TradeMatchResult.builder()
                .trades(List.copyOf(diaryTrades))
                .source(diarySource(correlated, sequenced.trades()))
                .unmatchedOpens(unmatchedOpens)
                .build();
    }

    List<CompletedTrade> matchCorrelated(List<DiaryRecord> records) {
        List<CompletedTrade> trades = new ArrayList<>();
        for (DiaryRecord close : records) {
            if (close.getAction() != DiaryAction.RECONCILE_CLOSE || close.getOpenedAt() == null) {
                continue;
            }
            Optional<DiaryRecord> open = correlatedOpen(close, records);
            if (open.isEmpty() || open.get().getEntryPrice() == null || open.get().getAmount() == null) {
                continue;
            }
            DiaryRecord opener = open.get();
            Optional<String> holding = HoldingDurationFormatter.format(opener.getTimestamp(), close.getTimestamp());
            if (holding.isEmpty()) {
                log.debug("Dropping correlated close at line {}: closes before its open", close.getSequence());
                continue;
            }
            BigDecimal notional = opener.getAllocationUsd() != null ? opener.getAllocationUsd() : BigDecimal.ZERO;
            trades.add(CompletedTrade.builder()
                    .id("corr-" + close.getSequence())
                    .asset(close.getAsset())
                    .direction(sideOf(opener.getAction()))
                    .entryPrice(opener.getEntryPrice())
                    .exitPrice(opener.getEntryPrice())
                    .quantity(opener.getAmount())
                    .entryNotional(notional)
                    .exitNotional(notional)
                    .holdingDuration(holding.get())
                    .realizedPnl(BigDecimal.ZERO)
                    .openedAt(opener.getTimestamp())
                    .closedAt(close.getTimestamp())
                    .source(TradeSource.DIARY_CORRELATION)
                    .build());
        }
        return trades;
    }

    private Optional<DiaryRecord> correlatedOpen(DiaryRecord close, List<DiaryRecord> records) {
        return records.stream()
                .filter(r -> r.getAction().isOpen())
                .filter(r -> Objects.equals(r.getAsset(), close.getAsset()))
                .filter(r -> close.getOpenedAt().equals(r.getOpenedAt()))
                .findFirst();
    }

    private List<DiaryRecord> stillOpen(List<DiaryRecord> unmatchedOpens, List<DiaryRecord> records) {
        Set<Long> retired = new HashSet<>();
        for (DiaryRecord close : records) {
            if (close.getAction() == DiaryAction.RECONCILE_CLOSE && close.getOpenedAt() != null) {
                correlatedOpen(close, records)
                        .filter(open -> !close.getTimestamp().isBefore(open.getTimestamp()))
                        .ifPresent(open -> retired.add(open.getSequence()));
            }
        }
        if (retired.isEmpty()) {
            return unmatchedOpens;
        }
        return unmatchedOpens.stream()
                .filter(open -> !retired.contains(open.getSequence()))
                .toList();
    }

    /**
     * A pair whose prices or size were not logged is still consumed, so it cannot
     * shift later pairings, but yields no trade.
     */
    SequenceMatch matchSequential(List<DiaryRecord> records) {
        List<DiaryRecord> executed = records.stream()
                .filter(r -> r.getAction().isOpen() && r.isExecuted())
                .sorted(Comparator.comparing(DiaryRecord::getTimestamp).thenComparingLong(DiaryRecord::getSequence))
                .toList();

        Set<Long> consumed = new HashSet<>();
        List<CompletedTrade> trades = new ArrayList<>();
        List<DiaryRecord> unmatchedOpens = new ArrayList<>();

        for (int i = 0; i < executed.size(); i++) {
            DiaryRecord open = executed.get(i);
            if (consumed.contains(open.getSequence())) {
                continue;
            }
            DiaryRecord close = null;
            for (int j = i + 1; j < executed.size(); j++) {
                DiaryRecord candidate = executed.get(j);
                if (!consumed.contains(candidate.getSequence())
                        && Objects.equals(candidate.getAsset(), open.getAsset())
                        && candidate.getAction() != open.getAction()) {
                    close = candidate;
                    break;
                }
            }
            if (close == null) {
                unmatchedOpens.add(open);
                continue;
            }
            consumed.add(open.getSequence());
            consumed.add(close.getSequence());
            toSequentialTrade(open, close).ifPresent(trades::add);
        }
        return new SequenceMatch(List.copyOf(trades), List.copyOf(unmatchedOpens));
    }

    private Optional<CompletedTrade> toSequentialTrade(DiaryRecord open, DiaryRecord close) {
        if (open.getEntryPrice() == null || open.getAmount() == null || close.getEntryPrice() == null) {
            log.debug(
                    "Diary lines {} and {} pair without logged prices, no trade emitted",
                    open.getSequence(),
                    close.getSequence());
            return Optional.empty();
        }
        Optional<String> holding = HoldingDurationFormatter.format(open.getTimestamp(), close.getTimestamp());
        if (holding.isEmpty()) {
            return Optional.empty();
        }

        PositionSide direction = sideOf(open.getAction());
        BigDecimal entry = open.getEntryPrice();
        BigDecimal exit = close.getEntryPrice();
        BigDecimal quantity = open.getAmount();
        BigDecimal move = direction == PositionSide.LONG ? exit.subtract(entry) : entry.subtract(exit);

        return Optional.of(CompletedTrade.builder()
                .id("seq-" + open.getSequence() + "-" + close.getSequence())
                .asset(open.getAsset())
                .direction(direction)
                .entryPrice(entry)
                .exitPrice(exit)
                .quantity(quantity)
                .entryNotional(open.getAllocationUsd() != null ? open.getAllocationUsd() : BigDecimal.ZERO)
                .exitNotional(close.getAllocationUsd() != null ? close.getAllocationUsd() : BigDecimal.ZERO)
                .holdingDuration(holding.get())
                .realizedPnl(move.multiply(quantity).setScale(2, RoundingMode.HALF_UP))
                .openedAt(open.getTimestamp())
                .closedAt(close.getTimestamp())
                .source(TradeSource.DIARY_SEQUENCE)
                .build());
    }

    List<CompletedTrade> matchFills(List<Fill> fills) {
        List<Fill> ordered = fills.stream()
                .sorted(Comparator.comparingLong(Fill::getTimestampMs))
                .toList();

        Map<String, Deque<Fill>> openQueues = new HashMap<>();
        List<CompletedTrade> trades = new ArrayList<>();

        for (Fill fill : ordered) {
            if (fill.getDirection().isOpening()) {
                openQueues.computeIfAbsent(fill.getAsset(), k -> new ArrayDeque<>()).addLast(fill);
                if (fill.getRealizedPnl() != null && fill.getRealizedPnl().signum() != 0) {
                    trades.add(informationalOpen(fill));
                }
                continue;
            }
            Deque<Fill> queue = openQueues.get(fill.getAsset());
            Fill open = queue != null ? queue.pollFirst() : null;
            trades.add(open != null ? closedAgainst(open, fill) : orphanClose(fill));
        }

        trades.sort(NEWEST_FIRST);
        return List.copyOf(trades);
    }

    private CompletedTrade closedAgainst(Fill open, Fill close) {
        return CompletedTrade.builder()
                .id("fill-" + close.getId())
                .asset(close.getAsset())
                .direction(close.getDirection().side())
                .entryPrice(open.getPrice())
                .exitPrice(close.getPrice())
                .quantity(close.getQuantity())
                .entryNotional(open.getPrice().multiply(close.getQuantity()))
                .exitNotional(close.getNotional())
                .holdingDuration(HoldingDurationFormatter.format(open.getTimestamp(), close.getTimestamp())
                        .orElse(HoldingDurationFormatter.UNKNOWN))
                .realizedPnl(close.getRealizedPnl())
                .openedAt(open.getTimestamp())
                .closedAt(close.getTimestamp())
                .sourceHash(close.getTransactionHash())
                .source(TradeSource.EXCHANGE_FILL)
                .build();
    }

    private CompletedTrade orphanClose(Fill close) {
        return CompletedTrade.builder()
                .id("fill-" + close.getId())
                .asset(close.getAsset())
                .direction(close.getDirection().side())
                .entryPrice(close.getPrice())
                .exitPrice(close.getPrice())
                .quantity(close.getQuantity())
                .entryNotional(close.getNotional())
                .exitNotional(close.getNotional())
                .holdingDuration(HoldingDurationFormatter.UNKNOWN)
                .realizedPnl(close.getRealizedPnl())
                .openedAt(close.getTimestamp())
                .closedAt(close.getTimestamp())
                .sourceHash(close.getTransactionHash())
                .source(TradeSource.EXCHANGE_FILL)
                .build();
    }

    private CompletedTrade informationalOpen(Fill open) {
        CompletedTrade trade = orphanClose(open);
        trade.setId("fill-open-" + open.getId());
        return trade;
    }

    private TradeSource diarySource(List<CompletedTrade> correlated, List<CompletedTrade> sequenced) {
        if (!sequenced.isEmpty()) {
            return TradeSource.DIARY_SEQUENCE;
        }
        return correlated.isEmpty() ? TradeSource.NONE : TradeSource.DIARY_CORRELATION;
    }

    private PositionSide sideOf(DiaryAction action) {
        return action == DiaryAction.OPEN_LONG ? PositionSide.LONG : PositionSide.SHORT;
    }

    record SequenceMatch(List<CompletedTrade> trades, List<DiaryRecord> unmatchedOpens) {}
}
