package com.agentledger.reconciliation;

import com.agentledger.config.AgentLedgerProperties;
import com.agentledger.diary.DiaryReadResult;
import com.agentledger.diary.DiaryReader;
import com.agentledger.domain.enums.DataSource;
import com.agentledger.domain.enums.DiaryAction;
import com.agentledger.domain.enums.FillDirection;
import com.agentledger.domain.enums.PositionSide;
import com.agentledger.domain.model.AccountState;
import com.agentledger.domain.model.ActiveTrade;
import com.agentledger.domain.model.AgentStats;
import com.agentledger.domain.model.AssetMarketData;
import com.agentledger.domain.model.DiaryRecord;
import com.agentledger.domain.model.ExchangeSnapshot;
import com.agentledger.domain.model.FeedEntry;
import com.agentledger.domain.model.MarketSnapshot;
import com.agentledger.domain.model.Position;
import com.agentledger.domain.model.ProcessLogExtract;
import com.agentledger.domain.model.PromptAccount;
import com.agentledger.domain.model.PromptPosition;
import com.agentledger.domain.model.ReconciliationResult;
import com.agentledger.event.ReconciliationEvent;
import com.agentledger.exception.ExchangeException;
import com.agentledger.exchange.ExchangeSnapshotSource;
import com.agentledger.exchange.mapper.ExchangeSnapshotMapper;
import com.agentledger.feed.FeedComposer;
import com.agentledger.io.ArtifactLocator;
import com.agentledger.matching.TradeMatchResult;
import com.agentledger.matching.TradeMatcher;
import com.agentledger.processlog.ProcessLogExtractor;
import com.agentledger.processlog.PromptLogReader;
import com.agentledger.stats.StatsAggregator;
import com.agentledger.stats.StatsPublisher;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs one read-and-reconcile poll for an account.
 *
 * <p>The live exchange snapshot is authoritative for positions, account state, open
 * orders and total P&L. When it is unavailable (disabled, unreachable, circuit open
 * or malformed) the poll still succeeds:
 * <ul>
 *   <li>positions come from the prompt log's last account echo, then the agent's
 *       tracked active trades, then executed diary opens nothing closed, each source
 *       only filling assets the previous ones did not cover</li>
 *   <li>account state comes from the prompt log's account value</li>
 *   <li>open orders are empty</li>
 *   <li>stats repeat the last published value</li>
 * </ul>
 *
 * <p>Matching always uses the whole diary; {@code limit} only bounds the diary
 * records narrated in the feed.
 */
@Service
public class AgentReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(AgentReconciliationService.class);

    private final DiaryReader diaryReader;
    private final ProcessLogExtractor processLogExtractor;
    private final PromptLogReader promptLogReader;
    private final ExchangeSnapshotSource exchangeSnapshotSource;
    private final ExchangeSnapshotMapper exchangeSnapshotMapper;
    private final TradeMatcher tradeMatcher;
    private final StatsAggregator statsAggregator;
    private final StatsPublisher statsPublisher;
    private final FeedComposer feedComposer;
    private final AgentLedgerProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;

    public AgentReconciliationService(
            DiaryReader diaryReader,
            ProcessLogExtractor processLogExtractor,
            PromptLogReader promptLogReader,
            ExchangeSnapshotSource exchangeSnapshotSource,
            ExchangeSnapshotMapper exchangeSnapshotMapper,
            TradeMatcher tradeMatcher,
            StatsAggregator statsAggregator,
            StatsPublisher statsPublisher,
            FeedComposer feedComposer,
            AgentLedgerProperties properties,
            ApplicationEventPublisher applicationEventPublisher) {
        this.diaryReader = diaryReader;
        this.processLogExtractor = processLogExtractor;
        this.promptLogReader = promptLogReader;
        this.exchangeSnapshotSource = exchangeSnapshotSource;
        this.exchangeSnapshotMapper = exchangeSnapshotMapper;
        this.tradeMatcher = tradeMatcher;
        this.statsAggregator = statsAggregator;
        this.statsPublisher = statsPublisher;
        this.feedComposer = feedComposer;
        this.properties = properties;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Reconciles the account's artifacts and live state.
     *
     * @param accountKey opaque account key, also the exchange user address
     * @param limit      number of newest diary records narrated in the feed
     */
    public ReconciliationResult reconcile(String accountKey, int limit) {
        ArtifactLocator.validated(accountKey);
        long started = System.nanoTime();

        DiaryReadResult diary = diaryReader.read(accountKey, 0);
        List<DiaryRecord> records = diary.getRecords();
        ProcessLogExtract extract = processLogExtractor.extract(accountKey);
        Optional<MarketSnapshot> prompt = promptLogReader.readLatest(accountKey);
        ExchangeSnapshot live = fetchLive(accountKey);

        TradeMatchResult match = tradeMatcher.match(records, live.isAvailable() ? live.getFills() : List.of());

        Optional<AgentStats> update = live.isAvailable()
                ? statsAggregator.aggregate(
                        match.getTrades(),
                        live.getTotalRealizedPnl(),
                        count(records, DiaryAction.HOLD),
                        openCount(match, live, records, PositionSide.LONG),
                        openCount(match, live, records, PositionSide.SHORT))
                : Optional.empty();
        AgentStats stats = statsPublisher.publish(accountKey, update);

        List<Position> positions =
                live.isAvailable() ? live.getPositions() : fallbackPositions(prompt, match.getUnmatchedOpens());
        AccountState accountState = live.isAvailable() ? live.getAccountState() : fallbackAccountState(prompt);
        List<FeedEntry> feed = feedComposer.compose(extract, prompt.orElse(null), newest(records, limit));

        ReconciliationResult result = ReconciliationResult.builder()
                .accountKey(accountKey)
                .positions(positions)
                .completedTrades(match.getTrades())
                .openOrders(live.isAvailable() ? live.getOpenOrders() : List.of())
                .stats(stats)
                .accountState(accountState)
                .feed(feed)
                .tradeSource(match.getSource())
                .exchangeAvailable(live.isAvailable())
                .skippedDiaryLines(diary.getSkippedLines())
                .reconciledAt(Instant.now())
                .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started))
                .build();

        log.info(
                "Reconciled {}: {} positions, {} trades ({}), exchange {}, {} feed entries in {}ms",
                accountKey,
                positions.size(),
                match.getTrades().size(),
                match.getSource(),
                live.isAvailable() ? "available" : "unavailable",
                feed.size(),
                result.getDurationMs());

        applicationEventPublisher.publishEvent(new ReconciliationEvent(this, result));
        return result;
    }

    /** Newest {@code limit} diary records, oldest first; all of them when limit is 0 or less. */
    public List<DiaryRecord> recentDiary(String accountKey, int limit) {
        return diaryReader.read(accountKey, limit).getRecords();
    }

    private ExchangeSnapshot fetchLive(String accountKey) {
        if (!properties.getExchange().isEnabled()) {
            return ExchangeSnapshot.unavailable();
        }
        try {
            return exchangeSnapshotMapper.toSnapshot(exchangeSnapshotSource.fetch(accountKey), accountKey);
        } catch (ExchangeException | CallNotPermittedException e) {
            log.warn("Exchange unavailable for {}, using artifact fallbacks: {}", accountKey, e.getMessage());
            return ExchangeSnapshot.unavailable();
        }
    }

    /**
     * Long/short counts come from opening fills when the fill pass was published,
     * otherwise from the diary's entry decisions.
     */
    private int openCount(
            TradeMatchResult match, ExchangeSnapshot live, List<DiaryRecord> records, PositionSide side) {
        if (match.isExchangeSourced()) {
            FillDirection opening = side == PositionSide.LONG ? FillDirection.OPEN_LONG : FillDirection.OPEN_SHORT;
            return (int) live.getFills().stream()
                    .filter(f -> f.getDirection() == opening)
                    .count();
        }
        return count(records, side == PositionSide.LONG ? DiaryAction.OPEN_LONG : DiaryAction.OPEN_SHORT);
    }

    private int count(List<DiaryRecord> records, DiaryAction action) {
        return (int) records.stream().filter(r -> r.getAction() == action).count();
    }

    List<Position> fallbackPositions(Optional<MarketSnapshot> prompt, List<DiaryRecord> unmatchedOpens) {
        List<Position> positions = new ArrayList<>();
        Set<String> covered = new HashSet<>();

        PromptAccount account = prompt.map(MarketSnapshot::getAccount).orElse(null);
        if (account != null) {
            for (PromptPosition echoed : nonNull(account.getPositions())) {
                fromPromptPosition(echoed).filter(p -> covered.add(p.getAsset())).ifPresent(positions::add);
            }
            List<AssetMarketData> marketData = prompt.map(MarketSnapshot::getMarketData).orElse(null);
            for (ActiveTrade trade : nonNull(account.getActiveTrades())) {
                fromActiveTrade(trade, marketData).filter(p -> covered.add(p.getAsset())).ifPresent(positions::add);
            }
        }

        for (int i = unmatchedOpens.size() - 1; i >= 0; i--) {
            fromDiaryOpen(unmatchedOpens.get(i)).filter(p -> covered.add(p.getAsset())).ifPresent(positions::add);
        }
        return List.copyOf(positions);
    }

    private Optional<Position> fromPromptPosition(PromptPosition echoed) {
        if (echoed == null
                || echoed.getSymbol() == null
                || echoed.getQuantity() == null
                || echoed.getQuantity().signum() == 0) {
            return Optional.empty();
        }
        BigDecimal entryPrice = echoed.getEntryPrice() != null ? echoed.getEntryPrice() : BigDecimal.ZERO;
        Integer leverage = echoed.getLeverage();
        return Optional.of(Position.builder()
                .id("prompt-" + echoed.getSymbol())
                .asset(echoed.getSymbol())
                .side(echoed.getQuantity().signum() > 0 ? PositionSide.LONG : PositionSide.SHORT)
                .entryPrice(entryPrice)
                .currentPrice(echoed.getCurrentPrice() != null ? echoed.getCurrentPrice() : entryPrice)
                .quantity(echoed.getQuantity().abs())
                .leverage(leverage == null || leverage < 1 ? 1 : leverage)
                .unrealizedPnl(echoed.getUnrealizedPnl() != null ? echoed.getUnrealizedPnl() : BigDecimal.ZERO)
                .liquidationPrice(echoed.getLiquidationPrice())
                .source(DataSource.PROMPT_LOG)
                .build());
    }

    private Optional<Position> fromActiveTrade(ActiveTrade trade, List<AssetMarketData> marketData) {
        if (trade == null
                || trade.getAsset() == null
                || trade.getLongSide() == null
                || trade.getAmount() == null
                || trade.getAmount().signum() <= 0
                || trade.getEntryPrice() == null) {
            return Optional.empty();
        }
        return Optional.of(Position.builder()
                .id("trade-" + trade.getAsset() + "-" + trade.getOpenedAt())
                .asset(trade.getAsset())
                .side(trade.getLongSide() ? PositionSide.LONG : PositionSide.SHORT)
                .entryPrice(trade.getEntryPrice())
                .currentPrice(marketPrice(marketData, trade.getAsset()).orElse(trade.getEntryPrice()))
                .quantity(trade.getAmount())
                .leverage(1)
                .unrealizedPnl(BigDecimal.ZERO)
                .source(DataSource.PROMPT_LOG)
                .build());
    }

    private Optional<BigDecimal> marketPrice(List<AssetMarketData> marketData, String asset) {
        return nonNull(marketData).stream()
                .filter(m -> m != null && asset.equals(m.getAsset()))
                .map(AssetMarketData::getCurrentPrice)
                .filter(price -> price != null && Double.isFinite(price))
                .findFirst()
                .map(BigDecimal::valueOf);
    }

    private Optional<Position> fromDiaryOpen(DiaryRecord open) {
        if (open.getEntryPrice() == null || open.getAmount() == null || open.getAmount().signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(Position.builder()
                .id("diary-" + open.getSequence())
                .asset(open.getAsset())
                .side(open.getAction() == DiaryAction.OPEN_LONG ? PositionSide.LONG : PositionSide.SHORT)
                .entryPrice(open.getEntryPrice())
                .currentPrice(open.getEntryPrice())
                .quantity(open.getAmount())
                .leverage(1)
                .unrealizedPnl(BigDecimal.ZERO)
                .source(DataSource.DIARY)
                .build());
    }

    private AccountState fallbackAccountState(Optional<MarketSnapshot> prompt) {
        PromptAccount account = prompt.map(MarketSnapshot::getAccount).orElse(null);
        if (account == null) {
            return null;
        }
        BigDecimal value = account.getAccountValue() != null ? account.getAccountValue() : account.getBalance();
        if (value == null) {
            return null;
        }
        return AccountState.builder()
                .balance(value)
                .unrealizedPnl(BigDecimal.ZERO)
                .marginUsed(BigDecimal.ZERO)
                .source(DataSource.PROMPT_LOG)
                .build();
    }

    private List<DiaryRecord> newest(List<DiaryRecord> records, int limit) {
        if (limit <= 0 || records.size() <= limit) {
            return records;
        }
        return records.subList(records.size() - limit, records.size());
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list != null ? list : List.of();
    }
}
