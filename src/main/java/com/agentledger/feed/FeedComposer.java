package com.agentledger.feed;

import com.agentledger.domain.enums.DiaryAction;
import com.agentledger.domain.enums.FeedEntryKind;
import com.agentledger.domain.model.AssetMarketData;
import com.agentledger.domain.model.DecisionRationale;
import com.agentledger.domain.model.DiaryRecord;
import com.agentledger.domain.model.FeedEntry;
import com.agentledger.domain.model.MarketSnapshot;
import com.agentledger.domain.model.ProcessLogExtract;
import com.agentledger.domain.model.PromptAccount;
import com.agentledger.domain.model.ReasoningEntry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Builds the display feed for one poll.
 *
 * <p>Priority order: reasoning blocks, per-asset rationales, the account summary, one
 * market line per asset, and the raw diary. The diary is only narrated when the
 * process log has no reasoning, so it never crowds out the richer text. Entries
 * repeating an earlier id are dropped. Process-log and snapshot entries are also
 * dropped on a repeated (asset, text) pair; diary entries only when they repeat a
 * process-log rationale, so identical decisions from separate cycles all stay.
 */
@Component
public class FeedComposer {

    public List<FeedEntry> compose(
            ProcessLogExtract extract, MarketSnapshot latestSnapshot, List<DiaryRecord> diaryRecords) {
        ProcessLogExtract logExtract = extract != null ? extract : ProcessLogExtract.empty();
        List<FeedEntry> candidates = new ArrayList<>();

        logExtract.getReasonings().stream()
                .sorted(Comparator.comparing(ReasoningEntry::getTimestamp).reversed())
                .map(this::reasoningEntry)
                .forEach(candidates::add);

        logExtract.getRationales().stream()
                .sorted(Comparator.comparing(DecisionRationale::getTimestamp).reversed())
                .map(this::rationaleEntry)
                .forEach(candidates::add);

        if (latestSnapshot != null) {
            addSnapshotEntries(latestSnapshot, candidates);
        }

        List<FeedEntry> diaryCandidates = new ArrayList<>();
        if (!logExtract.hasReasoning() && diaryRecords != null) {
            for (int i = diaryRecords.size() - 1; i >= 0; i--) {
                diaryCandidates.add(diaryEntry(diaryRecords.get(i)));
            }
        }

        return deduplicate(candidates, diaryCandidates, logExtract.getRationales());
    }

    private void addSnapshotEntries(MarketSnapshot snapshot, List<FeedEntry> candidates) {
        PromptAccount account = snapshot.getAccount();
        if (account != null && (account.getBalance() != null || account.getAccountValue() != null)) {
            BigDecimal balance = account.getBalance() != null ? account.getBalance() : account.getAccountValue();
            candidates.add(FeedEntry.builder()
                    .id("account-" + snapshot.getTimestamp())
                    .kind(FeedEntryKind.ACCOUNT_INFO)
                    .timestamp(snapshot.getTimestamp())
                    .text("Account: $" + twoDecimals(balance) + " balance | " + twoDecimals(account.getTotalReturnPct())
                            + "% return")
                    .build());
        }
        if (snapshot.getMarketData() == null) {
            return;
        }
        for (AssetMarketData market : snapshot.getMarketData()) {
            if (market == null || market.getAsset() == null) {
                continue;
            }
            candidates.add(FeedEntry.builder()
                    .id("market-" + market.getAsset() + "-" + snapshot.getTimestamp())
                    .kind(FeedEntryKind.MARKET_INFO)
                    .timestamp(snapshot.getTimestamp())
                    .asset(market.getAsset())
                    .text(MarketSummaryFormatter.summarize(market))
                    .build());
        }
    }

    private FeedEntry reasoningEntry(ReasoningEntry reasoning) {
        return FeedEntry.builder()
                .id("reasoning-" + reasoning.getTimestamp())
                .kind(FeedEntryKind.REASONING)
                .timestamp(reasoning.getTimestamp())
                .text(reasoning.getText())
                .build();
    }

    private FeedEntry rationaleEntry(DecisionRationale rationale) {
        return FeedEntry.builder()
                .id("rationale-" + rationale.getAsset() + "-" + rationale.getTimestamp())
                .kind(FeedEntryKind.DECISION)
                .timestamp(rationale.getTimestamp())
                .asset(rationale.getAsset())
                .text(rationale.getText())
                .build();
    }

    private FeedEntry diaryEntry(DiaryRecord record) {
        return FeedEntry.builder()
                .id(record.getTimestamp() + "-" + record.getAsset())
                .kind(record.getAction() == DiaryAction.HOLD ? FeedEntryKind.DECISION : FeedEntryKind.TRADE)
                .timestamp(record.getTimestamp())
                .asset(record.getAsset())
                .text(record.getRationale() != null && !record.getRationale().isBlank()
                        ? record.getRationale().trim()
                        : describe(record))
                .build();
    }

    static String describe(DiaryRecord record) {
        String asset = record.getAsset();
        return switch (record.getAction()) {
            case OPEN_LONG -> "GOING LONG " + asset;
            case OPEN_SHORT -> "GOING SHORT " + asset;
            case HOLD -> "HOLD " + asset;
            case RECONCILE_CLOSE -> record.getReason() != null && !record.getReason().isBlank()
                    ? "CLOSED " + asset + " (" + record.getReason().trim() + ")"
                    : "CLOSED " + asset;
        };
    }

    private List<FeedEntry> deduplicate(
            List<FeedEntry> candidates, List<FeedEntry> diaryCandidates, List<DecisionRationale> rationales) {
        Set<String> ids = new HashSet<>();
        Set<Map.Entry<String, String>> assetTexts = new HashSet<>();
        List<FeedEntry> feed = new ArrayList<>();
        for (FeedEntry entry : candidates) {
            if (!ids.add(entry.getId())) {
                continue;
            }
            if (!assetTexts.add(assetText(entry.getAsset(), entry.getText()))) {
                continue;
            }
            feed.add(entry);
        }

        Set<Map.Entry<String, String>> rationaleTexts = new HashSet<>();
        for (DecisionRationale rationale : rationales) {
            rationaleTexts.add(assetText(rationale.getAsset(), rationale.getText()));
        }
        for (FeedEntry entry : diaryCandidates) {
            if (!ids.add(entry.getId())) {
                continue;
            }
            if (rationaleTexts.contains(assetText(entry.getAsset(), entry.getText()))) {
                continue;
            }
            feed.add(entry);
        }
        return List.copyOf(feed);
    }

    private Map.Entry<String, String> assetText(String asset, String text) {
        return new AbstractMap.SimpleImmutableEntry<>(asset, text);
    }

    private String twoDecimals(BigDecimal value) {
        return value != null ? value.setScale(2, RoundingMode.HALF_UP).toPlainString() : MarketSummaryFormatter.NOT_AVAILABLE;
    }
}
