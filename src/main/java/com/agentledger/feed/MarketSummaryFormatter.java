package com.agentledger.feed;

import com.agentledger.domain.model.AssetMarketData;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.List;
import java.util.Locale;

/**
 * One-line conversational summary of an asset's market context, e.g.
 * {@code BTC @ $97,250.5 • above EMA20 ($96,800) • MACD positive (120.55) • RSI neutral (55.2) • 4H RSI weak (48.1) • Funding 10.9%}.
 *
 * <p>Indicators the agent could not compute (null or NaN) render as {@code N/A}.
 */
final class MarketSummaryFormatter {

    static final String NOT_AVAILABLE = "N/A";

    private MarketSummaryFormatter() {}

    static String summarize(AssetMarketData market) {
        AssetMarketData.Intraday intraday = market.getIntraday();
        Double price = present(market.getCurrentPrice());
        Double ema20 = intraday != null ? present(intraday.getEma20()) : null;
        Double macd = intraday != null ? present(intraday.getMacd()) : null;
        Double rsi14 = intraday != null ? present(intraday.getRsi14()) : null;
        Double longRsi = lastRsi(market.getLongTerm());
        Double funding = present(market.getFundingAnnualizedPct());

        String priceVsEma = price != null && ema20 != null ? (price > ema20 ? "above" : "below") : "vs";
        String macdStatus = macd != null ? (macd > 0 ? "positive" : "negative") : "";
        String rsiStatus = rsi14 != null ? (rsi14 > 60 ? "overbought" : rsi14 < 40 ? "oversold" : "neutral") : "unknown";
        String longRsiStatus =
                longRsi != null ? (longRsi < 30 ? "deeply oversold" : longRsi > 70 ? "overbought" : "weak") : "unknown";

        return market.getAsset() + " @ $" + grouped(price)
                + " • " + priceVsEma + " EMA20 ($" + grouped(ema20) + ")"
                + " • MACD " + macdStatus + " (" + fixed(macd, 2) + ")"
                + " • RSI " + rsiStatus + " (" + fixed(rsi14, 1) + ")"
                + " • 4H RSI " + longRsiStatus + " (" + fixed(longRsi, 1) + ")"
                + " • Funding " + fixed(funding, 1) + "%";
    }

    static String fixed(Double value, int decimals) {
        return value != null ? String.format(Locale.ROOT, "%." + decimals + "f", value) : NOT_AVAILABLE;
    }

    private static String grouped(Double value) {
        if (value == null) {
            return NOT_AVAILABLE;
        }
        return new DecimalFormat("#,##0.###", DecimalFormatSymbols.getInstance(Locale.US)).format(value);
    }

    private static Double lastRsi(AssetMarketData.LongTerm longTerm) {
        if (longTerm == null || longTerm.getRsiSeries() == null || longTerm.getRsiSeries().isEmpty()) {
            return null;
        }
        List<Double> series = longTerm.getRsiSeries();
        return present(series.get(series.size() - 1));
    }

    private static Double present(Double value) {
        return value == null || value.isNaN() || value.isInfinite() ? null : value;
    }
}
