package com.agentledger.exchange.mapper;

import com.agentledger.domain.enums.DataSource;
import com.agentledger.domain.enums.FillDirection;
import com.agentledger.domain.enums.OrderSide;
import com.agentledger.domain.enums.PositionSide;
import com.agentledger.domain.model.AccountState;
import com.agentledger.domain.model.ExchangeSnapshot;
import com.agentledger.domain.model.Fill;
import com.agentledger.domain.model.Order;
import com.agentledger.domain.model.Position;
import com.agentledger.exchange.dto.RawClearinghouseState;
import com.agentledger.exchange.dto.RawExchangeSnapshot;
import com.agentledger.exchange.dto.RawFill;
import com.agentledger.exchange.dto.RawLedgerUpdate;
import com.agentledger.exchange.dto.RawOpenOrder;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maps raw exchange payloads to the domain {@link ExchangeSnapshot}.
 *
 * <p>The exchange encodes every number as a decimal string. Unparseable numbers are
 * treated as absent. Positions are reported with a signed size ({@code szi}); the
 * domain model keeps a positive quantity and a {@link PositionSide}.
 *
 * <p>Realized P&L for the account is derived from the ledger as
 * {@code accountValue - netDeposits}, so funding and fees are included.
 */
@Component
public class ExchangeSnapshotMapper {

    private static final Logger log = LoggerFactory.getLogger(ExchangeSnapshotMapper.class);

    public ExchangeSnapshot toSnapshot(RawExchangeSnapshot raw, String accountKey) {
        if (raw == null) {
            return ExchangeSnapshot.unavailable();
        }
        return toSnapshot(raw.getState(), raw.getFills(), raw.getOpenOrders(), raw.getLedgerUpdates(), accountKey);
    }

    /**
     * Builds the snapshot. A state without a margin summary or account value is
     * malformed and yields an unavailable snapshot. Null fills or orders map to empty
     * lists; a null ledger leaves {@code totalRealizedPnl} absent.
     */
    public ExchangeSnapshot toSnapshot(
            RawClearinghouseState rawState,
            List<RawFill> rawFills,
            List<RawOpenOrder> rawOrders,
            List<RawLedgerUpdate> rawLedger,
            String accountKey) {
        if (rawState == null || rawState.getMarginSummary() == null) {
            log.warn("Clearinghouse state for {} has no margin summary, treating exchange as unavailable", accountKey);
            return ExchangeSnapshot.unavailable();
        }
        BigDecimal accountValue = parse(rawState.getMarginSummary().getAccountValue());
        if (accountValue == null) {
            log.warn("Clearinghouse state for {} has no account value, treating exchange as unavailable", accountKey);
            return ExchangeSnapshot.unavailable();
        }

        List<Position> positions = toPositions(rawState, accountKey);
        BigDecimal totalRealizedPnl = rawLedger == null ? null : accountValue.subtract(netDeposits(rawLedger, accountKey));

        return ExchangeSnapshot.builder()
                .available(true)
                .accountState(toAccountState(rawState.getMarginSummary(), accountValue, positions))
                .positions(positions)
                .fills(toFills(rawFills))
                .openOrders(toOrders(rawOrders))
                .totalRealizedPnl(totalRealizedPnl)
                .build();
    }

    List<Position> toPositions(RawClearinghouseState rawState, String accountKey) {
        if (rawState.getAssetPositions() == null) {
            return List.of();
        }
        List<Position> positions = new ArrayList<>();
        for (RawClearinghouseState.AssetPosition assetPosition : rawState.getAssetPositions()) {
            if (assetPosition == null || assetPosition.getPosition() == null) {
                continue;
            }
            toPosition(assetPosition.getPosition(), accountKey).ifPresent(positions::add);
        }
        return List.copyOf(positions);
    }

    private Optional<Position> toPosition(RawClearinghouseState.PositionData raw, String accountKey) {
        BigDecimal size = parse(raw.getSzi());
        if (raw.getCoin() == null || size == null || size.signum() == 0) {
            return Optional.empty();
        }
        BigDecimal quantity = size.abs();
        BigDecimal entryPrice = orZero(parse(raw.getEntryPx()));
        BigDecimal positionValue = parse(raw.getPositionValue());
        BigDecimal currentPrice =
                positionValue != null ? positionValue.abs().divide(quantity, MathContext.DECIMAL64) : entryPrice;

        Integer leverage = raw.getLeverage() != null ? raw.getLeverage().getValue() : null;

        return Optional.of(Position.builder()
                .id(accountKey + ":" + raw.getCoin())
                .asset(raw.getCoin())
                .side(size.signum() > 0 ? PositionSide.LONG : PositionSide.SHORT)
                .entryPrice(entryPrice)
                .currentPrice(currentPrice)
                .quantity(quantity)
                .leverage(leverage == null || leverage < 1 ? 1 : leverage)
                .unrealizedPnl(orZero(parse(raw.getUnrealizedPnl())))
                .liquidationPrice(parse(raw.getLiquidationPx()))
                .source(DataSource.EXCHANGE)
                .build());
    }

    private AccountState toAccountState(
            RawClearinghouseState.MarginSummary summary, BigDecimal accountValue, List<Position> positions) {
        BigDecimal unrealizedPnl =
                positions.stream().map(Position::getUnrealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal reportedMargin = parse(summary.getTotalMarginUsed());
        BigDecimal marginUsed = reportedMargin != null && reportedMargin.signum() > 0
                ? reportedMargin
                : orZero(parse(summary.getTotalNtlPos())).abs();

        return AccountState.builder()
                .balance(accountValue)
                .unrealizedPnl(unrealizedPnl)
                .marginUsed(marginUsed)
                .source(DataSource.EXCHANGE)
                .build();
    }

    List<Fill> toFills(List<RawFill> rawFills) {
        if (rawFills == null) {
            return List.of();
        }
        List<Fill> fills = new ArrayList<>();
        for (RawFill raw : rawFills) {
            toFill(raw).ifPresent(fills::add);
        }
        return List.copyOf(fills);
    }

    private Optional<Fill> toFill(RawFill raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Optional<FillDirection> direction = FillDirection.fromExchangeDir(raw.getDir());
        BigDecimal price = parse(raw.getPx());
        BigDecimal quantity = parse(raw.getSz());
        if (direction.isEmpty() || price == null || quantity == null || raw.getTime() == null || raw.getCoin() == null) {
            log.debug("Skipping fill {} with dir '{}'", raw.getTid(), raw.getDir());
            return Optional.empty();
        }

        String id = raw.getTid() != null ? String.valueOf(raw.getTid()) : raw.getHash() + ":" + raw.getTime();

        return Optional.of(Fill.builder()
                .id(id)
                .asset(raw.getCoin())
                .direction(direction.get())
                .price(price)
                .quantity(quantity)
                .notional(price.multiply(quantity))
                .feeUsd(orZero(parse(raw.getFee())))
                .realizedPnl(orZero(parse(raw.getClosedPnl())))
                .timestampMs(raw.getTime())
                .transactionHash(raw.getHash())
                .build());
    }

    List<Order> toOrders(List<RawOpenOrder> rawOrders) {
        if (rawOrders == null) {
            return List.of();
        }
        List<Order> orders = new ArrayList<>();
        for (RawOpenOrder raw : rawOrders) {
            if (raw == null) {
                continue;
            }
            OrderSide side = toOrderSide(raw.getSide());
            if (side == null) {
                log.debug("Skipping open order {} with side '{}'", raw.getOid(), raw.getSide());
                continue;
            }
            BigDecimal triggerPrice = parse(raw.getTriggerPx());
            orders.add(Order.builder()
                    .id(String.valueOf(raw.getOid()))
                    .asset(raw.getCoin())
                    .side(side)
                    .quantity(parse(raw.getSz()))
                    .limitPrice(parse(raw.getLimitPx()))
                    .triggerPrice(triggerPrice != null && triggerPrice.signum() != 0 ? triggerPrice : null)
                    .orderType(raw.getOrderType())
                    .reduceOnly(Boolean.TRUE.equals(raw.getReduceOnly()))
                    .placedAt(raw.getTimestamp() != null ? Instant.ofEpochMilli(raw.getTimestamp()) : null)
                    .build());
        }
        return List.copyOf(orders);
    }

    /**
     * Deposits and inbound transfers count positive, withdrawals and outbound transfers
     * negative. Transfers between two other addresses, or of unknown type, count zero.
     */
    BigDecimal netDeposits(List<RawLedgerUpdate> ledger, String accountKey) {
        BigDecimal net = BigDecimal.ZERO;
        for (RawLedgerUpdate update : ledger) {
            if (update == null || update.getDelta() == null) {
                continue;
            }
            net = net.add(signedAmount(update.getDelta(), accountKey));
        }
        return net;
    }

    private BigDecimal signedAmount(RawLedgerUpdate.Delta delta, String accountKey) {
        String type = delta.getType() == null ? "" : delta.getType();
        BigDecimal usdc = parse(delta.getUsdc());
        return switch (type) {
            case "deposit" -> orZero(usdc);
            case "withdraw" -> orZero(usdc).negate();
            case "accountClassTransfer" -> Boolean.TRUE.equals(delta.getToPerp()) ? orZero(usdc) : orZero(usdc).negate();
            case "internalTransfer", "subAccountTransfer" -> directed(orZero(usdc), delta, accountKey);
            case "spotTransfer" -> directed(orZero(usdc != null ? usdc : parse(delta.getUsdcValue())), delta, accountKey);
            default -> BigDecimal.ZERO;
        };
    }

    private BigDecimal directed(BigDecimal amount, RawLedgerUpdate.Delta delta, String accountKey) {
        boolean inbound = accountKey.equalsIgnoreCase(delta.getDestination());
        boolean outbound = accountKey.equalsIgnoreCase(delta.getUser());
        if (inbound && !outbound) {
            return amount;
        }
        if (outbound && !inbound) {
            return amount.negate();
        }
        return BigDecimal.ZERO;
    }

    private OrderSide toOrderSide(String side) {
        if ("B".equals(side)) {
            return OrderSide.BUY;
        }
        if ("A".equals(side)) {
            return OrderSide.SELL;
        }
        return null;
    }

    private BigDecimal parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Unparseable exchange number '{}'", value);
            return null;
        }
    }

    private BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
