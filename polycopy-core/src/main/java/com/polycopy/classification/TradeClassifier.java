package com.polycopy.classification;

import com.polycopy.config.CopyProperties;
import com.polycopy.domain.Classification;
import com.polycopy.domain.ClosedTradeRecord;
import com.polycopy.domain.Direction;
import com.polycopy.domain.FillEvent;
import com.polycopy.domain.Position;
import com.polycopy.domain.TradeSide;
import com.polycopy.error.InconsistentStateException;
import com.polycopy.error.InvalidEventException;
import com.polycopy.ledger.LedgerDelta;
import com.polycopy.ledger.LedgerView;
import com.polycopy.ledger.PositionChange;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides what a fill means relative to the exposure already held and computes the resulting ledger delta.
 *
 * Evaluation order:
 * 1. BUY with a position on the market's other outcome: hedge (HEDGE_CLOSE / PARTIAL_HEDGE)
 * 2. No position on the token: OPEN
 * 3. Same direction as the held position: INCREASE
 * 4. Opposite direction: FULL_CLOSE, REVERSE or PARTIAL_CLOSE depending on what remains
 *
 * Pure: reads the supplied view, never mutates it, never logs.
 */
public final class TradeClassifier {

  /** Combined settlement value of a binary market's two outcomes. */
  private static final BigDecimal PAR = BigDecimal.ONE;

  private final BigDecimal sizeEpsilon;
  private final int priceScale;

  public TradeClassifier(BigDecimal sizeEpsilon, int priceScale) {
    this.sizeEpsilon = Objects.requireNonNull(sizeEpsilon, "sizeEpsilon");
    if (sizeEpsilon.signum() <= 0) {
      throw new IllegalArgumentException("sizeEpsilon must be positive");
    }
    this.priceScale = priceScale;
  }

  public static TradeClassifier from(CopyProperties.Ledger ledger) {
    return new TradeClassifier(ledger.sizeEpsilon(), ledger.priceScale());
  }

  /**
   * @throws InvalidEventException if the fill violates the input contract
   * @throws InconsistentStateException if the view holds a position the fill cannot be classified against
   */
  public ClassificationResult classify(LedgerView ledger, FillEvent fill) {
    validate(fill);

    if (fill.side() == TradeSide.BUY) {
      Optional<Position> opposite = ledger.getOppositePosition(fill.marketId(), fill.outcome());
      if (opposite.isPresent() && opposite.get().size().signum() > 0) {
        return hedge(ledger, fill, opposite.get());
      }
    }

    Position existing = ledger.getPosition(fill.tokenId()).orElse(null);
    if (existing == null) {
      if (fill.side() == TradeSide.SELL) {
        throw new InvalidEventException("SELL " + fill.size() + " of token " + fill.tokenId()
            + " with no open position to reduce (trade " + fill.tradeId() + ")");
      }
      Position opened = Position.open(fill, fill.size(), fill.price(), Direction.of(fill.side()));
      return new ClassificationResult(Classification.OPEN, fill, LedgerDelta.upsert(null, opened), opened);
    }
    requireSameMarket(existing, fill);

    BigDecimal currentSigned = existing.signedSize();
    BigDecimal signedSize = fill.signedSize();
    if (currentSigned.signum() * signedSize.signum() > 0) {
      Position increased = existing.increase(fill.size(), fill.price(), priceScale, fill.timestamp());
      return new ClassificationResult(Classification.INCREASE, fill, LedgerDelta.upsert(existing, increased), increased);
    }
    return reduce(existing, fill, currentSigned.add(signedSize));
  }

  private ClassificationResult reduce(Position existing, FillEvent fill, BigDecimal remainingSigned) {
    BigDecimal closingSize = fill.size().min(existing.size());

    if (remainingSigned.abs().compareTo(sizeEpsilon) <= 0) {
      ClosedTradeRecord record = closeRecord(existing, fill, Classification.FULL_CLOSE, closingSize);
      return new ClassificationResult(Classification.FULL_CLOSE, fill,
          LedgerDelta.of(record, new PositionChange.Removal(existing)), null);
    }

    if (remainingSigned.signum() != existing.signedSize().signum()) {
      ClosedTradeRecord record = closeRecord(existing, fill, Classification.REVERSE, existing.size());
      Position flipped = Position.open(fill, remainingSigned.abs(), fill.price(), existing.direction().opposite());
      return new ClassificationResult(Classification.REVERSE, fill,
          LedgerDelta.of(record, new PositionChange.Upsert(existing, flipped)), flipped);
    }

    ClosedTradeRecord record = closeRecord(existing, fill, Classification.PARTIAL_CLOSE, closingSize);
    Position reduced = existing.reduceTo(remainingSigned.abs(), fill.timestamp());
    return new ClassificationResult(Classification.PARTIAL_CLOSE, fill,
        LedgerDelta.of(record, new PositionChange.Upsert(existing, reduced)), reduced);
  }

  /**
   * Buying one outcome unwinds the position held on the other. PnL is priced against par:
   * {@code closing * (1 - oppositeEntry - price)}, capped at what was held, while the bought token
   * is credited with the full fill size.
   */
  private ClassificationResult hedge(LedgerView ledger, FillEvent fill, Position opposite) {
    BigDecimal closingSize = fill.size().min(opposite.size());
    BigDecimal pnl = closingSize.multiply(PAR.subtract(opposite.entryPrice()).subtract(fill.price()));
    BigDecimal oppositeRemaining = opposite.size().subtract(closingSize);

    Classification kind;
    PositionChange oppositeChange;
    if (oppositeRemaining.compareTo(sizeEpsilon) <= 0) {
      kind = Classification.HEDGE_CLOSE;
      oppositeChange = new PositionChange.Removal(opposite);
    } else {
      kind = Classification.PARTIAL_HEDGE;
      oppositeChange = new PositionChange.Upsert(opposite, opposite.reduceTo(oppositeRemaining, fill.timestamp()));
    }

    Position own = ledger.getPosition(fill.tokenId()).orElse(null);
    if (own != null) {
      requireSameMarket(own, fill);
    }
    Position bought = own == null
        ? Position.open(fill, fill.size(), fill.price(), Direction.LONG)
        : own.increase(fill.size(), fill.price(), priceScale, fill.timestamp());

    ClosedTradeRecord record = new ClosedTradeRecord(
        opposite.marketId(),
        opposite.tokenId(),
        opposite.outcome(),
        kind,
        opposite.direction(),
        closingSize,
        opposite.entryPrice(),
        PAR.subtract(fill.price()),
        pnl,
        fill.timestamp(),
        fill.tradeId()
    );
    return new ClassificationResult(kind, fill,
        LedgerDelta.of(record, oppositeChange, new PositionChange.Upsert(own, bought)), bought);
  }

  private static ClosedTradeRecord closeRecord(Position existing, FillEvent fill, Classification kind, BigDecimal closingSize) {
    BigDecimal pnl = closingSize
        .multiply(fill.price().subtract(existing.entryPrice()))
        .multiply(BigDecimal.valueOf(existing.direction().signum()));
    return new ClosedTradeRecord(
        existing.marketId(),
        existing.tokenId(),
        existing.outcome(),
        kind,
        existing.direction(),
        closingSize,
        existing.entryPrice(),
        fill.price(),
        pnl,
        fill.timestamp(),
        fill.tradeId()
    );
  }

  private static void requireSameMarket(Position position, FillEvent fill) {
    if (!Objects.equals(position.marketId(), fill.marketId())) {
      throw new InconsistentStateException("token " + fill.tokenId() + " is held under market " + position.marketId()
          + " but fill " + fill.tradeId() + " references market " + fill.marketId());
    }
  }

  static void validate(FillEvent fill) {
    if (fill == null) {
      throw new InvalidEventException("fill must not be null");
    }
    requireText(fill.tokenId(), "tokenId", fill);
    requireText(fill.marketId(), "marketId", fill);
    requireText(fill.outcome(), "outcome", fill);
    if (fill.side() == null) {
      throw new InvalidEventException("fill " + fill.tradeId() + " has no side");
    }
    if (fill.timestamp() == null) {
      throw new InvalidEventException("fill " + fill.tradeId() + " has no timestamp");
    }
    if (fill.size() == null || fill.size().signum() <= 0) {
      throw new InvalidEventException("fill " + fill.tradeId() + " size must be > 0, got " + fill.size());
    }
    if (fill.price() == null || fill.price().signum() < 0 || fill.price().compareTo(BigDecimal.ONE) > 0) {
      throw new InvalidEventException("fill " + fill.tradeId() + " price must be within [0, 1], got " + fill.price());
    }
  }

  private static void requireText(String value, String field, FillEvent fill) {
    if (value == null || value.isBlank()) {
      throw new InvalidEventException("fill " + fill.tradeId() + " is missing " + field);
    }
  }
}
