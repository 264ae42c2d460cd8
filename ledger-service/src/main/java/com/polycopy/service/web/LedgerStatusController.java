package com.polycopy.service.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.domain.ClosedTradeRecord;
import com.polycopy.domain.FillEvent;
import com.polycopy.domain.Position;
import com.polycopy.events.payload.ClassificationEvent;
import com.polycopy.ledger.PositionLedger;
import com.polycopy.service.processing.FillProcessor;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class LedgerStatusController {

  private final @NonNull PositionLedger ledger;
  private final @NonNull FillProcessor fillProcessor;

  @GetMapping("/positions")
  public ResponseEntity<List<Position>> positions() {
    return ResponseEntity.ok(ledger.listOpenPositions());
  }

  @GetMapping("/closed-trades")
  public ResponseEntity<List<ClosedTradeRecord>> closedTrades(@RequestParam(defaultValue = "50") int limit) {
    return ResponseEntity.ok(ledger.listClosedTrades(limit));
  }

  @GetMapping("/pnl")
  public ResponseEntity<PnlResponse> pnl() {
    return ResponseEntity.ok(new PnlResponse(
        ledger.cumulativeRealizedPnl(),
        ledger.state().closedTrades().size(),
        ledger.state().positionsByTokenId().size()
    ));
  }

  @GetMapping("/status")
  public ResponseEntity<Map<String, Object>> status() {
    return ResponseEntity.ok(fillProcessor.getMetrics());
  }

  /**
   * Apply a single fill. An invalid or inconsistent fill is answered by {@link LedgerExceptionHandler}.
   */
  @PostMapping("/fills")
  public ResponseEntity<ClassificationEvent> submitFill(@RequestBody FillEvent fill) {
    return ResponseEntity.ok(fillProcessor.process(fill));
  }

  /**
   * Take in a data-api {@code /activity} page as returned by Polymarket (newest first). Rows already
   * seen are skipped; rejected rows are dropped without failing the request.
   */
  @PostMapping("/activity")
  public ResponseEntity<List<ClassificationEvent>> submitActivity(@RequestBody JsonNode payload) {
    return ResponseEntity.ok(fillProcessor.ingestActivity(payload));
  }

  public record PnlResponse(
      BigDecimal cumulativeRealizedPnl,
      int closedTrades,
      int openPositions
  ) {
  }
}
